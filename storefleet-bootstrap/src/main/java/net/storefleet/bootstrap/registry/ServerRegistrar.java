package net.storefleet.bootstrap.registry;

import net.storefleet.bootstrap.props.StorefleetProperties;
import net.storefleet.core.fleet.HeartbeatService;
import net.storefleet.core.model.Server;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TxRunner;
import net.storefleet.integration.spring.sched.WorkerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기동 시 이 호스트를 서버 레지스트리에 등록(hostname 기준 멱등)하고 워커 신원을 묶는다.
 */
public class ServerRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ServerRegistrar.class);

    private final ServerRepository servers;
    private final HeartbeatService heartbeat;
    private final WorkerIdentity identity;
    private final TxRunner tx;
    private final Clock clock;

    public ServerRegistrar(ServerRepository servers,
                           HeartbeatService heartbeat,
                           WorkerIdentity identity,
                           TxRunner tx,
                           Clock clock) {
        this.servers = servers;
        this.heartbeat = heartbeat;
        this.identity = identity;
        this.tx = tx;
        this.clock = clock;
    }

    public Server register(StorefleetProperties.Server def) throws Exception {
        if (def.getPortRangeStart() <= 0 || def.getPortRangeEnd() < def.getPortRangeStart()) {
            throw new IllegalArgumentException("invalid port range: "
                    + def.getPortRangeStart() + "-" + def.getPortRangeEnd());
        }
        if (def.getMaxTenants() <= 0) {
            throw new IllegalArgumentException("server.max-tenants must be positive");
        }
        String name = def.getName() == null ? identity.hostname() : def.getName();

        Server server = tx.required(() -> servers.upsert(
                name,
                identity.hostname(),
                def.getAddress(),
                def.getMaxTenants(),
                def.getPortRangeStart(),
                def.getPortRangeEnd(),
                clock.now()));

        heartbeat.beat(server.id());
        identity.bind(server.id());
        log.info("Server registered: id={} hostname='{}' capacity={} ports={}-{}",
                server.id(), server.hostname(), server.maxTenants(),
                server.portRangeStart(), server.portRangeEnd());
        return server;
    }
}
