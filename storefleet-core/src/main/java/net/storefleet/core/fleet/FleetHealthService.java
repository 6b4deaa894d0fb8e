package net.storefleet.core.fleet;

import net.storefleet.core.model.Server;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ReachabilityProbe;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 상태 화면용 서버별/전체 헬스.
 * 하트비트가 신선하면 그대로 믿고, 낡았을 때만 직접 도달성 검사로 판단한다.
 */
public final class FleetHealthService {
    private static final Logger log = LoggerFactory.getLogger(FleetHealthService.class);

    /** 심각도 오름차순 */
    public enum Health {
        OPERATIONAL("All Systems Operational"),
        MAINTENANCE("Scheduled Maintenance"),
        DEGRADED("Degraded Performance"),
        MAJOR_OUTAGE("Major Outage");

        private final String banner;

        Health(String banner) { this.banner = banner; }

        public String banner() { return banner; }
    }

    public record ServerHealth(long serverId, String name, String hostname, Health health,
                               Server.Status declared, Instant lastHeartbeat, boolean probed,
                               int liveTenants, int maxTenants) { }

    public record FleetReport(Health overall, String message, List<ServerHealth> servers, Instant generatedAt) { }

    private final ServerRepository servers;
    private final TenantRepository tenants;
    private final ReachabilityProbe probe;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration statusWindow;

    public FleetHealthService(ServerRepository servers, TenantRepository tenants, ReachabilityProbe probe,
                              TxRunner tx, Clock clock, Duration statusWindow) {
        this.servers = servers;
        this.tenants = tenants;
        this.probe = probe;
        this.tx = tx;
        this.clock = clock;
        this.statusWindow = statusWindow;
    }

    public FleetReport report() throws Exception {
        Instant now = clock.now();
        List<Server> all = tx.required(servers::findAll);
        Map<Long, Integer> load = tx.required(tenants::countLiveByServer);

        List<ServerHealth> rows = new ArrayList<>(all.size());
        Health overall = Health.OPERATIONAL;
        for (Server s : all) {
            ServerHealth h = assess(s, now, load.getOrDefault(s.id(), 0));
            rows.add(h);
            if (h.health().compareTo(overall) > 0) overall = h.health();
        }
        return new FleetReport(overall, overall.banner(), rows, now);
    }

    private ServerHealth assess(Server s, Instant now, int live) {
        if (s.status() == Server.Status.MAINTENANCE) {
            return row(s, Health.MAINTENANCE, false, live);
        }
        if (s.isLive(now, statusWindow)) {
            return row(s, Health.OPERATIONAL, false, live);
        }
        // 하트비트가 낡음. 죽은 하트비트 작성기가 정상처럼 보이지 않도록 직접 확인
        ReachabilityProbe.Reachability r = probe.probe(s);
        log.warn("server {} heartbeat stale (age={}), probe says {}", s.name(), s.heartbeatAge(now), r);
        Health h = switch (r) {
            case UP, DEGRADED -> Health.DEGRADED;
            case DOWN -> Health.MAJOR_OUTAGE;
        };
        return row(s, h, true, live);
    }

    private static ServerHealth row(Server s, Health h, boolean probed, int live) {
        return new ServerHealth(s.id(), s.name(), s.hostname(), h, s.status(), s.lastHeartbeat(), probed,
                live, s.maxTenants());
    }
}
