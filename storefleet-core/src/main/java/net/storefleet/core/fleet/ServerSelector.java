package net.storefleet.core.fleet;

import net.storefleet.core.error.ResourceExhaustedException;
import net.storefleet.core.model.Server;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 신규 테넌트 라우팅 대상 서버 선택.
 * 선언 상태와 무관하게 하트비트가 신선해야 하고, live 테넌트 수가 최대치 미만이어야 한다.
 */
public final class ServerSelector {
    private static final Logger log = LoggerFactory.getLogger(ServerSelector.class);

    private final ServerRepository servers;
    private final TenantRepository tenants;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration freshness;

    public ServerSelector(ServerRepository servers, TenantRepository tenants, TxRunner tx, Clock clock,
                          Duration freshness) {
        this.servers = servers;
        this.tenants = tenants;
        this.tx = tx;
        this.clock = clock;
        this.freshness = freshness;
    }

    /** 후보 서버와 현재 부하 */
    public record Candidate(Server server, int liveTenants) {
        public int freeSlots() { return server.maxTenants() - liveTenants; }
    }

    /** hint 가 자격이 있으면 hint, 아니면 가장 한가한 서버 */
    public Server select(Long hint) throws Exception {
        List<Candidate> eligible = eligible();
        if (hint != null) {
            for (Candidate c : eligible) {
                if (c.server().id().equals(hint)) return c.server();
            }
            log.info("server hint {} is not eligible, choosing least loaded", hint);
        }
        return eligible.stream()
                .min(Comparator.comparingInt(Candidate::liveTenants).thenComparing(c -> c.server().id()))
                .map(Candidate::server)
                .orElseThrow(() -> new ResourceExhaustedException("no live server with free capacity"));
    }

    public boolean isEligible(long serverId) throws Exception {
        return eligible().stream().anyMatch(c -> c.server().id() == serverId);
    }

    public List<Candidate> eligible() throws Exception {
        Instant now = clock.now();
        List<Server> all = tx.required(servers::findAll);
        Map<Long, Integer> load = tx.required(tenants::countLiveByServer);
        return all.stream()
                .filter(s -> s.status() == Server.Status.ACTIVE)
                .filter(s -> s.isLive(now, freshness))
                .map(s -> new Candidate(s, load.getOrDefault(s.id(), 0)))
                .filter(c -> c.liveTenants() < c.server().maxTenants())
                .toList();
    }
}
