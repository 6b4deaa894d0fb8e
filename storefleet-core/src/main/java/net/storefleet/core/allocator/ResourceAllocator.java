package net.storefleet.core.allocator;

import net.storefleet.core.error.ResourceExhaustedException;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.PortAssignment;
import net.storefleet.core.model.QuotaGrant;
import net.storefleet.core.model.Server;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.PortAssignmentRepository;
import net.storefleet.core.spi.QuotaRepository;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 서버별 포트와 테넌트별 쿼터 할당.
 * 동시성은 저장소 unique 제약으로 중재한다 (먼저 커밋한 쪽이 이김, 진 쪽은 다음 후보로).
 */
public final class ResourceAllocator {
    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    /** 스냅샷이 낡아 모든 후보에서 진 경우 재스캔 횟수 */
    static final int MAX_SCAN_ROUNDS = 3;

    private final ServerRepository servers;
    private final PortAssignmentRepository ports;
    private final QuotaRepository quotas;
    private final PlanCatalog plans;
    private final TxRunner tx;
    private final Clock clock;

    public ResourceAllocator(ServerRepository servers,
                             PortAssignmentRepository ports,
                             QuotaRepository quotas,
                             PlanCatalog plans,
                             TxRunner tx,
                             Clock clock) {
        this.servers = servers;
        this.ports = ports;
        this.quotas = quotas;
        this.plans = plans;
        this.tx = tx;
        this.clock = clock;
    }

    public record PortUsage(long serverId, int total, int used, int free) { }

    /**
     * 서버 범위에서 가장 낮은 빈 포트를 테넌트에 바인딩.
     * 테넌트가 이미 같은 서버의 유효 포트를 가지고 있으면 그대로 돌려준다.
     */
    public int allocatePort(long serverId, long tenantId) throws Exception {
        Server server = tx.required(() -> servers.findById(serverId))
                .orElseThrow(() -> new IllegalArgumentException("unknown server: " + serverId));

        Optional<Integer> held = reuseOrRelease(server, tenantId);
        if (held.isPresent()) return held.get();

        for (int round = 0; round < MAX_SCAN_ROUNDS; round++) {
            Set<Integer> used = new HashSet<>(tx.required(() -> ports.findUsedPorts(serverId)));
            boolean sawFree = false;

            for (int p = server.portRangeStart(); p <= server.portRangeEnd(); p++) {
                if (used.contains(p)) continue;
                sawFree = true;

                final int candidate = p;
                boolean won = tx.requiresNew(() -> ports.tryInsert(serverId, candidate, tenantId, clock.now()));
                if (won) {
                    log.info("port allocated: server={} port={} tenant={}", serverId, candidate, tenantId);
                    return candidate;
                }
                // 같은 테넌트가 동시에 할당받은 경우
                Optional<PortAssignment> mine = tx.required(() -> ports.findByTenant(tenantId));
                if (mine.isPresent() && mine.get().serverId() == serverId) return mine.get().port();
            }
            if (!sawFree) break;
            log.debug("port scan round {} lost every candidate on server {}, rescanning", round, serverId);
        }
        throw new ResourceExhaustedException("no free port on server " + serverId
                + " (range " + server.portRangeStart() + "-" + server.portRangeEnd() + ")");
    }

    private Optional<Integer> reuseOrRelease(Server server, long tenantId) throws Exception {
        Optional<PortAssignment> existing = tx.required(() -> ports.findByTenant(tenantId));
        if (existing.isEmpty()) return Optional.empty();

        PortAssignment pa = existing.get();
        if (pa.serverId() == server.id() && server.inRange(pa.port())) {
            log.info("reusing port {} on server {} for tenant {}", pa.port(), pa.serverId(), tenantId);
            return Optional.of(pa.port());
        }
        // 다른 서버/범위 밖 할당은 풀고 새로 잡는다
        tx.required(() -> ports.delete(pa.serverId(), pa.port()));
        log.info("released stale port {} on server {} held by tenant {}", pa.port(), pa.serverId(), tenantId);
        return Optional.empty();
    }

    /** 이미 비어 있는 포트 해제는 no-op */
    public void releasePort(long serverId, int port) throws Exception {
        int n = tx.required(() -> ports.delete(serverId, port));
        if (n > 0) log.info("port released: server={} port={}", serverId, port);
    }

    /** 테넌트가 가진 포트가 있으면 해제 */
    public void releaseTenantPort(long tenantId) throws Exception {
        int n = tx.required(() -> ports.deleteByTenant(tenantId));
        if (n > 0) log.info("port released for tenant {}", tenantId);
    }

    /** 플랜 티어에서 한도를 도출해 저장. 소비 강제는 QuotaMonitor 몫 */
    public QuotaGrant allocateQuota(long tenantId, String planCode) throws Exception {
        PlanTier tier = plans.require(planCode);
        QuotaGrant grant = new QuotaGrant(tenantId, tier.code(), tier.diskBytes(), tier.bandwidthBytes(), clock.now());
        return tx.required(() -> quotas.upsert(grant));
    }

    public void releaseQuota(long tenantId) throws Exception {
        tx.required(() -> quotas.delete(tenantId));
    }

    public PortUsage portUsage(long serverId) throws Exception {
        Server server = tx.required(() -> servers.findById(serverId))
                .orElseThrow(() -> new IllegalArgumentException("unknown server: " + serverId));
        int used = tx.required(() -> ports.countByServer(serverId));
        int total = server.portCapacity();
        return new PortUsage(serverId, total, used, Math.max(0, total - used));
    }
}
