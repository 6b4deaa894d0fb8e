package net.storefleet.adapter.jdbc;

import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.model.Credentials;
import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/** 워커 호스트 협력자 인메모리 대역 */
final class HostFakes {
    private HostFakes() {}

    static final Path ROOT = Path.of("/srv/customers");

    static final class MutableClock implements Clock {
        private final AtomicReference<Instant> now;

        MutableClock(Instant start) { this.now = new AtomicReference<>(start); }

        @Override public Instant now() { return now.get(); }

        void set(Instant t) { now.set(t); }

        void advance(java.time.Duration d) { now.updateAndGet(t -> t.plus(d)); }
    }

    static final class Workspaces implements WorkspaceStore {
        final Set<Long> present = ConcurrentHashMap.newKeySet();
        final Map<String, String> files = new ConcurrentHashMap<>();

        @Override public Path resolve(long tenantId) { return ROOT.resolve("customer-" + tenantId); }

        @Override public boolean exists(long tenantId) { return present.contains(tenantId); }

        @Override
        public Path ensure(long tenantId, Platform platform) {
            present.add(tenantId);
            return resolve(tenantId);
        }

        @Override
        public Path write(long tenantId, String fileName, String content) {
            Path p = resolve(tenantId).resolve(fileName);
            files.put(p.toString(), content);
            return p;
        }

        @Override
        public void delete(long tenantId) {
            present.remove(tenantId);
            String prefix = resolve(tenantId).toString();
            files.keySet().removeIf(k -> k.startsWith(prefix));
        }

        String file(long tenantId, String fileName) { return files.get(resolve(tenantId).resolve(fileName).toString()); }
    }

    /** 워크스페이스별 컨테이너 상태. failUps 만큼 up 이 실패한다 */
    static final class Runtime implements ContainerRuntime {
        final Map<Path, Health> state = new ConcurrentHashMap<>();
        final AtomicInteger failUps = new AtomicInteger();
        final AtomicInteger failStarts = new AtomicInteger();
        final AtomicInteger downCalls = new AtomicInteger();
        volatile Health reported = Health.RUNNING;

        @Override
        public void up(Path workspace) throws Exception {
            if (failUps.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                // 실패해도 일부 컨테이너가 남는 상황 재현
                state.put(workspace, Health.EXITED);
                throw new InfrastructureException("compose up failed for " + workspace);
            }
            state.put(workspace, Health.RUNNING);
        }

        @Override
        public void down(Path workspace) {
            downCalls.incrementAndGet();
            state.remove(workspace);
        }

        @Override
        public void stop(Path workspace) {
            state.computeIfPresent(workspace, (k, v) -> Health.EXITED);
        }

        @Override
        public void start(Path workspace) throws Exception {
            if (failStarts.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new InfrastructureException("compose start failed for " + workspace);
            }
            state.put(workspace, Health.RUNNING);
        }

        @Override
        public Health health(Path workspace) {
            Health h = state.get(workspace);
            if (h == null) return Health.ABSENT;
            return h == Health.RUNNING ? reported : h;
        }

        long running() { return state.values().stream().filter(h -> h == Health.RUNNING).count(); }

        boolean isRunning(Path workspace) { return state.get(workspace) == Health.RUNNING; }
    }

    static final class Proxy implements ReverseProxy {
        final Map<Long, Route> active = new ConcurrentHashMap<>();
        volatile boolean failRemove;

        @Override public void apply(Route route) { active.put(route.tenantId(), route); }

        @Override
        public void remove(long tenantId) throws Exception {
            if (failRemove) throw new InfrastructureException("nginx reload failed");
            active.remove(tenantId);
        }

        @Override public boolean isActive(long tenantId) { return active.containsKey(tenantId); }
    }

    static final class Issuer implements CertificateIssuer {
        final Set<String> issued = ConcurrentHashMap.newKeySet();
        volatile boolean fail;
        /** 발급 도중 끼어드는 작업 (예: 정리 작업이 잡을 회수) */
        volatile java.util.concurrent.Callable<?> during;

        @Override
        public void issue(long tenantId, String domain) throws Exception {
            if (during != null) during.call();
            if (fail) throw new InfrastructureException("acme challenge failed for " + domain);
            issued.add(domain);
        }
    }

    static final class Mailbox implements Notifier {
        final List<ReadyNotice> ready = new CopyOnWriteArrayList<>();
        final List<ResourceAlert> alerts = new CopyOnWriteArrayList<>();
        final List<HealthAlert> health = new CopyOnWriteArrayList<>();
        volatile boolean fail;

        @Override
        public void tenantReady(ReadyNotice notice) throws Exception {
            if (fail) throw new IllegalStateException("webhook unreachable");
            ready.add(notice);
        }

        @Override
        public void resourceAlert(Tenant tenant, ResourceAlert alert) throws Exception {
            if (fail) throw new IllegalStateException("webhook unreachable");
            alerts.add(alert);
        }

        @Override
        public void healthAlert(Tenant tenant, HealthAlert alert) throws Exception {
            if (fail) throw new IllegalStateException("webhook unreachable");
            health.add(alert);
        }
    }

    /** 도메인별 응답 여부. 기본은 응답함 */
    static final class Sites implements SiteProbe {
        final Set<String> down = ConcurrentHashMap.newKeySet();

        @Override
        public boolean responds(String domain) { return !down.contains(domain); }
    }

    /** 테스트용 가역 인코딩 */
    static final class PlainCipher implements CredentialCipher {
        @Override
        public String seal(Credentials c) {
            return String.join("|", c.dbName(), c.dbUser(), c.dbPassword(), c.dbRootPassword(),
                    c.adminUser(), c.adminPassword());
        }

        @Override
        public Credentials open(String sealed) {
            String[] p = sealed.split("\\|", -1);
            return new Credentials(p[0], p[1], p[2], p[3], p[4], p[5]);
        }
    }

    static final class Usage implements UsageProbe {
        final Map<Long, Long> disk = new ConcurrentHashMap<>();
        final Map<Long, Long> bandwidth = new ConcurrentHashMap<>();
        final Set<Long> broken = ConcurrentHashMap.newKeySet();

        @Override
        public long diskBytes(long tenantId, Path workspace) throws Exception {
            if (broken.contains(tenantId)) throw new InfrastructureException("du failed");
            return disk.getOrDefault(tenantId, 0L);
        }

        @Override
        public long bandwidthBytes(long tenantId, Instant since) {
            return bandwidth.getOrDefault(tenantId, 0L);
        }
    }

    static final class Probe implements ReachabilityProbe {
        final Map<String, Reachability> byHost = new ConcurrentHashMap<>();
        final List<String> probed = new CopyOnWriteArrayList<>();

        @Override
        public Reachability probe(net.storefleet.core.model.Server server) {
            probed.add(server.hostname());
            return byHost.getOrDefault(server.hostname(), Reachability.DOWN);
        }
    }

    static final class Backups implements BackupTool {
        final AtomicInteger seq = new AtomicInteger();
        final List<String> restored = new CopyOnWriteArrayList<>();
        volatile boolean fail;

        @Override
        public String backup(long tenantId, net.storefleet.core.model.BackupJob.Scope scope) throws Exception {
            if (fail) throw new InfrastructureException("backup script exited with 1");
            return "snap-" + tenantId + "-" + scope.arg() + "-" + seq.incrementAndGet();
        }

        @Override
        public void restore(long tenantId, String snapshotId, net.storefleet.core.model.BackupJob.Scope scope) throws Exception {
            if (fail) throw new InfrastructureException("restore script exited with 2");
            restored.add(snapshotId);
        }
    }
}
