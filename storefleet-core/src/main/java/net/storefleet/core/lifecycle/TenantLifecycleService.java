package net.storefleet.core.lifecycle;

import net.storefleet.core.allocator.PlanCatalog;
import net.storefleet.core.allocator.ResourceAllocator;
import net.storefleet.core.error.AlreadyInFlightException;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.error.TenantValidationException;
import net.storefleet.core.fleet.ServerSelector;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.SuspensionLogEntry;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.queue.JobDispatchService;
import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ContainerRuntime;
import net.storefleet.core.spi.ReverseProxy;
import net.storefleet.core.spi.SuspensionLogRepository;
import net.storefleet.core.spi.TenantRepository;
import net.storefleet.core.spi.TxRunner;
import net.storefleet.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 테넌트 접수/재시도/정지/재개/해지.
 * 프로비저닝 자체는 큐에 넣기만 하고 워커가 수행한다.
 */
public final class TenantLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(TenantLifecycleService.class);

    static final Pattern DOMAIN =
            Pattern.compile("^(?=.{1,253}$)([a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");
    static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final TenantRepository tenants;
    private final SuspensionLogRepository suspensions;
    private final JobDispatchService dispatch;
    private final ServerSelector selector;
    private final PlanCatalog plans;
    private final ResourceAllocator allocator;
    private final ContainerRuntime runtime;
    private final ReverseProxy proxy;
    private final WorkspaceStore workspaces;
    private final TxRunner tx;
    private final Clock clock;

    public TenantLifecycleService(TenantRepository tenants,
                                  SuspensionLogRepository suspensions,
                                  JobDispatchService dispatch,
                                  ServerSelector selector,
                                  PlanCatalog plans,
                                  ResourceAllocator allocator,
                                  ContainerRuntime runtime,
                                  ReverseProxy proxy,
                                  WorkspaceStore workspaces,
                                  TxRunner tx,
                                  Clock clock) {
        this.tenants = tenants;
        this.suspensions = suspensions;
        this.dispatch = dispatch;
        this.selector = selector;
        this.plans = plans;
        this.allocator = allocator;
        this.runtime = runtime;
        this.proxy = proxy;
        this.workspaces = workspaces;
        this.tx = tx;
        this.clock = clock;
    }

    /** 검증 → 서버 선택 → PENDING 생성 → 잡 적재. 검증 실패는 큐에 들어가지 않는다 */
    public IntakeReceipt submit(IntakeRequest req) throws Exception {
        String domain = normalizeDomain(req.domain());
        String email = req.email() == null ? "" : req.email().trim();
        if (!EMAIL.matcher(email).matches()) {
            throw new TenantValidationException("malformed e-mail: " + req.email());
        }
        Platform platform = parsePlatform(req.platform());
        String planCode = plans.require(req.planCode()).code();

        if (tx.required(() -> tenants.findByDomain(domain)).isPresent()) {
            throw new TenantValidationException("domain already registered: " + domain);
        }

        Server server = selector.select(req.serverHint());
        Tenant tenant = tx.requiresNew(() -> tenants.insertPending(domain, email, platform, planCode, server.id(), clock.now()))
                .orElseThrow(() -> new TenantValidationException("domain already registered: " + domain));

        long jobId = dispatch.enqueue(tenant.id(), server.id());
        log.info("tenant {} ({}, {}) accepted on server {}: job {}", tenant.id(), domain, platform, server.name(), jobId);
        return new IntakeReceipt(tenant.id(), jobId, server.id());
    }

    /** FAILED 테넌트 재시도. 원래 서버가 자격을 잃었으면 새로 고른다 */
    public long retry(long tenantId) throws Exception {
        Tenant t = require(tenantId);
        Optional<ProvisioningJob> running = dispatch.inFlight(tenantId);
        if (running.isPresent()) throw new AlreadyInFlightException(tenantId, running.get().id());
        if (!t.retryable()) {
            throw new TenantValidationException("tenant " + tenantId + " is " + t.status() + ", only FAILED can be retried");
        }

        long serverId = t.serverId();
        if (!selector.isEligible(serverId)) {
            Server next = selector.select(null);
            if (next.id() != serverId) {
                boolean moved = tx.required(() -> tenants.reassignServer(tenantId, next.id(), clock.now()));
                if (!moved) throw new TenantValidationException("tenant " + tenantId + " changed state during retry");
                log.info("tenant {} moved from server {} to {} for retry", tenantId, serverId, next.id());
                serverId = next.id();
            }
        }
        long jobId = dispatch.enqueue(tenantId, serverId);
        log.info("tenant {} retry queued as job {}", tenantId, jobId);
        return jobId;
    }

    /** ACTIVE → SUSPENDED. 컨테이너만 멈추고 볼륨과 포트는 유지 */
    public Tenant suspend(long tenantId, String reason, boolean automatic) throws Exception {
        Tenant t = require(tenantId);
        if (t.status() != Tenant.Status.ACTIVE) {
            throw new TenantValidationException("tenant " + tenantId + " is " + t.status() + ", only ACTIVE can be suspended");
        }
        runtime.stop(workspaces.resolve(tenantId));

        boolean done = tx.required(() -> {
            if (!tenants.suspend(tenantId, reason, automatic, clock.now())) return false;
            suspensions.append(new SuspensionLogEntry(null, tenantId, SuspensionLogEntry.Action.SUSPEND,
                    reason, automatic, clock.now()));
            return true;
        });
        if (!done) {
            // 동시에 상태가 바뀌었으면 멈춘 컨테이너를 되살린다
            runtime.start(workspaces.resolve(tenantId));
            throw new TenantValidationException("tenant " + tenantId + " changed state during suspend");
        }
        log.info("tenant {} suspended ({}{})", tenantId, reason, automatic ? ", automatic" : "");
        return require(tenantId);
    }

    /**
     * SUSPENDED → ACTIVE.
     * 기동 실패 시 환경/라우트/포트를 정리하고 FAILED 로 남겨 재시도 대상으로 만든다.
     */
    public Tenant reactivate(long tenantId) throws Exception {
        Tenant t = require(tenantId);
        if (t.status() != Tenant.Status.SUSPENDED) {
            throw new TenantValidationException("tenant " + tenantId + " is " + t.status() + ", only SUSPENDED can be reactivated");
        }
        try {
            runtime.start(workspaces.resolve(tenantId));
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.error("tenant {} failed to restart, tearing down: {}", tenantId, e.getMessage(), e);
            teardown(t, false);
            String message = "[reactivate] " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            tx.required(() -> tenants.markFailed(tenantId, Tenant.Status.SUSPENDED, message, clock.now()));
            return require(tenantId);
        }

        boolean done = tx.required(() -> {
            if (!tenants.reactivate(tenantId, clock.now())) return false;
            suspensions.append(new SuspensionLogEntry(null, tenantId, SuspensionLogEntry.Action.REACTIVATE,
                    null, false, clock.now()));
            return true;
        });
        if (!done) throw new TenantValidationException("tenant " + tenantId + " changed state during reactivate");
        log.info("tenant {} reactivated", tenantId);
        return require(tenantId);
    }

    /** 진행 중인 잡이 있으면 거부. 모든 자원을 풀고 행을 삭제한다 */
    public void decommission(long tenantId) throws Exception {
        Tenant t = require(tenantId);
        Optional<ProvisioningJob> running = dispatch.inFlight(tenantId);
        if (running.isPresent()) throw new AlreadyInFlightException(tenantId, running.get().id());

        teardown(t, true);
        allocator.releaseQuota(tenantId);
        workspaces.delete(tenantId);
        tx.required(() -> tenants.delete(tenantId));
        log.info("tenant {} ({}) decommissioned", tenantId, t.domain());
    }

    public Optional<Tenant> find(long tenantId) throws Exception {
        return tx.required(() -> tenants.findById(tenantId));
    }

    /**
     * 환경(볼륨 포함)/라우트/포트 정리.
     * strict 이면 실패를 그대로 던지고, 아니면 기록만 하고 계속한다.
     */
    private void teardown(Tenant t, boolean strict) throws Exception {
        long id = t.id();
        try {
            if (workspaces.exists(id)) runtime.down(workspaces.resolve(id));
        } catch (Exception e) {
            if (strict) throw new InfrastructureException("environment teardown failed for tenant " + id, e);
            log.warn("tenant {} environment teardown failed: {}", id, e.getMessage());
        }
        try {
            proxy.remove(id);
        } catch (Exception e) {
            if (strict) throw new InfrastructureException("route removal failed for tenant " + id, e);
            log.warn("tenant {} route removal failed: {}", id, e.getMessage());
        }
        allocator.releaseTenantPort(id);
    }

    private Tenant require(long tenantId) throws Exception {
        return find(tenantId).orElseThrow(() -> new TenantValidationException("unknown tenant: " + tenantId));
    }

    private static Platform parsePlatform(String raw) throws TenantValidationException {
        try {
            return Platform.from(raw);
        } catch (IllegalArgumentException e) {
            throw new TenantValidationException(e.getMessage());
        }
    }

    static String normalizeDomain(String raw) throws TenantValidationException {
        String d = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (d.endsWith(".")) d = d.substring(0, d.length() - 1);
        if (!DOMAIN.matcher(d).matches()) throw new TenantValidationException("malformed domain: " + raw);
        return d;
    }
}
