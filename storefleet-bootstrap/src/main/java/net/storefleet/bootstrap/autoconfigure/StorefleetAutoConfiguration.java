package net.storefleet.bootstrap.autoconfigure;

import net.storefleet.adapter.host.backup.ScriptBackupTool;
import net.storefleet.adapter.host.crypto.AesGcmCredentialCipher;
import net.storefleet.adapter.host.http.WebClients;
import net.storefleet.adapter.host.notify.LogOnlyNotifier;
import net.storefleet.adapter.host.notify.WebhookNotifier;
import net.storefleet.adapter.host.probe.HostUsageProbe;
import net.storefleet.adapter.host.probe.HttpReachabilityProbe;
import net.storefleet.adapter.host.probe.HttpSiteProbe;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.adapter.host.process.ProcessCommandRunner;
import net.storefleet.adapter.host.proxy.CertbotIssuer;
import net.storefleet.adapter.host.proxy.NginxReverseProxy;
import net.storefleet.adapter.host.proxy.NginxRouteRenderer;
import net.storefleet.adapter.host.runtime.DockerComposeRuntime;
import net.storefleet.adapter.host.runtime.LocalWorkspaceStore;
import net.storefleet.bootstrap.props.StorefleetProperties;
import net.storefleet.bootstrap.registry.ServerRegistrar;
import net.storefleet.core.allocator.PlanCatalog;
import net.storefleet.core.allocator.ResourceAllocator;
import net.storefleet.core.backup.BackupService;
import net.storefleet.core.certificates.CertificateRenewalService;
import net.storefleet.core.fleet.FleetHealthService;
import net.storefleet.core.fleet.HeartbeatService;
import net.storefleet.core.fleet.ServerSelector;
import net.storefleet.core.lifecycle.TenantLifecycleService;
import net.storefleet.core.maintenance.MaintenanceService;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.Platform;
import net.storefleet.core.pipeline.CredentialGenerator;
import net.storefleet.core.pipeline.EnvironmentRenderer;
import net.storefleet.core.pipeline.ProvisioningPipeline;
import net.storefleet.core.pipeline.StandardSteps;
import net.storefleet.core.pipeline.step.VerifyHealthStep;
import net.storefleet.core.queue.JobDispatchService;
import net.storefleet.core.queue.ProvisioningWorker;
import net.storefleet.core.monitoring.TenantHealthMonitor;
import net.storefleet.core.quota.QuotaMonitor;
import net.storefleet.core.spi.*;
import net.storefleet.integration.spring.StorefleetSpringConfig;
import net.storefleet.integration.spring.cron.CronBillingCalendar;
import net.storefleet.integration.spring.sched.StorefleetSchedulers;
import net.storefleet.integration.spring.sched.WorkerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(StorefleetProperties.class)
@Import(StorefleetSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class StorefleetAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(StorefleetAutoConfiguration.class);

    // --- 호스트 어댑터 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebClient storefleetWebClient(StorefleetProperties props) {
        var t = props.getScheduler().getProbeTimeout();
        return WebClients.create(t, t);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceStore workspaceStore(StorefleetProperties props) {
        return new LocalWorkspaceStore(Path.of(props.getPipeline().getWorkspaceRoot()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ContainerRuntime containerRuntime(CommandRunner runner, StorefleetProperties props) {
        var p = props.getPipeline();
        return new DockerComposeRuntime(runner, new DockerComposeRuntime.Timeouts(
                p.getComposeUpTimeout(), p.getComposeDownTimeout(), p.getInspectTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ReverseProxy reverseProxy(CommandRunner runner, StorefleetProperties props) {
        var p = props.getProxy();
        var renderer = new NginxRouteRenderer(p.getAccessLogDir(), p.getAcmeRoot());
        return new NginxReverseProxy(runner, renderer, new NginxReverseProxy.Settings(
                Path.of(p.getSitesAvailable()), Path.of(p.getSitesEnabled()),
                p.getTestCommand(), p.getReloadCommand(), props.getPipeline().getCommandTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public CertificateIssuer certificateIssuer(CommandRunner runner, StorefleetProperties props) {
        var c = props.getCertificates();
        return new CertbotIssuer(runner, c.getAdminEmail(), c.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public UsageProbe usageProbe(CommandRunner runner, StorefleetProperties props) {
        var q = props.getQuota();
        return new HostUsageProbe(runner, new HostUsageProbe.Settings(
                q.isProjectQuota(), q.getQuotaMount(),
                Path.of(props.getProxy().getAccessLogDir()), props.getPipeline().getCommandTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ReachabilityProbe reachabilityProbe(WebClient storefleetWebClient, StorefleetProperties props) {
        return HttpReachabilityProbe.https(storefleetWebClient, props.getScheduler().getProbeTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SiteProbe siteProbe(WebClient storefleetWebClient, StorefleetProperties props) {
        return HttpSiteProbe.https(storefleetWebClient, props.getMonitoring().getHttpTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupTool backupTool(CommandRunner runner, StorefleetProperties props) {
        var b = props.getBackup();
        var d = ScriptBackupTool.Settings.defaults(Path.of(b.getScriptsDir()));
        return new ScriptBackupTool(runner, new ScriptBackupTool.Settings(
                d.backupScript(), d.restoreScript(), b.isSudo(), b.getRestoreSource(),
                b.getBackupTimeout(), b.getRestoreTimeout()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(WebClient storefleetWebClient, StorefleetProperties props) {
        var n = props.getNotification();
        if (n.getWebhookUrl() == null || n.getWebhookUrl().isBlank()) {
            log.warn("storefleet.notification.webhook-url not set; notifications are only logged");
            return new LogOnlyNotifier();
        }
        return new WebhookNotifier(storefleetWebClient, n.getWebhookUrl(), n.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialCipher credentialCipher(StorefleetProperties props) {
        String key = props.getSecurity().getCredentialKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("storefleet.security.credential-key is required (base64, 32 bytes)");
        }
        return AesGcmCredentialCipher.fromBase64(key);
    }

    @Bean
    @ConditionalOnMissingBean
    public BillingCalendar billingCalendar(StorefleetProperties props) {
        return new CronBillingCalendar(props.getQuota().getBillingCron(), ZoneId.of(props.getZone()));
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public PlanCatalog planCatalog(StorefleetProperties props) {
        if (props.getPlans().isEmpty()) return PlanCatalog.defaults();
        log.info("plans: \n{}", props.getPlans().stream()
                .map(StorefleetProperties.Plan::toString).collect(Collectors.joining("\n")));
        return new PlanCatalog(props.getPlans().stream()
                .map(p -> new PlanTier(p.getCode(), p.getMemoryLimit(), p.getCpuLimit(),
                        p.getDiskGb(), p.getBandwidthGb()))
                .toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceAllocator resourceAllocator(ServerRepository servers,
                                               PortAssignmentRepository ports,
                                               QuotaRepository quotas,
                                               PlanCatalog plans,
                                               TxRunner tx,
                                               Clock clock) {
        return new ResourceAllocator(servers, ports, quotas, plans, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDispatchService jobDispatch(ProvisioningJobRepository jobs, TxRunner tx, Clock clock,
                                          StorefleetProperties props) {
        return new JobDispatchService(jobs, tx, clock, props.getScheduler().getDequeuePoll());
    }

    @Bean
    @ConditionalOnMissingBean
    public ServerSelector serverSelector(ServerRepository servers, TenantRepository tenants,
                                         TxRunner tx, Clock clock, StorefleetProperties props) {
        return new ServerSelector(servers, tenants, tx, clock, props.getScheduler().getFreshness());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProvisioningPipeline provisioningPipeline(WorkspaceStore workspaces,
                                                     ContainerRuntime runtime,
                                                     ResourceAllocator allocator,
                                                     ReverseProxy proxy,
                                                     CertificateIssuer issuer,
                                                     CredentialCipher cipher,
                                                     Notifier notifier,
                                                     ProvisioningJobRepository jobs,
                                                     TenantRepository tenants,
                                                     ProvisioningLogRepository logs,
                                                     TxRunner tx,
                                                     Clock clock,
                                                     StorefleetProperties props) {
        var p = props.getPipeline();
        Map<Platform, Duration> timeouts = new EnumMap<>(Platform.class);
        timeouts.put(Platform.WOOCOMMERCE, p.getWoocommerceHealthTimeout());
        timeouts.put(Platform.MAGENTO, p.getMagentoHealthTimeout());
        var health = new VerifyHealthStep.Policy(timeouts, p.getHealthPoll());

        var steps = StandardSteps.create(workspaces, runtime, new CredentialGenerator(), allocator,
                new EnvironmentRenderer(), proxy, issuer, health, cipher, notifier, tenants, tx, clock);
        return new ProvisioningPipeline(steps, jobs, tenants, logs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProvisioningWorker provisioningWorker(JobDispatchService dispatch,
                                                 TenantRepository tenants,
                                                 ServerRepository servers,
                                                 PlanCatalog plans,
                                                 ProvisioningPipeline pipeline,
                                                 TxRunner tx,
                                                 Clock clock) {
        return new ProvisioningWorker(dispatch, tenants, servers, plans, pipeline, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantLifecycleService tenantLifecycle(TenantRepository tenants,
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
        return new TenantLifecycleService(tenants, suspensions, dispatch, selector, plans, allocator,
                runtime, proxy, workspaces, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public HeartbeatService heartbeatService(ServerRepository servers, TxRunner tx, Clock clock) {
        return new HeartbeatService(servers, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FleetHealthService fleetHealth(ServerRepository servers, TenantRepository tenants,
                                          ReachabilityProbe probe, TxRunner tx, Clock clock,
                                          StorefleetProperties props) {
        return new FleetHealthService(servers, tenants, probe, tx, clock, props.getScheduler().getStatusWindow());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaMonitor quotaMonitor(TenantRepository tenants,
                                     QuotaRepository quotas,
                                     UsageRepository usage,
                                     ResourceAlertRepository alerts,
                                     UsageProbe probe,
                                     WorkspaceStore workspaces,
                                     Notifier notifier,
                                     BillingCalendar billing,
                                     TxRunner tx,
                                     Clock clock,
                                     StorefleetProperties props) {
        var q = props.getQuota();
        var settings = new QuotaMonitor.Settings(q.getWarningPercent(), q.getCriticalPercent(),
                q.getCooldown(), ZoneId.of(props.getZone()));
        return new QuotaMonitor(tenants, quotas, usage, alerts, probe, workspaces, notifier, billing,
                tx, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantHealthMonitor tenantHealthMonitor(TenantRepository tenants,
                                                   TenantHealthRepository health,
                                                   SiteProbe site,
                                                   ContainerRuntime runtime,
                                                   WorkspaceStore workspaces,
                                                   Notifier notifier,
                                                   TxRunner tx,
                                                   Clock clock,
                                                   StorefleetProperties props) {
        var m = props.getMonitoring();
        return new TenantHealthMonitor(tenants, health, site, runtime, workspaces, notifier, tx, clock,
                new TenantHealthMonitor.Settings(m.getFailureThreshold(), m.getAlertCooldown()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(ProvisioningJobRepository jobs,
                                          TenantRepository tenants,
                                          ServerRepository servers,
                                          ProvisioningLogRepository logs,
                                          TxRunner tx,
                                          Clock clock) {
        return new MaintenanceService(jobs, tenants, servers, logs, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CertificateRenewalService certificateRenewal(TenantRepository tenants, CertificateIssuer issuer,
                                                        TxRunner tx, Clock clock) {
        return new CertificateRenewalService(tenants, issuer, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupService backupService(TenantRepository tenants, BackupJobRepository backups,
                                       BackupTool tool, TxRunner tx, Clock clock) {
        return new BackupService(tenants, backups, tool, tx, clock);
    }

    // --- 워커 신원/등록 ---

    @Bean
    @ConditionalOnMissingBean
    public WorkerIdentity workerIdentity(StorefleetProperties props) {
        String hostname = props.getServer().getHostname();
        if (hostname == null || hostname.isBlank()) hostname = localHostname();
        return new WorkerIdentity(hostname, "worker@" + hostname);
    }

    @Bean
    public ServerRegistrar serverRegistrar(ServerRepository servers,
                                           HeartbeatService heartbeat,
                                           WorkerIdentity identity,
                                           TxRunner tx,
                                           Clock clock) {
        return new ServerRegistrar(servers, heartbeat, identity, tx, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "storefleet.server", name = "register", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner serverRegistrationRunner(ServerRegistrar registrar, StorefleetProperties props) {
        return args -> registrar.register(props.getServer());
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "storefleet.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StorefleetSchedulers storefleetSchedulers(WorkerIdentity identity,
                                                     HeartbeatService heartbeat,
                                                     ProvisioningWorker worker,
                                                     QuotaMonitor quota,
                                                     TenantHealthMonitor health,
                                                     MaintenanceService maintenance,
                                                     CertificateRenewalService certificates,
                                                     StorefleetProperties props) {
        var s = new StorefleetSchedulers(identity, heartbeat, worker, quota, health, maintenance, certificates);

        // @Scheduled 딜레이는 storefleet.scheduler.*-delay-ms 키에서 직접 읽힘. 나머지만 세터로 주입
        var sp = props.getScheduler();
        s.setDequeueWait(sp.getDequeueWait());
        s.setStaleJobAfter(sp.getStaleJobAfter());
        s.setOfflineAfter(sp.getOfflineAfter());
        s.setLogRetention(sp.getLogRetention());
        return s;
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("cannot resolve local hostname, falling back to 'localhost'", e);
            return "localhost";
        }
    }
}
