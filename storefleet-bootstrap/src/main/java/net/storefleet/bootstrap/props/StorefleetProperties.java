package net.storefleet.bootstrap.props;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("storefleet")
public class StorefleetProperties {
    private String zone = "UTC";
    private Server server = new Server();
    private Pipeline pipeline = new Pipeline();
    private List<Plan> plans = new ArrayList<>(); // 비어 있으면 기본 티어
    private Scheduler scheduler = new Scheduler();
    private Quota quota = new Quota();
    private Monitoring monitoring = new Monitoring();
    private Proxy proxy = new Proxy();
    private Certificates certificates = new Certificates();
    private Backup backup = new Backup();
    private Notification notification = new Notification();
    private Security security = new Security();

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }

    public List<Plan> getPlans() { return plans; }
    public void setPlans(List<Plan> plans) { this.plans = plans; }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public Quota getQuota() { return quota; }
    public void setQuota(Quota quota) { this.quota = quota; }

    public Monitoring getMonitoring() { return monitoring; }
    public void setMonitoring(Monitoring monitoring) { this.monitoring = monitoring; }

    public Proxy getProxy() { return proxy; }
    public void setProxy(Proxy proxy) { this.proxy = proxy; }

    public Certificates getCertificates() { return certificates; }
    public void setCertificates(Certificates certificates) { this.certificates = certificates; }

    public Backup getBackup() { return backup; }
    public void setBackup(Backup backup) { this.backup = backup; }

    public Notification getNotification() { return notification; }
    public void setNotification(Notification notification) { this.notification = notification; }

    public Security getSecurity() { return security; }
    public void setSecurity(Security security) { this.security = security; }

    /** 이 워커 호스트의 신원과 선언 용량 */
    public static class Server {
        private String name;
        private String hostname;
        private String address = "127.0.0.1";
        private int maxTenants = 20;
        private int portRangeStart = 8001;
        private int portRangeEnd = 8100;
        private boolean register = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getHostname() { return hostname; }
        public void setHostname(String hostname) { this.hostname = hostname; }

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public int getMaxTenants() { return maxTenants; }
        public void setMaxTenants(int maxTenants) { this.maxTenants = maxTenants; }

        public int getPortRangeStart() { return portRangeStart; }
        public void setPortRangeStart(int portRangeStart) { this.portRangeStart = portRangeStart; }

        public int getPortRangeEnd() { return portRangeEnd; }
        public void setPortRangeEnd(int portRangeEnd) { this.portRangeEnd = portRangeEnd; }

        public boolean isRegister() { return register; }
        public void setRegister(boolean register) { this.register = register; }
    }

    public static class Pipeline {
        private String workspaceRoot = "/var/customers";
        private Duration woocommerceHealthTimeout = Duration.ofMinutes(5);
        private Duration magentoHealthTimeout = Duration.ofMinutes(10);
        private Duration healthPoll = Duration.ofSeconds(10);
        private Duration composeUpTimeout = Duration.ofMinutes(5);
        private Duration composeDownTimeout = Duration.ofMinutes(2);
        private Duration inspectTimeout = Duration.ofSeconds(10);
        private Duration commandTimeout = Duration.ofSeconds(60);

        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }

        public Duration getWoocommerceHealthTimeout() { return woocommerceHealthTimeout; }
        public void setWoocommerceHealthTimeout(Duration v) { this.woocommerceHealthTimeout = v; }

        public Duration getMagentoHealthTimeout() { return magentoHealthTimeout; }
        public void setMagentoHealthTimeout(Duration v) { this.magentoHealthTimeout = v; }

        public Duration getHealthPoll() { return healthPoll; }
        public void setHealthPoll(Duration healthPoll) { this.healthPoll = healthPoll; }

        public Duration getComposeUpTimeout() { return composeUpTimeout; }
        public void setComposeUpTimeout(Duration composeUpTimeout) { this.composeUpTimeout = composeUpTimeout; }

        public Duration getComposeDownTimeout() { return composeDownTimeout; }
        public void setComposeDownTimeout(Duration composeDownTimeout) { this.composeDownTimeout = composeDownTimeout; }

        public Duration getInspectTimeout() { return inspectTimeout; }
        public void setInspectTimeout(Duration inspectTimeout) { this.inspectTimeout = inspectTimeout; }

        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    }

    public static class Plan {
        private String code;
        private String memoryLimit;
        private String cpuLimit;
        private long diskGb;
        private long bandwidthGb;

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getMemoryLimit() { return memoryLimit; }
        public void setMemoryLimit(String memoryLimit) { this.memoryLimit = memoryLimit; }

        public String getCpuLimit() { return cpuLimit; }
        public void setCpuLimit(String cpuLimit) { this.cpuLimit = cpuLimit; }

        public long getDiskGb() { return diskGb; }
        public void setDiskGb(long diskGb) { this.diskGb = diskGb; }

        public long getBandwidthGb() { return bandwidthGb; }
        public void setBandwidthGb(long bandwidthGb) { this.bandwidthGb = bandwidthGb; }

        @Override
        public String toString() {
            return "Plan{code='" + code + "', memory=" + memoryLimit + ", cpus=" + cpuLimit
                    + ", diskGb=" + diskGb + ", bandwidthGb=" + bandwidthGb + '}';
        }
    }

    /** 루프 주기(@Scheduled 는 *-delay-ms 키를 직접 읽음)와 판정 기준 */
    public static class Scheduler {
        private boolean enabled = true;
        private long heartbeatDelayMs = 30_000;
        private long workerDelayMs = 1_000;
        private long quotaDelayMs = 3_600_000;
        private long maintenanceDelayMs = 60_000;
        private long certificateDelayMs = 3_600_000;
        private long healthDelayMs = 60_000;
        private Duration dequeueWait = Duration.ofSeconds(5);
        private Duration dequeuePoll = Duration.ofSeconds(1);
        private Duration freshness = Duration.ofSeconds(90);
        private Duration statusWindow = Duration.ofMinutes(5);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private Duration staleJobAfter = Duration.ofMinutes(30);
        private Duration offlineAfter = Duration.ofMinutes(15);
        private Duration logRetention = Duration.ofDays(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getHeartbeatDelayMs() { return heartbeatDelayMs; }
        public void setHeartbeatDelayMs(long heartbeatDelayMs) { this.heartbeatDelayMs = heartbeatDelayMs; }

        public long getWorkerDelayMs() { return workerDelayMs; }
        public void setWorkerDelayMs(long workerDelayMs) { this.workerDelayMs = workerDelayMs; }

        public long getQuotaDelayMs() { return quotaDelayMs; }
        public void setQuotaDelayMs(long quotaDelayMs) { this.quotaDelayMs = quotaDelayMs; }

        public long getMaintenanceDelayMs() { return maintenanceDelayMs; }
        public void setMaintenanceDelayMs(long maintenanceDelayMs) { this.maintenanceDelayMs = maintenanceDelayMs; }

        public long getCertificateDelayMs() { return certificateDelayMs; }
        public void setCertificateDelayMs(long certificateDelayMs) { this.certificateDelayMs = certificateDelayMs; }

        public long getHealthDelayMs() { return healthDelayMs; }
        public void setHealthDelayMs(long healthDelayMs) { this.healthDelayMs = healthDelayMs; }

        public Duration getDequeueWait() { return dequeueWait; }
        public void setDequeueWait(Duration dequeueWait) { this.dequeueWait = dequeueWait; }

        public Duration getDequeuePoll() { return dequeuePoll; }
        public void setDequeuePoll(Duration dequeuePoll) { this.dequeuePoll = dequeuePoll; }

        public Duration getFreshness() { return freshness; }
        public void setFreshness(Duration freshness) { this.freshness = freshness; }

        public Duration getStatusWindow() { return statusWindow; }
        public void setStatusWindow(Duration statusWindow) { this.statusWindow = statusWindow; }

        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

        public Duration getStaleJobAfter() { return staleJobAfter; }
        public void setStaleJobAfter(Duration staleJobAfter) { this.staleJobAfter = staleJobAfter; }

        public Duration getOfflineAfter() { return offlineAfter; }
        public void setOfflineAfter(Duration offlineAfter) { this.offlineAfter = offlineAfter; }

        public Duration getLogRetention() { return logRetention; }
        public void setLogRetention(Duration logRetention) { this.logRetention = logRetention; }
    }

    public static class Quota {
        private double warningPercent = 80.0;
        private double criticalPercent = 90.0;
        private Duration cooldown = Duration.ofHours(24);
        private String billingCron = "0 0 0 1 * ?";
        private boolean projectQuota = false;
        private String quotaMount = "/";

        public double getWarningPercent() { return warningPercent; }
        public void setWarningPercent(double warningPercent) { this.warningPercent = warningPercent; }

        public double getCriticalPercent() { return criticalPercent; }
        public void setCriticalPercent(double criticalPercent) { this.criticalPercent = criticalPercent; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

        public String getBillingCron() { return billingCron; }
        public void setBillingCron(String billingCron) { this.billingCron = billingCron; }

        public boolean isProjectQuota() { return projectQuota; }
        public void setProjectQuota(boolean projectQuota) { this.projectQuota = projectQuota; }

        public String getQuotaMount() { return quotaMount; }
        public void setQuotaMount(String quotaMount) { this.quotaMount = quotaMount; }
    }

    /** 테넌트 스토어 다운 감시 */
    public static class Monitoring {
        private int failureThreshold = 3;
        private Duration alertCooldown = Duration.ofMinutes(5);
        private Duration httpTimeout = Duration.ofSeconds(10);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public Duration getAlertCooldown() { return alertCooldown; }
        public void setAlertCooldown(Duration alertCooldown) { this.alertCooldown = alertCooldown; }

        public Duration getHttpTimeout() { return httpTimeout; }
        public void setHttpTimeout(Duration httpTimeout) { this.httpTimeout = httpTimeout; }
    }

    public static class Proxy {
        private String sitesAvailable = "/etc/nginx/sites-available";
        private String sitesEnabled = "/etc/nginx/sites-enabled";
        private String accessLogDir = "/var/log/nginx";
        private String acmeRoot = "/var/www/html";
        private List<String> testCommand = new ArrayList<>(List.of("nginx", "-t"));
        private List<String> reloadCommand = new ArrayList<>(List.of("systemctl", "reload", "nginx"));

        public String getSitesAvailable() { return sitesAvailable; }
        public void setSitesAvailable(String sitesAvailable) { this.sitesAvailable = sitesAvailable; }

        public String getSitesEnabled() { return sitesEnabled; }
        public void setSitesEnabled(String sitesEnabled) { this.sitesEnabled = sitesEnabled; }

        public String getAccessLogDir() { return accessLogDir; }
        public void setAccessLogDir(String accessLogDir) { this.accessLogDir = accessLogDir; }

        public String getAcmeRoot() { return acmeRoot; }
        public void setAcmeRoot(String acmeRoot) { this.acmeRoot = acmeRoot; }

        public List<String> getTestCommand() { return testCommand; }
        public void setTestCommand(List<String> testCommand) { this.testCommand = testCommand; }

        public List<String> getReloadCommand() { return reloadCommand; }
        public void setReloadCommand(List<String> reloadCommand) { this.reloadCommand = reloadCommand; }
    }

    public static class Certificates {
        private String adminEmail;
        private Duration timeout = Duration.ofMinutes(2);

        public String getAdminEmail() { return adminEmail; }
        public void setAdminEmail(String adminEmail) { this.adminEmail = adminEmail; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Backup {
        private String scriptsDir = "/opt/storefleet/scripts";
        private boolean sudo = true;
        private String restoreSource = "manual";
        private Duration backupTimeout = Duration.ofMinutes(10);
        private Duration restoreTimeout = Duration.ofMinutes(20);

        public String getScriptsDir() { return scriptsDir; }
        public void setScriptsDir(String scriptsDir) { this.scriptsDir = scriptsDir; }

        public boolean isSudo() { return sudo; }
        public void setSudo(boolean sudo) { this.sudo = sudo; }

        public String getRestoreSource() { return restoreSource; }
        public void setRestoreSource(String restoreSource) { this.restoreSource = restoreSource; }

        public Duration getBackupTimeout() { return backupTimeout; }
        public void setBackupTimeout(Duration backupTimeout) { this.backupTimeout = backupTimeout; }

        public Duration getRestoreTimeout() { return restoreTimeout; }
        public void setRestoreTimeout(Duration restoreTimeout) { this.restoreTimeout = restoreTimeout; }
    }

    public static class Notification {
        private String webhookUrl;
        private Duration timeout = Duration.ofSeconds(10);

        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Security {
        private String credentialKey; // base64, 32 bytes

        public String getCredentialKey() { return credentialKey; }
        public void setCredentialKey(String credentialKey) { this.credentialKey = credentialKey; }
    }
}
