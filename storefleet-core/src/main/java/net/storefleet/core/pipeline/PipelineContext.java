package net.storefleet.core.pipeline;

import net.storefleet.core.model.Credentials;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.Tenant;

import java.nio.file.Path;

/** 한 번의 파이프라인 실행 동안 스텝 사이에 전달되는 상태 */
public final class PipelineContext {
    private final ProvisioningJob job;
    private final Tenant tenant;
    private final Server server;
    private final PlanTier plan;

    private Path workspace;
    private Credentials credentials;
    private Integer port;
    private boolean tlsEnabled;

    public PipelineContext(ProvisioningJob job, Tenant tenant, Server server, PlanTier plan) {
        this.job = job;
        this.tenant = tenant;
        this.server = server;
        this.plan = plan;
        this.tlsEnabled = tenant.tlsEnabled();
    }

    public ProvisioningJob job() { return job; }
    public Tenant tenant() { return tenant; }
    public long tenantId() { return tenant.id(); }
    public Server server() { return server; }
    public long serverId() { return server.id(); }
    public PlanTier plan() { return plan; }

    public Path workspace() { return workspace; }
    public void workspace(Path workspace) { this.workspace = workspace; }

    public Credentials credentials() { return credentials; }
    public void credentials(Credentials credentials) { this.credentials = credentials; }

    public Integer port() { return port; }
    public void port(Integer port) { this.port = port; }

    public boolean tlsEnabled() { return tlsEnabled; }
    public void tlsEnabled(boolean tlsEnabled) { this.tlsEnabled = tlsEnabled; }

    public String storeUrl() { return (tlsEnabled ? "https://" : "http://") + tenant.domain(); }
}
