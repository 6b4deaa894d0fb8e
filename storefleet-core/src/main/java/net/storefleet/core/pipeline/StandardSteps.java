package net.storefleet.core.pipeline;

import net.storefleet.core.allocator.ResourceAllocator;
import net.storefleet.core.pipeline.step.*;
import net.storefleet.core.spi.*;

import java.util.List;

/** 프로비저닝 표준 스텝 순서 */
public final class StandardSteps {
    private StandardSteps() {}

    public static List<PipelineStep> create(WorkspaceStore workspaces,
                                            ContainerRuntime runtime,
                                            CredentialGenerator credentials,
                                            ResourceAllocator allocator,
                                            EnvironmentRenderer renderer,
                                            ReverseProxy proxy,
                                            CertificateIssuer issuer,
                                            VerifyHealthStep.Policy health,
                                            CredentialCipher cipher,
                                            Notifier notifier,
                                            TenantRepository tenants,
                                            TxRunner tx,
                                            Clock clock) {
        return List.of(
                new EnsureWorkspaceStep(workspaces, runtime),
                new GenerateCredentialsStep(credentials),
                new AllocateResourcesStep(allocator, tenants, tx, clock),
                new RenderEnvironmentStep(renderer, workspaces),
                new StartEnvironmentStep(runtime),
                new ConfigureRouteStep(proxy),
                new IssueCertificateStep(issuer, tenants, tx, clock),
                new VerifyHealthStep(runtime, health),
                new ActivateTenantStep(cipher, tenants, tx, clock),
                new NotifyTenantStep(notifier)
        );
    }
}
