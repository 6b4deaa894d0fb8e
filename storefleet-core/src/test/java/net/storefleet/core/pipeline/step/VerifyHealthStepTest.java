package net.storefleet.core.pipeline.step;

import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.ProvisioningJob;
import net.storefleet.core.model.Server;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.spi.ContainerRuntime;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class VerifyHealthStepTest {

    /** 미리 정한 순서로 상태를 돌려주는 런타임 */
    static final class ScriptedRuntime implements ContainerRuntime {
        final Deque<Health> script;
        int polls;
        int failuresLeft;

        ScriptedRuntime(List<Health> states) { this.script = new ArrayDeque<>(states); }

        @Override public void up(Path workspace) { }
        @Override public void down(Path workspace) { }
        @Override public void stop(Path workspace) { }
        @Override public void start(Path workspace) { }

        @Override
        public Health health(Path workspace) throws Exception {
            polls++;
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new InfrastructureException("compose ps failed (1): daemon busy");
            }
            return script.size() > 1 ? script.poll() : script.peek();
        }
    }

    private static PipelineContext ctx() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        var tenant = new Tenant(5L, "shop.example.com", "o@example.com", Platform.WOOCOMMERCE, "starter",
                Tenant.Status.PROVISIONING, 1L, 8001, false, null, false, null, null, null, null, now, now);
        var server = new Server(1L, "w1", "w1.local", "10.0.0.1", Server.Status.ACTIVE, 10, 8001, 8010,
                now, now, now);
        var job = new ProvisioningJob(11L, 5L, 1L, ProvisioningJob.Status.RUNNING, 8, "verify-health", 1,
                null, now, now, now, null);
        var c = new PipelineContext(job, tenant, server, new PlanTier("starter", "1g", "1.0", 25, 250));
        c.workspace(Path.of("/tmp/customer-5"));
        return c;
    }

    private static VerifyHealthStep.Policy fast(Duration timeout) {
        return new VerifyHealthStep.Policy(Map.of(Platform.WOOCOMMERCE, timeout), Duration.ofMillis(5));
    }

    @Test
    void a1_waits_through_starting_until_running() throws Exception {
        var runtime = new ScriptedRuntime(List.of(
                ContainerRuntime.Health.ABSENT, ContainerRuntime.Health.STARTING, ContainerRuntime.Health.RUNNING));
        new VerifyHealthStep(runtime, fast(Duration.ofSeconds(5))).execute(ctx());
        assertEquals(3, runtime.polls);
    }

    @Test
    void a2_exited_container_fails_immediately() {
        var runtime = new ScriptedRuntime(List.of(ContainerRuntime.Health.STARTING, ContainerRuntime.Health.EXITED));
        var step = new VerifyHealthStep(runtime, fast(Duration.ofSeconds(5)));
        assertThrows(StepFailedException.class, () -> step.execute(ctx()));
        assertEquals(2, runtime.polls);
    }

    @Test
    void a3_bounded_wait_expires() {
        var runtime = new ScriptedRuntime(List.of(ContainerRuntime.Health.STARTING));
        var step = new VerifyHealthStep(runtime, fast(Duration.ofMillis(50)));
        var ex = assertThrows(StepFailedException.class, () -> step.execute(ctx()));
        assertTrue(ex.getMessage().contains("STARTING"));
        assertTrue(runtime.polls > 1);
    }

    @Test
    void a4_default_policy_gives_magento_longer() {
        var p = VerifyHealthStep.Policy.defaults();
        assertEquals(Duration.ofMinutes(5), p.timeoutFor(Platform.WOOCOMMERCE));
        assertEquals(Duration.ofMinutes(10), p.timeoutFor(Platform.MAGENTO));
    }

    @Test
    void a5_transient_check_failure_keeps_waiting() throws Exception {
        var runtime = new ScriptedRuntime(List.of(ContainerRuntime.Health.RUNNING));
        runtime.failuresLeft = 1;
        new VerifyHealthStep(runtime, fast(Duration.ofSeconds(2))).execute(ctx());
        assertEquals(2, runtime.polls);
    }

    @Test
    void a6_check_failing_until_deadline_fails_with_last_error() {
        var runtime = new ScriptedRuntime(List.of(ContainerRuntime.Health.RUNNING));
        runtime.failuresLeft = Integer.MAX_VALUE;
        var step = new VerifyHealthStep(runtime, fast(Duration.ofMillis(50)));
        var ex = assertThrows(StepFailedException.class, () -> step.execute(ctx()));
        assertTrue(ex.getMessage().contains("daemon busy"));
        assertInstanceOf(InfrastructureException.class, ex.getCause());
        assertTrue(runtime.polls > 1);
    }
}
