package net.storefleet.core.pipeline.step;

import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.model.Platform;
import net.storefleet.core.pipeline.PipelineContext;
import net.storefleet.core.pipeline.PipelineStep;
import net.storefleet.core.spi.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/** 8. 제한 시간 안에 환경이 RUNNING 이 되는지 폴링. 실패는 치명적 (롤백) */
public final class VerifyHealthStep implements PipelineStep {
    private static final Logger log = LoggerFactory.getLogger(VerifyHealthStep.class);

    private final ContainerRuntime runtime;
    private final Policy policy;

    /** 플랫폼별 최대 대기 + 폴링 간격 */
    public record Policy(Map<Platform, Duration> timeouts, Duration pollInterval) {
        public static Policy defaults() {
            Map<Platform, Duration> m = new EnumMap<>(Platform.class);
            m.put(Platform.WOOCOMMERCE, Duration.ofMinutes(5));
            m.put(Platform.MAGENTO, Duration.ofMinutes(10));
            return new Policy(m, Duration.ofSeconds(10));
        }

        public Duration timeoutFor(Platform p) {
            return timeouts.getOrDefault(p, Duration.ofMinutes(5));
        }
    }

    public VerifyHealthStep(ContainerRuntime runtime, Policy policy) {
        this.runtime = runtime;
        this.policy = policy;
    }

    @Override public String name() { return "verify-health"; }

    @Override
    public void execute(PipelineContext ctx) throws Exception {
        Duration timeout = policy.timeoutFor(ctx.tenant().platform());
        long deadline = System.nanoTime() + timeout.toNanos();
        ContainerRuntime.Health last = null;
        Exception lastError = null;

        while (true) {
            try {
                last = runtime.health(ctx.workspace());
                lastError = null;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                // 일시적인 상태 조회 실패는 마감까지 재시도
                lastError = e;
                log.warn("tenant {} health check failed, retrying: {}", ctx.tenantId(), e.getMessage());
            }
            if (lastError == null) {
                switch (last) {
                    case RUNNING -> {
                        log.info("tenant {} environment healthy", ctx.tenantId());
                        return;
                    }
                    case EXITED -> throw new StepFailedException("environment exited during startup");
                    default -> log.debug("tenant {} environment {} - waiting", ctx.tenantId(), last);
                }
            }
            if (System.nanoTime() - deadline >= 0) break;
            Thread.sleep(policy.pollInterval().toMillis());
        }
        if (lastError != null) {
            throw new StepFailedException("environment not healthy after " + timeout.toSeconds()
                    + "s (last check failed: " + lastError.getMessage() + ")", lastError);
        }
        throw new StepFailedException("environment not healthy after " + timeout.toSeconds() + "s (last state " + last + ")");
    }
}
