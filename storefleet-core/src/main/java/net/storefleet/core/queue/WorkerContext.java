package net.storefleet.core.queue;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** 워커 루프 반복 간에 전달되는 상태. 전역 가변 상태 대신 이 객체를 넘긴다 */
public final class WorkerContext {
    private final long serverId;
    private final String workerName;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicReference<Long> lastJobId = new AtomicReference<>();
    private final AtomicReference<Instant> lastJobAt = new AtomicReference<>();

    public WorkerContext(long serverId, String workerName) {
        this.serverId = serverId;
        this.workerName = workerName;
    }

    public long serverId() { return serverId; }
    public String workerName() { return workerName; }

    public long processed() { return processed.get(); }
    public long succeeded() { return succeeded.get(); }
    public long failed() { return failed.get(); }
    public Long lastJobId() { return lastJobId.get(); }
    public Instant lastJobAt() { return lastJobAt.get(); }

    void record(long jobId, boolean success, Instant at) {
        processed.incrementAndGet();
        (success ? succeeded : failed).incrementAndGet();
        lastJobId.set(jobId);
        lastJobAt.set(at);
    }

    @Override public String toString() {
        return "WorkerContext{" +
                "serverId=" + serverId +
                ", worker='" + workerName + '\'' +
                ", processed=" + processed +
                ", succeeded=" + succeeded +
                ", failed=" + failed +
                '}';
    }
}
