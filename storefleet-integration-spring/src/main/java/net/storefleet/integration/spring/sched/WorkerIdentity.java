package net.storefleet.integration.spring.sched;

import net.storefleet.core.queue.WorkerContext;

/**
 * 이 프로세스가 대표하는 서버. 서버 행 등록이 끝나야 루프가 돈다.
 */
public final class WorkerIdentity {
    private final String hostname;
    private final String workerName;
    private volatile WorkerContext context;

    public WorkerIdentity(String hostname, String workerName) {
        this.hostname = hostname;
        this.workerName = workerName;
    }

    public String hostname() { return hostname; }

    public String workerName() { return workerName; }

    /** 서버 등록 직후 한 번 호출 */
    public synchronized void bind(long serverId) {
        if (context != null && context.serverId() != serverId) {
            throw new IllegalStateException("worker already bound to server " + context.serverId());
        }
        if (context == null) context = new WorkerContext(serverId, workerName);
    }

    public boolean isBound() { return context != null; }

    public WorkerContext context() {
        WorkerContext c = context;
        if (c == null) throw new IllegalStateException("server not registered yet: " + hostname);
        return c;
    }
}
