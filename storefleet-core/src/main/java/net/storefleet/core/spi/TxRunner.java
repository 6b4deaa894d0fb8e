package net.storefleet.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Work body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Work body) throws Exception { requiresNew(() -> { body.run(); return null; }); }

    /** 반환값 없는 트랜잭션 본문 */
    @FunctionalInterface
    interface Work {
        void run() throws Exception;
    }
}
