package net.storefleet.core.spi;

import net.storefleet.core.model.Server;

/** 하트비트가 오래됐을 때만 쓰는 직접 도달성 검사 */
public interface ReachabilityProbe {
    enum Reachability { UP, DEGRADED, DOWN }

    Reachability probe(Server server);
}
