package net.storefleet.core.fleet;

import net.storefleet.core.spi.Clock;
import net.storefleet.core.spi.ServerRepository;
import net.storefleet.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 워커 호스트 하트비트 기록 */
public final class HeartbeatService {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final ServerRepository servers;
    private final TxRunner tx;
    private final Clock clock;

    public HeartbeatService(ServerRepository servers, TxRunner tx, Clock clock) {
        this.servers = servers;
        this.tx = tx;
        this.clock = clock;
    }

    /** OFFLINE 으로 내려갔던 서버는 하트비트로 ACTIVE 복귀 */
    public boolean beat(long serverId) throws Exception {
        boolean ok = tx.required(() -> servers.heartbeat(serverId, clock.now()));
        if (ok) log.debug("heartbeat written for server {}", serverId);
        else log.warn("heartbeat for unknown server {}", serverId);
        return ok;
    }
}
