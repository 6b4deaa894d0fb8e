package net.storefleet.core.spi;

import net.storefleet.core.model.Server;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ServerRepository {
    /** hostname 기준 멱등 등록 (선언 용량/포트 범위 갱신) */
    Server upsert(String name, String hostname, String address,
                  int maxTenants, int portRangeStart, int portRangeEnd, Instant now) throws Exception;

    Optional<Server> findById(long id) throws Exception;

    Optional<Server> findByHostname(String hostname) throws Exception;

    List<Server> findAll() throws Exception;

    /** LAST_HEARTBEAT 갱신. OFFLINE 이었으면 ACTIVE 로 복귀 */
    boolean heartbeat(long id, Instant now) throws Exception;

    void updateStatus(long id, Server.Status status, Instant now) throws Exception;

    /** threshold 이전부터 조용한 ACTIVE 서버를 OFFLINE 으로 (삭제하지 않음) */
    int markOfflineSilentSince(Instant threshold, Instant now) throws Exception;
}
