package net.storefleet.core.spi;

import net.storefleet.core.model.PortAssignment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PortAssignmentRepository {
    /** (server, port) 선점 시도. unique 위반(다른 워커가 먼저 커밋)이면 false */
    boolean tryInsert(long serverId, int port, long tenantId, Instant now) throws Exception;

    Optional<PortAssignment> findByTenant(long tenantId) throws Exception;

    /** 오름차순 */
    List<Integer> findUsedPorts(long serverId) throws Exception;

    int countByServer(long serverId) throws Exception;

    int delete(long serverId, int port) throws Exception;

    int deleteByTenant(long tenantId) throws Exception;
}
