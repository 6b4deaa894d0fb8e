package net.storefleet.core.spi;

import net.storefleet.core.model.Platform;

import java.nio.file.Path;

public interface WorkspaceStore {
    Path resolve(long tenantId);

    boolean exists(long tenantId);

    /** 디렉터리 트리를 보장. 이미 있어도 실패하지 않는다 */
    Path ensure(long tenantId, Platform platform) throws Exception;

    Path write(long tenantId, String fileName, String content) throws Exception;

    void delete(long tenantId) throws Exception;
}
