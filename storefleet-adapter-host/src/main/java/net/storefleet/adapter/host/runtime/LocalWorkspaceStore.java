package net.storefleet.adapter.host.runtime;

import net.storefleet.core.model.Platform;
import net.storefleet.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 로컬 파일시스템 워크스페이스: {root}/customer-{id}/
 * <pre>
 *   docker-compose.yml
 *   volumes/db, volumes/files, (magento) volumes/varnish
 *   logs
 * </pre>
 */
public final class LocalWorkspaceStore implements WorkspaceStore {
    private static final Logger log = LoggerFactory.getLogger(LocalWorkspaceStore.class);

    public static final String PREFIX = "customer-";

    private final Path root;

    public LocalWorkspaceStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public Path resolve(long tenantId) {
        return root.resolve(PREFIX + tenantId);
    }

    @Override
    public boolean exists(long tenantId) {
        return Files.isDirectory(resolve(tenantId));
    }

    @Override
    public Path ensure(long tenantId, Platform platform) throws IOException {
        Path ws = resolve(tenantId);
        for (String sub : layout(platform)) {
            Files.createDirectories(ws.resolve(sub));
        }
        return ws;
    }

    static List<String> layout(Platform platform) {
        if (platform == Platform.MAGENTO) {
            return List.of("volumes/db", "volumes/files", "volumes/varnish", "logs");
        }
        return List.of("volumes/db", "volumes/files", "logs");
    }

    /** 임시 파일에 쓴 뒤 교체. 반쯤 쓰인 정의 파일이 남지 않는다 */
    @Override
    public Path write(long tenantId, String fileName, String content) throws IOException {
        Path ws = resolve(tenantId);
        Path target = ws.resolve(fileName).normalize();
        if (!target.startsWith(ws)) {
            throw new IllegalArgumentException("file name escapes workspace: " + fileName);
        }
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return target;
    }

    @Override
    public void delete(long tenantId) throws IOException {
        Path ws = resolve(tenantId);
        if (!Files.exists(ws)) return;
        try (Stream<Path> walk = Files.walk(ws)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
        log.info("workspace removed: {}", ws);
    }
}
