package net.storefleet.adapter.host.backup;

import net.storefleet.adapter.host.process.CommandResult;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.model.BackupJob;
import net.storefleet.core.spi.BackupTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 호스트의 백업/복원 스크립트를 호출한다.
 * <ul>
 *   <li>{@code customer-backup.sh <id> <scope>} → stdout 의 {@code SNAPSHOT_ID=...}</li>
 *   <li>{@code customer-restore.sh <id> <snapshot> <scope> <source>}</li>
 * </ul>
 */
public final class ScriptBackupTool implements BackupTool {
    private static final Logger log = LoggerFactory.getLogger(ScriptBackupTool.class);

    static final String SNAPSHOT_MARKER = "SNAPSHOT_ID=";

    public record Settings(Path backupScript, Path restoreScript, boolean sudo, String restoreSource,
                           Duration backupTimeout, Duration restoreTimeout) {
        public static Settings defaults(Path scriptsDir) {
            return new Settings(scriptsDir.resolve("customer-backup.sh"), scriptsDir.resolve("customer-restore.sh"),
                    true, "manual", Duration.ofMinutes(10), Duration.ofMinutes(20));
        }
    }

    private final CommandRunner runner;
    private final Settings settings;

    public ScriptBackupTool(CommandRunner runner, Settings settings) {
        this.runner = runner;
        this.settings = settings;
    }

    @Override
    public String backup(long tenantId, BackupJob.Scope scope) throws Exception {
        CommandResult r = runner.run(command(settings.backupScript(), String.valueOf(tenantId), scope.arg()),
                settings.backupTimeout());
        if (r.timedOut()) throw new InfrastructureException("backup timed out after " + settings.backupTimeout());
        if (r.exitCode() != 0) throw new InfrastructureException("backup failed: " + lastError(r));

        String snapshot = snapshotId(r.output());
        if (snapshot == null) {
            throw new InfrastructureException("backup finished without " + SNAPSHOT_MARKER + " line");
        }
        log.info("backup done: tenant={} scope={} snapshot={}", tenantId, scope, snapshot);
        return snapshot;
    }

    @Override
    public void restore(long tenantId, String snapshotId, BackupJob.Scope scope) throws Exception {
        CommandResult r = runner.run(command(settings.restoreScript(), String.valueOf(tenantId), snapshotId,
                scope.arg(), settings.restoreSource()), settings.restoreTimeout());
        if (r.timedOut()) throw new InfrastructureException("restore timed out after " + settings.restoreTimeout());
        if (r.exitCode() != 0) throw new InfrastructureException("restore failed: " + lastError(r));
        log.info("restore done: tenant={} scope={} snapshot={}", tenantId, scope, snapshotId);
    }

    private List<String> command(Path script, String... args) {
        List<String> cmd = new ArrayList<>();
        if (settings.sudo()) cmd.add("sudo");
        cmd.add(script.toString());
        cmd.addAll(List.of(args));
        return cmd;
    }

    static String snapshotId(String output) {
        if (output == null) return null;
        for (String line : output.split("\\R")) {
            String s = line.strip();
            if (s.startsWith(SNAPSHOT_MARKER)) {
                String id = s.substring(SNAPSHOT_MARKER.length()).strip();
                return id.isEmpty() ? null : id;
            }
        }
        return null;
    }

    /** 스크립트는 stdout 에 로그를 남기므로 마지막 ERROR: 줄을 우선한다 */
    static String lastError(CommandResult r) {
        String out = r.output() == null ? "" : r.output();
        String[] lines = out.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            int at = lines[i].indexOf("ERROR:");
            if (at >= 0) return lines[i].substring(at + "ERROR:".length()).strip();
        }
        String tail = r.tail(300);
        return tail.isEmpty() ? "exit " + r.exitCode() : tail;
    }
}
