package net.storefleet.adapter.host.probe;

import net.storefleet.adapter.host.process.CommandResult;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.spi.UsageProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 디스크: XFS/ext4 프로젝트 쿼터(repquota, 프로젝트 id = 테넌트 id)가 켜져 있으면 그 값, 아니면 du.
 * 대역폭: nginx combined 형식 access log 의 응답 바이트 합.
 */
public final class HostUsageProbe implements UsageProbe {
    private static final Logger log = LoggerFactory.getLogger(HostUsageProbe.class);

    static final DateTimeFormatter NGINX_TIME =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    // [time] "request" status bytes
    private static final Pattern COMBINED = Pattern.compile("\\[([^\\]]+)]\\s+\"[^\"]*\"\\s+(\\d{3})\\s+(\\d+|-)");

    public record Settings(boolean projectQuota, String quotaMount, Path accessLogDir, Duration timeout) { }

    private final CommandRunner runner;
    private final Settings settings;

    public HostUsageProbe(CommandRunner runner, Settings settings) {
        this.runner = runner;
        this.settings = settings;
    }

    @Override
    public long diskBytes(long tenantId, Path workspace) throws Exception {
        if (!Files.isDirectory(workspace)) {
            log.warn("workspace not found for usage sample: {}", workspace);
            return 0;
        }
        if (settings.projectQuota()) {
            Long fromQuota = fromRepquota(tenantId);
            if (fromQuota != null) return fromQuota;
        }
        CommandResult r = runner.run(List.of("du", "-sb", workspace.toString()), settings.timeout());
        if (!r.ok()) {
            throw new InfrastructureException("du failed for " + workspace + ": " + r.tail(300));
        }
        try {
            return Long.parseLong(r.output().strip().split("\\s+")[0]);
        } catch (NumberFormatException e) {
            throw new InfrastructureException("unexpected du output: " + r.tail(100), e);
        }
    }

    /** repquota 는 KB 단위. 해당 프로젝트 줄이 없으면 null */
    private Long fromRepquota(long tenantId) throws Exception {
        CommandResult r = runner.run(List.of("repquota", "-P", "-O", "csv", settings.quotaMount()), settings.timeout());
        if (!r.ok()) {
            log.warn("repquota failed ({}), falling back to du", r.exitCode());
            return null;
        }
        String prefix = "#" + tenantId + ",";
        for (String line : r.output().split("\\R")) {
            if (!line.startsWith(prefix)) continue;
            String[] parts = line.split(",");
            if (parts.length < 3) continue;
            try {
                return Long.parseLong(parts[2].trim()) * 1024;
            } catch (NumberFormatException e) {
                log.warn("unparsable repquota line: {}", line);
            }
        }
        return null;
    }

    @Override
    public long bandwidthBytes(long tenantId, Instant since) throws Exception {
        Path logFile = settings.accessLogDir().resolve("customer-" + tenantId + "-access.log");
        if (!Files.exists(logFile)) return 0;

        long sum = 0;
        try (BufferedReader in = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                sum += bytesSince(line, since);
            }
        }
        return sum;
    }

    static long bytesSince(String line, Instant since) {
        Matcher m = COMBINED.matcher(line);
        if (!m.find() || m.group(3).equals("-")) return 0;
        try {
            Instant at = OffsetDateTime.parse(m.group(1), NGINX_TIME).toInstant();
            return at.isBefore(since) ? 0 : Long.parseLong(m.group(3));
        } catch (DateTimeParseException | NumberFormatException e) {
            return 0;
        }
    }
}
