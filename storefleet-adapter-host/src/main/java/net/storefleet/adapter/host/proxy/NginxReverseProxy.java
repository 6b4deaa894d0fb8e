package net.storefleet.adapter.host.proxy;

import net.storefleet.adapter.host.process.CommandResult;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.spi.ReverseProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * sites-available 에 server 블록을 쓰고 sites-enabled 에 링크한 뒤
 * {@code nginx -t} 가 통과할 때만 reload 한다.
 * 검사/reload 실패 시 파일과 링크를 이전 상태로 되돌린다.
 */
public final class NginxReverseProxy implements ReverseProxy {
    private static final Logger log = LoggerFactory.getLogger(NginxReverseProxy.class);

    public record Settings(Path sitesAvailable, Path sitesEnabled, List<String> testCommand,
                           List<String> reloadCommand, Duration timeout) {
        public static Settings defaults() {
            return new Settings(Path.of("/etc/nginx/sites-available"), Path.of("/etc/nginx/sites-enabled"),
                    List.of("nginx", "-t"), List.of("systemctl", "reload", "nginx"), Duration.ofSeconds(30));
        }
    }

    private final CommandRunner runner;
    private final NginxRouteRenderer renderer;
    private final Settings settings;

    public NginxReverseProxy(CommandRunner runner, NginxRouteRenderer renderer, Settings settings) {
        this.runner = runner;
        this.renderer = renderer;
        this.settings = settings;
    }

    static String siteName(long tenantId) {
        return "customer-" + tenantId;
    }

    Path configFile(long tenantId) {
        return settings.sitesAvailable().resolve(siteName(tenantId) + ".conf");
    }

    Path enabledLink(long tenantId) {
        return settings.sitesEnabled().resolve(siteName(tenantId) + ".conf");
    }

    @Override
    public synchronized void apply(Route route) throws Exception {
        Path conf = configFile(route.tenantId());
        Path link = enabledLink(route.tenantId());

        String previous = Files.exists(conf) ? Files.readString(conf, StandardCharsets.UTF_8) : null;
        boolean wasLinked = Files.exists(link, java.nio.file.LinkOption.NOFOLLOW_LINKS);

        Files.createDirectories(conf.getParent());
        Files.writeString(conf, renderer.render(route), StandardCharsets.UTF_8);
        if (!wasLinked) {
            Files.createDirectories(link.getParent());
            Files.createSymbolicLink(link, conf);
        }

        CommandResult test = runner.run(settings.testCommand(), settings.timeout());
        if (!test.ok()) {
            revert(conf, link, previous, wasLinked);
            throw new InfrastructureException("nginx config test failed for " + route.domain() + ": " + test.tail(500));
        }
        CommandResult reload = runner.run(settings.reloadCommand(), settings.timeout());
        if (!reload.ok()) {
            revert(conf, link, previous, wasLinked);
            throw new InfrastructureException("nginx reload failed: " + reload.tail(500));
        }
        log.info("route active: {} -> 127.0.0.1:{}", route.domain(), route.port());
    }

    private void revert(Path conf, Path link, String previous, boolean wasLinked) throws IOException {
        if (!wasLinked) Files.deleteIfExists(link);
        if (previous != null) Files.writeString(conf, previous, StandardCharsets.UTF_8);
        else Files.deleteIfExists(conf);
    }

    @Override
    public synchronized void remove(long tenantId) throws Exception {
        boolean removedLink = Files.deleteIfExists(enabledLink(tenantId));
        boolean removedConf = Files.deleteIfExists(configFile(tenantId));
        if (!removedLink && !removedConf) return;

        CommandResult reload = runner.run(settings.reloadCommand(), settings.timeout());
        if (!reload.ok()) {
            throw new InfrastructureException("nginx reload failed after removing " + siteName(tenantId)
                    + ": " + reload.tail(500));
        }
        log.info("route removed: {}", siteName(tenantId));
    }

    @Override
    public boolean isActive(long tenantId) {
        return Files.exists(enabledLink(tenantId), java.nio.file.LinkOption.NOFOLLOW_LINKS);
    }
}
