package net.storefleet.adapter.host.proxy;

import net.storefleet.adapter.host.process.RecordingCommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.spi.ReverseProxy.Route;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static net.storefleet.adapter.host.process.RecordingCommandRunner.fail;
import static net.storefleet.adapter.host.process.RecordingCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;

class NginxReverseProxyTest {

    @TempDir
    Path etc;
    RecordingCommandRunner runner;
    NginxReverseProxy proxy;

    @BeforeEach
    void setUp() {
        runner = new RecordingCommandRunner();
        var settings = new NginxReverseProxy.Settings(etc.resolve("sites-available"), etc.resolve("sites-enabled"),
                List.of("nginx", "-t"), List.of("systemctl", "reload", "nginx"), Duration.ofSeconds(5));
        proxy = new NginxReverseProxy(runner, new NginxRouteRenderer("/var/log/nginx", "/var/www/html"), settings);
    }

    @Test
    void apply_writesBlock_testsThenReloads() throws Exception {
        proxy.apply(new Route(12, "shop.example.com", 8005));

        String conf = Files.readString(proxy.configFile(12));
        assertTrue(conf.contains("server_name shop.example.com;"));
        assertTrue(conf.contains("proxy_pass http://127.0.0.1:8005;"));
        assertTrue(conf.contains("access_log /var/log/nginx/customer-12-access.log;"));
        assertTrue(conf.contains("proxy_set_header Host $host;"));
        assertTrue(Files.isSymbolicLink(proxy.enabledLink(12)));
        assertTrue(proxy.isActive(12));

        assertEquals(List.of(List.of("nginx", "-t"), List.of("systemctl", "reload", "nginx")), runner.calls);
    }

    @Test
    void failedSyntaxTest_leavesNothingActive_andNoReload() {
        runner.respond(cmd -> cmd.get(0).equals("nginx") ? fail(1, "nginx: [emerg] unexpected \"}\"") : ok(""));

        InfrastructureException ex = assertThrows(InfrastructureException.class,
                () -> proxy.apply(new Route(13, "bad.example.com", 8006)));
        assertTrue(ex.getMessage().contains("emerg"));
        assertFalse(proxy.isActive(13));
        assertFalse(Files.exists(proxy.configFile(13)));
        assertFalse(runner.ran("systemctl"));
    }

    @Test
    void failedTestOnUpdate_restoresPreviousBlock() throws Exception {
        proxy.apply(new Route(14, "keep.example.com", 8007));
        String before = Files.readString(proxy.configFile(14));

        runner.respond(cmd -> cmd.get(0).equals("nginx") ? fail(1, "broken") : ok(""));
        assertThrows(InfrastructureException.class, () -> proxy.apply(new Route(14, "keep.example.com", 8099)));

        assertEquals(before, Files.readString(proxy.configFile(14)));
        assertTrue(proxy.isActive(14));
    }

    @Test
    void remove_isIdempotent_reloadsOnlyWhenSomethingRemoved() throws Exception {
        proxy.apply(new Route(15, "gone.example.com", 8008));
        runner.calls.clear();

        proxy.remove(15);
        assertFalse(proxy.isActive(15));
        assertFalse(Files.exists(proxy.configFile(15)));
        assertEquals(1, runner.calls.size());

        proxy.remove(15);
        assertEquals(1, runner.calls.size());
    }

    @Test
    void certbot_commandShape_andFailure() {
        var issuer = new CertbotIssuer(runner, "ops@storefleet.net", Duration.ofMinutes(2));
        assertEquals(List.of("certbot", "--nginx", "-d", "shop.example.com", "--non-interactive", "--agree-tos",
                "--email", "ops@storefleet.net", "--redirect"), issuer.command("shop.example.com"));

        runner.respond(cmd -> fail(1, "Challenge failed for domain shop.example.com"));
        var ex = assertThrows(InfrastructureException.class, () -> issuer.issue(1, "shop.example.com"));
        assertTrue(ex.getMessage().contains("Challenge failed"));
        assertThrows(IllegalArgumentException.class, () -> new CertbotIssuer(runner, " ", Duration.ofSeconds(1)));
    }
}
