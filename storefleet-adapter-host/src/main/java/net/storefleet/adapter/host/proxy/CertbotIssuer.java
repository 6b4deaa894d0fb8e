package net.storefleet.adapter.host.proxy;

import net.storefleet.adapter.host.process.CommandResult;
import net.storefleet.adapter.host.process.CommandRunner;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.spi.CertificateIssuer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/** certbot nginx 플러그인으로 발급하고 HTTP→HTTPS 리다이렉트까지 설정한다 */
public final class CertbotIssuer implements CertificateIssuer {
    private static final Logger log = LoggerFactory.getLogger(CertbotIssuer.class);

    private final CommandRunner runner;
    private final String adminEmail;
    private final Duration timeout;

    public CertbotIssuer(CommandRunner runner, String adminEmail, Duration timeout) {
        if (adminEmail == null || adminEmail.isBlank()) {
            throw new IllegalArgumentException("certificate admin e-mail is required");
        }
        this.runner = runner;
        this.adminEmail = adminEmail;
        this.timeout = timeout;
    }

    List<String> command(String domain) {
        return List.of("certbot", "--nginx", "-d", domain, "--non-interactive", "--agree-tos",
                "--email", adminEmail, "--redirect");
    }

    @Override
    public void issue(long tenantId, String domain) throws Exception {
        CommandResult r = runner.run(command(domain), timeout);
        if (r.timedOut()) {
            throw new InfrastructureException("certbot timed out for " + domain);
        }
        if (r.exitCode() != 0) {
            throw new InfrastructureException("certbot failed for " + domain + ": " + r.tail(500));
        }
        log.info("certificate issued: tenant={} domain={}", tenantId, domain);
    }
}
