package net.storefleet.adapter.host.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.model.HealthAlert;
import net.storefleet.core.model.ResourceAlert;
import net.storefleet.core.model.Tenant;
import net.storefleet.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 알림 서비스(메일 발송 등)로 JSON 이벤트를 POST 한다.
 * <pre>
 * { "event": "tenant.ready" | "resource.alert" | "tenant.health", ... }
 * </pre>
 */
public final class WebhookNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    public static final String EVENT_READY = "tenant.ready";
    public static final String EVENT_ALERT = "resource.alert";
    public static final String EVENT_HEALTH = "tenant.health";

    private final WebClient client;
    private final String url;
    private final Duration timeout;
    private final ObjectMapper om = new ObjectMapper();

    public WebhookNotifier(WebClient client, String url, Duration timeout) {
        this.client = client;
        this.url = url;
        this.timeout = timeout;
    }

    @Override
    public void tenantReady(ReadyNotice n) throws Exception {
        ObjectNode body = om.createObjectNode()
                .put("event", EVENT_READY)
                .put("tenantId", n.tenantId())
                .put("email", n.email())
                .put("domain", n.domain())
                .put("storeUrl", n.storeUrl())
                .put("adminUrl", n.adminUrl())
                .put("adminUser", n.adminUser())
                .put("temporaryPassword", n.temporaryPassword());
        post(body);
        log.info("ready notice sent: tenant={} domain={}", n.tenantId(), n.domain());
    }

    @Override
    public void resourceAlert(Tenant tenant, ResourceAlert alert) throws Exception {
        ObjectNode body = om.createObjectNode()
                .put("event", EVENT_ALERT)
                .put("tenantId", tenant.id())
                .put("email", tenant.email())
                .put("domain", tenant.domain())
                .put("kind", alert.kind().code())
                .put("resource", alert.kind().resource().name())
                .put("level", alert.kind().level().name())
                .put("percent", Math.round(alert.percent() * 10) / 10.0)
                .put("usageBytes", alert.usageBytes())
                .put("limitBytes", alert.limitBytes());
        post(body);
        log.info("alert notice sent: tenant={} kind={}", tenant.id(), alert.kind());
    }

    @Override
    public void healthAlert(Tenant tenant, HealthAlert alert) throws Exception {
        ObjectNode body = om.createObjectNode()
                .put("event", EVENT_HEALTH)
                .put("tenantId", tenant.id())
                .put("email", tenant.email())
                .put("domain", tenant.domain())
                .put("kind", alert.kind().code())
                .put("detail", alert.detail())
                .put("consecutiveFailures", alert.consecutiveFailures());
        post(body);
        log.info("health notice sent: tenant={} kind={}", tenant.id(), alert.kind());
    }

    private void post(ObjectNode body) throws InfrastructureException {
        try {
            client.post().uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(om.writeValueAsString(body))
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(),
                            r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                    .flatMap(b -> Mono.error(new InfrastructureException(
                                            "webhook " + r.statusCode().value() + (b.isBlank() ? "" : " -> " + b)))))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            // block() 은 checked 예외를 감싸서 던진다
            if (e.getCause() instanceof InfrastructureException ie) throw ie;
            throw new InfrastructureException("webhook delivery failed: " + e.getMessage(), e);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new InfrastructureException("webhook payload not serializable", e);
        }
    }
}
