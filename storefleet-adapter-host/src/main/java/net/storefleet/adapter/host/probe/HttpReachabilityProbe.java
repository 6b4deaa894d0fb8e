package net.storefleet.adapter.host.probe;

import net.storefleet.core.model.Server;
import net.storefleet.core.spi.ReachabilityProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 하트비트가 끊긴 서버의 https://{hostname}/health 를 직접 확인한다.
 * 2xx → UP, 그 외 응답 → DEGRADED, 연결 실패/타임아웃 → DOWN
 */
public final class HttpReachabilityProbe implements ReachabilityProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpReachabilityProbe.class);

    private final WebClient client;
    private final String scheme;
    private final String path;
    private final Duration timeout;

    public HttpReachabilityProbe(WebClient client, String scheme, String path, Duration timeout) {
        this.client = client;
        this.scheme = scheme;
        this.path = path;
        this.timeout = timeout;
    }

    public static HttpReachabilityProbe https(WebClient client, Duration timeout) {
        return new HttpReachabilityProbe(client, "https", "/health", timeout);
    }

    String url(Server server) {
        return scheme + "://" + server.hostname() + path;
    }

    @Override
    public Reachability probe(Server server) {
        String url = url(server);
        HttpStatusCode status = client.get().uri(url)
                .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode()))
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("reachability probe failed: {} ({})", url, e.toString());
                    return Mono.empty();
                })
                .block();

        if (status == null) return Reachability.DOWN;
        if (status.is2xxSuccessful()) return Reachability.UP;
        log.warn("reachability probe {} -> {}", url, status.value());
        return Reachability.DEGRADED;
    }
}
