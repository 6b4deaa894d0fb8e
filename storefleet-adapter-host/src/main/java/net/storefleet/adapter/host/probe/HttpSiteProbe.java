package net.storefleet.adapter.host.probe;

import net.storefleet.core.spi.SiteProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 테넌트 스토어 https://{domain}/ 확인.
 * 4xx 는 서버가 응답한 것으로 보고 통과, 5xx 와 연결 실패/타임아웃만 실패.
 */
public final class HttpSiteProbe implements SiteProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpSiteProbe.class);

    public static final String USER_AGENT = "Storefleet-Monitor/1.0";

    private final WebClient client;
    private final String scheme;
    private final Duration timeout;

    public HttpSiteProbe(WebClient client, String scheme, Duration timeout) {
        this.client = client;
        this.scheme = scheme;
        this.timeout = timeout;
    }

    public static HttpSiteProbe https(WebClient client, Duration timeout) {
        return new HttpSiteProbe(client, "https", timeout);
    }

    @Override
    public boolean responds(String domain) {
        String url = scheme + "://" + domain + "/";
        HttpStatusCode status = client.get().uri(url)
                .header("User-Agent", USER_AGENT)
                .exchangeToMono(resp -> resp.releaseBody().thenReturn(resp.statusCode()))
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("site check failed: {} ({})", url, e.toString());
                    return Mono.empty();
                })
                .block();

        if (status == null) return false;
        if (status.is5xxServerError()) {
            log.warn("site check {} -> {}", url, status.value());
            return false;
        }
        return true;
    }
}
