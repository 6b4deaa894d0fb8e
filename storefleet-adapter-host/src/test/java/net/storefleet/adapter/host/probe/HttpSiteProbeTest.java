package net.storefleet.adapter.host.probe;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpSiteProbeTest {

    private HttpSiteProbe probeAnswering(Mono<ClientResponse> answer, List<String> seen) {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    seen.add(req.url() + " " + req.headers().getFirst("User-Agent"));
                    return answer;
                })
                .build();
        return HttpSiteProbe.https(client, Duration.ofMillis(500));
    }

    @Test
    void storeRoot_isChecked_withMonitorAgent() {
        List<String> seen = new ArrayList<>();
        var probe = probeAnswering(Mono.just(ClientResponse.create(HttpStatus.OK).build()), seen);
        assertTrue(probe.responds("shop.example.com"));
        assertEquals(List.of("https://shop.example.com/ " + HttpSiteProbe.USER_AGENT), seen);
    }

    @Test
    void clientErrors_stillCountAsResponding() {
        var probe = probeAnswering(Mono.just(ClientResponse.create(HttpStatus.UNAUTHORIZED).build()), new ArrayList<>());
        assertTrue(probe.responds("shop.example.com"));
    }

    @Test
    void serverErrors_connectionFailure_andTimeout_fail() {
        var bad = probeAnswering(Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()), new ArrayList<>());
        assertFalse(bad.responds("shop.example.com"));

        var refused = probeAnswering(Mono.error(new ConnectException("refused")), new ArrayList<>());
        assertFalse(refused.responds("shop.example.com"));

        var silent = probeAnswering(Mono.never(), new ArrayList<>());
        assertFalse(silent.responds("shop.example.com"));
    }
}
