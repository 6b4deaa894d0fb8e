package net.storefleet.adapter.host.probe;

import net.storefleet.core.model.Server;
import net.storefleet.core.spi.ReachabilityProbe.Reachability;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpReachabilityProbeTest {

    final Server server = new Server(1L, "node-1", "node-1.storefleet.net", "10.0.0.1", Server.Status.ACTIVE,
            20, 8001, 8100, Instant.EPOCH, Instant.EPOCH, Instant.EPOCH);

    private HttpReachabilityProbe probeAnswering(Mono<ClientResponse> answer, List<String> seen) {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    seen.add(req.url().toString());
                    return answer;
                })
                .build();
        return HttpReachabilityProbe.https(client, Duration.ofMillis(500));
    }

    @Test
    void ok_isUp_andHitsHealthEndpoint() {
        List<String> seen = new ArrayList<>();
        var probe = probeAnswering(Mono.just(ClientResponse.create(HttpStatus.OK).build()), seen);
        assertEquals(Reachability.UP, probe.probe(server));
        assertEquals(List.of("https://node-1.storefleet.net/health"), seen);
    }

    @Test
    void errorStatus_isDegraded() {
        var probe = probeAnswering(Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()), new ArrayList<>());
        assertEquals(Reachability.DEGRADED, probe.probe(server));
    }

    @Test
    void connectionFailure_orTimeout_isDown() {
        var refused = probeAnswering(Mono.error(new ConnectException("refused")), new ArrayList<>());
        assertEquals(Reachability.DOWN, refused.probe(server));

        var silent = probeAnswering(Mono.never(), new ArrayList<>());
        assertEquals(Reachability.DOWN, silent.probe(server));
    }
}
