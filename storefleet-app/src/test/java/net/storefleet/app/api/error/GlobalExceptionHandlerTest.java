package net.storefleet.app.api.error;

import net.storefleet.core.error.AlreadyInFlightException;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.error.ResourceExhaustedException;
import net.storefleet.core.error.TenantValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    private MockHttpServletRequest request() {
        var req = new MockHttpServletRequest("POST", "/api/tenants");
        req.addHeader("X-Correlation-Id", "cid-42");
        return req;
    }

    @Test
    void exhaustion_maps_to_503() {
        var res = handler.handleExhausted(new ResourceExhaustedException("no eligible server"), request());
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(res.getBody().code()).isEqualTo(ErrorCode.RESOURCE_EXHAUSTED);
        assertThat(res.getBody().correlationId()).isEqualTo("cid-42");
    }

    @Test
    void in_flight_maps_to_409_with_job_id() {
        var res = handler.handleInFlight(new AlreadyInFlightException(7L, 11L), request());
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(res.getBody().details()).containsEntry("tenantId", 7L).containsEntry("jobId", 11L);
    }

    @Test
    void in_flight_without_known_job_omits_job_id() {
        var res = handler.handleInFlight(new AlreadyInFlightException(7L, null), request());
        assertThat(res.getBody().details()).containsOnlyKeys("tenantId");
    }

    @Test
    void validation_maps_to_400() {
        var res = handler.handleTenantValidation(new TenantValidationException("malformed domain: x"), request());
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(res.getBody().message()).isEqualTo("malformed domain: x");
    }

    @Test
    void infrastructure_maps_to_502() {
        var res = handler.handleInfrastructure(new InfrastructureException("compose start failed"), request());
        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(res.getBody().code()).isEqualTo(ErrorCode.INFRASTRUCTURE);
    }
}
