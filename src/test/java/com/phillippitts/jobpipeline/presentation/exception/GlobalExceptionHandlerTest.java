package com.phillippitts.jobpipeline.presentation.exception;

import com.phillippitts.jobpipeline.exception.ForbiddenException;
import com.phillippitts.jobpipeline.exception.JobTimeoutException;
import com.phillippitts.jobpipeline.exception.NotFoundException;
import com.phillippitts.jobpipeline.exception.RateLimitExceededException;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.exception.UpstreamUnavailableException;
import com.phillippitts.jobpipeline.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsValidationTo400WithDetails() {
        ResponseEntity<?> response = handler.handlePipeline(new ValidationException("formType is required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("VALIDATION").contains("formType is required");
    }

    @Test
    void mapsForbiddenAndNotFound() {
        assertThat(handler.handlePipeline(new ForbiddenException("nope", "u2")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handlePipeline(new NotFoundException("Job", "j1")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        ResponseEntity<?> response = handler.handleRateLimited(
                new RateLimitExceededException("submit:u1:voice", 10, Duration.ofSeconds(60)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("60");
        assertThat(response.getBody().toString()).contains("Limit of 10 per 60s reached");
    }

    @Test
    void dependencyFailuresAre503WithoutInternalDetail() {
        ResponseEntity<?> store = handler.handlePipeline(
                new StoreUnavailableException("HGETALL job:secret", new IllegalStateException("10.0.0.5 refused")));
        ResponseEntity<?> upstream = handler.handlePipeline(new UpstreamUnavailableException("model host down"));

        assertThat(store.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(upstream.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(store.getBody().toString()).doesNotContain("10.0.0.5").doesNotContain("job:secret");
        assertThat(upstream.getBody().toString()).doesNotContain("model host");
    }

    @Test
    void otherPipelineErrorsAre500() {
        ResponseEntity<?> response = handler.handlePipeline(new JobTimeoutException(Duration.ofMinutes(30), true));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("PT30M");
    }

    @Test
    void unexpectedErrorsHideMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("password=hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("An unexpected error occurred")
                .doesNotContain("hunter2");
    }
}
