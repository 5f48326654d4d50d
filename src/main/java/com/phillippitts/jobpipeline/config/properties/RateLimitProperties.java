package com.phillippitts.jobpipeline.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Rate limits applied by the REST adapter.
 */
@ConfigurationProperties(prefix = "ratelimit")
@Validated
public class RateLimitProperties {

    /** Job submissions per owner and job kind. */
    @Valid
    private Limit submit = new Limit();

    public Limit getSubmit() {
        return submit;
    }

    public void setSubmit(Limit submit) {
        this.submit = submit;
    }

    public static class Limit {

        @Positive(message = "Limit must be positive")
        private int limit = 10;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
