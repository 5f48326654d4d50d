package com.phillippitts.jobpipeline.presentation.controller;

import com.phillippitts.jobpipeline.config.properties.RateLimitProperties;
import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.JobStatus;
import com.phillippitts.jobpipeline.exception.RateLimitExceededException;
import com.phillippitts.jobpipeline.presentation.dto.SubmitJobRequest;
import com.phillippitts.jobpipeline.presentation.dto.SubmitJobResponse;
import com.phillippitts.jobpipeline.service.job.JobService;
import com.phillippitts.jobpipeline.service.processing.SubmissionRequest;
import com.phillippitts.jobpipeline.service.ratelimit.RateLimitDecision;
import com.phillippitts.jobpipeline.service.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Job submission, status polling, the caller's job history and cancellation.
 *
 * <p>Submissions are throttled per owner and job kind through {@link RateLimiter}.
 */
@RestController
@RequestMapping("/api/v1/jobs")
class JobController {

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final int DEFAULT_HISTORY_LIMIT = 20;

    private final JobService jobService;
    private final RateLimiter rateLimiter;
    private final RateLimitProperties rateLimitProperties;
    private final RequesterResolver requesterResolver;

    JobController(JobService jobService,
                  RateLimiter rateLimiter,
                  RateLimitProperties rateLimitProperties,
                  RequesterResolver requesterResolver) {
        this.jobService = jobService;
        this.rateLimiter = rateLimiter;
        this.rateLimitProperties = rateLimitProperties;
        this.requesterResolver = requesterResolver;
    }

    @PostMapping("/{kind}")
    ResponseEntity<SubmitJobResponse> submit(@PathVariable("kind") String kind,
                                             @RequestBody SubmitJobRequest body,
                                             HttpServletRequest request) {
        String ownerId = requesterResolver.resolve(request);
        JobKind jobKind = JobKind.fromValue(kind);

        RateLimitProperties.Limit limit = rateLimitProperties.getSubmit();
        String key = "submit:" + ownerId + ":" + jobKind.getValue();
        RateLimitDecision decision = rateLimiter.isAllowed(key, limit.getLimit(), limit.getWindow());
        if (!decision.allowed()) {
            throw new RateLimitExceededException(key, limit.getLimit(), limit.getWindow());
        }

        Locale locale = body.locale() == null || body.locale().isBlank()
                ? null
                : Locale.forLanguageTag(body.locale());
        String jobId = jobService.submit(ownerId, jobKind, new SubmissionRequest(body.content(), body.params()), locale);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .header(REMAINING_HEADER, Integer.toString(decision.remaining()))
                .body(new SubmitJobResponse(jobId, "/api/v1/jobs/" + jobId));
    }

    @GetMapping
    ResponseEntity<List<JobStatus>> history(@RequestParam(name = "limit", required = false) Integer limit,
                                            HttpServletRequest request) {
        String ownerId = requesterResolver.resolve(request);
        return ResponseEntity.ok(jobService.history(ownerId, limit == null ? DEFAULT_HISTORY_LIMIT : limit));
    }

    @GetMapping("/{id}")
    ResponseEntity<JobStatus> status(@PathVariable("id") String id) {
        return ResponseEntity.ok(jobService.getStatus(id));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<JobStatus> cancel(@PathVariable("id") String id, HttpServletRequest request) {
        String requesterId = requesterResolver.resolve(request);
        return ResponseEntity.ok(jobService.cancel(id, requesterId));
    }
}
