package com.phillippitts.jobpipeline.presentation.controller;

import com.phillippitts.jobpipeline.service.maintenance.JobStatisticsAggregator;
import com.phillippitts.jobpipeline.service.maintenance.JobStatisticsReport;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the job statistics: success rate and latency per job kind.
 */
@RestController
@RequestMapping("/api/v1/statistics")
class StatisticsController {

    private final JobStatisticsAggregator statisticsAggregator;
    private final RequesterResolver requesterResolver;

    StatisticsController(JobStatisticsAggregator statisticsAggregator, RequesterResolver requesterResolver) {
        this.statisticsAggregator = statisticsAggregator;
        this.requesterResolver = requesterResolver;
    }

    @GetMapping("/jobs")
    ResponseEntity<JobStatisticsReport> jobs(HttpServletRequest request) {
        requesterResolver.resolve(request);
        return ResponseEntity.ok(statisticsAggregator.current());
    }
}
