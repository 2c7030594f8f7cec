package com.example.bookfetch.api.controller;

import com.example.bookfetch.api.response.ApiResponse;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.queue.JobQueueStats;
import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final JobQueueService jobQueueService;

    public JobController(JobQueueService jobQueueService) {
        this.jobQueueService = jobQueueService;
    }

    @GetMapping
    public ApiResponse<List<JobEntity>> list(
            @RequestParam(value = "status", defaultValue = "failed") String status,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ApiResponse.success(jobQueueService.listJobsByStatus(status, limit));
    }

    @GetMapping("/stats")
    public ApiResponse<JobQueueStats> stats() {
        return ApiResponse.success(jobQueueService.stats());
    }

    @GetMapping("/{id}")
    public ApiResponse<JobEntity> get(@PathVariable("id") Long id) {
        return ApiResponse.success(jobQueueService.getJob(id));
    }

    @PostMapping("/{id}/retry")
    public ApiResponse<JobEntity> retry(@PathVariable("id") Long id) {
        return ApiResponse.success(jobQueueService.retryJob(id));
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<String> cancel(@PathVariable("id") Long id) {
        return ApiResponse.success(jobQueueService.cancelJob(id) ? "CANCELLED" : "IGNORED");
    }
}
