package com.example.bookfetch.api.controller;

import com.example.bookfetch.api.request.CreateRequestRequest;
import com.example.bookfetch.api.response.ApiResponse;
import com.example.bookfetch.api.response.PageResponse;
import com.example.bookfetch.api.response.RequestResponse;
import com.example.bookfetch.application.queue.JobQueueService;
import com.example.bookfetch.application.service.RequestService;
import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/requests")
public class RequestController {

    private final RequestService requestService;
    private final JobQueueService jobQueueService;

    public RequestController(RequestService requestService, JobQueueService jobQueueService) {
        this.requestService = requestService;
        this.jobQueueService = jobQueueService;
    }

    @PostMapping
    public ApiResponse<RequestResponse> create(@Valid @RequestBody CreateRequestRequest request) {
        return ApiResponse.success(requestService.create(request));
    }

    @GetMapping
    public ApiResponse<PageResponse<RequestResponse>> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "pageNo", defaultValue = "1") int pageNo,
            @RequestParam(value = "pageSize", defaultValue = "20") int pageSize) {
        return ApiResponse.success(requestService.list(status, pageNo, pageSize));
    }

    @GetMapping("/{id}")
    public ApiResponse<RequestResponse> get(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.get(id));
    }

    @GetMapping("/{id}/jobs")
    public ApiResponse<List<JobEntity>> listJobs(@PathVariable("id") Long id) {
        return ApiResponse.success(jobQueueService.listJobsForRequest(id));
    }

    @PostMapping("/{id}/approve")
    public ApiResponse<RequestResponse> approve(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.approve(id));
    }

    @PostMapping("/{id}/deny")
    public ApiResponse<RequestResponse> deny(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.deny(id));
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<RequestResponse> cancel(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.cancel(id));
    }

    @PostMapping("/{id}/retry-import")
    public ApiResponse<RequestResponse> retryImport(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.retryImport(id));
    }

    @PostMapping("/{id}/search")
    public ApiResponse<RequestResponse> reSearch(@PathVariable("id") Long id) {
        return ApiResponse.success(requestService.reSearch(id));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> delete(@PathVariable("id") Long id) {
        requestService.delete(id);
        return ApiResponse.success("DELETED");
    }
}
