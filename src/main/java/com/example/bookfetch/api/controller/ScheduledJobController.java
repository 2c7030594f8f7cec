package com.example.bookfetch.api.controller;

import com.example.bookfetch.api.request.CreateScheduledJobRequest;
import com.example.bookfetch.api.request.UpdateScheduledJobRequest;
import com.example.bookfetch.api.response.ApiResponse;
import com.example.bookfetch.application.service.ScheduledJobService;
import com.example.bookfetch.infrastructure.persistence.entity.ScheduledJobEntity;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/scheduled-jobs")
public class ScheduledJobController {

    private final ScheduledJobService scheduledJobService;

    public ScheduledJobController(ScheduledJobService scheduledJobService) {
        this.scheduledJobService = scheduledJobService;
    }

    @GetMapping
    public ApiResponse<List<ScheduledJobEntity>> list() {
        return ApiResponse.success(scheduledJobService.list());
    }

    @GetMapping("/{id}")
    public ApiResponse<ScheduledJobEntity> get(@PathVariable("id") Long id) {
        return ApiResponse.success(scheduledJobService.get(id));
    }

    @PostMapping
    public ApiResponse<ScheduledJobEntity> create(@Valid @RequestBody CreateScheduledJobRequest request) {
        return ApiResponse.success(scheduledJobService.create(request));
    }

    @PatchMapping("/{id}")
    public ApiResponse<ScheduledJobEntity> update(@PathVariable("id") Long id,
                                                  @RequestBody UpdateScheduledJobRequest request) {
        return ApiResponse.success(scheduledJobService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<String> delete(@PathVariable("id") Long id) {
        scheduledJobService.delete(id);
        return ApiResponse.success("DELETED");
    }

    @PostMapping("/{id}/trigger")
    public ApiResponse<Long> trigger(@PathVariable("id") Long id) {
        return ApiResponse.success(scheduledJobService.triggerNow(id));
    }
}
