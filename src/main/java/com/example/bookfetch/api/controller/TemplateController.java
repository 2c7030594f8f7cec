package com.example.bookfetch.api.controller;

import com.example.bookfetch.api.request.ValidateTemplateRequest;
import com.example.bookfetch.api.response.ApiResponse;
import com.example.bookfetch.api.response.TemplateValidationResponse;
import com.example.bookfetch.application.service.PathTemplateEngine;
import com.example.bookfetch.domain.model.TemplateValidationResult;
import java.util.Collections;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/templates")
public class TemplateController {

    private final PathTemplateEngine pathTemplateEngine;

    public TemplateController(PathTemplateEngine pathTemplateEngine) {
        this.pathTemplateEngine = pathTemplateEngine;
    }

    @PostMapping("/validate")
    public ApiResponse<TemplateValidationResponse> validate(@RequestBody ValidateTemplateRequest request) {
        TemplateValidationResult result = request.isFilename()
                ? pathTemplateEngine.validateFilenameTemplate(request.getTemplate())
                : pathTemplateEngine.validateTemplate(request.getTemplate());
        List<String> previews = result.isValid()
                ? pathTemplateEngine.generatePreviews(request.getTemplate())
                : Collections.<String>emptyList();
        return ApiResponse.success(new TemplateValidationResponse(result.isValid(), result.getError(), previews,
                pathTemplateEngine.getValidVariables()));
    }
}
