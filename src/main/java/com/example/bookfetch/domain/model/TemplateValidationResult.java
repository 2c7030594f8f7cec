package com.example.bookfetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateValidationResult {

    private boolean valid;

    private String error;

    public static TemplateValidationResult ok() {
        return new TemplateValidationResult(true, null);
    }

    public static TemplateValidationResult invalid(String error) {
        return new TemplateValidationResult(false, error);
    }
}
