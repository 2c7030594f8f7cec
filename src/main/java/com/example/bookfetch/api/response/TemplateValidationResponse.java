package com.example.bookfetch.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateValidationResponse {

    private boolean valid;
    private String error;
    private List<String> previews;
    private List<String> variables;
}
