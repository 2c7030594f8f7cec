package com.example.bookfetch.api.request;

import lombok.Data;

@Data
public class ValidateTemplateRequest {

    private String template;

    /** When set, validated as a file name template instead of a directory template. */
    private boolean filename;
}
