package com.example.bookfetch.infrastructure.persistence.model;

import lombok.Data;

@Data
public class JobStatusCountRow {

    private String status;

    private Long total;
}
