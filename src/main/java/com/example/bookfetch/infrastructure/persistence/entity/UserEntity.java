package com.example.bookfetch.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class UserEntity {

    private Long id;

    private String username;

    private String role;

    private Boolean autoApproveRequests;

    private LocalDateTime createdAt;
}
