package com.example.bookfetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AudiobookRef {

    private Long id;

    private String title;

    private String author;

    private String asin;
}
