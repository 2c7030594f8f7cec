package com.example.bookfetch.domain.model;

import lombok.Data;

/**
 * Tag and header data of one audio part, used to order and title chapters.
 */
@Data
public class AudioTrackInfo {

    private String title;

    private Integer trackNo;

    private Integer discNo;

    private Integer durationSec;

    private Integer bitrate;
}
