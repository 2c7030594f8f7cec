package com.example.bookfetch.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Why a candidate scored what it did. Maxima: format 10, size 15, seeders 15, match 60.
 */
@Data
public class ScoreBreakdown {

    private double formatScore;

    private double sizeScore;

    private double seederScore;

    private double matchScore;

    private double totalScore;

    private List<String> notes = new ArrayList<>();
}
