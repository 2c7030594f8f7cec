package com.example.bookfetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BonusModifier {

    /** indexer_priority, indexer_flag or preferred_format */
    private String type;

    /** Multiplier applied to the base score, e.g. 0.2 for +20%. */
    private double value;

    private double points;

    private String reason;
}
