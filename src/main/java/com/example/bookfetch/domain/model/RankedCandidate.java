package com.example.bookfetch.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class RankedCandidate {

    private TorrentCandidate candidate;

    private int discoveryIndex;

    private double score;

    private List<BonusModifier> bonusModifiers = new ArrayList<>();

    private double bonusPoints;

    private double finalScore;

    private ScoreBreakdown breakdown;

    private int rank;
}
