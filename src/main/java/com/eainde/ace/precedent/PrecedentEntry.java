package com.eainde.ace.precedent;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome history and trust score for one action class. {@code score} is the value as of
 * {@code decayAnchor}; readers apply decay for the time elapsed since.
 */
@Getter
@Setter
@NoArgsConstructor
public class PrecedentEntry {

    static final int MAX_INSTANCES = 100;
    static final int MAX_SCORE_HISTORY = 50;

    private List<ActionInstance> instances = new ArrayList<>();
    private double score;
    private List<ScorePoint> scoreHistory = new ArrayList<>();
    private Instant lastPositive;
    private Instant lastNegative;
    private int approved;
    private int corrected;
    private Instant decayAnchor;

    static PrecedentEntry create(Instant now) {
        PrecedentEntry entry = new PrecedentEntry();
        entry.setScore(PrecedentMemory.PRECEDENT_FLOOR);
        entry.getScoreHistory().add(new ScorePoint(now, PrecedentMemory.PRECEDENT_FLOOR));
        entry.setDecayAnchor(now);
        return entry;
    }

    void addInstance(ActionInstance instance) {
        instances.add(instance);
        if (instances.size() > MAX_INSTANCES) {
            instances = new ArrayList<>(instances.subList(instances.size() - MAX_INSTANCES, instances.size()));
        }
    }

    void moveScore(double newScore, Instant now) {
        this.score = newScore;
        this.decayAnchor = now;
        scoreHistory.add(new ScorePoint(now, newScore));
        if (scoreHistory.size() > MAX_SCORE_HISTORY) {
            scoreHistory = new ArrayList<>(scoreHistory.subList(scoreHistory.size() - MAX_SCORE_HISTORY, scoreHistory.size()));
        }
    }
}
