package com.eainde.ace.precedent;

import java.time.Instant;

public record ScorePoint(Instant ts, double score) {
}
