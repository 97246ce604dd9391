package com.eainde.ace.precedent;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
public class PrecedentMetadata {
    private Instant createdAt;
    private Instant lastUpdated;
    private long totalActions;
    private long totalPositive;
    private long totalNegative;
}
