package com.eainde.ace.precedent;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The whole precedent document as persisted: entries keyed by action class.
 */
@Getter
@Setter
@NoArgsConstructor
public class PrecedentSnapshot {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private Map<String, PrecedentEntry> classes = new LinkedHashMap<>();
    private PrecedentMetadata metadata = new PrecedentMetadata();

    public static PrecedentSnapshot empty(Instant now) {
        PrecedentSnapshot snapshot = new PrecedentSnapshot();
        snapshot.getMetadata().setCreatedAt(now);
        return snapshot;
    }
}
