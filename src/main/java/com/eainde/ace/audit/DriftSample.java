package com.eainde.ace.audit;

import java.time.Instant;

public record DriftSample(Instant timestamp, double rate, int samples, int expanding, int contracting) {
}
