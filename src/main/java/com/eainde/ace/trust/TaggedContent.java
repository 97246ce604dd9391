package com.eainde.ace.trust;

public record TaggedContent(String content, TrustSource source, boolean hostileDetected) {
}
