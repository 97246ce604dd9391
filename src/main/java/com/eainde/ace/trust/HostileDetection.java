package com.eainde.ace.trust;

import java.util.List;

/**
 * Result of scanning content for injection signatures.
 *
 * @param hostile    whether any signature matched
 * @param matches    matched text, one per signature
 * @param patternIds ids of the signatures that matched, same order as {@code matches}
 */
public record HostileDetection(boolean hostile, List<String> matches, List<String> patternIds) {

    public static final HostileDetection CLEAN = new HostileDetection(false, List.of(), List.of());
}
