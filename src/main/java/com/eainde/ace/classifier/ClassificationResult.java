package com.eainde.ace.classifier;

import java.io.Serializable;

/**
 * Static policy facts for one action class.
 */
public record ClassificationResult(String actionClass,
                                   boolean hasHardCeiling,
                                   boolean requiresDeliberation,
                                   double defaultReversibility,
                                   double defaultBlastRadius) implements Serializable {
}
