package com.eainde.ace.trust;

import java.util.List;

public record ChainValidation(boolean valid, TrustLevel lowestLevel, List<String> untrustedLinks) {
}
