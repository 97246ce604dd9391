package com.eainde.ace.bypass;

import java.io.Serializable;

public record BypassCheck(boolean bypassed, BypassMode mode, boolean hardCeilingBlocked, String reason)
        implements Serializable {

    public static final BypassCheck NONE = new BypassCheck(false, BypassMode.OFF, false, null);
}
