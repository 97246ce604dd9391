package com.eainde.ace.precedent;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One recorded attempt of an action class, updated in place when its outcome arrives.
 */
@Getter
@Setter
@NoArgsConstructor
public class ActionInstance {
    private Instant ts;
    private String detail;
    private String tier;
    private String operatorResponse;
    private Outcome outcome = Outcome.PENDING;
    private String note;

    public static ActionInstance pending(Instant ts, String detail, String tier) {
        ActionInstance instance = new ActionInstance();
        instance.setTs(ts);
        instance.setDetail(detail == null ? "" : detail);
        instance.setTier(tier == null ? "unknown" : tier);
        return instance;
    }
}
