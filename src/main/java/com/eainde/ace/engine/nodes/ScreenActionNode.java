package com.eainde.ace.engine.nodes;

import com.eainde.ace.audit.AuditChecks;
import com.eainde.ace.audit.TrustAuditService;
import com.eainde.ace.bypass.BypassCheck;
import com.eainde.ace.bypass.BypassManager;
import com.eainde.ace.bypass.BypassMode;
import com.eainde.ace.engine.GateState;
import com.eainde.ace.scoring.Tier;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * First gate stage. Self-modification and hard-ceiling classes are blocked outright; a
 * disabled ACE lets everything else through unscored.
 */
@Slf4j
@Component
public class ScreenActionNode implements AsyncNodeAction<GateState> {

    private final TrustAuditService auditService;
    private final BypassManager bypassManager;

    public ScreenActionNode(TrustAuditService auditService, BypassManager bypassManager) {
        this.auditService = auditService;
        this.bypassManager = bypassManager;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(GateState state) {
        String actionClass = state.getRequest().getActionClass();

        // consulted first so hard-ceiling blocks during a bypass are counted
        BypassCheck bypass = bypassManager.isBypassed(actionClass);
        AuditChecks.SelfModification selfModification = auditService.checkSelfModification(actionClass);

        if (selfModification.blocked()) {
            log.info("Blocked {}: {}", actionClass, selfModification.reason());
            Map<String, Object> update = GateState.verdict(Tier.ESCALATE, selfModification.reason());
            update.put(GateState.BLOCKED, true);
            update.put(GateState.BYPASS, bypass);
            return CompletableFuture.completedFuture(update);
        }

        if (bypass.bypassed() && bypass.mode() == BypassMode.DISABLED) {
            log.debug("Gating disabled for {}: {}", actionClass, bypass.reason());
            Map<String, Object> update = GateState.verdict(Tier.ACT, bypass.reason());
            update.put(GateState.BYPASS, bypass);
            return CompletableFuture.completedFuture(update);
        }

        return CompletableFuture.completedFuture(Map.of(GateState.BYPASS, bypass));
    }
}
