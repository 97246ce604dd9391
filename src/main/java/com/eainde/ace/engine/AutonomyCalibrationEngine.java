package com.eainde.ace.engine;

import com.eainde.ace.audit.AuditChecks;
import com.eainde.ace.audit.EscalationResponse;
import com.eainde.ace.audit.TrustAuditService;
import com.eainde.ace.bypass.BypassCheck;
import com.eainde.ace.bypass.BypassMode;
import com.eainde.ace.model.ActionRequest;
import com.eainde.ace.precedent.OutcomeRequest;
import com.eainde.ace.precedent.OutcomeResult;
import com.eainde.ace.precedent.PrecedentMemory;
import com.eainde.ace.scoring.Tier;
import com.eainde.ace.store.AceStorageException;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for an agent about to take an action.
 * <p>
 * {@link #decide(ActionRequest)} runs the action gate graph (screen, score, and deliberate
 * when the scored tier is Deliberate), records the action in precedent memory and any
 * deliberation in the audit trail, and returns the tier together with whether the agent may
 * proceed on its own. Once the action has played out the caller reports the result through
 * {@link #reportOutcome(OutcomeRequest)}.
 * <p>
 * In {@code log-only} bypass mode every step still runs and is recorded, but the agent is
 * allowed to proceed whatever the tier. Hard-ceiling classes are never let through.
 */
@Slf4j
@Service
public class AutonomyCalibrationEngine {

    private final CompiledGraph<GateState> gate;
    private final PrecedentMemory precedentMemory;
    private final TrustAuditService auditService;

    public AutonomyCalibrationEngine(@Qualifier(ActionGateGraphConfig.GATE_WORKFLOW) CompiledGraph<GateState> gate,
                                     PrecedentMemory precedentMemory,
                                     TrustAuditService auditService) {
        this.gate = gate;
        this.precedentMemory = precedentMemory;
        this.auditService = auditService;
    }

    public GateDecision decide(ActionRequest request) {
        if (request == null || request.getActionClass() == null || request.getActionClass().isBlank()) {
            throw new IllegalArgumentException("Action class is required");
        }

        GateState state = run(request);
        Tier tier = state.getTier() != null ? state.getTier() : Tier.ESCALATE;
        BypassCheck bypass = state.getBypass();

        boolean proceed = !state.isBlocked() && (tier == Tier.ACT || bypass.bypassed());
        if (proceed && tier != Tier.ACT && bypass.mode() == BypassMode.LOG_ONLY) {
            log.warn("log-only bypass: {} would have been {} ({})", request.getActionClass(), tier.value(), state.getReason());
        }

        precedentMemory.recordAction(request.getActionClass(), request.getDetails(), tier.value());
        if (state.getDeliberation() != null) {
            auditService.recordDeliberation(state.getDeliberation());
        }

        log.info("Gate {} -> {} (proceed={})", request.getActionClass(), tier.value(), proceed);
        return new GateDecision(request.getActionClass(), tier, state.getReason(), proceed, bypass,
                state.getScore(), state.getDeliberation());
    }

    public OutcomeResult reportOutcome(OutcomeRequest outcome) {
        return precedentMemory.recordOutcome(outcome);
    }

    public AuditChecks.EscalationAck respondToEscalation(EscalationResponse response) {
        return auditService.recordEscalationResponse(response);
    }

    private GateState run(ActionRequest request) {
        Optional<GateState> result;
        try {
            result = gate.invoke(GateState.initial(request));
        } catch (AceStorageException e) {
            throw e;
        } catch (Exception e) {
            AceStorageException storage = findStorageFailure(e);
            if (storage != null) {
                throw storage;
            }
            throw new IllegalStateException("Action gate failed for " + request.getActionClass(), e);
        }
        return result.orElseThrow(() ->
                new IllegalStateException("Action gate produced no state for " + request.getActionClass()));
    }

    private static AceStorageException findStorageFailure(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof AceStorageException storage) {
                return storage;
            }
        }
        return null;
    }
}
