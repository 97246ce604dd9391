package com.eainde.ace.engine;

import com.eainde.ace.model.ActionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Gates changes an agent proposes to itself. Each kind of change maps onto a
 * {@code self:improve:*} action class; anything unrecognised is treated as a core change,
 * which always escalates.
 */
@Slf4j
@Component
public class SelfImprovementGate {

    public enum ChangeType {
        REFLECTION("self:improve:reflection"),
        SKILL("self:improve:skill"),
        PLUGIN("self:improve:plugin"),
        CONFIG("self:improve:config"),
        CORE("self:improve:core");

        private final String actionClass;

        ChangeType(String actionClass) {
            this.actionClass = actionClass;
        }

        public String actionClass() {
            return actionClass;
        }

        public static ChangeType fromValue(String value) {
            if (value != null) {
                for (ChangeType type : values()) {
                    if (type.name().equalsIgnoreCase(value.trim())) {
                        return type;
                    }
                }
            }
            return CORE;
        }
    }

    private final AutonomyCalibrationEngine engine;

    public SelfImprovementGate(AutonomyCalibrationEngine engine) {
        this.engine = engine;
    }

    public static String classifyImprovement(String type) {
        return ChangeType.fromValue(type).actionClass();
    }

    /**
     * Self-improvements start without precedent, so the first of each kind always reaches
     * an operator.
     */
    public GateDecision evaluate(String type, String description) {
        String actionClass = classifyImprovement(type);
        log.info("Self-improvement {} classified as {}", type == null ? "null" : type.toLowerCase(Locale.ROOT), actionClass);
        return engine.decide(ActionRequest.of(actionClass)
                .details(description)
                .motivation(description)
                .build());
    }
}
