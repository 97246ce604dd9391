package com.eainde.ace.model;

import com.eainde.ace.trust.TrustSource;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A proposed agent action, as handed to scoring, deliberation and the action gate.
 * Only the action class is required; every omitted score falls back to the class default
 * or to precedent memory.
 *
 * <pre>{@code
 * ActionRequest request = ActionRequest.of("git:push:remote")
 *         .details("push feature branch")
 *         .motivation("operator asked for a PR")
 *         .trustSource(source)
 *         .build();
 * }</pre>
 */
public final class ActionRequest implements Serializable {

    public static final String MOTIVATION_EXTERNAL = "external";

    private final String actionClass;
    private final String details;

    // scoring overrides
    private final Double reversibility;
    private final Double precedent;
    private final Double blastRadius;
    private final TrustSource trustSource;
    private final Boolean firstInClass;

    // deliberation context
    private final String motivation;
    private final String motivationSource;
    private final String goalId;
    private final String triggerEvent;
    private final Instant deadline;
    private final boolean opportunityLost;
    private final Boolean userAvailable;
    private final boolean backupExists;
    private final boolean affectsExternal;
    private final List<Dependency> dependencies;

    private ActionRequest(Builder builder) {
        this.actionClass = builder.actionClass;
        this.details = builder.details;
        this.reversibility = builder.reversibility;
        this.precedent = builder.precedent;
        this.blastRadius = builder.blastRadius;
        this.trustSource = builder.trustSource;
        this.firstInClass = builder.firstInClass;
        this.motivation = builder.motivation;
        this.motivationSource = builder.motivationSource;
        this.goalId = builder.goalId;
        this.triggerEvent = builder.triggerEvent;
        this.deadline = builder.deadline;
        this.opportunityLost = builder.opportunityLost;
        this.userAvailable = builder.userAvailable;
        this.backupExists = builder.backupExists;
        this.affectsExternal = builder.affectsExternal;
        this.dependencies = builder.dependencies == null ? List.of() : List.copyOf(builder.dependencies);
    }

    public static Builder of(String actionClass) {
        return new Builder(actionClass);
    }

    /** Builder pre-filled with this request's values. */
    public Builder toBuilder() {
        return new Builder(actionClass)
                .details(details)
                .reversibility(reversibility)
                .precedent(precedent)
                .blastRadius(blastRadius)
                .trustSource(trustSource)
                .firstInClass(firstInClass)
                .motivation(motivation)
                .motivationSource(motivationSource)
                .goalId(goalId)
                .triggerEvent(triggerEvent)
                .deadline(deadline)
                .opportunityLost(opportunityLost)
                .userAvailable(userAvailable)
                .backupExists(backupExists)
                .affectsExternal(affectsExternal)
                .dependencies(dependencies);
    }

    // =========================================================================
    //  Getters
    // =========================================================================

    public String getActionClass() { return actionClass; }
    public String getDetails() { return details; }
    public Double getReversibility() { return reversibility; }
    public Double getPrecedent() { return precedent; }
    public Double getBlastRadius() { return blastRadius; }
    public TrustSource getTrustSource() { return trustSource; }
    public Boolean getFirstInClass() { return firstInClass; }
    public String getMotivation() { return motivation; }
    public String getMotivationSource() { return motivationSource; }
    public String getGoalId() { return goalId; }
    public String getTriggerEvent() { return triggerEvent; }
    public Instant getDeadline() { return deadline; }
    public boolean isOpportunityLost() { return opportunityLost; }
    public Boolean getUserAvailable() { return userAvailable; }
    public boolean isBackupExists() { return backupExists; }
    public boolean isAffectsExternal() { return affectsExternal; }
    public List<Dependency> getDependencies() { return dependencies; }

    public boolean hasMotivation() {
        return motivation != null && !motivation.isBlank();
    }

    public boolean hasTrustSource() {
        return trustSource != null;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static final class Builder {
        private final String actionClass;
        private String details;
        private Double reversibility;
        private Double precedent;
        private Double blastRadius;
        private TrustSource trustSource;
        private Boolean firstInClass;
        private String motivation;
        private String motivationSource;
        private String goalId;
        private String triggerEvent;
        private Instant deadline;
        private boolean opportunityLost;
        private Boolean userAvailable;
        private boolean backupExists;
        private boolean affectsExternal;
        private List<Dependency> dependencies;

        private Builder(String actionClass) {
            this.actionClass = actionClass;
        }

        public Builder details(String details) { this.details = details; return this; }
        public Builder reversibility(Double reversibility) { this.reversibility = reversibility; return this; }
        public Builder precedent(Double precedent) { this.precedent = precedent; return this; }
        public Builder blastRadius(Double blastRadius) { this.blastRadius = blastRadius; return this; }
        public Builder trustSource(TrustSource trustSource) { this.trustSource = trustSource; return this; }
        public Builder firstInClass(Boolean firstInClass) { this.firstInClass = firstInClass; return this; }
        public Builder motivation(String motivation) { this.motivation = motivation; return this; }
        public Builder motivationSource(String motivationSource) { this.motivationSource = motivationSource; return this; }
        public Builder goalId(String goalId) { this.goalId = goalId; return this; }
        public Builder triggerEvent(String triggerEvent) { this.triggerEvent = triggerEvent; return this; }
        public Builder deadline(Instant deadline) { this.deadline = deadline; return this; }
        public Builder opportunityLost(boolean opportunityLost) { this.opportunityLost = opportunityLost; return this; }
        public Builder userAvailable(Boolean userAvailable) { this.userAvailable = userAvailable; return this; }
        public Builder backupExists(boolean backupExists) { this.backupExists = backupExists; return this; }
        public Builder affectsExternal(boolean affectsExternal) { this.affectsExternal = affectsExternal; return this; }
        public Builder dependencies(List<Dependency> dependencies) { this.dependencies = dependencies; return this; }

        /** Sets R, P and B in one call. */
        public Builder scores(double reversibility, double precedent, double blastRadius) {
            this.reversibility = reversibility;
            this.precedent = precedent;
            this.blastRadius = blastRadius;
            return this;
        }

        public ActionRequest build() {
            return new ActionRequest(this);
        }
    }
}
