package com.eainde.ace.bypass;

import com.eainde.ace.classifier.ActionClasses;
import com.eainde.ace.config.AceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Operator escape hatch. A temporary bypass is capped at 24 hours and expires by clock
 * comparison when next checked; no timer runs. Beneath it sits the standing mode from
 * configuration, and {@code ace.enabled=false} reads as {@link BypassMode#DISABLED}.
 * Hard-ceiling classes are never bypassed, in any mode.
 */
@Slf4j
@Service
public class BypassManager {

    static final Duration MAX_TEMPORARY_BYPASS = Duration.ofHours(24);

    private static final Pattern DURATION = Pattern.compile("^(\\d+)([smhd])$", Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final boolean aceEnabled;
    private final BypassMode configuredMode;

    private BypassState temporaryBypass;

    private int temporaryBypassCount;
    private int actionsWhileBypassed;
    private int hardCeilingBlockedDuringBypass;
    private Instant lastBypassAt;
    private String lastBypassDuration;

    @Autowired
    public BypassManager(Clock clock, AceProperties properties) {
        this(clock, properties.isEnabled(), resolveConfiguredMode(properties.getBypassMode()));
    }

    public BypassManager(Clock clock, boolean aceEnabled, BypassMode configuredMode) {
        this.clock = clock;
        this.aceEnabled = aceEnabled;
        this.configuredMode = configuredMode == null ? BypassMode.OFF : configuredMode;
    }

    private static BypassMode resolveConfiguredMode(String value) {
        Optional<BypassMode> mode = BypassMode.parse(value);
        if (mode.isEmpty()) {
            log.warn("Invalid bypass mode \"{}\", defaulting to \"off\"", value);
            return BypassMode.OFF;
        }
        return mode.get();
    }

    // =========================================================================
    //  State
    // =========================================================================

    public synchronized BypassState getBypassMode() {
        if (temporaryBypass != null) {
            if (clock.instant().isBefore(temporaryBypass.expiresAt())) {
                return temporaryBypass;
            }
            log.info("Temporary {} bypass expired at {}", temporaryBypass.mode().value(), temporaryBypass.expiresAt());
            temporaryBypass = null;
        }
        if (!aceEnabled) {
            return BypassState.standing(BypassMode.DISABLED, "ACE disabled via ace.enabled=false");
        }
        return BypassState.standing(configuredMode, null);
    }

    /**
     * Whether gating is bypassed for {@code actionClass}. Hard-ceiling classes always come
     * back not bypassed with {@code hardCeilingBlocked=true}.
     */
    public synchronized BypassCheck isBypassed(String actionClass) {
        BypassState state = getBypassMode();

        if (actionClass != null && ActionClasses.hasHardCeiling(actionClass)) {
            if (state.mode() != BypassMode.OFF) {
                hardCeilingBlockedDuringBypass++;
                log.warn("Hard ceiling {} blocked during {} bypass", actionClass, state.mode().value());
            }
            return new BypassCheck(false, state.mode(), true,
                    "Hard ceiling action \"" + actionClass + "\" cannot be bypassed");
        }

        switch (state.mode()) {
            case DISABLED:
                actionsWhileBypassed++;
                return new BypassCheck(true, BypassMode.DISABLED, false,
                        state.reason() != null ? state.reason() : "ACE disabled");
            case LOG_ONLY:
                actionsWhileBypassed++;
                return new BypassCheck(true, BypassMode.LOG_ONLY, false,
                        state.reason() != null ? state.reason() : "ACE in log-only mode");
            default:
                return BypassCheck.NONE;
        }
    }

    public BypassCheck isBypassed() {
        return isBypassed(null);
    }

    // =========================================================================
    //  Temporary bypass
    // =========================================================================

    public BypassResult setTemporaryBypass(String duration) {
        return setTemporaryBypass(duration, BypassMode.LOG_ONLY.value(), null, null);
    }

    /**
     * Starts a temporary bypass.
     *
     * @param duration {@code <n>s}, {@code <n>m}, {@code <n>h} or {@code <n>d}; capped at 24 hours
     * @param mode     {@code log-only} (default) or {@code disabled}
     */
    public synchronized BypassResult setTemporaryBypass(String duration, String mode, String reason, String setBy) {
        Duration requested = parseDuration(duration);
        if (requested == null) {
            return BypassResult.invalid("Invalid duration \"" + duration + "\". Use format: 30s, 5m, 1h, 2d");
        }
        String modeValue = mode == null ? BypassMode.LOG_ONLY.value() : mode;
        Optional<BypassMode> parsed = BypassMode.parse(modeValue);
        if (parsed.isEmpty() || parsed.get() == BypassMode.OFF) {
            return BypassResult.invalid("Invalid bypass mode \"" + modeValue + "\". Use: log-only or disabled");
        }

        Duration effective = requested.compareTo(MAX_TEMPORARY_BYPASS) > 0 ? MAX_TEMPORARY_BYPASS : requested;
        Instant now = clock.instant();
        Instant expiresAt = now.plus(effective);
        temporaryBypass = new BypassState(
                parsed.get(),
                true,
                expiresAt,
                reason != null ? reason : "Temporary bypass for " + duration,
                setBy != null ? setBy : "operator");

        temporaryBypassCount++;
        lastBypassAt = now;
        lastBypassDuration = duration;

        log.info("Temporary {} bypass enabled until {} by {}", parsed.get().value(), expiresAt, temporaryBypass.setBy());
        return BypassResult.success(expiresAt, parsed.get());
    }

    public synchronized void clearTemporaryBypass() {
        if (temporaryBypass != null) {
            log.info("Temporary bypass cleared");
        }
        temporaryBypass = null;
    }

    /**
     * Human-readable time left on the temporary bypass, e.g. {@code "2h 15m remaining"}, or
     * {@code null} when none is active.
     */
    public synchronized String getRemainingBypassTime() {
        if (temporaryBypass == null) {
            return null;
        }
        Duration remaining = Duration.between(clock.instant(), temporaryBypass.expiresAt());
        if (remaining.isNegative() || remaining.isZero()) {
            return null;
        }
        long seconds = remaining.toSeconds();
        long minutes = seconds / 60;
        long hours = minutes / 60;
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m remaining";
        }
        if (minutes > 0) {
            return minutes + "m " + (seconds % 60) + "s remaining";
        }
        return seconds + "s remaining";
    }

    // =========================================================================
    //  Stats
    // =========================================================================

    public synchronized BypassStats getBypassStats() {
        BypassState current = getBypassMode();
        return new BypassStats(
                temporaryBypassCount,
                actionsWhileBypassed,
                hardCeilingBlockedDuringBypass,
                lastBypassAt,
                lastBypassDuration,
                current,
                temporaryBypass != null);
    }

    public synchronized void resetBypassStats() {
        temporaryBypassCount = 0;
        actionsWhileBypassed = 0;
        hardCeilingBlockedDuringBypass = 0;
        lastBypassAt = null;
        lastBypassDuration = null;
    }

    /** Parses {@code 30s}, {@code 5m}, {@code 1h}, {@code 2d}; returns {@code null} for anything else or zero. */
    static Duration parseDuration(String duration) {
        if (duration == null) {
            return null;
        }
        Matcher matcher = DURATION.matcher(duration.trim());
        if (!matcher.matches()) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (value <= 0) {
            return null;
        }
        return switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
            case "s" -> safeDuration(value, Duration.ofSeconds(1));
            case "m" -> safeDuration(value, Duration.ofMinutes(1));
            case "h" -> safeDuration(value, Duration.ofHours(1));
            default -> safeDuration(value, Duration.ofDays(1));
        };
    }

    private static Duration safeDuration(long value, Duration unit) {
        try {
            return unit.multipliedBy(value);
        } catch (ArithmeticException e) {
            return MAX_TEMPORARY_BYPASS.plusSeconds(1);
        }
    }
}
