package vn.com.fecredit.videoupload.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an upload session.
 *
 * <p>
 * Legal transitions:
 * <ul>
 * <li>{@code ACTIVE -> COMPLETING | CANCELLED | EXPIRED}</li>
 * <li>{@code COMPLETING -> COMPLETED | ACTIVE} (back to active when finalize fails)</li>
 * </ul>
 * Nothing leaves a terminal status.
 */
public enum SessionStatus {
    ACTIVE,
    COMPLETING,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    /** Statuses that still count against the owner's quota. */
    public static final Set<SessionStatus> OPEN = EnumSet.of(ACTIVE, COMPLETING);

    /** Statuses no event can leave. */
    public static final Set<SessionStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, EXPIRED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(SessionStatus next) {
        switch (this) {
            case ACTIVE:
                return next == COMPLETING || next == CANCELLED || next == EXPIRED;
            case COMPLETING:
                return next == COMPLETED || next == ACTIVE;
            default:
                return false;
        }
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionStatus fromWireName(String value) {
        return SessionStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
