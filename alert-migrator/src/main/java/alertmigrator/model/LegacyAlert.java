package alertmigrator.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One legacy dashboard-panel alert, as read from the legacy alert table.
 *
 * <p>Immutable input of the migration; never modified by the pipeline.
 *
 * @param id legacy numeric alert id
 * @param orgId owning organization
 * @param dashboardId legacy numeric dashboard id
 * @param panelId panel the alert was defined on
 * @param name alert name, becomes the rule title
 * @param message free-text notification message, may be empty
 * @param frequency evaluation frequency in seconds
 * @param forDuration how long the condition must hold before firing
 * @param state current run state ({@code paused}, {@code ok}, {@code alerting}, ...)
 * @param settings raw settings JSON
 */
public record LegacyAlert(
        long id,
        long orgId,
        long dashboardId,
        long panelId,
        String name,
        String message,
        long frequency,
        Duration forDuration,
        String state,
        String settings
) {
    public static final String STATE_PAUSED = "paused";

    public LegacyAlert {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(settings, "settings");
        message = message == null ? "" : message;
        state = state == null ? "" : state;
        forDuration = forDuration == null ? Duration.ZERO : forDuration;
    }

    /** Returns true if the legacy alert was paused. */
    public boolean isPaused() {
        return STATE_PAUSED.equals(state);
    }
}
