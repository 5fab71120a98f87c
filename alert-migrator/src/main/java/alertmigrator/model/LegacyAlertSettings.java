package alertmigrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded legacy alert settings. Decoded once per alert and read-only afterwards.
 *
 * @param noDataState legacy no-data policy ({@code no_data}, {@code alerting}, {@code keep_state}, {@code ok})
 * @param executionErrorState legacy error policy ({@code alerting}, {@code keep_state}, {@code ok})
 * @param alertRuleTags free-form tags, values are strings or JSON scalars
 * @param notifications notification channels the alert sends to
 * @param conditions classic conditions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyAlertSettings(
        String noDataState,
        String executionErrorState,
        Map<String, JsonNode> alertRuleTags,
        List<NotificationTarget> notifications,
        List<LegacyCondition> conditions
) {
    public static final String KEEP_STATE = "keep_state";

    public LegacyAlertSettings {
        noDataState = noDataState == null ? "" : noDataState;
        executionErrorState = executionErrorState == null ? "" : executionErrorState;
        alertRuleTags = alertRuleTags == null ? Map.of() : new LinkedHashMap<>(alertRuleTags);
        notifications = notifications == null ? List.of() : notifications.stream().filter(Objects::nonNull).toList();
        conditions = conditions == null ? List.of() : conditions.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Tags as labels. Only JSON string values are kept; numbers, booleans,
     * null, arrays and objects become the empty string.
     */
    public Map<String, String> tagLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        alertRuleTags.forEach((k, v) -> labels.put(k, v != null && v.isTextual() ? v.textValue() : ""));
        return labels;
    }

    public boolean keepsStateOnNoData() {
        return KEEP_STATE.equals(noDataState);
    }

    public boolean keepsStateOnError() {
        return KEEP_STATE.equals(executionErrorState);
    }
}
