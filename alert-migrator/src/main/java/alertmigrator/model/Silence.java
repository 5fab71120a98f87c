package alertmigrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Time-bound suppression of alerts whose labels match every matcher.
 *
 * @param id silence id
 * @param matchers equality matchers, all must match
 * @param startsAt start of the suppression
 * @param endsAt end of the suppression
 * @param createdBy author shown in the alertmanager
 * @param comment reason shown in the alertmanager
 */
public record Silence(
        String id,
        List<Matcher> matchers,
        Instant startsAt,
        Instant endsAt,
        String createdBy,
        String comment
) {
    public Silence {
        matchers = List.copyOf(matchers);
    }

    /** Returns true if the given labels are matched by every matcher. */
    public boolean matches(Map<String, String> labels) {
        return matchers.stream().allMatch(m -> m.value().equals(labels.get(m.name())));
    }
}
