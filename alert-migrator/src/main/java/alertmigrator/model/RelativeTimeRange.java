package alertmigrator.model;

import java.time.Duration;

/**
 * Query time range relative to evaluation time.
 *
 * @param from how far before evaluation time the range starts
 * @param to how far before evaluation time the range ends
 */
public record RelativeTimeRange(Duration from, Duration to) {

    public static final RelativeTimeRange NONE = new RelativeTimeRange(Duration.ZERO, Duration.ZERO);

    public boolean isValid() {
        return !from.isNegative() && !to.isNegative() && from.compareTo(to) > 0;
    }
}
