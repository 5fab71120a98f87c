package alertmigrator.model;

import java.util.Objects;

/**
 * Reference to a legacy notification channel, either by UID or by numeric id.
 *
 * <p>Legacy settings carry one or the other; the UID wins when both are set.
 */
public interface ChannelReference {

    static ChannelReference of(String uid) {
        return new Uid(uid);
    }

    static ChannelReference of(long id) {
        return new Id(id);
    }

    record Uid(String uid) implements ChannelReference {
        public Uid {
            Objects.requireNonNull(uid, "uid");
            if (uid.isEmpty()) throw new IllegalArgumentException("uid must not be empty");
        }

        @Override
        public String toString() {
            return uid;
        }
    }

    record Id(long id) implements ChannelReference {
        public Id {
            if (id <= 0) throw new IllegalArgumentException("id must be positive: " + id);
        }

        @Override
        public String toString() {
            return Long.toString(id);
        }
    }
}
