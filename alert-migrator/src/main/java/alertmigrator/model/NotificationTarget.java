package alertmigrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Entry of the legacy {@code notifications} list. Older alerts reference the
 * channel by numeric id, newer ones by UID.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationTarget(String uid, long id) {
}
