package alertmigrator.model;

import java.util.Objects;

/**
 * A legacy alert together with the dashboard and folder it is migrated into.
 */
public record DashboardAlert(LegacyAlert alert, Dashboard dashboard, Folder folder) {

    public DashboardAlert {
        Objects.requireNonNull(alert, "alert");
        Objects.requireNonNull(dashboard, "dashboard");
        Objects.requireNonNull(folder, "folder");
    }
}
