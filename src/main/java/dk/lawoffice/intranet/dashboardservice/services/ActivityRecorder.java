package dk.lawoffice.intranet.dashboardservice.services;

import dk.lawoffice.intranet.dashboardservice.model.RecentActivity;
import dk.lawoffice.intranet.events.ActivityEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.TransactionPhase;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

/**
 * Writes every {@link ActivityEvent} to the activity feed in the transaction of the service
 * that fired it. The user's daily dashboard snapshot is refreshed once that transaction has
 * committed, in a transaction of its own.
 */
@JBossLog
@ApplicationScoped
public class ActivityRecorder {

    private static final int MAX_DESCRIPTION = 500;
    static final int STATS_ATTEMPTS = 2;

    @Inject
    DashboardService dashboardService;

    @Transactional
    void onActivity(@Observes ActivityEvent event) {
        if (event.useruuid() == null) {
            log.debugf("Skipping anonymous activity %s", event.type());
            return;
        }
        String description = event.description();
        if (description.length() > MAX_DESCRIPTION) description = description.substring(0, MAX_DESCRIPTION);
        dashboardService.record(event.useruuid(), new RecentActivity(event.useruuid(), event.type(), description, event.relatedObjectId()));
    }

    void afterActivity(@Observes(during = TransactionPhase.AFTER_SUCCESS) ActivityEvent event) {
        if (event.useruuid() != null) refreshStats(event.useruuid());
    }

    /**
     * Recomputes today's snapshot of the user. Two first writes of the day can race on the
     * (user, date) unique key; the loser retries and updates the row the winner inserted.
     */
    public void refreshStats(String useruuid) {
        for (int attempt = 1; attempt <= STATS_ATTEMPTS; attempt++) {
            try {
                dashboardService.refreshTodayStats(useruuid);
                return;
            } catch (PersistenceException e) {
                if (attempt < STATS_ATTEMPTS) {
                    log.debugf("Concurrent stats write for %s, retrying: %s", useruuid, e.getMessage());
                } else {
                    log.errorf(e, "Could not refresh today's dashboard stats for %s", useruuid);
                }
            }
        }
    }
}
