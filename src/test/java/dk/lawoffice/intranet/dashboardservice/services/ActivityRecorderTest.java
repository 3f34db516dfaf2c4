package dk.lawoffice.intranet.dashboardservice.services;

import dk.lawoffice.intranet.dashboardservice.model.DashboardStats;
import dk.lawoffice.intranet.dashboardservice.model.RecentActivity;
import dk.lawoffice.intranet.events.ActivityEvent;
import dk.lawoffice.intranet.events.ActivityType;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActivityRecorderTest {

    private static final String USER = "user-1";

    @Mock
    DashboardService dashboardService;

    @InjectMocks
    ActivityRecorder recorder;

    @Test
    @DisplayName("a clash on today's stats row is retried")
    void retriesConcurrentFirstWrite() {
        when(dashboardService.refreshTodayStats(USER))
                .thenThrow(new PersistenceException("duplicate key uk_dashboard_stats_user_date"))
                .thenReturn(new DashboardStats(USER, LocalDate.now()));

        recorder.refreshStats(USER);

        verify(dashboardService, times(2)).refreshTodayStats(USER);
    }

    @Test
    @DisplayName("a stats failure never surfaces to the committed request")
    void givesUpAfterLastAttempt() {
        when(dashboardService.refreshTodayStats(USER)).thenThrow(new PersistenceException("database gone"));

        assertDoesNotThrow(() -> recorder.refreshStats(USER));

        verify(dashboardService, times(ActivityRecorder.STATS_ATTEMPTS)).refreshTodayStats(USER);
    }

    @Test
    @DisplayName("the activity row is written without touching the stats")
    void recordsActivityOnly() {
        recorder.onActivity(new ActivityEvent(USER, ActivityType.CLIENT_CREATED, "Client Ada Byron created", "c-1"));

        verify(dashboardService).record(eq(USER), any(RecentActivity.class));
        verify(dashboardService, never()).refreshTodayStats(any());
    }
}
