package dk.lawoffice.intranet.dashboardservice.services;

import dk.lawoffice.intranet.appointmentservice.model.Appointment;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.appointmentservice.repositories.AppointmentRepository;
import dk.lawoffice.intranet.appointmentservice.services.AppointmentService;
import dk.lawoffice.intranet.clientservice.model.Client;
import dk.lawoffice.intranet.clientservice.repositories.ClientRepository;
import dk.lawoffice.intranet.clientservice.services.ClientService;
import dk.lawoffice.intranet.dashboardservice.dto.ActivityChartPointDTO;
import dk.lawoffice.intranet.dashboardservice.dto.ClientGrowthPointDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardStatsDTO;
import dk.lawoffice.intranet.dashboardservice.dto.RecentActivityDTO;
import dk.lawoffice.intranet.dashboardservice.model.DashboardStats;
import dk.lawoffice.intranet.dashboardservice.model.RecentActivity;
import dk.lawoffice.intranet.dashboardservice.repositories.DashboardStatsRepository;
import dk.lawoffice.intranet.dashboardservice.repositories.RecentActivityRepository;
import dk.lawoffice.intranet.events.UserDeletedEvent;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.invoiceservice.repositories.InvoiceRepository;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.model.User;
import dk.lawoffice.intranet.utils.RequestValidator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@JBossLog
@ApplicationScoped
public class DashboardService {

    static final int RECENT_CLIENTS = 5;
    static final int UPCOMING_APPOINTMENTS = 5;
    static final int DASHBOARD_ACTIVITIES = 10;
    static final int ACTIVITY_FEED = 50;
    static final int STATS_HISTORY = 30;
    static final int MAX_CHART_DAYS = 365;

    @Inject
    ClientRepository clientRepository;

    @Inject
    AppointmentRepository appointmentRepository;

    @Inject
    InvoiceRepository invoiceRepository;

    @Inject
    DashboardStatsRepository statsRepository;

    @Inject
    RecentActivityRepository activityRepository;

    @Inject
    ClientService clientService;

    @Inject
    AppointmentService appointmentService;

    @Inject
    RequestValidator validator;

    public DashboardDTO overview(String useruuid) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime startOfMonth = now.toLocalDate().withDayOfMonth(1).atStartOfDay();
        User user = User.findById(useruuid);
        return DashboardDTO.builder()
                .totalClients(clientRepository.countByOwner(useruuid))
                .totalAppointments(appointmentRepository.countByUser(useruuid))
                .upcomingAppointments(appointmentRepository.countUpcoming(useruuid, now))
                .completedAppointments(appointmentRepository.countByStatus(useruuid, AppointmentStatus.COMPLETED))
                .cancelledAppointments(appointmentRepository.countByStatus(useruuid, AppointmentStatus.CANCELLED))
                .newClientsThisMonth(clientRepository.countCreatedSince(useruuid, startOfMonth))
                .recentClients(clientRepository.findRecent(useruuid, RECENT_CLIENTS).stream()
                        .map(clientService::toDTO).collect(Collectors.toList()))
                .upcomingAppointmentsList(appointmentRepository.findUpcoming(useruuid, now, UPCOMING_APPOINTMENTS).stream()
                        .map(appointmentService::toDTO).collect(Collectors.toList()))
                .recentActivities(activityRepository.findLatest(useruuid, DASHBOARD_ACTIVITIES).stream()
                        .map(DashboardService::toDTO).collect(Collectors.toList()))
                .userInfo(user != null ? UserDTO.from(user) : null)
                .build();
    }

    public List<DashboardStatsDTO> statsHistory(String useruuid) {
        return statsRepository.findLatest(useruuid, STATS_HISTORY).stream()
                .map(DashboardService::toDTO)
                .collect(Collectors.toList());
    }

    public List<RecentActivityDTO> activities(String useruuid) {
        return activityRepository.findLatest(useruuid, ACTIVITY_FEED).stream()
                .map(DashboardService::toDTO)
                .collect(Collectors.toList());
    }

    @Transactional
    public RecentActivity logActivity(String useruuid, RecentActivityDTO dto) {
        validator.validate(dto);
        RecentActivity activity = record(useruuid, new RecentActivity(useruuid, dto.getActivityType(),
                dto.getDescription().trim(), dto.getRelatedObjectId()));
        return activity;
    }

    RecentActivity record(String useruuid, RecentActivity activity) {
        activityRepository.persist(activity);
        log.debugf("Recorded activity %s for %s: %s", activity.getActivityType(), useruuid, activity.getDescription());
        return activity;
    }

    /**
     * Appointments per start day over the last {@code days} days, oldest day first. Days
     * without appointments are left out.
     */
    public List<ActivityChartPointDTO> activityChart(String useruuid, int days) {
        LocalDateTime since = LocalDateTime.now().minusDays(checkDays(days));
        Map<LocalDate, ActivityChartPointDTO> points = new TreeMap<>();
        for (Appointment appointment : appointmentRepository.search(useruuid, null, since, null, null).list()) {
            ActivityChartPointDTO point = points.computeIfAbsent(appointment.getStartTime().toLocalDate(),
                    day -> new ActivityChartPointDTO(day, 0, 0, 0));
            point.setTotal(point.getTotal() + 1);
            if (appointment.getStatus() == AppointmentStatus.COMPLETED) point.setCompleted(point.getCompleted() + 1);
            if (appointment.getStatus() == AppointmentStatus.CANCELLED) point.setCancelled(point.getCancelled() + 1);
        }
        return List.copyOf(points.values());
    }

    public List<ClientGrowthPointDTO> clientGrowth(String useruuid, int days) {
        LocalDateTime since = LocalDateTime.now().minusDays(checkDays(days));
        Map<LocalDate, Long> perDay = clientRepository.findCreatedSince(useruuid, since).stream()
                .collect(Collectors.groupingBy(client -> client.getCreatedAt().toLocalDate(), TreeMap::new, Collectors.counting()));
        return perDay.entrySet().stream()
                .map(entry -> new ClientGrowthPointDTO(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    /**
     * Recomputes the caller's snapshot row for today, creating it on first use. The insert is
     * flushed right away so a clash on the (user, date) key surfaces here.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public DashboardStats refreshTodayStats(String useruuid) {
        LocalDate today = LocalDate.now();
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime startOfMonth = today.withDayOfMonth(1).atStartOfDay();
        DashboardStats stats = statsRepository.findByUserAndDate(useruuid, today).orElseGet(() -> {
            DashboardStats created = new DashboardStats(useruuid, today);
            statsRepository.persistAndFlush(created);
            return created;
        });
        stats.setTotalClients(clientRepository.countByOwner(useruuid));
        stats.setTotalAppointments(appointmentRepository.countByUser(useruuid));
        stats.setUpcomingAppointments(appointmentRepository.countUpcoming(useruuid, now));
        stats.setCompletedAppointments(appointmentRepository.countByStatus(useruuid, AppointmentStatus.COMPLETED));
        stats.setCancelledAppointments(appointmentRepository.countByStatus(useruuid, AppointmentStatus.CANCELLED));
        stats.setNewClientsThisMonth(clientRepository.countCreatedSince(useruuid, startOfMonth));
        stats.setRevenueThisMonth(invoiceRepository.sumPaid(useruuid, startOfMonth, null));
        return stats;
    }

    private static int checkDays(int days) {
        if (days < 1 || days > MAX_CHART_DAYS) {
            throw ValidationException.of("days", "Ensure this value is between 1 and " + MAX_CHART_DAYS + ".");
        }
        return days;
    }

    public static RecentActivityDTO toDTO(RecentActivity activity) {
        return RecentActivityDTO.builder()
                .uuid(activity.getUuid())
                .user(activity.getUseruuid())
                .activityType(activity.getActivityType())
                .activityTypeDisplay(activity.getActivityType().getLabel())
                .description(activity.getDescription())
                .relatedObjectId(activity.getRelatedObjectId())
                .createdAt(activity.getCreatedAt())
                .build();
    }

    static DashboardStatsDTO toDTO(DashboardStats stats) {
        return DashboardStatsDTO.builder()
                .uuid(stats.getUuid())
                .user(stats.getUseruuid())
                .statDate(stats.getStatDate())
                .totalClients(stats.getTotalClients())
                .totalAppointments(stats.getTotalAppointments())
                .upcomingAppointments(stats.getUpcomingAppointments())
                .completedAppointments(stats.getCompletedAppointments())
                .cancelledAppointments(stats.getCancelledAppointments())
                .newClientsThisMonth(stats.getNewClientsThisMonth())
                .revenueThisMonth(stats.getRevenueThisMonth())
                .createdAt(stats.getCreatedAt())
                .updatedAt(stats.getUpdatedAt())
                .build();
    }

    void onUserDeleted(@Observes UserDeletedEvent event) {
        statsRepository.deleteByUser(event.useruuid());
        activityRepository.deleteByUser(event.useruuid());
    }
}
