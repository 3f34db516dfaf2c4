package dk.lawoffice.intranet.dashboardservice.resources;

import dk.lawoffice.intranet.dashboardservice.dto.ActivityChartPointDTO;
import dk.lawoffice.intranet.dashboardservice.dto.ClientGrowthPointDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardStatsDTO;
import dk.lawoffice.intranet.dashboardservice.dto.RecentActivityDTO;
import dk.lawoffice.intranet.dashboardservice.services.ActivityRecorder;
import dk.lawoffice.intranet.dashboardservice.services.DashboardService;
import dk.lawoffice.intranet.security.RequestUserHolder;
import dk.lawoffice.intranet.security.Roles;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.dto.UserUpdateRequest;
import dk.lawoffice.intranet.userservice.services.UserService;
import dk.lawoffice.intranet.utils.RequestValidator;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@Tag(name = "dashboard")
@JBossLog
@Path("/dashboard")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class DashboardResource {

    @Inject
    DashboardService dashboardService;

    @Inject
    ActivityRecorder activityRecorder;

    @Inject
    UserService userService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    RequestValidator validator;

    @GET
    @Operation(summary = "Counters and recent items of the caller")
    public DashboardDTO dashboard() {
        log.infof("GET /dashboard by %s", requestUser.getEmail());
        return dashboardService.overview(user());
    }

    @GET
    @Path("/stats")
    @Operation(summary = "The last 30 daily snapshots, newest first")
    public List<DashboardStatsDTO> stats() {
        log.info("GET /dashboard/stats");
        return dashboardService.statsHistory(user());
    }

    @GET
    @Path("/activities")
    public List<RecentActivityDTO> activities() {
        log.info("GET /dashboard/activities");
        return dashboardService.activities(user());
    }

    @POST
    @Path("/activities")
    public Response logActivity(RecentActivityDTO dto) {
        log.infof("POST /dashboard/activities: %s", dto != null ? dto.getActivityType() : null);
        RecentActivityDTO created = DashboardService.toDTO(dashboardService.logActivity(user(), dto));
        activityRecorder.refreshStats(user());
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @GET
    @Path("/activity-chart")
    public List<ActivityChartPointDTO> activityChart(@QueryParam("days") @DefaultValue("30") int days) {
        log.infof("GET /dashboard/activity-chart?days=%d", days);
        return dashboardService.activityChart(user(), days);
    }

    @GET
    @Path("/client-growth")
    public List<ClientGrowthPointDTO> clientGrowth(@QueryParam("days") @DefaultValue("30") int days) {
        log.infof("GET /dashboard/client-growth?days=%d", days);
        return dashboardService.clientGrowth(user(), days);
    }

    @GET
    @Path("/profile")
    public UserDTO profile() {
        return UserDTO.from(userService.findByUuid(user()));
    }

    /**
     * Same as {@code PATCH /auth/profile} except that the email address cannot be changed here.
     */
    @PATCH
    @Path("/profile")
    public UserDTO updateProfile(UserUpdateRequest request) {
        log.infof("PATCH /dashboard/profile by %s", requestUser.getEmail());
        validator.validate(request);
        request.setEmail(null);
        return UserDTO.from(userService.update(user(), request, requestUser.isAdmin()));
    }

    private String user() {
        return requestUser.requireUserUuid();
    }
}
