package dk.lawoffice.intranet.appointmentservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentStatsDTO;
import dk.lawoffice.intranet.appointmentservice.model.Appointment;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.appointmentservice.services.AppointmentService;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.dto.StatusResponse;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.security.RequestUserHolder;
import dk.lawoffice.intranet.security.Roles;
import dk.lawoffice.intranet.utils.Pagination;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The caller's own appointments.
 */
@Tag(name = "appointments")
@JBossLog
@Path("/appointments")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class AppointmentResource {

    @Inject
    AppointmentService appointmentService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    @Operation(summary = "List appointments, latest start first")
    public PagedResponse<AppointmentDTO> findAll(@QueryParam("status") String status,
                                                 @Parameter(description = "yyyy-MM-dd or ISO date-time, inclusive") @QueryParam("start_date") String startDate,
                                                 @Parameter(description = "yyyy-MM-dd (whole day included) or ISO date-time, exclusive") @QueryParam("end_date") String endDate,
                                                 @QueryParam("client") String client,
                                                 @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                                 @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /appointments?status=%s&start_date=%s&end_date=%s&client=%s", status, startDate, endDate, client);
        return pagination.page(appointmentService.search(user(), parseStatus(status),
                        parseBound("start_date", startDate, false), parseBound("end_date", endDate, true), client),
                page, pageSize, uriInfo, appointmentService::toDTO);
    }

    @GET
    @Path("/upcoming")
    public List<AppointmentDTO> upcoming() {
        log.info("GET /appointments/upcoming");
        return toDTOs(appointmentService.upcoming(user()));
    }

    @GET
    @Path("/today")
    public List<AppointmentDTO> today() {
        log.info("GET /appointments/today");
        return toDTOs(appointmentService.today(user()));
    }

    @GET
    @Path("/calendar")
    @Operation(summary = "Appointments starting within [start, end)")
    public List<AppointmentDTO> calendar(@QueryParam("start") String start, @QueryParam("end") String end) {
        log.infof("GET /appointments/calendar?start=%s&end=%s", start, end);
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            throw ValidationException.nonField("start and end parameters are required.");
        }
        return toDTOs(appointmentService.calendar(user(), parseBound("start", start, false), parseBound("end", end, true)));
    }

    @GET
    @Path("/stats")
    public AppointmentStatsDTO stats() {
        log.info("GET /appointments/stats");
        return appointmentService.stats(user());
    }

    @GET
    @Path("/{uuid}")
    public AppointmentDTO findByUuid(@PathParam("uuid") String uuid) {
        log.infof("GET /appointments/%s", uuid);
        return appointmentService.toDTO(appointmentService.findOwned(user(), uuid));
    }

    @POST
    public Response create(AppointmentDTO dto) {
        log.infof("POST /appointments: %s", dto != null ? dto.getTitle() : null);
        AppointmentDTO created = appointmentService.toDTO(appointmentService.create(user(), dto));
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}")
    public AppointmentDTO update(@PathParam("uuid") String uuid, AppointmentDTO dto) {
        log.infof("PUT /appointments/%s", uuid);
        return appointmentService.toDTO(appointmentService.update(user(), uuid, dto));
    }

    @PATCH
    @Path("/{uuid}")
    public AppointmentDTO patch(@PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /appointments/%s", uuid);
        return appointmentService.toDTO(appointmentService.patch(user(), uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        log.infof("DELETE /appointments/%s", uuid);
        appointmentService.delete(user(), uuid);
        return Response.noContent().build();
    }

    @POST
    @Path("/{uuid}/confirm")
    public StatusResponse confirm(@PathParam("uuid") String uuid) {
        log.infof("POST /appointments/%s/confirm", uuid);
        appointmentService.setStatus(user(), uuid, AppointmentStatus.CONFIRMED);
        return new StatusResponse("appointment confirmed");
    }

    @POST
    @Path("/{uuid}/cancel")
    public StatusResponse cancel(@PathParam("uuid") String uuid) {
        log.infof("POST /appointments/%s/cancel", uuid);
        appointmentService.setStatus(user(), uuid, AppointmentStatus.CANCELLED);
        return new StatusResponse("appointment cancelled");
    }

    @POST
    @Path("/{uuid}/complete")
    public StatusResponse complete(@PathParam("uuid") String uuid) {
        log.infof("POST /appointments/%s/complete", uuid);
        appointmentService.setStatus(user(), uuid, AppointmentStatus.COMPLETED);
        return new StatusResponse("appointment completed");
    }

    private List<AppointmentDTO> toDTOs(List<Appointment> appointments) {
        return appointments.stream().map(appointmentService::toDTO).collect(Collectors.toList());
    }

    private String user() {
        return requestUser.requireUserUuid();
    }

    static AppointmentStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return AppointmentStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw ValidationException.of("status", e.getMessage());
        }
    }

    /**
     * Parses a date or date-time query bound. A plain date used as upper bound covers the whole day.
     */
    static LocalDateTime parseBound(String field, String value, boolean upper) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                LocalDate date = LocalDate.parse(trimmed);
                return upper ? date.plusDays(1).atStartOfDay() : date.atStartOfDay();
            }
            return LocalDateTime.parse(trimmed.endsWith("Z") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
        } catch (DateTimeParseException e) {
            throw ValidationException.of(field, "Enter a valid date or date/time.");
        }
    }
}
