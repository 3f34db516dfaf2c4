package dk.lawoffice.intranet.appointmentservice.resources;

import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.services.AppointmentService;
import dk.lawoffice.intranet.security.RequestUserHolder;
import dk.lawoffice.intranet.security.Roles;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.stream.Collectors;

@Tag(name = "clients")
@JBossLog
@Path("/clients/{clientuuid}/appointments")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class ClientAppointmentsResource {

    @Inject
    AppointmentService appointmentService;

    @Inject
    RequestUserHolder requestUser;

    @GET
    public List<AppointmentDTO> findByClient(@PathParam("clientuuid") String clientuuid) {
        log.infof("GET /clients/%s/appointments", clientuuid);
        return appointmentService.forClient(requestUser.requireUserUuid(), clientuuid).stream()
                .map(appointmentService::toDTO)
                .collect(Collectors.toList());
    }
}
