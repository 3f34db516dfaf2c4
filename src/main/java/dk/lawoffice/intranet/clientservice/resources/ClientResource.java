package dk.lawoffice.intranet.clientservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientStatsDTO;
import dk.lawoffice.intranet.clientservice.dto.NotesSummaryDTO;
import dk.lawoffice.intranet.clientservice.services.ClientNoteService;
import dk.lawoffice.intranet.clientservice.services.ClientService;
import dk.lawoffice.intranet.dto.PagedResponse;
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
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Clients of the calling user. Clients created by other users are reported as not found.
 */
@Tag(name = "clients")
@JBossLog
@Path("/clients")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class ClientResource {

    @Inject
    ClientService clientService;

    @Inject
    ClientNoteService noteService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    public PagedResponse<ClientDTO> findAll(@QueryParam("search") String search,
                                            @QueryParam("is_active") Boolean active,
                                            @QueryParam("city") String city,
                                            @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                            @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /clients?search=%s&is_active=%s&city=%s", search, active, city);
        return pagination.page(clientService.search(owner(), search, active, city), page, pageSize, uriInfo, clientService::toDTO);
    }

    @GET
    @Path("/stats")
    public ClientStatsDTO stats() {
        log.info("GET /clients/stats");
        return clientService.stats(owner());
    }

    @GET
    @Path("/{uuid}")
    public ClientDTO findByUuid(@PathParam("uuid") String uuid) {
        log.infof("GET /clients/%s", uuid);
        return clientService.toDTO(clientService.findOwned(owner(), uuid));
    }

    @POST
    public Response create(ClientDTO dto) {
        log.infof("POST /clients: %s %s", dto != null ? dto.getFirstName() : null, dto != null ? dto.getLastName() : null);
        ClientDTO created = clientService.toDTO(clientService.create(owner(), dto));
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}")
    public ClientDTO update(@PathParam("uuid") String uuid, ClientDTO dto) {
        log.infof("PUT /clients/%s", uuid);
        return clientService.toDTO(clientService.update(owner(), uuid, dto));
    }

    @PATCH
    @Path("/{uuid}")
    public ClientDTO patch(@PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /clients/%s", uuid);
        return clientService.toDTO(clientService.patch(owner(), uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        log.infof("DELETE /clients/%s", uuid);
        clientService.delete(owner(), uuid);
        return Response.noContent().build();
    }

    @POST
    @Path("/{uuid}/activate")
    public ClientDTO activate(@PathParam("uuid") String uuid) {
        log.infof("POST /clients/%s/activate", uuid);
        return clientService.toDTO(clientService.setActive(owner(), uuid, true));
    }

    @POST
    @Path("/{uuid}/deactivate")
    public ClientDTO deactivate(@PathParam("uuid") String uuid) {
        log.infof("POST /clients/%s/deactivate", uuid);
        return clientService.toDTO(clientService.setActive(owner(), uuid, false));
    }

    @GET
    @Path("/{uuid}/notes_summary")
    public NotesSummaryDTO notesSummary(@PathParam("uuid") String uuid) {
        log.infof("GET /clients/%s/notes_summary", uuid);
        return noteService.summary(owner(), uuid);
    }

    private String owner() {
        return requestUser.requireUserUuid();
    }
}
