package dk.lawoffice.intranet.clientservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientNoteDTO;
import dk.lawoffice.intranet.clientservice.services.ClientNoteService;
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

@Tag(name = "clients")
@JBossLog
@Path("/clients/{clientuuid}/notes")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class ClientNoteResource {

    @Inject
    ClientNoteService noteService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    public PagedResponse<ClientNoteDTO> findAll(@PathParam("clientuuid") String clientuuid,
                                                @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                                @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /clients/%s/notes", clientuuid);
        return pagination.page(noteService.list(owner(), clientuuid), page, pageSize, uriInfo, noteService::toDTO);
    }

    @GET
    @Path("/{uuid}")
    public ClientNoteDTO findByUuid(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid) {
        return noteService.toDTO(noteService.find(owner(), clientuuid, uuid));
    }

    @POST
    public Response create(@PathParam("clientuuid") String clientuuid, ClientNoteDTO dto) {
        log.infof("POST /clients/%s/notes", clientuuid);
        ClientNoteDTO created = noteService.toDTO(noteService.create(owner(), clientuuid, dto));
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}")
    public ClientNoteDTO update(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid, ClientNoteDTO dto) {
        log.infof("PUT /clients/%s/notes/%s", clientuuid, uuid);
        return noteService.toDTO(noteService.update(owner(), clientuuid, uuid, dto));
    }

    @PATCH
    @Path("/{uuid}")
    public ClientNoteDTO patch(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /clients/%s/notes/%s", clientuuid, uuid);
        return noteService.toDTO(noteService.patch(owner(), clientuuid, uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid) {
        log.infof("DELETE /clients/%s/notes/%s", clientuuid, uuid);
        noteService.delete(owner(), clientuuid, uuid);
        return Response.noContent().build();
    }

    private String owner() {
        return requestUser.requireUserUuid();
    }
}
