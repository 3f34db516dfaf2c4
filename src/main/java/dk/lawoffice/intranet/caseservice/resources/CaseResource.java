package dk.lawoffice.intranet.caseservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.caseservice.dto.CaseDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseNoteDTO;
import dk.lawoffice.intranet.caseservice.model.enums.CaseStatus;
import dk.lawoffice.intranet.caseservice.services.CaseService;
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
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cases the caller created or is assigned to, newest first.
 */
@Tag(name = "cases")
@JBossLog
@Path("/cases")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class CaseResource {

    @Inject
    CaseService caseService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    public PagedResponse<CaseDTO> findAll(@QueryParam("status") String status,
                                          @QueryParam("client") String client,
                                          @QueryParam("search") String search,
                                          @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                          @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /cases?status=%s&client=%s&search=%s", status, client, search);
        return pagination.page(caseService.list(user(), parseStatus(status), client, search), page, pageSize, uriInfo, caseService::toDTO);
    }

    @GET
    @Path("/{uuid}")
    public CaseDTO findByUuid(@PathParam("uuid") String uuid) {
        log.infof("GET /cases/%s", uuid);
        return caseService.toDTO(caseService.findVisible(user(), uuid));
    }

    @POST
    public Response create(CaseDTO dto) {
        log.infof("POST /cases: %s", dto != null ? dto.getTitle() : null);
        CaseDTO created = caseService.toDTO(caseService.create(user(), dto));
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}")
    public CaseDTO update(@PathParam("uuid") String uuid, CaseDTO dto) {
        log.infof("PUT /cases/%s", uuid);
        return caseService.toDTO(caseService.update(user(), uuid, dto));
    }

    @PATCH
    @Path("/{uuid}")
    public CaseDTO patch(@PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /cases/%s", uuid);
        return caseService.toDTO(caseService.patch(user(), uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        log.infof("DELETE /cases/%s", uuid);
        caseService.delete(user(), uuid);
        return Response.noContent().build();
    }

    @POST
    @Path("/{uuid}/add_note")
    public Response addNote(@PathParam("uuid") String uuid, CaseNoteDTO dto) {
        log.infof("POST /cases/%s/add_note", uuid);
        CaseNoteDTO note = caseService.toNoteDTO(caseService.addNote(user(), uuid, dto));
        return Response.status(Response.Status.CREATED).entity(note).build();
    }

    @GET
    @Path("/{uuid}/notes")
    public List<CaseNoteDTO> notes(@PathParam("uuid") String uuid) {
        log.infof("GET /cases/%s/notes", uuid);
        return caseService.notes(user(), uuid).stream().map(caseService::toNoteDTO).collect(Collectors.toList());
    }

    @POST
    @Path("/{uuid}/assign_to_me")
    public StatusResponse assignToMe(@PathParam("uuid") String uuid) {
        log.infof("POST /cases/%s/assign_to_me", uuid);
        caseService.assignToMe(user(), uuid);
        return new StatusResponse("case assigned to you");
    }

    @POST
    @Path("/{uuid}/close")
    public CaseDTO close(@PathParam("uuid") String uuid) {
        log.infof("POST /cases/%s/close", uuid);
        return caseService.toDTO(caseService.close(user(), uuid));
    }

    private String user() {
        return requestUser.requireUserUuid();
    }

    static CaseStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return CaseStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw ValidationException.of("status", e.getMessage());
        }
    }
}
