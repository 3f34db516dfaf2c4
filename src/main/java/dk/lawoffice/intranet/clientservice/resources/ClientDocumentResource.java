package dk.lawoffice.intranet.clientservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.clientservice.dto.ClientDocumentDTO;
import dk.lawoffice.intranet.clientservice.model.ClientDocument;
import dk.lawoffice.intranet.clientservice.services.ClientDocumentService;
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
import org.jboss.resteasy.plugins.providers.multipart.InputPart;
import org.jboss.resteasy.plugins.providers.multipart.MultipartFormDataInput;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Files attached to a client. Uploads are multipart forms with a {@code document} file part
 * and {@code title}, {@code description} and {@code document_type} text parts.
 */
@Tag(name = "clients")
@JBossLog
@Path("/clients/{clientuuid}/documents")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class ClientDocumentResource {

    static final String FILE_PART = "document";
    private static final Pattern FILENAME = Pattern.compile("filename=\"?([^\";]*)\"?");

    @Inject
    ClientDocumentService documentService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    public PagedResponse<ClientDocumentDTO> findAll(@PathParam("clientuuid") String clientuuid,
                                                    @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                                    @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /clients/%s/documents", clientuuid);
        return pagination.page(documentService.list(owner(), clientuuid), page, pageSize, uriInfo, documentService::toDTO);
    }

    @GET
    @Path("/{uuid}")
    public ClientDocumentDTO findByUuid(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid) {
        return documentService.toDTO(documentService.find(owner(), clientuuid, uuid));
    }

    @POST
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Response upload(@PathParam("clientuuid") String clientuuid, MultipartFormDataInput input) throws IOException {
        log.infof("POST /clients/%s/documents", clientuuid);
        Map<String, List<InputPart>> form = input.getFormDataMap();
        ClientDocumentDTO metadata = ClientDocumentDTO.builder()
                .title(text(form, "title"))
                .description(text(form, "description"))
                .documentType(text(form, "document_type"))
                .build();

        InputPart filePart = first(form, FILE_PART);
        String filename = filePart != null ? filename(filePart) : null;
        String contentType = filePart != null ? filePart.getMediaType().toString() : null;
        try (InputStream content = filePart != null ? filePart.getBody(InputStream.class, null) : null) {
            ClientDocument document = documentService.upload(owner(), clientuuid, metadata, filename, contentType, content);
            return Response.status(Response.Status.CREATED).entity(documentService.toDTO(document)).build();
        }
    }

    @PATCH
    @Path("/{uuid}")
    @Consumes(MediaType.APPLICATION_JSON)
    public ClientDocumentDTO patch(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /clients/%s/documents/%s", clientuuid, uuid);
        return documentService.toDTO(documentService.patch(owner(), clientuuid, uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid) {
        log.infof("DELETE /clients/%s/documents/%s", clientuuid, uuid);
        documentService.delete(owner(), clientuuid, uuid);
        return Response.noContent().build();
    }

    @GET
    @Path("/{uuid}/download")
    @Produces(MediaType.WILDCARD)
    public Response download(@PathParam("clientuuid") String clientuuid, @PathParam("uuid") String uuid) {
        log.infof("GET /clients/%s/documents/%s/download", clientuuid, uuid);
        ClientDocument document = documentService.find(owner(), clientuuid, uuid);
        String filename = document.getOriginalFilename() != null ? document.getOriginalFilename() : document.getTitle();
        return Response.ok(documentService.open(document))
                .type(document.getContentType() != null ? document.getContentType() : MediaType.APPLICATION_OCTET_STREAM)
                .header("Content-Disposition", "attachment; filename=\"" + filename.replace("\"", "") + "\"")
                .build();
    }

    private String owner() {
        return requestUser.requireUserUuid();
    }

    private static InputPart first(Map<String, List<InputPart>> form, String name) {
        List<InputPart> parts = form.get(name);
        return parts == null || parts.isEmpty() ? null : parts.get(0);
    }

    private static String text(Map<String, List<InputPart>> form, String name) throws IOException {
        InputPart part = first(form, name);
        return part != null ? part.getBodyAsString() : null;
    }

    static String filename(InputPart part) {
        String disposition = part.getHeaders().getFirst("Content-Disposition");
        if (disposition == null) return null;
        Matcher matcher = FILENAME.matcher(disposition);
        return matcher.find() ? matcher.group(1) : null;
    }
}
