package dk.lawoffice.intranet.invoiceservice.resources;

import com.fasterxml.jackson.databind.JsonNode;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.dto.StatusResponse;
import dk.lawoffice.intranet.exceptions.ValidationException;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import dk.lawoffice.intranet.invoiceservice.services.InvoiceService;
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
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Tag(name = "billing")
@JBossLog
@Path("/billing/invoices")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class InvoiceResource {

    @Inject
    InvoiceService invoiceService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    @Operation(summary = "Invoices created by the caller, newest issue date first")
    public PagedResponse<InvoiceDTO> findAll(@QueryParam("status") String status,
                                             @QueryParam("client") String client,
                                             @QueryParam(Pagination.PAGE_PARAM) Integer page,
                                             @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.infof("GET /billing/invoices?status=%s&client=%s", status, client);
        return pagination.page(invoiceService.list(user(), parseStatus(status), client), page, pageSize, uriInfo, invoiceService::toDTO);
    }

    @GET
    @Path("/{uuid}")
    public InvoiceDTO findByUuid(@PathParam("uuid") String uuid) {
        log.infof("GET /billing/invoices/%s", uuid);
        return invoiceService.toDTO(invoiceService.findOwned(user(), uuid));
    }

    @POST
    @Operation(summary = "Create an invoice with its line items")
    public Response create(InvoiceDTO dto) {
        log.infof("POST /billing/invoices: client=%s", dto != null ? dto.getClient() : null);
        InvoiceDTO created = invoiceService.toDTO(invoiceService.create(user(), dto));
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @PUT
    @Path("/{uuid}")
    public InvoiceDTO update(@PathParam("uuid") String uuid, InvoiceDTO dto) {
        log.infof("PUT /billing/invoices/%s", uuid);
        return invoiceService.toDTO(invoiceService.update(user(), uuid, dto));
    }

    @PATCH
    @Path("/{uuid}")
    public InvoiceDTO patch(@PathParam("uuid") String uuid, JsonNode patch) {
        log.infof("PATCH /billing/invoices/%s", uuid);
        return invoiceService.toDTO(invoiceService.patch(user(), uuid, patch));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        log.infof("DELETE /billing/invoices/%s", uuid);
        invoiceService.delete(user(), uuid);
        return Response.noContent().build();
    }

    @POST
    @Path("/{uuid}/mark_as_paid")
    public InvoiceDTO markAsPaid(@PathParam("uuid") String uuid) {
        log.infof("POST /billing/invoices/%s/mark_as_paid", uuid);
        return invoiceService.toDTO(invoiceService.markAsPaid(user(), uuid));
    }

    @POST
    @Path("/{uuid}/send_to_client")
    public StatusResponse sendToClient(@PathParam("uuid") String uuid) {
        log.infof("POST /billing/invoices/%s/send_to_client", uuid);
        invoiceService.sendToClient(user(), uuid);
        return new StatusResponse("invoice sent to client");
    }

    private String user() {
        return requestUser.requireUserUuid();
    }

    static InvoiceStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return InvoiceStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw ValidationException.of("status", e.getMessage());
        }
    }
}
