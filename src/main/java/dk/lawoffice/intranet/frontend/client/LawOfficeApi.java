package dk.lawoffice.intranet.frontend.client;

import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.dto.AppointmentStatsDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseDTO;
import dk.lawoffice.intranet.caseservice.dto.CaseNoteDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.clientservice.dto.ClientStatsDTO;
import dk.lawoffice.intranet.dashboardservice.dto.DashboardDTO;
import dk.lawoffice.intranet.dashboardservice.dto.RecentActivityDTO;
import dk.lawoffice.intranet.dto.MessageResponse;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.dto.StatusResponse;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.userservice.dto.AccessTokenResponse;
import dk.lawoffice.intranet.userservice.dto.ChangePasswordRequest;
import dk.lawoffice.intranet.userservice.dto.LoginRequest;
import dk.lawoffice.intranet.userservice.dto.LoginResponse;
import dk.lawoffice.intranet.userservice.dto.RefreshRequest;
import dk.lawoffice.intranet.userservice.dto.UserCreateRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.dto.UserUpdateRequest;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;

import java.util.List;

/**
 * Typed client of the law office REST API. Instances are built by {@link ApiClientFactory};
 * the bearer token is attached by {@link BearerTokenFilter}.
 */
@RegisterProvider(ApiErrorMapper.class)
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface LawOfficeApi extends AutoCloseable {

    // auth

    @POST
    @Path("/auth/login")
    LoginResponse login(LoginRequest request);

    @POST
    @Path("/auth/token/refresh")
    AccessTokenResponse refresh(RefreshRequest request);

    @POST
    @Path("/auth/logout")
    void logout(RefreshRequest request);

    @POST
    @Path("/auth/register")
    UserDTO register(UserCreateRequest request);

    @GET
    @Path("/auth/profile")
    UserDTO profile();

    @PATCH
    @Path("/auth/profile")
    UserDTO updateProfile(UserUpdateRequest request);

    @PUT
    @Path("/auth/change-password")
    MessageResponse changePassword(ChangePasswordRequest request);

    // dashboard

    @GET
    @Path("/dashboard")
    DashboardDTO dashboard();

    @GET
    @Path("/dashboard/activities")
    List<RecentActivityDTO> activities();

    // clients

    @GET
    @Path("/clients")
    PagedResponse<ClientDTO> clients(@QueryParam("search") String search,
                                     @QueryParam("is_active") Boolean active,
                                     @QueryParam("page") Integer page,
                                     @QueryParam("page_size") Integer pageSize);

    @GET
    @Path("/clients/{uuid}")
    ClientDTO client(@PathParam("uuid") String uuid);

    @POST
    @Path("/clients")
    ClientDTO createClient(ClientDTO client);

    @PUT
    @Path("/clients/{uuid}")
    ClientDTO updateClient(@PathParam("uuid") String uuid, ClientDTO client);

    @DELETE
    @Path("/clients/{uuid}")
    void deleteClient(@PathParam("uuid") String uuid);

    @POST
    @Path("/clients/{uuid}/activate")
    ClientDTO activateClient(@PathParam("uuid") String uuid);

    @POST
    @Path("/clients/{uuid}/deactivate")
    ClientDTO deactivateClient(@PathParam("uuid") String uuid);

    @GET
    @Path("/clients/stats")
    ClientStatsDTO clientStats();

    // appointments

    @GET
    @Path("/appointments")
    PagedResponse<AppointmentDTO> appointments(@QueryParam("status") String status,
                                               @QueryParam("page") Integer page,
                                               @QueryParam("page_size") Integer pageSize);

    @POST
    @Path("/appointments")
    AppointmentDTO createAppointment(AppointmentDTO appointment);

    @PUT
    @Path("/appointments/{uuid}")
    AppointmentDTO updateAppointment(@PathParam("uuid") String uuid, AppointmentDTO appointment);

    @DELETE
    @Path("/appointments/{uuid}")
    void deleteAppointment(@PathParam("uuid") String uuid);

    @POST
    @Path("/appointments/{uuid}/confirm")
    StatusResponse confirmAppointment(@PathParam("uuid") String uuid);

    @POST
    @Path("/appointments/{uuid}/cancel")
    StatusResponse cancelAppointment(@PathParam("uuid") String uuid);

    @POST
    @Path("/appointments/{uuid}/complete")
    StatusResponse completeAppointment(@PathParam("uuid") String uuid);

    @GET
    @Path("/appointments/upcoming")
    List<AppointmentDTO> upcomingAppointments();

    @GET
    @Path("/appointments/stats")
    AppointmentStatsDTO appointmentStats();

    // cases

    @GET
    @Path("/cases")
    PagedResponse<CaseDTO> cases(@QueryParam("status") String status,
                                 @QueryParam("page") Integer page,
                                 @QueryParam("page_size") Integer pageSize);

    @POST
    @Path("/cases")
    CaseDTO createCase(CaseDTO legalCase);

    @DELETE
    @Path("/cases/{uuid}")
    void deleteCase(@PathParam("uuid") String uuid);

    @POST
    @Path("/cases/{uuid}/close")
    CaseDTO closeCase(@PathParam("uuid") String uuid);

    @POST
    @Path("/cases/{uuid}/assign_to_me")
    StatusResponse assignCaseToMe(@PathParam("uuid") String uuid);

    @POST
    @Path("/cases/{uuid}/add_note")
    CaseNoteDTO addCaseNote(@PathParam("uuid") String uuid, CaseNoteDTO note);

    // billing

    @GET
    @Path("/billing/invoices")
    PagedResponse<InvoiceDTO> invoices(@QueryParam("status") String status,
                                       @QueryParam("page") Integer page,
                                       @QueryParam("page_size") Integer pageSize);

    @POST
    @Path("/billing/invoices")
    InvoiceDTO createInvoice(InvoiceDTO invoice);

    @DELETE
    @Path("/billing/invoices/{uuid}")
    void deleteInvoice(@PathParam("uuid") String uuid);

    @POST
    @Path("/billing/invoices/{uuid}/mark_as_paid")
    InvoiceDTO markInvoicePaid(@PathParam("uuid") String uuid);

    @POST
    @Path("/billing/invoices/{uuid}/send_to_client")
    StatusResponse sendInvoice(@PathParam("uuid") String uuid);
}
