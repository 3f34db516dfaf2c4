package dk.lawoffice.intranet.frontend.web;

import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.frontend.client.ApiClientFactory;
import dk.lawoffice.intranet.frontend.client.ApiException;
import dk.lawoffice.intranet.frontend.client.SessionExpiredException;
import dk.lawoffice.intranet.frontend.viewmodel.AppointmentsViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.BillingViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.CasesViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.ClientsViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.DashboardViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.LoginViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.ProfileViewModel;
import dk.lawoffice.intranet.frontend.viewmodel.Route;
import dk.lawoffice.intranet.frontend.viewmodel.ViewModel;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import jakarta.annotation.security.PermitAll;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Server-rendered web front-end. It talks to the REST API like any other client and keeps the
 * tokens in HttpOnly cookies.
 */
@Tag(name = "web")
@JBossLog
@Path("/web")
@RequestScoped
@PermitAll
@Produces(MediaType.TEXT_HTML)
public class WebUiResource {

    @Inject
    ApiClientFactory apiClientFactory;

    @Inject
    PageRenderer renderer;

    @CookieParam(WebSession.ACCESS_COOKIE)
    String accessCookie;

    @CookieParam(WebSession.REFRESH_COOKIE)
    String refreshCookie;

    @GET
    public Response index() {
        return redirect("/web/dashboard");
    }

    @GET
    @Path("/login")
    public String loginForm() {
        return renderer.render("login", new HashMap<>());
    }

    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Form login; sets the token cookies and redirects to the dashboard")
    public Response login(@FormParam("email") String email, @FormParam("password") String password) {
        try (WebSession web = new WebSession(apiClientFactory, null, null)) {
            LoginViewModel model = new LoginViewModel(web.getSession(), web);
            model.setEmail(email);
            model.setPassword(password);
            if (model.submit()) {
                log.infof("Web login for %s", email);
                return Response.seeOther(URI.create("/web/dashboard")).cookie(web.cookies()).build();
            }
            Map<String, Object> variables = new HashMap<>();
            variables.put("email", email);
            variables.put("error", model.getErrorMessage());
            return Response.ok(renderer.render("login", variables)).build();
        }
    }

    @POST
    @Path("/logout")
    public Response logout() {
        try (WebSession web = new WebSession(apiClientFactory, accessCookie, refreshCookie)) {
            new LoginViewModel(web.getSession(), web).logout();
            return Response.seeOther(URI.create("/web/login")).cookie(web.cookies()).build();
        }
    }

    @GET
    @Path("/dashboard")
    public Response dashboard() {
        return page("dashboard", web -> {
            DashboardViewModel model = new DashboardViewModel(web.getSession(), web);
            model.load();
            return variables(model, "dashboard", model.getDashboard());
        });
    }

    @GET
    @Path("/clients")
    public Response clients(@QueryParam("q") String filter, @QueryParam("page") @DefaultValue("1") int page) {
        return page("clients", web -> {
            ClientsViewModel model = new ClientsViewModel(web.getSession(), web);
            model.setFilter(filter);
            model.load(page);
            return clientVariables(model);
        });
    }

    @POST
    @Path("/clients")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response createClient(@FormParam("first_name") String firstName,
                                 @FormParam("last_name") String lastName,
                                 @FormParam("email") String email,
                                 @FormParam("phone") String phone,
                                 @FormParam("city") String city) {
        return page("clients", web -> {
            ClientsViewModel model = new ClientsViewModel(web.getSession(), web);
            model.load(1);
            model.create(ClientDTO.builder()
                    .firstName(firstName)
                    .lastName(lastName)
                    .email(blankToNull(email))
                    .phone(blankToNull(phone))
                    .city(blankToNull(city))
                    .build());
            return clientVariables(model);
        });
    }

    @GET
    @Path("/appointments")
    public Response appointments(@QueryParam("q") String filter) {
        return page("appointments", web -> {
            AppointmentsViewModel model = new AppointmentsViewModel(web.getSession(), web);
            model.setFilter(filter);
            model.load(1);
            return variables(model, "appointments", model.visibleAppointments());
        });
    }

    @POST
    @Path("/appointments/{uuid}/{action: confirm|cancel|complete}")
    public Response appointmentAction(@PathParam("uuid") String uuid, @PathParam("action") String action) {
        return page("appointments", web -> {
            AppointmentsViewModel model = new AppointmentsViewModel(web.getSession(), web);
            model.load(1);
            switch (action) {
                case "confirm" -> model.confirm(uuid);
                case "cancel" -> model.cancel(uuid);
                default -> model.complete(uuid);
            }
            return variables(model, "appointments", model.visibleAppointments());
        });
    }

    @GET
    @Path("/cases")
    public Response cases(@QueryParam("q") String filter) {
        return page("cases", web -> {
            CasesViewModel model = new CasesViewModel(web.getSession(), web);
            model.setFilter(filter);
            model.load(1);
            return variables(model, "cases", model.visibleCases());
        });
    }

    @POST
    @Path("/cases/{uuid}/close")
    public Response closeCase(@PathParam("uuid") String uuid) {
        return page("cases", web -> {
            CasesViewModel model = new CasesViewModel(web.getSession(), web);
            model.load(1);
            model.close(uuid);
            return variables(model, "cases", model.visibleCases());
        });
    }

    @GET
    @Path("/billing")
    public Response billing(@QueryParam("q") String filter) {
        return page("billing", web -> {
            BillingViewModel model = new BillingViewModel(web.getSession(), web);
            model.setFilter(filter);
            model.load(1);
            return billingVariables(model);
        });
    }

    @POST
    @Path("/billing/{uuid}/{action: mark_as_paid|send_to_client}")
    public Response invoiceAction(@PathParam("uuid") String uuid, @PathParam("action") String action) {
        return page("billing", web -> {
            BillingViewModel model = new BillingViewModel(web.getSession(), web);
            model.load(1);
            if ("mark_as_paid".equals(action)) model.markAsPaid(uuid);
            else model.sendToClient(uuid);
            return billingVariables(model);
        });
    }

    @GET
    @Path("/profile")
    public Response profile() {
        return page("profile", web -> {
            ProfileViewModel model = new ProfileViewModel(web.getSession(), web);
            model.load();
            return variables(model, "profile", model.getProfile());
        });
    }

    /**
     * Runs {@code build} with a session made from the request cookies and renders the template,
     * or redirects to the login page when there is no session or it has expired.
     */
    private Response page(String template, Function<WebSession, Map<String, Object>> build) {
        try (WebSession web = new WebSession(apiClientFactory, accessCookie, refreshCookie)) {
            if (!web.isAuthenticated()) {
                return redirect("/web/login");
            }
            Map<String, Object> variables = build.apply(web);
            if (!web.sentToLogin()) {
                variables.put("user", currentUser(web));
            }
            if (web.sentToLogin()) {
                log.debugf("Web session expired while rendering %s", template);
                return Response.seeOther(URI.create("/web/login")).cookie(web.cookies()).build();
            }
            variables.put("page", template);
            return Response.ok(renderer.render(template, variables)).cookie(web.cookies()).build();
        }
    }

    private static UserDTO currentUser(WebSession web) {
        try {
            return web.getSession().currentUser();
        } catch (SessionExpiredException e) {
            web.navigate(Route.LOGIN);
        } catch (ApiException e) {
            log.warnf("Could not load the current user: %s", e.userMessage());
        }
        return null;
    }

    private static Map<String, Object> variables(ViewModel model, String name, Object value) {
        Map<String, Object> variables = new HashMap<>();
        variables.put(name, value);
        variables.put("error", model.getErrorMessage());
        variables.put("info", model.getInfoMessage());
        return variables;
    }

    private static Map<String, Object> clientVariables(ClientsViewModel model) {
        Map<String, Object> variables = variables(model, "clients", model.visibleClients());
        variables.put("totalCount", model.getTotalCount());
        variables.put("filter", model.getFilter());
        return variables;
    }

    private static Map<String, Object> billingVariables(BillingViewModel model) {
        Map<String, Object> variables = variables(model, "invoices", model.visibleInvoices());
        variables.put("outstanding", model.outstanding());
        return variables;
    }

    private static Response redirect(String path) {
        return Response.seeOther(URI.create(path)).build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
