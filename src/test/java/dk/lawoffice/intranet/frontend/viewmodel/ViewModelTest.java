package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.appointmentservice.dto.AppointmentDTO;
import dk.lawoffice.intranet.appointmentservice.model.enums.AppointmentStatus;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.dto.StatusResponse;
import dk.lawoffice.intranet.frontend.client.ApiException;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import dk.lawoffice.intranet.frontend.client.SessionExpiredException;
import dk.lawoffice.intranet.invoiceservice.dto.InvoiceDTO;
import dk.lawoffice.intranet.invoiceservice.model.enums.InvoiceStatus;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("view models")
class ViewModelTest {

    @Mock
    ApiSession session;

    @Mock
    LawOfficeApi api;

    private final List<Route> routes = new ArrayList<>();
    private final Navigator navigator = routes::add;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        when(session.call(any())).thenAnswer(invocation -> ((Function<LawOfficeApi, Object>) invocation.getArgument(0)).apply(api));
    }

    private static <T> PagedResponse<T> page(List<T> results) {
        PagedResponse<T> response = new PagedResponse<>();
        response.setCount(results.size());
        response.setResults(new ArrayList<>(results));
        return response;
    }

    @Nested
    class Login {

        @Test
        void blankCredentialsAreRejectedLocally() {
            LoginViewModel model = new LoginViewModel(session, navigator);
            model.setEmail("john.doe@lawfirm.com");

            assertFalse(model.submit());

            assertEquals("Please enter both email and password.", model.getErrorMessage());
            verify(session, never()).login(any(), any());
        }

        @Test
        void successNavigatesToDashboard() {
            when(session.login("john.doe@lawfirm.com", "password123")).thenReturn(UserDTO.builder().fullName("John Doe").build());
            LoginViewModel model = new LoginViewModel(session, navigator);
            model.setEmail(" john.doe@lawfirm.com ");
            model.setPassword("password123");

            assertTrue(model.submit());

            assertEquals(List.of(Route.DASHBOARD), routes);
            assertNull(model.getPassword());
            assertEquals("John Doe", model.getUser().getFullName());
        }

        @Test
        void serverRejectionIsShown() {
            when(session.login(any(), any())).thenThrow(new ApiException(401, "No active account found with the given credentials", null));
            LoginViewModel model = new LoginViewModel(session, navigator);
            model.setEmail("john.doe@lawfirm.com");
            model.setPassword("wrong");

            assertFalse(model.submit());

            assertEquals("No active account found with the given credentials", model.getErrorMessage());
            assertTrue(routes.isEmpty());
        }
    }

    @Nested
    class Appointments {

        @Test
        void expiredSessionNavigatesToLogin() {
            doThrow(new SessionExpiredException("Your session has expired. Please log in again.")).when(session).call(any());
            AppointmentsViewModel model = new AppointmentsViewModel(session, navigator);

            assertFalse(model.load(1));

            assertEquals(List.of(Route.LOGIN), routes);
            assertTrue(model.hasError());
        }

        @Test
        void confirmUpdatesTheLoadedRow() {
            AppointmentDTO appointment = AppointmentDTO.builder().uuid("a1").title("Intake")
                    .status(AppointmentStatus.SCHEDULED).statusDisplay("Scheduled").build();
            when(api.appointments(any(), any(), any())).thenReturn(page(List.of(appointment)));
            when(api.confirmAppointment("a1")).thenReturn(new StatusResponse("appointment confirmed"));
            AppointmentsViewModel model = new AppointmentsViewModel(session, navigator);
            model.load(1);

            assertTrue(model.confirm("a1"));

            assertEquals(AppointmentStatus.CONFIRMED, model.getAppointments().get(0).getStatus());
            assertEquals("Confirmed", model.getAppointments().get(0).getStatusDisplay());
            assertEquals("appointment confirmed", model.getInfoMessage());
        }

        @Test
        void filtersByStatusAndText() {
            when(api.appointments(any(), any(), any())).thenReturn(page(List.of(
                    AppointmentDTO.builder().uuid("a1").title("Will signing").status(AppointmentStatus.SCHEDULED).build(),
                    AppointmentDTO.builder().uuid("a2").title("Court prep").status(AppointmentStatus.CONFIRMED).build(),
                    AppointmentDTO.builder().uuid("a3").title("Court hearing").status(AppointmentStatus.SCHEDULED).build())));
            AppointmentsViewModel model = new AppointmentsViewModel(session, navigator);
            model.load(1);

            model.setFilter("court");
            model.setStatusFilter(AppointmentStatus.SCHEDULED);

            assertEquals(List.of("a3"), model.visibleAppointments().stream().map(AppointmentDTO::getUuid).collect(Collectors.toList()));
        }
    }

    @Nested
    class Billing {

        @Test
        void outstandingSkipsPaidInvoices() {
            when(api.invoices(any(), any(), any())).thenReturn(page(List.of(
                    InvoiceDTO.builder().uuid("i1").status(InvoiceStatus.SENT).total(new BigDecimal("100.00")).build(),
                    InvoiceDTO.builder().uuid("i2").status(InvoiceStatus.PAID).total(new BigDecimal("50.00")).build(),
                    InvoiceDTO.builder().uuid("i3").status(InvoiceStatus.DRAFT).total(new BigDecimal("25.50")).build())));
            BillingViewModel model = new BillingViewModel(session, navigator);

            assertTrue(model.load(1));

            assertEquals(new BigDecimal("125.50"), model.outstanding());
        }

        @Test
        void sendOnlyMovesDrafts() {
            when(api.invoices(any(), any(), any())).thenReturn(page(List.of(
                    InvoiceDTO.builder().uuid("i1").status(InvoiceStatus.DRAFT).build())));
            when(api.sendInvoice("i1")).thenReturn(new StatusResponse("invoice sent to client"));
            BillingViewModel model = new BillingViewModel(session, navigator);
            model.load(1);

            assertTrue(model.sendToClient("i1"));

            assertEquals(InvoiceStatus.SENT, model.getInvoices().get(0).getStatus());
        }
    }

    @Nested
    class Profile {

        @Test
        void mismatchingNewPasswordsNeverReachTheServer() {
            ProfileViewModel model = new ProfileViewModel(session, navigator);

            assertFalse(model.changePassword("old-password", "new-password-1", "new-password-2"));

            assertEquals("New passwords do not match.", model.getErrorMessage());
            verifyNoInteractions(api);
        }
    }
}
