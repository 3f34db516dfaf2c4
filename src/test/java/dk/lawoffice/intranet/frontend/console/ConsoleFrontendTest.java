package dk.lawoffice.intranet.frontend.console;

import dk.lawoffice.intranet.clientservice.dto.ClientDTO;
import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.frontend.client.ApiException;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.InMemoryTokenStore;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import dk.lawoffice.intranet.frontend.client.StoredTokens;
import dk.lawoffice.intranet.frontend.viewmodel.Route;
import dk.lawoffice.intranet.userservice.dto.LoginRequest;
import dk.lawoffice.intranet.userservice.dto.LoginResponse;
import dk.lawoffice.intranet.userservice.dto.RefreshRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class ConsoleFrontendTest {

    private LawOfficeApi api;
    private InMemoryTokenStore tokenStore;
    private ByteArrayOutputStream buffer;
    private ConsoleFrontend console;

    @BeforeEach
    void setUp() {
        api = Mockito.mock(LawOfficeApi.class);
        tokenStore = new InMemoryTokenStore();
        buffer = new ByteArrayOutputStream();
        console = newConsole();
    }

    private ConsoleFrontend newConsole() {
        return new ConsoleFrontend(new ApiSession(api, tokenStore, Duration.ofSeconds(5)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void commandsNeedALogin() {
        console.execute("clients");

        assertTrue(output().contains("Please log in first."));
        Mockito.verifyNoInteractions(api);
    }

    @Test
    void loginThenListClients() throws Exception {
        when(api.login(any(LoginRequest.class))).thenReturn(new LoginResponse("a", "r",
                UserDTO.builder().fullName("John Doe").build()));
        PagedResponse<ClientDTO> page = new PagedResponse<>();
        page.setCount(1);
        page.setResults(new ArrayList<>(List.of(ClientDTO.builder()
                .uuid("0f3c9a77-1111-2222-3333-444455556666").fullName("Michael Johnson").city("New York").active(true).build())));
        when(api.clients(any(), any(), any(), any())).thenReturn(page);

        console.run(new BufferedReader(new StringReader("login john.doe@lawfirm.com password123\nclients\nquit\nclients\n")));

        String out = output();
        assertTrue(out.contains("Logged in as John Doe."));
        assertTrue(out.contains("0f3c9a77  Michael Johnson"));
        assertTrue(out.contains("New York"));
        Mockito.verify(api, Mockito.times(1)).clients(any(), any(), any(), any());
    }

    @Test
    void expiredSessionSendsUserBackToLogin() {
        tokenStore.save(new StoredTokens("stale", "revoked"));
        console = newConsole();
        when(api.dashboard()).thenThrow(new ApiException(401, "Token is invalid or expired", null));
        when(api.refresh(any(RefreshRequest.class))).thenThrow(new ApiException(401, "Token is blacklisted", null));

        console.execute("dashboard");

        assertEquals(Route.LOGIN, console.getRoute());
        assertTrue(output().contains("Your session has ended. Please log in again."));
        assertTrue(tokenStore.load().isEmpty());
    }

    @Test
    void unknownIdsAreReported() {
        tokenStore.save(new StoredTokens("a", "r"));

        console.execute("confirm 1234");

        assertTrue(output().contains("Unknown appointment"));
    }

    @Test
    void resolveNeedsAUniquePrefix() {
        List<String> ids = List.of("abc-1", "abc-2", "def-1");

        assertEquals("def-1", ConsoleFrontend.resolve("def", ids, id -> id).orElseThrow());
        assertTrue(ConsoleFrontend.resolve("abc", ids, id -> id).isEmpty());
        assertTrue(ConsoleFrontend.resolve(" ", ids, id -> id).isEmpty());
    }
}
