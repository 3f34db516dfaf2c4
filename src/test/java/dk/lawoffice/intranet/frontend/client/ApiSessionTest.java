package dk.lawoffice.intranet.frontend.client;

import dk.lawoffice.intranet.userservice.dto.AccessTokenResponse;
import dk.lawoffice.intranet.userservice.dto.LoginRequest;
import dk.lawoffice.intranet.userservice.dto.LoginResponse;
import dk.lawoffice.intranet.userservice.dto.RefreshRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApiSession")
class ApiSessionTest {

    private static final String OLD_ACCESS = "old-access";
    private static final String NEW_ACCESS = "new-access";
    private static final String REFRESH = "refresh-token";

    @Mock
    LawOfficeApi api;

    private InMemoryTokenStore tokenStore;
    private ApiSession session;

    @BeforeEach
    void setUp() {
        tokenStore = new InMemoryTokenStore(new StoredTokens(OLD_ACCESS, REFRESH));
        session = new ApiSession(api, tokenStore, Duration.ofSeconds(5));
    }

    private static UserDTO user() {
        return UserDTO.builder().email("john.doe@lawfirm.com").fullName("John Doe").build();
    }

    private static ApiException unauthorized() {
        return new ApiException(401, "Given token not valid for any token type", null);
    }

    @Test
    @DisplayName("login stores both tokens")
    void loginStoresTokens() {
        when(api.login(any(LoginRequest.class))).thenReturn(new LoginResponse("a", "r", user()));
        session.logout();

        UserDTO loggedIn = session.login("john.doe@lawfirm.com", "password123");

        assertEquals("John Doe", loggedIn.getFullName());
        assertEquals(new StoredTokens("a", "r"), tokenStore.load().orElseThrow());
    }

    @Test
    @DisplayName("a rejected access token is refreshed once and the request retried")
    void refreshAndRetry() {
        when(api.profile()).thenAnswer(invocation -> {
            if (OLD_ACCESS.equals(tokenStore.accessToken().orElse(null))) throw unauthorized();
            return user();
        });
        when(api.refresh(any(RefreshRequest.class))).thenReturn(new AccessTokenResponse(NEW_ACCESS));

        UserDTO profile = session.call(LawOfficeApi::profile);

        assertEquals("John Doe", profile.getFullName());
        assertEquals(NEW_ACCESS, tokenStore.accessToken().orElseThrow());
        assertEquals(REFRESH, tokenStore.load().orElseThrow().refresh());
        verify(api, times(2)).profile();
        verify(api, times(1)).refresh(any(RefreshRequest.class));
    }

    @Test
    @DisplayName("concurrent 401s share a single refresh")
    void singleFlightRefresh() throws Exception {
        CountDownLatch bothRejected = new CountDownLatch(2);
        when(api.profile()).thenAnswer(invocation -> {
            if (OLD_ACCESS.equals(tokenStore.accessToken().orElse(null))) {
                bothRejected.countDown();
                throw unauthorized();
            }
            return user();
        });
        when(api.refresh(any(RefreshRequest.class))).thenAnswer(invocation -> {
            assertTrue(bothRejected.await(5, TimeUnit.SECONDS));
            return new AccessTokenResponse(NEW_ACCESS);
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<UserDTO> first = executor.submit(() -> session.call(LawOfficeApi::profile));
            Future<UserDTO> second = executor.submit(() -> session.call(LawOfficeApi::profile));

            assertEquals("John Doe", first.get(10, TimeUnit.SECONDS).getFullName());
            assertEquals("John Doe", second.get(10, TimeUnit.SECONDS).getFullName());
        } finally {
            executor.shutdownNow();
        }
        verify(api, times(1)).refresh(any(RefreshRequest.class));
        assertEquals(NEW_ACCESS, tokenStore.accessToken().orElseThrow());
    }

    @Test
    @DisplayName("a failed refresh ends the session")
    void failedRefreshExpiresSession() {
        when(api.profile()).thenThrow(unauthorized());
        when(api.refresh(any(RefreshRequest.class))).thenThrow(unauthorized());

        SessionExpiredException expired = assertThrows(SessionExpiredException.class, () -> session.call(LawOfficeApi::profile));

        assertEquals(ApiSession.SESSION_EXPIRED, expired.getMessage());
        assertFalse(session.isAuthenticated());
        verify(api, times(1)).profile();
    }

    @Test
    @DisplayName("a second 401 after a successful refresh ends the session")
    void secondRejectionExpiresSession() {
        when(api.profile()).thenThrow(unauthorized());
        when(api.refresh(any(RefreshRequest.class))).thenReturn(new AccessTokenResponse(NEW_ACCESS));

        assertThrows(SessionExpiredException.class, () -> session.call(LawOfficeApi::profile));

        assertTrue(tokenStore.load().isEmpty());
        verify(api, times(2)).profile();
    }

    @Test
    @DisplayName("other errors pass through untouched")
    void nonAuthErrorsPassThrough() {
        when(api.profile()).thenThrow(new ApiException(404, "Not found", null));

        ApiException error = assertThrows(ApiException.class, () -> session.call(LawOfficeApi::profile));

        assertEquals(404, error.getStatus());
        assertTrue(session.isAuthenticated());
        verify(api, never()).refresh(any(RefreshRequest.class));
    }

    @Test
    @DisplayName("logout clears local tokens even when the server call fails")
    void logoutIsBestEffort() {
        doThrow(new ApiException(401, "Token is blacklisted", null)).when(api).logout(any(RefreshRequest.class));

        session.logout();

        assertFalse(session.isAuthenticated());
    }
}
