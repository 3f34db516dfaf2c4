package dk.lawoffice.intranet.frontend.client;

import dk.lawoffice.intranet.userservice.dto.LoginRequest;
import dk.lawoffice.intranet.userservice.dto.LoginResponse;
import dk.lawoffice.intranet.userservice.dto.RefreshRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.ws.rs.ProcessingException;
import lombok.extern.jbosslog.JBossLog;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An authenticated conversation with the API. Every call goes through {@link #call(Function)}:
 * a 401 triggers one token refresh and one retry. Concurrent 401s share a single refresh
 * call. When the refresh itself fails the tokens are cleared and
 * {@link SessionExpiredException} is raised.
 */
@JBossLog
public class ApiSession {

    static final String SESSION_EXPIRED = "Your session has expired. Please log in again.";

    private final LawOfficeApi api;
    private final TokenStore tokenStore;
    private final Duration timeout;
    private final Object refreshLock = new Object();

    private CompletableFuture<String> refreshInFlight;
    private volatile UserDTO currentUser;

    public ApiSession(LawOfficeApi api, TokenStore tokenStore, Duration timeout) {
        this.api = api;
        this.tokenStore = tokenStore;
        this.timeout = timeout;
    }

    public UserDTO login(String email, String password) {
        LoginResponse response = wrap(() -> api.login(new LoginRequest(email, password)));
        tokenStore.save(new StoredTokens(response.getAccess(), response.getRefresh()));
        currentUser = response.getUser();
        log.infof("Logged in as %s", email);
        return currentUser;
    }

    /**
     * Revokes the refresh token on the server when possible and always forgets the local tokens.
     */
    public void logout() {
        tokenStore.load().ifPresent(tokens -> {
            try {
                api.logout(new RefreshRequest(tokens.refresh()));
            } catch (ApiException | ProcessingException e) {
                log.warnf("Server-side logout failed: %s", e.getMessage());
            }
        });
        tokenStore.clear();
        currentUser = null;
    }

    public boolean isAuthenticated() {
        return tokenStore.load().isPresent();
    }

    public UserDTO currentUser() {
        if (currentUser == null && isAuthenticated()) {
            currentUser = call(LawOfficeApi::profile);
        }
        return currentUser;
    }

    public <T> T call(Function<LawOfficeApi, T> request) {
        String usedToken = tokenStore.accessToken().orElse(null);
        try {
            return wrap(() -> request.apply(api));
        } catch (ApiException e) {
            if (!e.isUnauthorized()) throw e;
            log.debug("Access token rejected, refreshing");
        }
        refreshAccessToken(usedToken);
        try {
            return wrap(() -> request.apply(api));
        } catch (ApiException e) {
            if (!e.isUnauthorized()) throw e;
            expire(e);
            throw new SessionExpiredException(SESSION_EXPIRED, e);
        }
    }

    public void run(Consumer<LawOfficeApi> request) {
        call(client -> {
            request.accept(client);
            return null;
        });
    }

    /**
     * {@link #call(Function)} on a worker thread, failing with a timeout after the configured
     * client timeout.
     */
    public <T> Uni<T> callAsync(Function<LawOfficeApi, T> request) {
        return Uni.createFrom().item(() -> call(request))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .ifNoItem().after(timeout).fail();
    }

    /**
     * Returns a fresh access token. {@code staleToken} is the token the failed request used;
     * when another caller already replaced it, the replacement is returned without a new refresh.
     */
    String refreshAccessToken(String staleToken) {
        CompletableFuture<String> future;
        boolean owner = false;
        synchronized (refreshLock) {
            String current = tokenStore.accessToken().orElse(null);
            if (current != null && !Objects.equals(current, staleToken)) return current;
            if (refreshInFlight == null) {
                refreshInFlight = new CompletableFuture<>();
                owner = true;
            }
            future = refreshInFlight;
        }
        if (owner) {
            try {
                future.complete(doRefresh());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            } finally {
                synchronized (refreshLock) {
                    refreshInFlight = null;
                }
            }
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) throw cause;
            throw e;
        }
    }

    private String doRefresh() {
        StoredTokens tokens = tokenStore.load().orElseThrow(() -> new SessionExpiredException(SESSION_EXPIRED));
        try {
            String access = wrap(() -> api.refresh(new RefreshRequest(tokens.refresh()))).getAccess();
            tokenStore.save(tokens.withAccess(access));
            log.debug("Access token refreshed");
            return access;
        } catch (ApiException e) {
            if (e.getStatus() == 0) throw e;
            expire(e);
            throw new SessionExpiredException(SESSION_EXPIRED, e);
        }
    }

    private void expire(ApiException cause) {
        log.infof("Session expired: %s", cause.getMessage());
        tokenStore.clear();
        currentUser = null;
    }

    private static <T> T wrap(Supplier<T> call) {
        try {
            return call.get();
        } catch (ProcessingException e) {
            if (e.getCause() instanceof ApiException apiException) throw apiException;
            throw new ApiException("Could not reach the server: " + e.getMessage(), e);
        }
    }

    public TokenStore getTokenStore() {
        return tokenStore;
    }
}
