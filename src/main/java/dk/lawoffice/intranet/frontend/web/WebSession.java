package dk.lawoffice.intranet.frontend.web;

import dk.lawoffice.intranet.frontend.client.ApiClientFactory;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.InMemoryTokenStore;
import dk.lawoffice.intranet.frontend.client.LawOfficeApi;
import dk.lawoffice.intranet.frontend.client.StoredTokens;
import dk.lawoffice.intranet.frontend.viewmodel.Navigator;
import dk.lawoffice.intranet.frontend.viewmodel.Route;
import jakarta.ws.rs.core.NewCookie;
import lombok.Getter;
import lombok.extern.jbosslog.JBossLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * API session of one browser request. The tokens come from HttpOnly cookies and changed
 * tokens are written back as cookies on the response.
 */
@JBossLog
class WebSession implements Navigator, AutoCloseable {

    static final String ACCESS_COOKIE = "lawoffice_access";
    static final String REFRESH_COOKIE = "lawoffice_refresh";
    static final String COOKIE_PATH = "/web";

    private final LawOfficeApi api;
    private final InMemoryTokenStore tokenStore;
    private final StoredTokens initial;

    @Getter
    private final ApiSession session;

    @Getter
    private Route route;

    WebSession(ApiClientFactory factory, String accessCookie, String refreshCookie) {
        this.initial = refreshCookie != null && !refreshCookie.isBlank() ? new StoredTokens(accessCookie, refreshCookie) : null;
        this.tokenStore = new InMemoryTokenStore(initial);
        this.api = factory.create(tokenStore);
        this.session = new ApiSession(api, tokenStore, factory.getTimeout());
    }

    @Override
    public void navigate(Route route) {
        this.route = route;
    }

    boolean isAuthenticated() {
        return tokenStore.load().isPresent();
    }

    boolean sentToLogin() {
        return route == Route.LOGIN;
    }

    NewCookie[] cookies() {
        Optional<StoredTokens> current = tokenStore.load();
        List<NewCookie> cookies = new ArrayList<>();
        if (current.isEmpty()) {
            if (initial != null) {
                cookies.add(cookie(ACCESS_COOKIE, "", 0));
                cookies.add(cookie(REFRESH_COOKIE, "", 0));
            }
        } else if (!Objects.equals(current.get(), initial)) {
            cookies.add(cookie(ACCESS_COOKIE, current.get().access(), NewCookie.DEFAULT_MAX_AGE));
            cookies.add(cookie(REFRESH_COOKIE, current.get().refresh(), NewCookie.DEFAULT_MAX_AGE));
        }
        return cookies.toArray(new NewCookie[0]);
    }

    private static NewCookie cookie(String name, String value, int maxAge) {
        return new NewCookie.Builder(name)
                .value(value)
                .path(COOKIE_PATH)
                .maxAge(maxAge)
                .httpOnly(true)
                .sameSite(NewCookie.SameSite.LAX)
                .build();
    }

    @Override
    public void close() {
        try {
            api.close();
        } catch (Exception e) {
            log.debugf("Closing API client failed: %s", e.getMessage());
        }
    }
}
