package dk.lawoffice.intranet.frontend.client;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;

import java.util.Set;

/**
 * Adds the stored access token to every request except the ones that establish a session.
 */
public class BearerTokenFilter implements ClientRequestFilter {

    static final Set<String> ANONYMOUS_PATHS = Set.of("/auth/login", "/auth/register", "/auth/token/refresh", "/auth/token/verify", "/auth/logout");

    private final TokenStore tokenStore;

    public BearerTokenFilter(TokenStore tokenStore) {
        this.tokenStore = tokenStore;
    }

    @Override
    public void filter(ClientRequestContext ctx) {
        String path = ctx.getUri().getPath();
        if (path != null && ANONYMOUS_PATHS.stream().anyMatch(path::endsWith)) return;
        tokenStore.accessToken().ifPresent(token -> ctx.getHeaders().putSingle(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }
}
