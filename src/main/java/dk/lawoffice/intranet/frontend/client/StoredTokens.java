package dk.lawoffice.intranet.frontend.client;

/**
 * Access and refresh token pair kept by a {@link TokenStore}.
 */
public record StoredTokens(String access, String refresh) {

    public StoredTokens withAccess(String newAccess) {
        return new StoredTokens(newAccess, refresh);
    }
}
