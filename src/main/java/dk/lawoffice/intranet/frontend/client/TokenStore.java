package dk.lawoffice.intranet.frontend.client;

import java.util.Optional;

public interface TokenStore {

    Optional<StoredTokens> load();

    void save(StoredTokens tokens);

    void clear();

    default Optional<String> accessToken() {
        return load().map(StoredTokens::access);
    }
}
