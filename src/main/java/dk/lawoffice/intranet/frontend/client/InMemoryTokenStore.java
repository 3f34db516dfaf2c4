package dk.lawoffice.intranet.frontend.client;

import java.util.Optional;

/**
 * Holds the tokens for the lifetime of one object: a web request or a test.
 */
public class InMemoryTokenStore implements TokenStore {

    private volatile StoredTokens tokens;

    public InMemoryTokenStore() {
    }

    public InMemoryTokenStore(StoredTokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public Optional<StoredTokens> load() {
        return Optional.ofNullable(tokens);
    }

    @Override
    public void save(StoredTokens tokens) {
        this.tokens = tokens;
    }

    @Override
    public void clear() {
        tokens = null;
    }
}
