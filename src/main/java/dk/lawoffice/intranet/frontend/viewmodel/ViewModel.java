package dk.lawoffice.intranet.frontend.viewmodel;

import dk.lawoffice.intranet.frontend.client.ApiException;
import dk.lawoffice.intranet.frontend.client.ApiSession;
import dk.lawoffice.intranet.frontend.client.SessionExpiredException;
import lombok.Getter;
import lombok.extern.jbosslog.JBossLog;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Base of the view models. Every API call runs through {@link #guard(Supplier)}, which keeps
 * the last good state on failure and stores a message for the renderer to show. An expired
 * session routes to the login view.
 */
@JBossLog
public abstract class ViewModel {

    static final String UNEXPECTED = "An unexpected error occurred. Please try again.";

    protected final ApiSession session;
    protected final Navigator navigator;

    @Getter
    private String errorMessage;

    @Getter
    private String infoMessage;

    @Getter
    private boolean loading;

    protected ViewModel(ApiSession session, Navigator navigator) {
        this.session = session;
        this.navigator = navigator;
    }

    protected <T> Optional<T> guard(Supplier<T> action) {
        errorMessage = null;
        infoMessage = null;
        loading = true;
        try {
            return Optional.ofNullable(action.get());
        } catch (SessionExpiredException e) {
            errorMessage = e.getMessage();
            navigator.navigate(Route.LOGIN);
        } catch (ApiException e) {
            log.debugf("API call failed: %s", e.getMessage());
            errorMessage = e.userMessage();
        } catch (RuntimeException e) {
            log.error("Unexpected front-end failure", e);
            errorMessage = UNEXPECTED;
        } finally {
            loading = false;
        }
        return Optional.empty();
    }

    protected boolean guardRun(Runnable action) {
        return guard(() -> {
            action.run();
            return Boolean.TRUE;
        }).isPresent();
    }

    protected void fail(String message) {
        this.errorMessage = message;
    }

    protected void info(String message) {
        this.infoMessage = message;
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    static boolean matches(String filter, String... values) {
        if (filter == null || filter.isBlank()) return true;
        String needle = filter.trim().toLowerCase();
        for (String value : values) {
            if (value != null && value.toLowerCase().contains(needle)) return true;
        }
        return false;
    }
}
