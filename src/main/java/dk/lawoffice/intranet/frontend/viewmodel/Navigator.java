package dk.lawoffice.intranet.frontend.viewmodel;

/**
 * Implemented by each renderer to switch views.
 */
@FunctionalInterface
public interface Navigator {

    void navigate(Route route);
}
