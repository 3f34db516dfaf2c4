package dk.lawoffice.intranet.frontend.viewmodel;

public enum Route {
    LOGIN,
    DASHBOARD,
    CLIENTS,
    APPOINTMENTS,
    CASES,
    BILLING,
    PROFILE
}
