package dk.lawoffice.intranet.security;

public final class Roles {

    public static final String ADMIN = "ADMIN";
    public static final String LAWYER = "LAWYER";
    public static final String PARALEGAL = "PARALEGAL";

    private Roles() {
        // no-op: constants
    }
}
