package dk.lawoffice.intranet.security;

import dk.lawoffice.intranet.exceptions.ErrorResponse;
import dk.lawoffice.intranet.userservice.services.TokenService;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.io.IOException;
import java.util.HashSet;

/**
 * Copies the verified JWT identity into {@link RequestUserHolder}. Only access tokens get
 * this far; anything else carrying a different token type is still turned away.
 */
@JBossLog
@Provider
@Priority(Priorities.AUTHENTICATION + 10)
public class RequestUserFilter implements ContainerRequestFilter {

    @Inject
    JsonWebToken jwt;

    @Inject
    RequestUserHolder requestUserHolder;

    @Override
    public void filter(ContainerRequestContext context) throws IOException {
        if (jwt == null || jwt.getRawToken() == null) {
            log.debugf("No bearer token on %s %s", context.getMethod(), context.getUriInfo().getPath());
            return;
        }
        String tokenType = jwt.getClaim(TokenService.TOKEN_TYPE_CLAIM);
        if (!TokenService.ACCESS_TOKEN_TYPE.equals(tokenType)) {
            log.warnf("Rejected %s token used as bearer credentials by %s", tokenType, jwt.getName());
            context.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponse("Given token not valid for any token type"))
                    .build());
            return;
        }
        requestUserHolder.setUserUuid(jwt.getSubject());
        requestUserHolder.setEmail(jwt.getName());
        requestUserHolder.setRoles(new HashSet<>(jwt.getGroups()));
        log.debugf("Request user set to %s", jwt.getName());
    }
}
