package dk.lawoffice.intranet.logging;

import dk.lawoffice.intranet.security.RequestUserHolder;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;
import org.jboss.logging.Logger;

import java.io.IOException;

@JBossLog
@Provider
@PreMatching
public class ApiUsageLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String START_TIME_PROPERTY = "apiUsageStartTime";

    @Inject
    RequestUserHolder requestUserHolder;

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        requestContext.setProperty(START_TIME_PROPERTY, System.currentTimeMillis());
        log.debugf("Started request %s %s", requestContext.getMethod(), requestContext.getUriInfo().getPath());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) throws IOException {
        Object start = requestContext.getProperty(START_TIME_PROPERTY);
        long duration = start instanceof Long ? System.currentTimeMillis() - (Long) start : -1;
        int status = responseContext.getStatus();
        log.logf(levelFor(status), "API request - user=%s method=%s path=%s status=%d duration=%dms",
                requestUserHolder.getEmail(), requestContext.getMethod(), requestContext.getUriInfo().getPath(), status, duration);
    }

    static Logger.Level levelFor(int status) {
        if (status >= 500) return Logger.Level.ERROR;
        if (status >= 400) return Logger.Level.WARN;
        return Logger.Level.INFO;
    }
}
