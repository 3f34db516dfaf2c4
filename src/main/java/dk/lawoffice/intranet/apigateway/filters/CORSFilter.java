package dk.lawoffice.intranet.apigateway.filters;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;

@JBossLog
@Provider
public class CORSFilter implements ContainerResponseFilter {

    @ConfigProperty(name = "lawoffice.cors.allowed-origin", defaultValue = "*")
    String allowedOrigin;

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) throws IOException {
        MultivaluedMap<String, Object> headers = responseContext.getHeaders();
        headers.putSingle("Access-Control-Allow-Origin", allowedOrigin);
        headers.putSingle("Access-Control-Allow-Headers", "Authorization, Content-Type, Accept");
        headers.putSingle("Access-Control-Allow-Methods", "GET, POST, PUT, PATCH, DELETE, OPTIONS");
        log.debugf("CORS origin %s applied to %s %s", allowedOrigin, requestContext.getMethod(), requestContext.getUriInfo().getPath());
    }
}
