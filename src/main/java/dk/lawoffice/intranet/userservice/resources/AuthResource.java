package dk.lawoffice.intranet.userservice.resources;

import dk.lawoffice.intranet.dto.MessageResponse;
import dk.lawoffice.intranet.security.RequestUserHolder;
import dk.lawoffice.intranet.security.Roles;
import dk.lawoffice.intranet.userservice.dto.*;
import dk.lawoffice.intranet.userservice.services.LoginService;
import dk.lawoffice.intranet.userservice.services.UserService;
import dk.lawoffice.intranet.utils.RequestValidator;
import jakarta.annotation.security.PermitAll;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Map;

@Tag(name = "auth")
@JBossLog
@Path("/auth")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityScheme(securitySchemeName = "jwt", type = SecuritySchemeType.HTTP, scheme = "bearer", bearerFormat = "jwt")
public class AuthResource {

    @Inject
    LoginService loginService;

    @Inject
    UserService userService;

    @Inject
    RequestValidator validator;

    @Inject
    RequestUserHolder requestUser;

    @POST
    @Path("/login")
    @PermitAll
    public LoginResponse login(LoginRequest request) {
        log.info("POST /auth/login");
        return loginService.login(validator.validate(request));
    }

    @POST
    @Path("/token/refresh")
    @PermitAll
    public AccessTokenResponse refresh(RefreshRequest request) {
        log.debug("POST /auth/token/refresh");
        return loginService.refresh(validator.validate(request).getRefresh());
    }

    @POST
    @Path("/token/verify")
    @PermitAll
    public Map<String, Object> verify(TokenVerifyRequest request) {
        loginService.verify(validator.validate(request).getToken());
        return Map.of();
    }

    @POST
    @Path("/logout")
    @PermitAll
    public Response logout(RefreshRequest request) {
        log.info("POST /auth/logout");
        loginService.logout(validator.validate(request).getRefresh());
        return Response.noContent().build();
    }

    @POST
    @Path("/register")
    @PermitAll
    public Response register(UserCreateRequest request) {
        log.infof("POST /auth/register: %s", request != null ? request.getEmail() : null);
        UserDTO user = UserDTO.from(userService.register(validator.validate(request)));
        return Response.status(Response.Status.CREATED).entity(user).build();
    }

    @GET
    @Path("/profile")
    @SecurityRequirement(name = "jwt")
    @RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
    public UserDTO profile() {
        return UserDTO.from(userService.findByUuid(requestUser.requireUserUuid()));
    }

    @PATCH
    @Path("/profile")
    @SecurityRequirement(name = "jwt")
    @RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
    public UserDTO updateProfile(UserUpdateRequest request) {
        log.infof("PATCH /auth/profile by %s", requestUser.getEmail());
        return UserDTO.from(userService.update(requestUser.requireUserUuid(), validator.validate(request), requestUser.isAdmin()));
    }

    @PUT
    @Path("/change-password")
    @SecurityRequirement(name = "jwt")
    @RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
    public MessageResponse changePassword(ChangePasswordRequest request) {
        log.infof("PUT /auth/change-password by %s", requestUser.getEmail());
        userService.changePassword(requestUser.requireUserUuid(), validator.validate(request));
        return new MessageResponse("Password updated successfully");
    }
}
