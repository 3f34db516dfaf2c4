package dk.lawoffice.intranet.userservice.resources;

import dk.lawoffice.intranet.dto.PagedResponse;
import dk.lawoffice.intranet.security.RequestUserHolder;
import dk.lawoffice.intranet.security.Roles;
import dk.lawoffice.intranet.userservice.dto.UserCreateRequest;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.dto.UserUpdateRequest;
import dk.lawoffice.intranet.userservice.services.UserService;
import dk.lawoffice.intranet.utils.Pagination;
import dk.lawoffice.intranet.utils.RequestValidator;
import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * User administration. Listing and creating accounts is reserved for administrators; any
 * user may read and update their own account through its uuid or the alias {@code me}.
 */
@Tag(name = "users")
@JBossLog
@Path("/users")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "jwt")
@RolesAllowed({Roles.ADMIN, Roles.LAWYER, Roles.PARALEGAL})
public class UserResource {

    static final String ME = "me";

    @Inject
    UserService userService;

    @Inject
    RequestUserHolder requestUser;

    @Inject
    RequestValidator validator;

    @Inject
    Pagination pagination;

    @Context
    UriInfo uriInfo;

    @GET
    @RolesAllowed({Roles.ADMIN})
    public PagedResponse<UserDTO> findAll(@QueryParam(Pagination.PAGE_PARAM) Integer page,
                                          @QueryParam(Pagination.PAGE_SIZE_PARAM) Integer pageSize) {
        log.info("GET /users");
        return pagination.page(userService.listAll(), page, pageSize, uriInfo, UserDTO::from);
    }

    @POST
    @RolesAllowed({Roles.ADMIN})
    public Response create(UserCreateRequest request) {
        log.infof("POST /users: %s", request != null ? request.getEmail() : null);
        UserDTO user = UserDTO.from(userService.create(validator.validate(request)));
        return Response.status(Response.Status.CREATED).entity(user).build();
    }

    @GET
    @Path("/{uuid}")
    public UserDTO findByUuid(@PathParam("uuid") String uuid) {
        log.infof("GET /users/%s", uuid);
        return UserDTO.from(userService.findByUuid(resolve(uuid)));
    }

    @PUT
    @Path("/{uuid}")
    public UserDTO update(@PathParam("uuid") String uuid, UserUpdateRequest request) {
        log.infof("PUT /users/%s", uuid);
        return UserDTO.from(userService.update(resolve(uuid), validator.validate(request), requestUser.isAdmin()));
    }

    @PATCH
    @Path("/{uuid}")
    public UserDTO patch(@PathParam("uuid") String uuid, UserUpdateRequest request) {
        log.infof("PATCH /users/%s", uuid);
        return UserDTO.from(userService.update(resolve(uuid), validator.validate(request), requestUser.isAdmin()));
    }

    @DELETE
    @Path("/{uuid}")
    public Response delete(@PathParam("uuid") String uuid) {
        log.infof("DELETE /users/%s", uuid);
        userService.delete(resolve(uuid));
        return Response.noContent().build();
    }

    private String resolve(String uuid) {
        String caller = requestUser.requireUserUuid();
        String target = ME.equals(uuid) ? caller : uuid;
        if (!target.equals(caller) && !requestUser.isAdmin()) {
            throw new WebApplicationException("You do not have permission to perform this action.", Response.Status.FORBIDDEN);
        }
        return target;
    }
}
