package dk.lawoffice.intranet.userservice.services;

import dk.lawoffice.intranet.userservice.dto.AccessTokenResponse;
import dk.lawoffice.intranet.userservice.dto.LoginRequest;
import dk.lawoffice.intranet.userservice.dto.LoginResponse;
import dk.lawoffice.intranet.userservice.dto.UserDTO;
import dk.lawoffice.intranet.userservice.model.RefreshToken;
import dk.lawoffice.intranet.userservice.model.User;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDateTime;
import java.util.Optional;

@JBossLog
@ApplicationScoped
public class LoginService {

    static final String LOGIN_FAILED = "No active account found with the given credentials";

    @Inject
    TokenService tokenService;

    @Transactional
    public LoginResponse login(LoginRequest request) {
        log.infof("Login attempt %s", request.getEmail());
        Optional<User> optionalUser = User.findByEmail(request.getEmail());
        if (optionalUser.isEmpty()) {
            log.warnf("Login by %s: unknown user", request.getEmail());
            throw new WebApplicationException(LOGIN_FAILED, Response.Status.UNAUTHORIZED);
        }
        User user = optionalUser.get();
        if (!user.isActive() || !user.checkPassword(request.getPassword())) {
            log.warnf("Login by %s: invalid", request.getEmail());
            throw new WebApplicationException(LOGIN_FAILED, Response.Status.UNAUTHORIZED);
        }
        user.setLastLogin(LocalDateTime.now());
        log.infof("Login by %s: valid", request.getEmail());
        return new LoginResponse(tokenService.createAccessToken(user), tokenService.createRefreshToken(user), UserDTO.from(user));
    }

    public AccessTokenResponse refresh(String refreshToken) {
        RefreshToken stored = tokenService.verifyRefreshToken(refreshToken);
        User user = User.findById(stored.getUseruuid());
        if (user == null || !user.isActive()) {
            log.warnf("Refresh refused for inactive or deleted user %s", stored.getUseruuid());
            throw new WebApplicationException("User is inactive", Response.Status.UNAUTHORIZED);
        }
        log.debugf("Access token refreshed for %s", user.getEmail());
        return new AccessTokenResponse(tokenService.createAccessToken(user));
    }

    public void verify(String accessToken) {
        tokenService.verifyAccessToken(accessToken);
    }

    public void logout(String refreshToken) {
        RefreshToken stored = tokenService.verifyRefreshToken(refreshToken);
        tokenService.revoke(stored);
    }
}
