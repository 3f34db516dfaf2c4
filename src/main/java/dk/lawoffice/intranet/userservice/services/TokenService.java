package dk.lawoffice.intranet.userservice.services;

import dk.lawoffice.intranet.userservice.model.RefreshToken;
import dk.lawoffice.intranet.userservice.model.User;
import io.smallrye.jwt.auth.principal.JWTAuthContextInfo;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.jwt.build.Jwt;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.jwt.Claims;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and verifies the RS256 tokens. Access and refresh tokens are signed with the same
 * key but for different audiences, so the bearer mechanism only accepts access tokens. The
 * {@value #TOKEN_TYPE_CLAIM} claim tells them apart as well and refresh tokens are tracked in
 * {@code refresh_tokens} so they can be revoked.
 */
@JBossLog
@ApplicationScoped
public class TokenService {

    public static final String TOKEN_TYPE_CLAIM = "token_type";
    public static final String ACCESS_TOKEN_TYPE = "access";
    public static final String REFRESH_TOKEN_TYPE = "refresh";

    private static final String KEY_ID = "lawoffice";

    @ConfigProperty(name = "lawoffice.jwt.issuer")
    String issuer;

    @ConfigProperty(name = "lawoffice.jwt.audience", defaultValue = "lawoffice-api")
    String audience;

    @ConfigProperty(name = "lawoffice.jwt.refresh-audience", defaultValue = "lawoffice-refresh")
    String refreshAudience;

    @ConfigProperty(name = "lawoffice.jwt.access-token-lifetime", defaultValue = "14400")
    long accessTokenLifetime;

    @ConfigProperty(name = "lawoffice.jwt.refresh-token-lifetime", defaultValue = "2592000")
    long refreshTokenLifetime;

    @Inject
    JWTParser parser;

    @Inject
    JWTAuthContextInfo authContextInfo;

    private JWTAuthContextInfo refreshContextInfo;

    @PostConstruct
    void init() {
        refreshContextInfo = new JWTAuthContextInfo(authContextInfo);
        refreshContextInfo.setExpectedAudience(Set.of(refreshAudience));
    }

    public String createAccessToken(User user) {
        return Jwt.issuer(issuer)
                .subject(user.getUuid())
                .upn(user.getEmail())
                .preferredUserName(user.getEmail())
                .audience(audience)
                .groups(Set.of(user.getUserType().name()))
                .claim(Claims.full_name.name(), user.getFullName())
                .claim(Claims.jti.name(), UUID.randomUUID().toString())
                .claim(TOKEN_TYPE_CLAIM, ACCESS_TOKEN_TYPE)
                .issuedAt(Instant.now())
                .expiresIn(Duration.ofSeconds(accessTokenLifetime))
                .jws().keyId(KEY_ID)
                .sign();
    }

    @Transactional
    public String createRefreshToken(User user) {
        String jti = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Instant expiresAt = now.plusSeconds(refreshTokenLifetime);
        new RefreshToken(jti, user.getUuid(), toLocal(now), toLocal(expiresAt)).persist();
        log.debugf("Issued refresh token %s for %s", jti, user.getEmail());
        return Jwt.issuer(issuer)
                .subject(user.getUuid())
                .upn(user.getEmail())
                .audience(refreshAudience)
                .claim(Claims.jti.name(), jti)
                .claim(TOKEN_TYPE_CLAIM, REFRESH_TOKEN_TYPE)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .jws().keyId(KEY_ID)
                .sign();
    }

    /**
     * Verifies signature, expiry, issuer and audience of a refresh token and checks it has not been revoked.
     *
     * @return the stored refresh token record
     * @throws WebApplicationException 401 when the token cannot be used
     */
    public RefreshToken verifyRefreshToken(String token) {
        JsonWebToken jwt = parse(token, refreshContextInfo);
        if (!REFRESH_TOKEN_TYPE.equals(jwt.getClaim(TOKEN_TYPE_CLAIM))) {
            throw invalidToken("Token has wrong type");
        }
        RefreshToken stored = RefreshToken.findById(jwt.getTokenID());
        if (stored == null || !stored.isUsable(LocalDateTime.now())) {
            throw invalidToken("Token is blacklisted");
        }
        return stored;
    }

    public JsonWebToken verifyAccessToken(String token) {
        JsonWebToken jwt = parse(token, authContextInfo);
        if (!ACCESS_TOKEN_TYPE.equals(jwt.getClaim(TOKEN_TYPE_CLAIM))) {
            throw invalidToken("Token has wrong type");
        }
        return jwt;
    }

    @Transactional
    public void revoke(RefreshToken refreshToken) {
        RefreshToken managed = RefreshToken.findById(refreshToken.getJti());
        if (managed != null && !managed.isRevoked()) {
            managed.setRevoked(true);
            log.infof("Revoked refresh token %s of user %s", managed.getJti(), managed.getUseruuid());
        }
    }

    private JsonWebToken parse(String token, JWTAuthContextInfo contextInfo) {
        try {
            return parser.parse(token, contextInfo);
        } catch (ParseException e) {
            log.debugf("Token rejected: %s", e.getMessage());
            throw invalidToken("Token is invalid or expired");
        }
    }

    private static WebApplicationException invalidToken(String detail) {
        return new WebApplicationException(detail, Response.Status.UNAUTHORIZED);
    }

    private static LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
    }
}
