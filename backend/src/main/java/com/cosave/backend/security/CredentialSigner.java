package com.cosave.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.cosave.backend.auth.config.AuthProperties;
import com.cosave.backend.auth.identity.Identity;
import com.cosave.backend.auth.token.support.TokenGenerator;
import com.cosave.backend.security.CredentialVerificationException.Failure;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access / Refresh 토큰 발급·검증 (Credential Signer)
 *
 * - 상태 없음: DB를 보지 않고 서명/만료/aud/iss만 판단한다.
 * - access와 refresh는 서로 다른 HMAC 키 + 다른 aud로 서명한다.
 * - 키 설정이 잘못되면(공백, 32바이트 미만, 두 키가 동일) 생성자에서 IllegalStateException → 부팅 실패.
 *
 * Access JWT:  iss / sub(userId) / aud=access / email / roles / iat / exp
 * Refresh JWT: iss / sub(ownerId) / aud=refresh / jti(recordId) / sec(랜덤 secret) / iat / exp
 *   - sec 원문은 DB에 저장하지 않는다. 저장소에는 sha256(sec)만 남는다.
 */
@Service
public class CredentialSigner {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String EMAIL_CLAIM = "email";
    private static final String ROLES_CLAIM = "roles";
    private static final String SECRET_CLAIM = "sec";

    private final AuthProperties.Jwt jwtProps;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final JwtParser accessParser;
    private final JwtParser refreshParser;

    public CredentialSigner(AuthProperties props, TokenGenerator tokenGenerator, Clock clock) {
        this.jwtProps = props.jwt();
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;

        byte[] accessBytes = requireSecret(jwtProps.accessSecret(), "access");
        byte[] refreshBytes = requireSecret(jwtProps.refreshSecret(), "refresh");
        if (Arrays.equals(accessBytes, refreshBytes)) {
            throw new IllegalStateException("JWT access secret and refresh secret must differ");
        }

        this.accessKey = Keys.hmacShaKeyFor(accessBytes);
        this.refreshKey = Keys.hmacShaKeyFor(refreshBytes);
        this.accessParser = buildParser(jwtProps.issuer(), CredentialKind.ACCESS, accessKey, clock);
        this.refreshParser = buildParser(jwtProps.issuer(), CredentialKind.REFRESH, refreshKey, clock);
    }

    /** identity 기반 Access JWT 발급 */
    public IssuedAccess issueAccess(Identity identity) {
        if (identity == null) throw new IllegalArgumentException("identity must not be null");

        Instant now = now();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        String token = Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(identity.id()))
                .setAudience(CredentialKind.ACCESS.audience())
                .claim(EMAIL_CLAIM, identity.email())
                .claim(ROLES_CLAIM, identity.roles().stream().sorted().toList())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(accessKey, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedAccess(token, exp);
    }

    /**
     * Refresh JWT 발급
     * - 랜덤 secret(48바이트)을 새로 만들어 토큰에 싣고, 저장소용 해시 재료로 같이 돌려준다.
     */
    public IssuedRefresh issueRefresh(Long ownerId, String recordId, long ttlSeconds) {
        if (ownerId == null) throw new IllegalArgumentException("ownerId must not be null");
        if (recordId == null || recordId.isBlank()) throw new IllegalArgumentException("recordId must not be blank");
        if (ttlSeconds <= 0) throw new IllegalArgumentException("ttlSeconds must be positive");

        Instant now = now();
        Instant exp = now.plusSeconds(ttlSeconds);
        String secret = tokenGenerator.generateSecret();

        String token = Jwts.builder()
                .setIssuer(jwtProps.issuer())
                .setSubject(String.valueOf(ownerId))
                .setAudience(CredentialKind.REFRESH.audience())
                .setId(recordId)
                .claim(SECRET_CLAIM, secret)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(exp))
                .signWith(refreshKey, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedRefresh(token, secret, exp);
    }

    /**
     * 순수 검증. 저장소를 보지 않는다.
     * - 다른 종류의 키로는 검증되는 토큰이면 WRONG_AUDIENCE로 구분해 둔다(로그/감사용).
     */
    public VerifiedCredential verify(String token, CredentialKind kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (token == null || token.isBlank()) {
            throw new CredentialVerificationException(Failure.INVALID_SIGNATURE, "token is null or blank", null);
        }

        try {
            Claims claims = parserFor(kind).parseClaimsJws(token).getBody();
            return toCredential(kind, claims);
        } catch (ExpiredJwtException e) {
            throw new CredentialVerificationException(Failure.EXPIRED, "token expired", e);
        } catch (IncorrectClaimException | MissingClaimException e) {
            Failure failure = Claims.AUDIENCE.equals(e.getClaimName()) ? Failure.WRONG_AUDIENCE : Failure.INVALID_SIGNATURE;
            throw new CredentialVerificationException(failure, "claim mismatch: " + e.getClaimName(), e);
        } catch (io.jsonwebtoken.security.SecurityException e) {
            Failure failure = verifiesAs(other(kind), token) ? Failure.WRONG_AUDIENCE : Failure.INVALID_SIGNATURE;
            throw new CredentialVerificationException(failure, "signature mismatch", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new CredentialVerificationException(Failure.INVALID_SIGNATURE, "malformed token", e);
        }
    }

    private VerifiedCredential toCredential(CredentialKind kind, Claims claims) {
        Long ownerId = parseSubject(claims.getSubject());
        Instant expiresAt = claims.getExpiration().toInstant();

        if (kind == CredentialKind.ACCESS) {
            String email = claims.get(EMAIL_CLAIM, String.class);
            return new VerifiedCredential(kind, ownerId, email, parseRoles(claims.get(ROLES_CLAIM)), null, null, expiresAt);
        }

        String recordId = claims.getId();
        String secret = claims.get(SECRET_CLAIM, String.class);
        if (recordId == null || recordId.isBlank() || secret == null || secret.isBlank()) {
            throw new JwtException("refresh token must carry jti and secret");
        }
        return new VerifiedCredential(kind, ownerId, null, List.of(), recordId, secret, expiresAt);
    }

    private boolean verifiesAs(CredentialKind kind, String token) {
        try {
            parserFor(kind).parseClaimsJws(token);
            return true;
        } catch (ExpiredJwtException e) {
            return true; // 서명 자체는 그 키로 맞음
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private JwtParser parserFor(CredentialKind kind) {
        return kind == CredentialKind.ACCESS ? accessParser : refreshParser;
    }

    private static CredentialKind other(CredentialKind kind) {
        return kind == CredentialKind.ACCESS ? CredentialKind.REFRESH : CredentialKind.ACCESS;
    }

    // jwt exp/iat는 초 단위라 저장소 expires_at과 어긋나지 않게 초로 자른다.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static byte[] requireSecret(String secret, String name) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT " + name + " secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT " + name + " secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return bytes;
    }

    private static JwtParser buildParser(String issuer, CredentialKind kind, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .requireAudience(kind.audience())
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    private static Long parseSubject(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static List<String> parseRoles(Object raw) {
        if (!(raw instanceof List<?> list)) {
            throw new JwtException("roles claim missing");
        }
        List<String> roles = new ArrayList<>(list.size());
        for (Object r : list) {
            roles.add(String.valueOf(r));
        }
        return List.copyOf(roles);
    }

    public record IssuedAccess(String token, Instant expiresAt) {}

    public record IssuedRefresh(String token, String secret, Instant expiresAt) {}
}
