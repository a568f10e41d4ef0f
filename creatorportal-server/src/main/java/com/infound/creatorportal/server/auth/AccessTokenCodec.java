package com.infound.creatorportal.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.RegisteredClaims;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.Verification;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and decodes access tokens.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256 and carry the creator username as subject, the session
 * id as JWT ID and an absolute expiry. The codec only proves authenticity and freshness; whether
 * the session is still live is decided by the session store.
 */
public class AccessTokenCodec {

  /**
   * Lifetime of an access token unless configured otherwise.
   */
  public static final Duration DEFAULT_TTL = Duration.ofDays(14);

  private static final Logger log = LoggerFactory.getLogger(AccessTokenCodec.class);

  private static final Set<String> RESERVED_CLAIMS = Set.of(
      RegisteredClaims.SUBJECT,
      RegisteredClaims.JWT_ID,
      RegisteredClaims.EXPIRES_AT,
      RegisteredClaims.ISSUER,
      RegisteredClaims.ISSUED_AT,
      RegisteredClaims.NOT_BEFORE,
      RegisteredClaims.AUDIENCE);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Creates a codec using the system clock.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer value of the {@code iss} claim, or null to omit it
   * @param ttl    token time-to-live
   */
  public AccessTokenCodec(byte[] secret, String issuer, Duration ttl) {
    this(secret, issuer, ttl, Clock.systemUTC());
  }

  /**
   * Creates a codec.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer value of the {@code iss} claim, or null to omit it
   * @param ttl    token time-to-live
   * @param clock  clock used to compute expiry at issuance
   */
  public AccessTokenCodec(byte[] secret, String issuer, Duration ttl, Clock clock) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("Signing secret must not be empty");
    }
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("Token ttl must be positive");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    Verification verification = JWT.require(algorithm);
    if (issuer != null && !issuer.isBlank()) {
      verification = verification.withIssuer(issuer);
    }
    this.verifier = verification.build();
    this.issuer = issuer;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Issues a signed token.
   *
   * @param subject    creator username
   * @param sessionId  session id, becomes the {@code jti}
   * @param extensions extra application claims; must not use registered claim names
   * @return the compact token
   */
  public String issue(String subject, String sessionId, Map<String, ?> extensions) {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("Token subject must not be blank");
    }
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Token session id must not be blank");
    }
    Instant expiresAt = clock.instant().plus(ttl);

    JWTCreator.Builder builder = JWT.create();
    if (extensions != null && !extensions.isEmpty()) {
      for (String name : extensions.keySet()) {
        if (RESERVED_CLAIMS.contains(name)) {
          throw new IllegalArgumentException("Extension claim shadows a registered claim: " + name);
        }
      }
      builder.withPayload(extensions);
    }
    if (issuer != null && !issuer.isBlank()) {
      builder.withIssuer(issuer);
    }
    String token = builder
        .withSubject(subject)
        .withJWTId(sessionId)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued token jti={} for {}", sessionId, subject);
    return token;
  }

  /**
   * Verifies the signature and expiry of a token and extracts its claims.
   *
   * @param token the compact token
   * @return the verified claims, or the reason the token was rejected
   */
  public DecodeResult verify(String token) {
    if (token == null || token.isBlank()) {
      return DecodeResult.invalid(DecodeResult.Failure.MALFORMED, "empty token");
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String subject = decoded.getSubject();
      String sessionId = decoded.getId();
      Instant expiresAt = decoded.getExpiresAtAsInstant();
      if (isBlank(subject) || isBlank(sessionId) || expiresAt == null) {
        return DecodeResult.invalid(DecodeResult.Failure.MISSING_CLAIMS,
            "token lacks sub, jti or exp");
      }
      return DecodeResult.valid(new TokenClaims(subject, sessionId, expiresAt, extensionsOf(decoded)));
    } catch (TokenExpiredException e) {
      log.debug("Token expired: {}", e.getMessage());
      return DecodeResult.invalid(DecodeResult.Failure.EXPIRED, e.getMessage());
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      log.debug("Token signature rejected: {}", e.getMessage());
      return DecodeResult.invalid(DecodeResult.Failure.BAD_SIGNATURE, e.getMessage());
    } catch (JWTDecodeException e) {
      log.debug("Token could not be decoded: {}", e.getMessage());
      return DecodeResult.invalid(DecodeResult.Failure.MALFORMED, e.getMessage());
    } catch (JWTVerificationException e) {
      log.debug("Token claim rejected: {}", e.getMessage());
      return DecodeResult.invalid(DecodeResult.Failure.INVALID_CLAIM, e.getMessage());
    }
  }

  public Duration ttl() {
    return ttl;
  }

  private static Map<String, Object> extensionsOf(DecodedJWT decoded) {
    Map<String, Object> extensions = new LinkedHashMap<>();
    for (Map.Entry<String, Claim> entry : decoded.getClaims().entrySet()) {
      Claim claim = entry.getValue();
      if (RESERVED_CLAIMS.contains(entry.getKey()) || claim.isNull() || claim.isMissing()) {
        continue;
      }
      extensions.put(entry.getKey(), claim.as(Object.class));
    }
    return extensions;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
