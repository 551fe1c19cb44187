package io.b2mash.invoiceintake.push;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.b2mash.invoiceintake.config.IntakeProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Authenticates push deliveries. Two modes, either of which admits a request:
 *
 * <ul>
 *   <li>shared verification token in the {@code token} query parameter;
 *   <li>Google-signed OIDC bearer token (RS256) carrying the configured audience and, when
 *       configured, the push service account's email.
 * </ul>
 *
 * With neither mode configured every request is rejected.
 */
@Component
public class PushAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(PushAuthenticator.class);

  static final Set<String> GOOGLE_ISSUERS =
      Set.of("accounts.google.com", "https://accounts.google.com");
  private static final Duration JWKS_TTL = Duration.ofHours(1);
  private static final int JWKS_TIMEOUT_MS = 5_000;
  private static final String BEARER_PREFIX = "Bearer ";

  private final String verificationToken;
  private final String audience;
  private final String serviceAccountEmail;
  private final String jwksUri;
  private final Clock clock;
  private final LoadingCache<String, JWKSet> jwksCache;

  @Autowired
  public PushAuthenticator(IntakeProperties properties, Clock clock) {
    this(properties.push(), clock, PushAuthenticator::fetchJwks, Ticker.systemTicker());
  }

  PushAuthenticator(
      IntakeProperties.Push push,
      Clock clock,
      Function<String, JWKSet> jwksLoader,
      Ticker ticker) {
    this.verificationToken = blankToNull(push.verificationToken());
    this.audience = blankToNull(push.audience());
    this.serviceAccountEmail = blankToNull(push.serviceAccountEmail());
    this.jwksUri = push.jwksUri();
    this.clock = clock;
    this.jwksCache =
        Caffeine.newBuilder()
            .expireAfterWrite(JWKS_TTL)
            .maximumSize(4)
            .ticker(ticker)
            .build(jwksLoader::apply);
  }

  /**
   * @param authorization the {@code Authorization} header, may be null
   * @param token the {@code token} query parameter, may be null
   * @throws PushAuthenticationException if neither credential is valid
   */
  public void authenticate(String authorization, String token) {
    if (verificationToken == null && audience == null) {
      throw new PushAuthenticationException("Push authentication is not configured");
    }
    if (verificationToken != null
        && token != null
        && constantTimeEquals(token, verificationToken)) {
      return;
    }
    if (audience != null && authorization != null && authorization.startsWith(BEARER_PREFIX)) {
      verifyOidcToken(authorization.substring(BEARER_PREFIX.length()).strip());
      return;
    }
    throw new PushAuthenticationException("Missing or invalid push credentials");
  }

  private void verifyOidcToken(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      if (!JWSAlgorithm.RS256.equals(signedJwt.getHeader().getAlgorithm())) {
        throw new PushAuthenticationException("Unexpected push token algorithm");
      }

      RSAKey key = signingKey(signedJwt.getHeader().getKeyID());
      if (!signedJwt.verify(new RSASSAVerifier(key))) {
        throw new PushAuthenticationException("Invalid push token signature");
      }

      JWTClaimsSet claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(Instant.now(clock))) {
        throw new PushAuthenticationException("Push token has expired");
      }
      if (!GOOGLE_ISSUERS.contains(claims.getIssuer())) {
        throw new PushAuthenticationException("Unexpected push token issuer");
      }
      if (claims.getAudience() == null || !claims.getAudience().contains(audience)) {
        throw new PushAuthenticationException("Unexpected push token audience");
      }
      if (serviceAccountEmail != null) {
        String email = claims.getStringClaim("email");
        Boolean verified = claims.getBooleanClaim("email_verified");
        if (!serviceAccountEmail.equalsIgnoreCase(email) || Boolean.FALSE.equals(verified)) {
          throw new PushAuthenticationException("Unexpected push token service account");
        }
      }
    } catch (ParseException | JOSEException e) {
      throw new PushAuthenticationException("Invalid push token: " + e.getMessage(), e);
    }
  }

  /** Looks the key up in the cached key set, refreshing once for a key id it does not know yet. */
  private RSAKey signingKey(String keyId) {
    if (keyId == null) {
      throw new PushAuthenticationException("Push token has no key id");
    }
    JWK jwk = loadJwks().getKeyByKeyId(keyId);
    if (jwk == null) {
      jwksCache.invalidate(jwksUri);
      jwk = loadJwks().getKeyByKeyId(keyId);
    }
    if (!(jwk instanceof RSAKey)) {
      throw new PushAuthenticationException("Unknown push token signing key " + keyId);
    }
    return (RSAKey) jwk;
  }

  private JWKSet loadJwks() {
    try {
      return jwksCache.get(jwksUri);
    } catch (UncheckedIOException e) {
      log.error("Failed to load Google signing keys from {}: {}", jwksUri, e.getMessage());
      throw new PushAuthenticationException("Signing keys unavailable", e);
    }
  }

  private static JWKSet fetchJwks(String uri) {
    try {
      return JWKSet.load(URI.create(uri).toURL(), JWKS_TIMEOUT_MS, JWKS_TIMEOUT_MS, 0);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (ParseException e) {
      throw new UncheckedIOException(new IOException("Malformed key set at " + uri, e));
    }
  }

  private static boolean constantTimeEquals(String a, String b) {
    return MessageDigest.isEqual(
        a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
