package io.b2mash.invoiceintake.admin;

import io.b2mash.invoiceintake.exception.AdminAuthenticationException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Shared-secret check for the admin surface. Rejects everything when no token is configured. */
@Component
public class AdminTokenGuard {

  public static final String HEADER = "X-Admin-Token";

  private final byte[] expectedToken;

  public AdminTokenGuard(@Value("${intake.admin.token:}") String adminToken) {
    this.expectedToken =
        adminToken == null || adminToken.isBlank()
            ? null
            : adminToken.getBytes(StandardCharsets.UTF_8);
  }

  public void check(String providedToken) {
    if (expectedToken == null) {
      throw new AdminAuthenticationException("Admin token is not configured");
    }
    if (providedToken == null
        || !MessageDigest.isEqual(expectedToken, providedToken.getBytes(StandardCharsets.UTF_8))) {
      throw new AdminAuthenticationException("Invalid admin token");
    }
  }
}
