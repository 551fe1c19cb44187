package io.b2mash.invoiceintake.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.UserCredentials;
import java.io.IOException;
import java.security.GeneralSecurityException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the Gmail client from an operator-provisioned OAuth refresh token. Token refresh is
 * handled by the Google auth library; the service never runs a consent flow.
 */
@Configuration
@ConditionalOnProperty(
    name = "intake.mailbox.provider",
    havingValue = "gmail",
    matchIfMissing = true)
public class GmailConfig {

  private static final int CONNECT_TIMEOUT_MS = 20_000;
  private static final int READ_TIMEOUT_MS = 60_000;

  @Bean
  Gmail gmail(IntakeProperties properties) throws GeneralSecurityException, IOException {
    var google = properties.google();
    if (google.refreshToken() == null || google.refreshToken().isBlank()) {
      throw new IllegalStateException(
          "Set intake.google.refresh-token, client-id and client-secret to reach the mailbox");
    }

    var credentials =
        UserCredentials.newBuilder()
            .setClientId(google.clientId())
            .setClientSecret(google.clientSecret())
            .setRefreshToken(google.refreshToken())
            .build();
    var credentialsAdapter = new HttpCredentialsAdapter(credentials);
    HttpRequestInitializer initializer =
        request -> {
          credentialsAdapter.initialize(request);
          request.setConnectTimeout(CONNECT_TIMEOUT_MS);
          request.setReadTimeout(READ_TIMEOUT_MS);
        };

    return new Gmail.Builder(
            GoogleNetHttpTransport.newTrustedTransport(),
            GsonFactory.getDefaultInstance(),
            initializer)
        .setApplicationName(google.applicationName())
        .build();
  }
}
