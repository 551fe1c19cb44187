package io.b2mash.invoiceintake.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bound from the {@code intake.*} namespace. Every group has defaults so a bare {@code
 * application.yml} starts; secrets (admin token, Google credentials) have none.
 */
@ConfigurationProperties("intake")
public record IntakeProperties(
    @DefaultValue Mailbox mailbox,
    @DefaultValue Watch watch,
    @DefaultValue Sync sync,
    @DefaultValue Storage storage,
    @DefaultValue Admin admin,
    @DefaultValue Push push,
    @DefaultValue Google google,
    @DefaultValue Scheduling scheduling) {

  public record Mailbox(
      @DefaultValue("gmail") String provider,
      @DefaultValue("me") String user,
      String address,
      @DefaultValue("has:attachment filename:zip in:inbox") String query,
      @DefaultValue("invoice-intake-processed") String processedLabelName,
      @DefaultValue("true") boolean markAsRead) {

    /**
     * Search query for mail that still needs processing. Gmail search spells spaces and slashes in
     * label names as dashes.
     */
    public String unprocessedQuery() {
      return "(" + query + ") -label:" + searchableLabel(processedLabelName);
    }

    static String searchableLabel(String labelName) {
      return labelName.strip().replaceAll("[\\s/]+", "-");
    }
  }

  public record Watch(
      String topic,
      @DefaultValue("INBOX") List<String> labelIds,
      @DefaultValue("include") String labelFilterAction,
      @DefaultValue("true") boolean registerOnStartup,
      @DefaultValue("PT24H") Duration renewBefore,
      @DefaultValue("0 0 */6 * * *") String renewalCron,
      @DefaultValue("true") boolean syncAfterStart) {

    public Watch {
      labelIds = labelIds == null ? List.of() : List.copyOf(labelIds);
    }
  }

  public record Sync(
      @DefaultValue("20") int maxCycles,
      @DefaultValue("20") int maxMessagesPerCycle,
      @DefaultValue("PT10M") Duration pollInterval,
      @DefaultValue("PT10S") Duration lockWait) {

    public Sync {
      if (maxCycles < 1) {
        throw new IllegalArgumentException("intake.sync.max-cycles must be >= 1");
      }
      if (maxMessagesPerCycle < 1) {
        throw new IllegalArgumentException("intake.sync.max-messages-per-cycle must be >= 1");
      }
    }
  }

  public record Storage(
      @DefaultValue("s3") String provider, @DefaultValue("invoices") String destinationFolderId) {}

  public record Admin(String token) {}

  public record Push(
      String verificationToken,
      String audience,
      String serviceAccountEmail,
      @DefaultValue("https://www.googleapis.com/oauth2/v3/certs") String jwksUri) {}

  public record Google(
      String clientId,
      String clientSecret,
      String refreshToken,
      @DefaultValue("invoice-intake") String applicationName) {}

  public record Scheduling(@DefaultValue("false") boolean enabled) {}
}
