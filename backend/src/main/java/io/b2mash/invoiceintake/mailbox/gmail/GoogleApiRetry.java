package io.b2mash.invoiceintake.mailbox.gmail;

import com.google.api.client.http.HttpResponseException;
import io.b2mash.invoiceintake.mailbox.MailboxException;
import io.b2mash.invoiceintake.mailbox.TransientMailboxException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Set;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;

/**
 * Runs Google API calls with bounded exponential backoff. Only transient failures (timeouts, rate
 * limits, 5xx) are retried; anything else fails on the first attempt.
 */
public class GoogleApiRetry {

  private static final Logger log = LoggerFactory.getLogger(GoogleApiRetry.class);

  private static final Set<Integer> TRANSIENT_STATUS = Set.of(408, 429, 500, 502, 503, 504);

  private final RetryTemplate retryTemplate;
  private final int maxAttempts;

  public GoogleApiRetry() {
    this(4, 1_000, 8_000);
  }

  GoogleApiRetry(int maxAttempts, long initialDelayMs, long maxDelayMs) {
    this.maxAttempts = maxAttempts;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(initialDelayMs, 2.0, maxDelayMs)
            .retryOn(TransientMailboxException.class)
            .withListener(new AttemptLogger())
            .build();
  }

  /** A single Google API request. */
  @FunctionalInterface
  public interface GoogleCall<T> {
    T execute() throws IOException;
  }

  public <T> T execute(String operation, GoogleCall<T> call) {
    return retryTemplate.execute(
        context -> {
          context.setAttribute("operation", operation);
          return invoke(operation, call);
        });
  }

  private static <T> T invoke(String operation, GoogleCall<T> call) {
    try {
      return call.execute();
    } catch (IOException e) {
      if (isTransient(e)) {
        throw new TransientMailboxException(operation + " failed: " + e.getMessage(), e);
      }
      throw new MailboxException(operation + " failed: " + e.getMessage(), e);
    }
  }

  /** HTTP status of a failed Google call, or -1 when the failure was not an HTTP response. */
  public static int httpStatus(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof HttpResponseException) {
        return ((HttpResponseException) current).getStatusCode();
      }
      current = current.getCause();
    }
    return -1;
  }

  static boolean isTransient(IOException error) {
    if (error instanceof HttpResponseException) {
      return TRANSIENT_STATUS.contains(((HttpResponseException) error).getStatusCode());
    }
    if (error instanceof SocketTimeoutException
        || error instanceof SSLException
        || error instanceof ConnectException) {
      return true;
    }
    String message = error.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("timed out") || lower.contains("temporarily unavailable");
  }

  private final class AttemptLogger implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      if (throwable instanceof TransientMailboxException) {
        log.warn(
            "Transient Google API error in {} (attempt {}/{}): {}",
            context.getAttribute("operation"),
            context.getRetryCount(),
            maxAttempts,
            throwable.getMessage());
      }
    }
  }
}
