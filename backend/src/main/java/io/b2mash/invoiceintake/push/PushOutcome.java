package io.b2mash.invoiceintake.push;

/** How a push notification was handled. Every outcome is acknowledged with HTTP 200. */
public enum PushOutcome {
  BOOTSTRAP_SYNC,
  HISTORY_INCREMENTAL,
  HISTORY_GAP_FULL_SYNC,
  DUPLICATE,
  IGNORED,
  REJECTED,
  BUSY,
  RETRYABLE_ERROR
}
