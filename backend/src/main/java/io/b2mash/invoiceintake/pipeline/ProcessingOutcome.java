package io.b2mash.invoiceintake.pipeline;

public enum ProcessingOutcome {
  /** Archives converted, uploaded and the message labeled. */
  PROCESSED,
  /** Already processed, or not an invoice mail. */
  SKIPPED,
  /** Left unlabeled; a later pass retries it. */
  FAILED
}
