package io.b2mash.invoiceintake.mailbox;

import java.util.Set;

/** A mailbox message surfaced by a history delta or a search, before any processing. */
public record CandidateMessage(
    String messageId, String threadId, Set<String> labels, boolean hasAttachment) {

  public CandidateMessage {
    labels = labels == null ? Set.of() : Set.copyOf(labels);
  }

  public static CandidateMessage ofId(String messageId) {
    return new CandidateMessage(messageId, null, Set.of(), false);
  }
}
