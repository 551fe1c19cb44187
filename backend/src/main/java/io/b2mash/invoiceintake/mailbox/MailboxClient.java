package io.b2mash.invoiceintake.mailbox;

import java.util.List;

/**
 * Capability over the remote mailbox. Domain services inject this interface instead of a vendor
 * client, so the sync and pipeline code never sees Gmail types.
 *
 * <p>Implementations retry transient failures themselves and surface what is left as {@link
 * TransientMailboxException}; other failures are {@link MailboxException}.
 */
public interface MailboxClient {

  /**
   * Fetch one page of the "message added" change log starting at {@code startCursor}.
   *
   * @throws HistoryExpiredException if the mailbox no longer retains history that old
   */
  HistoryPage fetchHistory(HistoryMarker startCursor, String pageToken);

  /** Search for messages matching {@code query}; {@code pageToken} is null for the first page. */
  SearchPage search(String query, String pageToken, int maxResults);

  /** Current labels and attachment parts of a message. */
  MailMessage getMessage(String messageId);

  /** Raw bytes of one attachment. */
  byte[] getAttachment(String messageId, AttachmentRef attachment);

  /** Resolve a label name to its id, creating the label when it does not exist yet. */
  String resolveLabelId(String labelName);

  /** Add {@code labelId} to the message, optionally marking it read in the same call. */
  void applyLabel(String messageId, String labelId, boolean markAsRead);

  /**
   * Create or renew the push subscription for the given labels.
   *
   * @param topic the push transport topic the mailbox publishes to
   * @param labelIds labels scoped by the subscription; empty for the whole mailbox
   * @param labelFilterAction {@code include} or {@code exclude}
   */
  WatchRegistration createOrRenewWatch(
      String topic, List<String> labelIds, String labelFilterAction);
}
