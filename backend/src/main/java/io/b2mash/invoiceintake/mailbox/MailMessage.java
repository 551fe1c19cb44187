package io.b2mash.invoiceintake.mailbox;

import java.util.List;
import java.util.Set;

/** Current view of a message: its label ids and attachment parts. */
public record MailMessage(
    String id,
    String threadId,
    String subject,
    Set<String> labelIds,
    List<AttachmentRef> attachments) {

  public MailMessage {
    labelIds = labelIds == null ? Set.of() : Set.copyOf(labelIds);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  public boolean hasLabel(String labelId) {
    return labelIds.contains(labelId);
  }
}
