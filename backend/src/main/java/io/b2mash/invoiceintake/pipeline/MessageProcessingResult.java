package io.b2mash.invoiceintake.pipeline;

import java.util.List;

public record MessageProcessingResult(
    String messageId,
    ProcessingOutcome outcome,
    int attachments,
    List<String> folderIds,
    String reason) {

  public MessageProcessingResult {
    folderIds = folderIds == null ? List.of() : List.copyOf(folderIds);
  }

  static MessageProcessingResult processed(String messageId, List<String> folderIds) {
    return new MessageProcessingResult(
        messageId, ProcessingOutcome.PROCESSED, folderIds.size(), folderIds, null);
  }

  static MessageProcessingResult skipped(String messageId, String reason) {
    return new MessageProcessingResult(messageId, ProcessingOutcome.SKIPPED, 0, List.of(), reason);
  }

  static MessageProcessingResult failed(String messageId, String reason) {
    return new MessageProcessingResult(messageId, ProcessingOutcome.FAILED, 0, List.of(), reason);
  }
}
