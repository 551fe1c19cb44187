package io.b2mash.invoiceintake.pipeline;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

/** Ledger row written once a message's uploads succeeded and its processed label was applied. */
@Entity
@Table(name = "processed_message")
public class ProcessedMessage {

  @Id
  @Column(name = "message_id", nullable = false, length = 64)
  private String messageId;

  @Column(name = "destination_folder_id", columnDefinition = "TEXT")
  private String destinationFolderId;

  @Column(name = "invoice_ids", columnDefinition = "TEXT")
  private String invoiceIds;

  @Column(name = "processed_at", nullable = false, updatable = false)
  private Instant processedAt;

  protected ProcessedMessage() {}

  public ProcessedMessage(String messageId, String destinationFolderId, String invoiceIds) {
    this.messageId = messageId;
    this.destinationFolderId = destinationFolderId;
    this.invoiceIds = invoiceIds;
  }

  @PrePersist
  void onPrePersist() {
    this.processedAt = Instant.now();
  }

  public String getMessageId() {
    return messageId;
  }

  public String getDestinationFolderId() {
    return destinationFolderId;
  }

  public String getInvoiceIds() {
    return invoiceIds;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }
}
