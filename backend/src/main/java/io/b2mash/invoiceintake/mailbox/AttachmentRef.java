package io.b2mash.invoiceintake.mailbox;

import java.util.Locale;

/**
 * An attachment part of a message. Small attachments arrive inline ({@code inlineData}); larger
 * ones must be fetched by {@code attachmentId}.
 */
public record AttachmentRef(String filename, String attachmentId, byte[] inlineData) {

  public boolean isZip() {
    return filename != null && filename.strip().toLowerCase(Locale.ROOT).endsWith(".zip");
  }
}
