package io.b2mash.invoiceintake.pipeline;

import io.b2mash.invoiceintake.config.IntakeProperties;
import io.b2mash.invoiceintake.conversion.ConvertedInvoice;
import io.b2mash.invoiceintake.conversion.FolderNames;
import io.b2mash.invoiceintake.conversion.InvoiceArchive;
import io.b2mash.invoiceintake.conversion.InvoiceArchiveExtractor;
import io.b2mash.invoiceintake.conversion.InvoiceConverter;
import io.b2mash.invoiceintake.mailbox.AttachmentRef;
import io.b2mash.invoiceintake.mailbox.CandidateMessage;
import io.b2mash.invoiceintake.mailbox.MailMessage;
import io.b2mash.invoiceintake.mailbox.MailboxClient;
import io.b2mash.invoiceintake.storage.OutputFile;
import io.b2mash.invoiceintake.storage.RemoteStorage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Takes one candidate message from "matched" to "uploaded and marked processed".
 *
 * <p>The processed check runs before any storage write, and the processed label is applied only
 * after every upload for the message succeeded. Uploads go to folders named after the invoice, so
 * a retry after a partial failure overwrites the same objects instead of duplicating them.
 * Failures never escape: they are reported as {@link ProcessingOutcome#FAILED} and the message
 * stays unlabeled for a later pass.
 */
@Service
public class ProcessingPipeline {

  private static final Logger log = LoggerFactory.getLogger(ProcessingPipeline.class);

  static final String PDF_CONTENT_TYPE = "application/pdf";

  private final MailboxClient mailboxClient;
  private final RemoteStorage remoteStorage;
  private final InvoiceArchiveExtractor archiveExtractor;
  private final InvoiceConverter invoiceConverter;
  private final ProcessedMessageRepository processedMessageRepository;
  private final IntakeProperties.Mailbox mailboxProperties;
  private final String destinationParentId;

  public ProcessingPipeline(
      MailboxClient mailboxClient,
      RemoteStorage remoteStorage,
      InvoiceArchiveExtractor archiveExtractor,
      InvoiceConverter invoiceConverter,
      ProcessedMessageRepository processedMessageRepository,
      IntakeProperties properties) {
    this.mailboxClient = mailboxClient;
    this.remoteStorage = remoteStorage;
    this.archiveExtractor = archiveExtractor;
    this.invoiceConverter = invoiceConverter;
    this.processedMessageRepository = processedMessageRepository;
    this.mailboxProperties = properties.mailbox();
    this.destinationParentId = properties.storage().destinationFolderId();
  }

  public MessageProcessingResult process(CandidateMessage candidate) {
    String messageId = candidate.messageId();
    try {
      return doProcess(messageId);
    } catch (RuntimeException e) {
      log.error("Failed to process message {}: {}", messageId, e.getMessage(), e);
      return MessageProcessingResult.failed(messageId, e.getMessage());
    }
  }

  private MessageProcessingResult doProcess(String messageId) {
    if (processedMessageRepository.existsById(messageId)) {
      log.debug("Message {} already in processed ledger", messageId);
      return MessageProcessingResult.skipped(messageId, "already processed");
    }

    String processedLabelId = mailboxClient.resolveLabelId(mailboxProperties.processedLabelName());
    MailMessage message = mailboxClient.getMessage(messageId);
    if (message.hasLabel(processedLabelId)) {
      log.debug("Message {} already carries the processed label", messageId);
      return MessageProcessingResult.skipped(messageId, "already processed");
    }

    List<AttachmentRef> archives =
        message.attachments().stream().filter(AttachmentRef::isZip).toList();
    if (archives.isEmpty()) {
      log.info("Message {} has no invoice archive (subject: {})", messageId, message.subject());
      mailboxClient.applyLabel(messageId, processedLabelId, mailboxProperties.markAsRead());
      return MessageProcessingResult.skipped(messageId, "no invoice archive");
    }

    var folderIds = new ArrayList<String>();
    var invoiceIds = new ArrayList<String>();
    for (AttachmentRef archiveRef : archives) {
      byte[] zipBytes = mailboxClient.getAttachment(messageId, archiveRef);
      InvoiceArchive archive = archiveExtractor.extract(archiveRef.filename(), zipBytes);
      ConvertedInvoice converted = invoiceConverter.convert(archive.xmlBytes());

      var files = new ArrayList<OutputFile>(converted.files());
      if (archive.hasPdf()) {
        String pdfName = FolderNames.safe(baseName(archive.pdfName()), "invoice.pdf");
        files.add(new OutputFile(pdfName, archive.pdfBytes(), PDF_CONTENT_TYPE));
      }

      String folderName = FolderNames.safe(converted.invoiceId(), stem(archive.xmlName()));
      folderIds.add(remoteStorage.uploadFolder(files, destinationParentId, folderName));
      invoiceIds.add(folderName);
    }

    mailboxClient.applyLabel(messageId, processedLabelId, mailboxProperties.markAsRead());
    processedMessageRepository.save(
        new ProcessedMessage(messageId, String.join(",", folderIds), String.join(",", invoiceIds)));

    log.info("Processed message {}: invoices {}", messageId, invoiceIds);
    return MessageProcessingResult.processed(messageId, folderIds);
  }

  private static String baseName(String entryName) {
    int slash = Math.max(entryName.lastIndexOf('/'), entryName.lastIndexOf('\\'));
    return entryName.substring(slash + 1);
  }

  private static String stem(String entryName) {
    String base = baseName(entryName);
    int dot = base.lastIndexOf('.');
    return dot > 0 ? base.substring(0, dot) : base;
  }
}
