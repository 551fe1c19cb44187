package io.b2mash.invoiceintake.conversion;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the invoice out of a ZIP attachment. The first XML entry that is (or embeds) a UBL invoice
 * wins; the first PDF entry, if any, travels with it. Entries are checked as they are read, and
 * reading stops once both are found. There is no merge policy for archives with several invoices.
 */
@Component
public class InvoiceArchiveExtractor {

  private static final Logger log = LoggerFactory.getLogger(InvoiceArchiveExtractor.class);

  /** Upper bound for a single entry; invoice archives are a few hundred KB. */
  static final int MAX_ENTRY_BYTES = 32 * 1024 * 1024;

  /** Upper bound for everything buffered from one archive. */
  static final long MAX_ARCHIVE_BYTES = 64L * 1024 * 1024;

  private final int maxEntryBytes;
  private final long maxArchiveBytes;

  public InvoiceArchiveExtractor() {
    this(MAX_ENTRY_BYTES, MAX_ARCHIVE_BYTES);
  }

  InvoiceArchiveExtractor(int maxEntryBytes, long maxArchiveBytes) {
    this.maxEntryBytes = maxEntryBytes;
    this.maxArchiveBytes = maxArchiveBytes;
  }

  public InvoiceArchive extract(String archiveName, byte[] zipBytes) {
    Entry invoice = null;
    Entry pdf = null;
    boolean sawXml = false;
    String lastRejection = null;
    long buffered = 0;

    try (var zip = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
      ZipEntry entry;
      while ((invoice == null || pdf == null) && (entry = zip.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        String name = entry.getName();
        String lower = name.toLowerCase(Locale.ROOT);
        boolean xml = lower.endsWith(".xml");
        if (xml) {
          sawXml = true;
        }
        if (!(xml && invoice == null) && !(lower.endsWith(".pdf") && pdf == null)) {
          continue;
        }

        byte[] bytes = readEntry(zip, maxArchiveBytes - buffered);
        if (bytes == null) {
          log.debug("Skipping oversize entry {} in {}", name, archiveName);
          lastRejection = "entry " + name + " exceeds size limit";
          continue;
        }
        buffered += bytes.length;

        if (xml) {
          try {
            UblDocuments.invoiceRoot(bytes);
            invoice = new Entry(name, bytes);
          } catch (MalformedInputException e) {
            log.debug("{} in {} is not an invoice: {}", name, archiveName, e.getMessage());
            lastRejection = e.getMessage();
          }
        } else {
          pdf = new Entry(name, bytes);
        }
      }
    } catch (IOException e) {
      throw new MalformedInputException("Unreadable archive " + archiveName, e);
    }

    if (!sawXml) {
      throw new MalformedInputException("No XML found in archive " + archiveName);
    }
    if (invoice == null) {
      throw new MalformedInputException(
          "No invoice XML in archive " + archiveName + ": " + lastRejection);
    }
    return new InvoiceArchive(
        invoice.name(),
        invoice.bytes(),
        pdf != null ? pdf.name() : null,
        pdf != null ? pdf.bytes() : null);
  }

  /**
   * Reads the current entry, or returns {@code null} when it is larger than the entry limit. Fails
   * the archive when the entry would take the archive past its total limit.
   */
  private byte[] readEntry(ZipInputStream zip, long archiveBudget) throws IOException {
    byte[] bytes = zip.readNBytes(maxEntryBytes + 1);
    if (bytes.length > maxEntryBytes) {
      return null;
    }
    if (bytes.length > archiveBudget) {
      throw new MalformedInputException("Archive exceeds size limit");
    }
    return bytes;
  }

  private record Entry(String name, byte[] bytes) {}
}
