package io.b2mash.invoiceintake.conversion;

/**
 * The parts of an invoice archive the pipeline uses: the eligible invoice XML and, when the archive
 * carries one, the first PDF rendition.
 */
public record InvoiceArchive(String xmlName, byte[] xmlBytes, String pdfName, byte[] pdfBytes) {

  public boolean hasPdf() {
    return pdfName != null && pdfBytes != null;
  }
}
