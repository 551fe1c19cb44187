package io.b2mash.invoiceintake.conversion;

/**
 * Turns invoice XML into the files uploaded for it. Implementations are pure: the same bytes always
 * yield the same files.
 */
public interface InvoiceConverter {

  /**
   * @param xmlBytes a UBL {@code Invoice}, or an {@code AttachedDocument} embedding one
   * @throws MalformedInputException if the document is not a readable invoice
   */
  ConvertedInvoice convert(byte[] xmlBytes);
}
