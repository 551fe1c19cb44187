package io.b2mash.invoiceintake.conversion;

import io.b2mash.invoiceintake.storage.OutputFile;
import java.util.List;

/** Converter output: the invoice identity (blank when the document carries none) and its files. */
public record ConvertedInvoice(String invoiceId, List<OutputFile> files) {

  public ConvertedInvoice {
    files = List.copyOf(files);
  }
}
