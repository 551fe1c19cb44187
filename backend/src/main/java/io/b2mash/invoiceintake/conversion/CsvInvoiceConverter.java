package io.b2mash.invoiceintake.conversion;

import io.b2mash.invoiceintake.storage.OutputFile;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Baseline converter: one CSV sheet listing the invoice lines with a short metadata header. No
 * pricing rules are applied; the columns carry the amounts as written in the invoice.
 */
@Component
public class CsvInvoiceConverter implements InvoiceConverter {

  static final String CONTENT_TYPE = "text/csv";

  private static final List<String> COLUMNS =
      List.of("Line", "Description", "Quantity", "Line Amount", "Tax %");

  @Override
  public ConvertedInvoice convert(byte[] xmlBytes) {
    Element invoice = UblDocuments.invoiceRoot(xmlBytes);
    String invoiceId = UblDocuments.text(invoice, "cbc:ID");

    var rows = new ArrayList<List<String>>();
    NodeList lines = invoice.getElementsByTagNameNS(UblDocuments.CAC, "InvoiceLine");
    for (int i = 0; i < lines.getLength(); i++) {
      rows.add(toRow((Element) lines.item(i)));
    }
    if (rows.isEmpty()) {
      throw new MalformedInputException("Invoice " + invoiceId + " has no lines");
    }

    var csv = new StringBuilder();
    csv.append("# Invoice ").append(invoiceId).append('\n');
    csv.append("# Supplier: ").append(supplierName(invoice)).append('\n');
    csv.append("# Customer: ").append(customerName(invoice)).append('\n');
    csv.append("# Issue date: ").append(UblDocuments.text(invoice, "cbc:IssueDate")).append('\n');
    csv.append("# Currency: ")
        .append(UblDocuments.text(invoice, "cbc:DocumentCurrencyCode"))
        .append('\n');
    csv.append(joinRow(COLUMNS)).append('\n');
    for (List<String> row : rows) {
      csv.append(joinRow(row)).append('\n');
    }

    String fileName = FolderNames.safe(invoiceId, null) + ".csv";
    var file =
        new OutputFile(fileName, csv.toString().getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);
    return new ConvertedInvoice(invoiceId, List.of(file));
  }

  private static List<String> toRow(Element line) {
    String taxPercent = "";
    NodeList percents = line.getElementsByTagNameNS(UblDocuments.CBC, "Percent");
    if (percents.getLength() > 0) {
      taxPercent = percents.item(0).getTextContent().strip();
    }
    return List.of(
        UblDocuments.text(line, "cbc:ID"),
        UblDocuments.text(line, "cac:Item", "cbc:Description"),
        UblDocuments.text(line, "cbc:InvoicedQuantity"),
        UblDocuments.text(line, "cbc:LineExtensionAmount"),
        taxPercent);
  }

  private static String supplierName(Element invoice) {
    return UblDocuments.firstText(
        invoice,
        new String[] {
          "cac:AccountingSupplierParty", "cac:Party", "cac:PartyTaxScheme", "cbc:RegistrationName"
        },
        new String[] {
          "cac:AccountingSupplierParty", "cac:Party", "cac:PartyLegalEntity", "cbc:RegistrationName"
        },
        new String[] {"cac:AccountingSupplierParty", "cac:Party", "cac:PartyName", "cbc:Name"});
  }

  private static String customerName(Element invoice) {
    return UblDocuments.firstText(
        invoice,
        new String[] {
          "cac:AccountingCustomerParty", "cac:Party", "cac:PartyTaxScheme", "cbc:RegistrationName"
        },
        new String[] {"cac:AccountingCustomerParty", "cac:Party", "cac:PartyName", "cbc:Name"});
  }

  private static String joinRow(List<String> values) {
    return values.stream().map(CsvInvoiceConverter::escapeCsv).collect(Collectors.joining(","));
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    // Defuse CSV formula injection (OWASP recommendation)
    if (!value.isEmpty() && "=+-@\t\r".indexOf(value.charAt(0)) >= 0) {
      value = "'" + value;
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
