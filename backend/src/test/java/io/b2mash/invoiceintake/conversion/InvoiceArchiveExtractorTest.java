package io.b2mash.invoiceintake.conversion;

import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.attachedDocumentXml;
import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.invoiceXml;
import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.utf8;
import static io.b2mash.invoiceintake.testutil.InvoiceFixtures.zip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InvoiceArchiveExtractorTest {

  private final InvoiceArchiveExtractor extractor = new InvoiceArchiveExtractor();

  @Test
  void extract_picksFirstEligibleXmlAndFirstPdf() {
    var entries = new LinkedHashMap<String, byte[]>();
    entries.put("notes.xml", utf8("<?xml version=\"1.0\"?><Notes>nothing here</Notes>"));
    entries.put("docs/first.pdf", utf8("%PDF-1"));
    entries.put("INV-001.xml", utf8(invoiceXml("INV-001")));
    entries.put("INV-002.xml", utf8(invoiceXml("INV-002")));
    entries.put("second.pdf", utf8("%PDF-2"));

    InvoiceArchive archive = extractor.extract("mail.zip", zip(entries));

    assertThat(archive.xmlName()).isEqualTo("INV-001.xml");
    assertThat(archive.pdfName()).isEqualTo("docs/first.pdf");
    assertThat(archive.hasPdf()).isTrue();
  }

  @Test
  void extract_oversizeEntryAfterInvoice_keepsFirstInvoice() {
    var entries = new LinkedHashMap<String, byte[]>();
    entries.put("INV-001.xml", utf8(invoiceXml("INV-001")));
    entries.put("annex.xml", new byte[InvoiceArchiveExtractor.MAX_ENTRY_BYTES + 1]);

    InvoiceArchive archive = extractor.extract("mail.zip", zip(entries));

    assertThat(archive.xmlName()).isEqualTo("INV-001.xml");
    assertThat(archive.hasPdf()).isFalse();
  }

  @Test
  void extract_oversizeEntryBeforeInvoice_isSkipped() {
    var small = new InvoiceArchiveExtractor(4096, 1024 * 1024);
    var entries = new LinkedHashMap<String, byte[]>();
    entries.put("annex.xml", new byte[4097]);
    entries.put("INV-002.xml", utf8(invoiceXml("INV-002")));

    InvoiceArchive archive = small.extract("mail.zip", zip(entries));

    assertThat(archive.xmlName()).isEqualTo("INV-002.xml");
  }

  @Test
  void extract_archiveOverTotalLimit_isMalformed() {
    var small = new InvoiceArchiveExtractor(64 * 1024, 1000);
    var entries = new LinkedHashMap<String, byte[]>();
    entries.put("scan.pdf", new byte[900]);
    entries.put("INV-003.xml", utf8(invoiceXml("INV-003")));

    assertThatThrownBy(() -> small.extract("big.zip", zip(entries)))
        .isInstanceOf(MalformedInputException.class)
        .hasMessageContaining("exceeds size limit");
  }

  @Test
  void extract_acceptsAttachedDocumentWrapper() {
    byte[] archive =
        zip(Map.of("ad.xml", utf8(attachedDocumentXml(invoiceXml("FE-77")))));

    InvoiceArchive extracted = extractor.extract("ad.zip", archive);

    assertThat(extracted.xmlName()).isEqualTo("ad.xml");
    assertThat(extracted.hasPdf()).isFalse();
  }

  @Test
  void extract_noXmlEntries_isMalformed() {
    byte[] archive = zip(Map.of("readme.txt", utf8("hello")));

    assertThatThrownBy(() -> extractor.extract("empty.zip", archive))
        .isInstanceOf(MalformedInputException.class)
        .hasMessageContaining("No XML");
  }

  @Test
  void extract_noEligibleXml_isMalformed() {
    byte[] archive = zip(Map.of("broken.xml", utf8("<Invoice><unclosed>")));

    assertThatThrownBy(() -> extractor.extract("broken.zip", archive))
        .isInstanceOf(MalformedInputException.class)
        .hasMessageContaining("No invoice XML");
  }

  @Test
  void extract_rejectsDoctypeDeclarations() {
    String xxe =
        "<?xml version=\"1.0\"?><!DOCTYPE Invoice [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
            + "<Invoice>&x;</Invoice>";
    byte[] archive = zip(Map.of("evil.xml", utf8(xxe)));

    assertThatThrownBy(() -> extractor.extract("evil.zip", archive))
        .isInstanceOf(MalformedInputException.class);
  }
}
