package io.b2mash.invoiceintake.conversion;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * DOM helpers for UBL 2.1 documents. Electronic invoices arrive either as a bare {@code Invoice} or
 * wrapped in an {@code AttachedDocument} whose {@code
 * cac:Attachment/cac:ExternalReference/cbc:Description} carries the invoice XML as text.
 */
final class UblDocuments {

  private static final Logger log = LoggerFactory.getLogger(UblDocuments.class);

  static final String CBC = "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";
  static final String CAC =
      "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";

  private UblDocuments() {}

  /** The {@code Invoice} element of the document, unwrapping an attached document if needed. */
  static Element invoiceRoot(byte[] xmlBytes) {
    Element root = parse(new InputSource(new ByteArrayInputStream(xmlBytes))).getDocumentElement();
    if ("Invoice".equals(root.getLocalName())) {
      return root;
    }
    return embeddedInvoice(root);
  }

  private static Element embeddedInvoice(Element root) {
    NodeList attachments = root.getElementsByTagNameNS(CAC, "Attachment");
    for (int i = 0; i < attachments.getLength(); i++) {
      Element reference = child((Element) attachments.item(i), CAC, "ExternalReference");
      Element description = reference != null ? child(reference, CBC, "Description") : null;
      if (description == null) {
        continue;
      }
      String payload = description.getTextContent();
      if (payload == null || !payload.contains("<Invoice")) {
        continue;
      }
      try {
        Element embedded = parse(new InputSource(new StringReader(payload))).getDocumentElement();
        if ("Invoice".equals(embedded.getLocalName())) {
          return embedded;
        }
      } catch (MalformedInputException e) {
        log.debug("Skipping unreadable embedded document in attachment {}: {}", i, e.getMessage());
      }
    }
    throw new MalformedInputException("No embedded Invoice found in " + root.getLocalName());
  }

  /** Text of the first element at the given child path, stripped; empty when absent. */
  static String text(Element parent, String... path) {
    Element current = parent;
    for (String step : path) {
      String[] parts = step.split(":", 2);
      current = child(current, "cac".equals(parts[0]) ? CAC : CBC, parts[1]);
      if (current == null) {
        return "";
      }
    }
    String value = current.getTextContent();
    return value == null ? "" : value.strip();
  }

  /** First candidate path with a non-empty value. */
  static String firstText(Element parent, String[]... paths) {
    for (String[] path : paths) {
      String value = text(parent, path);
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  static Element child(Element parent, String namespace, String localName) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE
          && localName.equals(node.getLocalName())
          && namespace.equals(node.getNamespaceURI())) {
        return (Element) node;
      }
    }
    return null;
  }

  private static Document parse(InputSource source) {
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      return builder.parse(source);
    } catch (SAXException | IOException e) {
      throw new MalformedInputException("Unreadable XML: " + e.getMessage(), e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser unavailable", e);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    var factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    return factory;
  }
}
