package com.scholary.videodigest.transcript;

import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/** Parses XML responses with external entities and DTDs disabled. */
public final class XmlDocuments {

  private XmlDocuments() {}

  /**
   * Parse an XML document.
   *
   * @param xml the document text
   * @param namespaceAware whether element lookups use namespaces
   * @throws IOException if the text is not well-formed XML
   */
  public static Document parse(String xml, boolean namespaceAware) throws IOException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(namespaceAware);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      return builder.parse(new InputSource(new StringReader(xml)));
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Malformed XML response", e);
    }
  }
}
