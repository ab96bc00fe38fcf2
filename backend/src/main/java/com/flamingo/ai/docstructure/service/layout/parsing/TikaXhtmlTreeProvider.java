package com.flamingo.ai.docstructure.service.layout.parsing;

import com.flamingo.ai.docstructure.exception.ParsedTreeException;
import com.flamingo.ai.docstructure.service.layout.model.ParsedNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.html.HtmlMapper;
import org.apache.tika.parser.html.IdentityHtmlMapper;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link ParsedTreeProvider} backed by Apache Tika.
 *
 * <p>Uses Tika's {@link AutoDetectParser} with a {@link ToXMLContentHandler} to produce XHTML, then
 * walks the DOM into {@link ParsedNode}s. HTML input goes through an {@link IdentityHtmlMapper} so
 * {@code class}, {@code data-page} and {@code data-bbox} attributes reach the layout builder
 * unchanged. PDF output carries one {@code <div class="page">} per page, which the builder uses for
 * page numbering.
 */
@Service
@Slf4j
public class TikaXhtmlTreeProvider implements ParsedTreeProvider {

  /** Tag given to text runs that sit between child elements. */
  public static final String TEXT_TAG = "#text";

  private static final Set<String> SUPPORTED_MIME_PREFIXES =
      Set.of(
          "application/pdf",
          "text/html",
          "application/xhtml+xml",
          "application/vnd.openxmlformats",
          "application/vnd.ms-",
          "application/msword",
          "application/vnd.oasis");

  @Override
  public ParsedNode parse(String documentId, InputStream inputStream, String mimeType) {
    try {
      byte[] xhtmlBytes = toXhtml(inputStream, mimeType);
      ParsedNode root = parseXhtml(xhtmlBytes);
      log.debug("Parsed tree for document {} ({}): {} bytes of XHTML", documentId, mimeType,
          xhtmlBytes.length);
      return root;
    } catch (IOException | SAXException | TikaException | ParserConfigurationException e) {
      log.error("Tika parsing failed for document {} mimeType={}: {}", documentId, mimeType,
          e.getMessage());
      throw new ParsedTreeException(documentId, "Failed to parse document: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    if (mimeType == null) {
      return false;
    }
    String normalized = mimeType.toLowerCase(Locale.ROOT);
    return SUPPORTED_MIME_PREFIXES.stream().anyMatch(normalized::startsWith);
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream inputStream, String mimeType)
      throws IOException, SAXException, TikaException {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    ParseContext context = new ParseContext();
    context.set(HtmlMapper.class, IdentityHtmlMapper.INSTANCE);
    tikaParser.parse(inputStream, handler, metadata, context);
    return out.toByteArray();
  }

  private ParsedNode parseXhtml(byte[] xhtmlBytes)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtmlBytes));
    dom.getDocumentElement().normalize();
    return toNode(dom.getDocumentElement());
  }

  private ParsedNode toNode(Element el) {
    String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();

    Map<String, String> attributes = new LinkedHashMap<>();
    NamedNodeMap attrs = el.getAttributes();
    for (int i = 0; i < attrs.getLength(); i++) {
      Attr attr = (Attr) attrs.item(i);
      String name = attr.getLocalName() != null ? attr.getLocalName() : attr.getName();
      if ("xmlns".equals(attr.getPrefix()) || "xmlns".equals(name)) {
        continue;
      }
      attributes.put(name.toLowerCase(Locale.ROOT), attr.getValue());
    }

    List<String> texts = new ArrayList<>();
    List<ParsedNode> children = new ArrayList<>();
    NodeList childNodes = el.getChildNodes();
    for (int i = 0; i < childNodes.getLength(); i++) {
      Node child = childNodes.item(i);
      if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
        String text = child.getTextContent();
        if (text != null && !text.isBlank()) {
          texts.add(text.trim());
          children.add(ParsedNode.of(TEXT_TAG, text.trim()));
        }
      } else if (child.getNodeType() == Node.ELEMENT_NODE) {
        children.add(toNode((Element) child));
      }
    }

    // Pure text nodes keep their text inline; mixed content keeps text runs as ordered children
    if (children.size() == texts.size()) {
      return new ParsedNode(tag, attributes, String.join(" ", texts), List.of());
    }
    return new ParsedNode(tag, attributes, "", children);
  }
}
