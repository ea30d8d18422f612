package dev.harvest.infrastructure.stage.feed;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * <strong>What:</strong> Parses RSS 2.0 and Atom 1.0 documents into {@link FeedEntry} values.
 * <p><strong>Security:</strong> DOCTYPE declarations and external entities are rejected.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; a document builder is created per call.</p>
 *
 * @since 0.1.0
 */
public final class FeedParser {
  private static final String ATOM_NS = "http://www.w3.org/2005/Atom";

  private final DocumentBuilderFactory factory;

  public FeedParser() {
    factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    try {
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    } catch (ParserConfigurationException ex) {
      throw new IllegalStateException("XML parser does not support secure processing", ex);
    }
  }

  /**
   * Parses a feed document.
   *
   * @param feed configured feed name stamped on every entry
   * @param document raw document bytes
   * @return entries in document order
   * @throws FeedParseException when the document is not RSS or Atom
   */
  public List<FeedEntry> parse(String feed, byte[] document) throws FeedParseException {
    Objects.requireNonNull(feed, "feed");
    Objects.requireNonNull(document, "document");
    Document xml;
    try {
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(null);
      xml = builder.parse(new ByteArrayInputStream(document));
    } catch (ParserConfigurationException | SAXException | IOException ex) {
      throw new FeedParseException("feed " + feed + " is not well-formed XML: " + ex.getMessage(), ex);
    }
    Element root = xml.getDocumentElement();
    String rootName = root.getLocalName() == null ? root.getNodeName() : root.getLocalName();
    if ("rss".equals(rootName)) {
      return parseRss(feed, root);
    }
    if ("feed".equals(rootName) && ATOM_NS.equals(root.getNamespaceURI())) {
      return parseAtom(feed, root);
    }
    throw new FeedParseException("feed " + feed + " has unsupported root element <" + rootName + ">");
  }

  private List<FeedEntry> parseRss(String feed, Element root) throws FeedParseException {
    Element channel = firstChild(root, null, "channel");
    if (channel == null) {
      throw new FeedParseException("feed " + feed + " has no <channel>");
    }
    List<FeedEntry> entries = new ArrayList<>();
    for (Element item : children(channel, null, "item")) {
      entries.add(new FeedEntry(
          feed,
          text(item, null, "guid"),
          text(item, null, "title"),
          text(item, null, "link"),
          text(item, null, "pubDate"),
          text(item, null, "description")));
    }
    return entries;
  }

  private List<FeedEntry> parseAtom(String feed, Element root) {
    List<FeedEntry> entries = new ArrayList<>();
    for (Element entry : children(root, ATOM_NS, "entry")) {
      String published = text(entry, ATOM_NS, "published");
      if (published.isEmpty()) {
        published = text(entry, ATOM_NS, "updated");
      }
      String summary = text(entry, ATOM_NS, "summary");
      if (summary.isEmpty()) {
        summary = text(entry, ATOM_NS, "content");
      }
      entries.add(new FeedEntry(
          feed,
          text(entry, ATOM_NS, "id"),
          text(entry, ATOM_NS, "title"),
          atomLink(entry),
          published,
          summary));
    }
    return entries;
  }

  private static String atomLink(Element entry) {
    String fallback = "";
    for (Element link : children(entry, ATOM_NS, "link")) {
      String rel = link.getAttribute("rel");
      String href = link.getAttribute("href");
      if (rel.isEmpty() || "alternate".equals(rel)) {
        return href;
      }
      if (fallback.isEmpty()) {
        fallback = href;
      }
    }
    return fallback;
  }

  private static String text(Element parent, String namespace, String name) {
    Element child = firstChild(parent, namespace, name);
    return child == null ? "" : child.getTextContent().trim();
  }

  private static Element firstChild(Element parent, String namespace, String name) {
    List<Element> matches = children(parent, namespace, name);
    return matches.isEmpty() ? null : matches.get(0);
  }

  private static List<Element> children(Element parent, String namespace, String name) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      String local = node.getLocalName() == null ? node.getNodeName() : node.getLocalName();
      boolean namespaceMatches = namespace == null
          ? node.getNamespaceURI() == null
          : namespace.equals(node.getNamespaceURI());
      if (local.equals(name) && namespaceMatches) {
        result.add((Element) node);
      }
    }
    return result;
  }
}
