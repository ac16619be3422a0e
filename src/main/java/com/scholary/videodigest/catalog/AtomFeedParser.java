package com.scholary.videodigest.catalog;

import com.scholary.videodigest.transcript.XmlDocuments;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** Parses the Atom feed YouTube publishes for each channel. */
class AtomFeedParser {

  static final String ATOM_NS = "http://www.w3.org/2005/Atom";
  static final String YOUTUBE_NS = "http://www.youtube.com/xml/schemas/2015";
  static final String MEDIA_NS = "http://search.yahoo.com/mrss/";

  /**
   * Parse feed entries in document order (newest first).
   *
   * @param limit maximum number of entries
   */
  List<VideoItem> parse(String xml, int limit) throws IOException {
    Document document = XmlDocuments.parse(xml, true);
    NodeList entries = document.getElementsByTagNameNS(ATOM_NS, "entry");

    List<VideoItem> items = new ArrayList<>();
    for (int i = 0; i < entries.getLength() && items.size() < limit; i++) {
      Element entry = (Element) entries.item(i);
      String videoId = childText(entry, YOUTUBE_NS, "videoId");
      if (videoId == null || videoId.isBlank()) {
        continue;
      }
      items.add(
          new VideoItem(
              videoId,
              orEmpty(childText(entry, ATOM_NS, "title")),
              orEmpty(childText(entry, ATOM_NS, "published")),
              VideoItem.watchUrl(videoId),
              childText(entry, MEDIA_NS, "description")));
    }
    return items;
  }

  private String childText(Element parent, String namespace, String localName) {
    NodeList nodes = parent.getElementsByTagNameNS(namespace, localName);
    if (nodes.getLength() == 0) {
      return null;
    }
    Node node = nodes.item(0);
    return node.getTextContent() == null ? null : node.getTextContent().strip();
  }

  private String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
