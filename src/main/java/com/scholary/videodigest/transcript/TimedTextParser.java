package com.scholary.videodigest.transcript;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.util.HtmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Parses the timed-text XML documents served for caption tracks.
 *
 * <p>Track list:
 *
 * <pre>
 * &lt;transcript_list&gt;
 *   &lt;track id="0" name="" lang_code="en" lang_original="English"/&gt;
 * &lt;/transcript_list&gt;
 * </pre>
 *
 * <p>Track:
 *
 * <pre>
 * &lt;transcript&gt;
 *   &lt;text start="0.5" dur="2.1"&gt;Hello &amp;amp;#39;world&lt;/text&gt;
 * &lt;/transcript&gt;
 * </pre>
 *
 * <p>Caption text is HTML-escaped once more inside the XML, so it is unescaped after parsing.
 */
class TimedTextParser {

  /** A caption track offered for a video. */
  record Track(String languageCode, String name) {}

  List<Track> parseTrackList(String xml) throws IOException {
    Document document = XmlDocuments.parse(xml, false);
    NodeList nodes = document.getElementsByTagName("track");
    List<Track> tracks = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      Element track = (Element) nodes.item(i);
      String languageCode = track.getAttribute("lang_code");
      if (!languageCode.isEmpty()) {
        tracks.add(new Track(languageCode, track.getAttribute("name")));
      }
    }
    return tracks;
  }

  List<TranscriptSnippet> parseTrack(String xml) throws IOException {
    Document document = XmlDocuments.parse(xml, false);
    NodeList nodes = document.getElementsByTagName("text");
    List<TranscriptSnippet> snippets = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      Element text = (Element) nodes.item(i);
      String content = HtmlUtils.htmlUnescape(text.getTextContent()).replace('\n', ' ').strip();
      if (content.isEmpty()) {
        continue;
      }
      snippets.add(
          new TranscriptSnippet(
              parseSeconds(text.getAttribute("start")),
              parseSeconds(text.getAttribute("dur")),
              content));
    }
    return snippets;
  }

  private double parseSeconds(String value) throws IOException {
    if (value == null || value.isEmpty()) {
      return 0.0;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IOException("Malformed caption timestamp: " + value, e);
    }
  }
}
