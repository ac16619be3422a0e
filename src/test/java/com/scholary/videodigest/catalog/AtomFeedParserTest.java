package com.scholary.videodigest.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class AtomFeedParserTest {

  static final String FEED =
      "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
          + "<feed xmlns:yt=\"http://www.youtube.com/xml/schemas/2015\""
          + " xmlns:media=\"http://search.yahoo.com/mrss/\""
          + " xmlns=\"http://www.w3.org/2005/Atom\">"
          + "<title>Channel</title>"
          + "<entry>"
          + "<yt:videoId>new111</yt:videoId>"
          + "<title>Newest upload</title>"
          + "<published>2024-06-02T10:00:00+00:00</published>"
          + "<media:group><media:description>Fresh</media:description></media:group>"
          + "</entry>"
          + "<entry>"
          + "<yt:videoId>old000</yt:videoId>"
          + "<title>Older upload</title>"
          + "<published>2024-06-01T10:00:00+00:00</published>"
          + "</entry>"
          + "</feed>";

  private final AtomFeedParser parser = new AtomFeedParser();

  @Test
  void parse_shouldReadEntriesNewestFirst() throws IOException {
    List<VideoItem> items = parser.parse(FEED, 10);

    assertThat(items).extracting(VideoItem::id).containsExactly("new111", "old000");
    VideoItem first = items.get(0);
    assertThat(first.title()).isEqualTo("Newest upload");
    assertThat(first.publishedAt()).isEqualTo("2024-06-02T10:00:00+00:00");
    assertThat(first.url()).isEqualTo("https://www.youtube.com/watch?v=new111");
    assertThat(first.description()).isEqualTo("Fresh");
    assertThat(items.get(1).description()).isNull();
  }

  @Test
  void parse_shouldHonourLimit() throws IOException {
    assertThat(parser.parse(FEED, 1)).extracting(VideoItem::id).containsExactly("new111");
  }

  @Test
  void parse_shouldReturnEmptyListForFeedWithoutEntries() throws IOException {
    String xml = "<feed xmlns=\"http://www.w3.org/2005/Atom\"><title>Empty</title></feed>";

    assertThat(parser.parse(xml, 5)).isEmpty();
  }
}
