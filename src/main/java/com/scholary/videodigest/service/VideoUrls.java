package com.scholary.videodigest.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Extracts video ids from YouTube URLs.
 *
 * <p>Supported forms:
 *
 * <ul>
 *   <li>{@code https://youtu.be/<id>}
 *   <li>{@code https://www.youtube.com/watch?v=<id>}
 *   <li>{@code https://www.youtube.com/embed/<id>}, {@code /v/<id>}, {@code /live/<id>}, {@code
 *       /shorts/<id>}
 * </ul>
 */
public final class VideoUrls {

  private static final String[] ID_PATH_PREFIXES = {"/embed/", "/v/", "/live/", "/shorts/"};

  private VideoUrls() {}

  /** Extract the video id, or empty if the URL is not a recognized video URL. */
  public static Optional<String> extractVideoId(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }

    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      return Optional.empty();
    }

    String host = uri.getHost() == null ? "" : uri.getHost();
    String path = uri.getPath() == null ? "" : uri.getPath();

    if (host.equals("youtu.be") || host.equals("www.youtu.be")) {
      return nonEmpty(path.length() > 1 ? path.substring(1) : "");
    }

    if (path.equals("/watch")) {
      return queryParameter(uri.getRawQuery(), "v");
    }

    for (String prefix : ID_PATH_PREFIXES) {
      if (path.startsWith(prefix)) {
        String rest = path.substring(prefix.length());
        int slash = rest.indexOf('/');
        return nonEmpty(slash >= 0 ? rest.substring(0, slash) : rest);
      }
    }
    return Optional.empty();
  }

  /**
   * Extract the video id.
   *
   * @throws InvalidVideoUrlException if the URL is not a recognized video URL
   */
  public static String requireVideoId(String url) {
    return extractVideoId(url)
        .orElseThrow(() -> new InvalidVideoUrlException("Not a valid YouTube video URL: " + url));
  }

  private static Optional<String> queryParameter(String rawQuery, String name) {
    if (rawQuery == null) {
      return Optional.empty();
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      String key = eq >= 0 ? pair.substring(0, eq) : pair;
      if (key.equals(name)) {
        String value = eq >= 0 ? pair.substring(eq + 1) : "";
        return nonEmpty(URLDecoder.decode(value, StandardCharsets.UTF_8));
      }
    }
    return Optional.empty();
  }

  private static Optional<String> nonEmpty(String value) {
    return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
  }
}
