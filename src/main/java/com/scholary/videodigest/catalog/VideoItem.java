package com.scholary.videodigest.catalog;

/**
 * A video listed by a channel feed or playlist.
 *
 * @param id the YouTube video id
 * @param title the video title
 * @param publishedAt publication timestamp as reported by the source (ISO-8601)
 * @param url watch URL
 * @param description the description, if the source provides one
 */
public record VideoItem(
    String id, String title, String publishedAt, String url, String description) {

  public static String watchUrl(String videoId) {
    return "https://www.youtube.com/watch?v=" + videoId;
  }
}
