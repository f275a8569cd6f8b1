package playlog;

/**
 * Producer-facing description of a track that started playing.
 *
 * <p>Missing titles and authors are normalised to {@value #UNKNOWN}; a missing or
 * negative duration becomes {@code 0}. The URL may be {@code null} for sources
 * that have no stable address.
 *
 * @param title      track title
 * @param author     track author or artist
 * @param url        track URL, or {@code null}
 * @param durationMs track length in milliseconds
 */
public record TrackInfo(String title, String author, String url, long durationMs) {

  public static final String UNKNOWN = "Unknown";

  public TrackInfo {
    title = blankToUnknown(title);
    author = blankToUnknown(author);
    durationMs = Math.max(0L, durationMs);
  }

  public static TrackInfo of(String title, String author, String url, long durationMs) {
    return new TrackInfo(title, author, url, durationMs);
  }

  private static String blankToUnknown(String value) {
    return value == null || value.isBlank() ? UNKNOWN : value;
  }
}
