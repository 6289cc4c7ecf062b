package scribe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

public final class EditorSettings {
  private static final Logger log = LoggerFactory.getLogger(EditorSettings.class);

  public static final String RESOURCE = "/scribe.properties";
  public static final String UNDO_COALESCE_MILLIS = "scribe.undo.coalesceMillis";
  public static final String TAB_WIDTH = "scribe.tab.width";

  public static final EditorSettings DEFAULT = new EditorSettings(400, 4);

  public final long undoCoalesceMillis;
  public final int tabWidth;

  public EditorSettings(long undoCoalesceMillis, int tabWidth) {
    if (undoCoalesceMillis < 0) {
      throw new IllegalArgumentException(UNDO_COALESCE_MILLIS + " must not be negative: " + undoCoalesceMillis);
    }
    if (tabWidth < 0) {
      throw new IllegalArgumentException(TAB_WIDTH + " must not be negative: " + tabWidth);
    }
    this.undoCoalesceMillis = undoCoalesceMillis;
    this.tabWidth = tabWidth;
  }

  public EditorSettings withUndoCoalesceMillis(long undoCoalesceMillis) {
    return new EditorSettings(undoCoalesceMillis, this.tabWidth);
  }

  public EditorSettings withTabWidth(int tabWidth) {
    return new EditorSettings(this.undoCoalesceMillis, tabWidth);
  }

  /**
   * Missing keys fall back to {@link #DEFAULT}; malformed numbers throw {@link IllegalArgumentException}.
   */
  public static EditorSettings fromProperties(Properties properties) {
    return new EditorSettings(parse(properties, UNDO_COALESCE_MILLIS, DEFAULT.undoCoalesceMillis),
                              (int)parse(properties, TAB_WIDTH, DEFAULT.tabWidth));
  }

  private static long parse(Properties properties, String key, long fallback) {
    String value = properties.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad value for " + key + ": " + value, e);
    }
  }

  /**
   * Reads {@value #RESOURCE} from the classpath, or returns {@link #DEFAULT} when there is none.
   */
  public static EditorSettings load() {
    try (InputStream in = EditorSettings.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("{} not found, using defaults", RESOURCE);
        return DEFAULT;
      }
      Properties properties = new Properties();
      properties.load(in);
      EditorSettings settings = fromProperties(properties);
      log.debug("loaded {} from {}", settings, RESOURCE);
      return settings;
    }
    catch (IOException e) {
      throw new UncheckedIOException("failed to read " + RESOURCE, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EditorSettings settings = (EditorSettings)o;
    return undoCoalesceMillis == settings.undoCoalesceMillis &&
           tabWidth == settings.tabWidth;
  }

  @Override
  public int hashCode() {
    return Objects.hash(undoCoalesceMillis, tabWidth);
  }

  @Override
  public String toString() {
    return "EditorSettings{" +
           "undoCoalesceMillis=" + undoCoalesceMillis +
           ", tabWidth=" + tabWidth +
           '}';
  }
}
