package com.scholary.captions.render;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Caption timestamps, rounded to the nearest millisecond. */
public final class TimestampFormatter {

  private static final Pattern TIMESTAMP =
      Pattern.compile("^(?:(\\d+):)?(\\d{2}):(\\d{2})[.,](\\d{3})$");

  private TimestampFormatter() {}

  /**
   * Format seconds as {@code HH:MM:SS<sep>mmm}.
   *
   * <p>Rounding happens once on the total, so 59.9996 becomes {@code 00:01:00,000} and never
   * {@code 00:00:59,1000}.
   */
  public static String format(double seconds, char millisSeparator) {
    long totalMillis = Math.round(Math.max(0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis / 60_000) % 60;
    long secs = (totalMillis / 1000) % 60;
    long millis = totalMillis % 1000;
    return String.format(
        Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }

  /**
   * Parse {@code HH:MM:SS,mmm}, {@code HH:MM:SS.mmm} or the short WebVTT form {@code MM:SS.mmm}.
   *
   * @throws CaptionParseException if the text is not a timestamp
   */
  public static double parse(String text) {
    Matcher matcher = TIMESTAMP.matcher(text.trim());
    if (!matcher.matches()) {
      throw new CaptionParseException("Not a caption timestamp: " + text);
    }
    long hours = matcher.group(1) == null ? 0 : Long.parseLong(matcher.group(1));
    long minutes = Long.parseLong(matcher.group(2));
    long secs = Long.parseLong(matcher.group(3));
    long millis = Long.parseLong(matcher.group(4));
    return (hours * 3_600_000 + minutes * 60_000 + secs * 1000 + millis) / 1000.0;
  }
}
