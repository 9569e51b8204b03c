package com.scholary.captions.render;

import com.scholary.captions.segment.ContentType;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds and removes the content-type markers shown to viewers.
 *
 * <pre>
 * SPEECH        Hello there
 * MUSIC         [♪ Upbeat jazz ♪]          (italic where styling is supported)
 * SOUND_EFFECT  [Sound: door slamming]     (bold where styling is supported)
 * SILENCE       [Tense silence]
 * </pre>
 *
 * <p>Segments store undecorated text. {@link #strip} is applied to service replies, which often
 * come back already decorated, so that {@link #decorate} never doubles a marker.
 */
public final class CaptionDecorator {

  private static final Pattern STYLE_TAGS = Pattern.compile("^<([ib])>(.*)</\\1>$", Pattern.DOTALL);
  private static final Pattern MUSIC_MARKER =
      Pattern.compile("^\\[?\\s*♪+\\s*(.*?)\\s*♪*\\s*]?$", Pattern.DOTALL);
  private static final Pattern SOUND_MARKER =
      Pattern.compile("^\\[\\s*sound\\s*:\\s*(.*?)\\s*]$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern BRACKETED = Pattern.compile("^\\[\\s*(.*?)\\s*]$", Pattern.DOTALL);

  private CaptionDecorator() {}

  /**
   * Decorate caption text for display.
   *
   * @param type content type of the segment
   * @param text undecorated text
   * @param format target format, decides whether inline styling is added
   * @return the text as it should appear in the document
   */
  public static String decorate(ContentType type, String text, CaptionFormat format) {
    String body = text == null || text.isBlank() ? defaultText(type) : text.trim();
    boolean styled = format.supportsStyling();
    if (styled) {
      body = escapeMarkup(body);
    }

    switch (type) {
      case MUSIC:
        String music = "[♪ " + body + " ♪]";
        return styled ? "<i>" + music + "</i>" : music;
      case SOUND_EFFECT:
        String sound = "[Sound: " + body + "]";
        return styled ? "<b>" + sound + "</b>" : sound;
      case SILENCE:
        return "[" + body + "]";
      case SPEECH:
      default:
        return body;
    }
  }

  /**
   * Remove the marker for the given type, if present.
   *
   * @param type the content type the text belongs to
   * @param text possibly decorated text
   * @return the undecorated text
   */
  public static String strip(ContentType type, String text) {
    if (text == null) {
      return "";
    }
    String body = stripStyle(text.trim());

    Matcher matcher;
    switch (type) {
      case MUSIC:
        matcher = body.contains("♪") ? MUSIC_MARKER.matcher(body) : BRACKETED.matcher(body);
        break;
      case SOUND_EFFECT:
        matcher = SOUND_MARKER.matcher(body);
        if (!matcher.matches()) {
          matcher = BRACKETED.matcher(body);
        }
        break;
      case SILENCE:
        matcher = BRACKETED.matcher(body);
        break;
      case SPEECH:
      default:
        return body;
    }
    return matcher.matches() ? matcher.group(1).trim() : body;
  }

  /**
   * Infer the content type from a decorated caption line.
   *
   * <p>Used when reading a caption document back. Speech that is itself entirely bracketed, such as
   * "[unintelligible]", reads back as silence; the JSON export is the lossless format.
   */
  public static ContentType classify(String decorated) {
    String body = stripStyle(decorated == null ? "" : decorated.trim());
    if (body.startsWith("[♪") || body.startsWith("♪")) {
      return ContentType.MUSIC;
    }
    if (SOUND_MARKER.matcher(body).matches()) {
      return ContentType.SOUND_EFFECT;
    }
    if (BRACKETED.matcher(body).matches()) {
      return ContentType.SILENCE;
    }
    return ContentType.SPEECH;
  }

  static String defaultText(ContentType type) {
    switch (type) {
      case MUSIC:
        return "Music";
      case SOUND_EFFECT:
        return "Background sounds";
      case SILENCE:
        return "Silence";
      case SPEECH:
      default:
        return "[unintelligible]";
    }
  }

  static String escapeMarkup(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }

  static String unescapeMarkup(String text) {
    return text.replace("&lt;", "<").replace("&gt;", ">").replace("&amp;", "&");
  }

  private static String stripStyle(String text) {
    Matcher matcher = STYLE_TAGS.matcher(text);
    return matcher.matches() ? matcher.group(2).trim() : text;
  }
}
