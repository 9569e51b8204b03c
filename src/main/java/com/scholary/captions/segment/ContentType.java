package com.scholary.captions.segment;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * What a caption interval contains.
 *
 * <p>The label is the lower-case name used on the wire with the audio understanding service and in
 * the JSON export.
 */
public enum ContentType {
  SPEECH("speech"),
  MUSIC("music"),
  SOUND_EFFECT("sound"),
  SILENCE("silence");

  private final String label;

  ContentType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Resolve a label returned by the service.
   *
   * <p>Accepts the canonical labels plus a few spellings the service is known to produce
   * ("sound_effect", "sfx", "ambient", "noise").
   *
   * @param label the raw label, may be null
   * @return the content type, or empty if the label is not recognised
   */
  public static Optional<ContentType> fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "speech":
      case "dialogue":
        return Optional.of(SPEECH);
      case "music":
        return Optional.of(MUSIC);
      case "sound":
      case "sound_effect":
      case "soundeffect":
      case "sfx":
      case "ambient":
      case "noise":
        return Optional.of(SOUND_EFFECT);
      case "silence":
        return Optional.of(SILENCE);
      default:
        return Optional.empty();
    }
  }
}
