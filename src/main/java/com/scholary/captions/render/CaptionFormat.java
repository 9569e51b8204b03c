package com.scholary.captions.render;

import com.scholary.captions.config.ConfigurationException;
import java.util.Locale;

/** Supported caption document formats. */
public enum CaptionFormat {
  /** SubRip: numbered blocks, comma before milliseconds, no inline styling. */
  SRT("srt", "application/x-subrip", ',', false),

  /** WebVTT: header, cue identifiers, dot before milliseconds, supports {@code <i>}/{@code <b>}. */
  VTT("vtt", "text/vtt", '.', true);

  private final String extension;
  private final String contentType;
  private final char millisSeparator;
  private final boolean supportsStyling;

  CaptionFormat(String extension, String contentType, char millisSeparator, boolean supportsStyling) {
    this.extension = extension;
    this.contentType = contentType;
    this.millisSeparator = millisSeparator;
    this.supportsStyling = supportsStyling;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  public char millisSeparator() {
    return millisSeparator;
  }

  public boolean supportsStyling() {
    return supportsStyling;
  }

  /**
   * Resolve a user supplied format name such as "srt", "VTT" or "webvtt".
   *
   * @throws ConfigurationException if the name is not a supported format
   */
  public static CaptionFormat fromName(String name) {
    if (name == null) {
      return SRT;
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "srt":
        return SRT;
      case "vtt":
      case "webvtt":
        return VTT;
      default:
        throw new ConfigurationException("Unsupported caption format: " + name);
    }
  }
}
