package com.scholary.captions.media;

/**
 * Encoded audio for one extracted range.
 *
 * <p>Held only long enough to be sent to the audio understanding service and, when auditing is on,
 * uploaded next to the job's output.
 */
public record AudioClip(byte[] data, String mimeType) {

  public static final String MP3 = "audio/mp3";

  public int size() {
    return data.length;
  }
}
