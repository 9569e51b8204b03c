package com.scholary.captions.media;

/**
 * Exception thrown when ffmpeg or ffprobe cannot produce what was asked for.
 *
 * <p>During chunk and gap processing this only costs the affected range, which falls back to gap
 * filling or a silence caption.
 */
public class MediaExtractionException extends RuntimeException {

  public MediaExtractionException(String message) {
    super(message);
  }

  public MediaExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
