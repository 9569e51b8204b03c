package com.scholary.captions.render;

/** Thrown when a caption document cannot be read. */
public class CaptionParseException extends RuntimeException {

  public CaptionParseException(String message) {
    super(message);
  }
}
