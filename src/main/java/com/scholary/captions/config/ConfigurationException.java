package com.scholary.captions.config;

/**
 * Thrown for invalid job parameters such as a non-positive duration or chunk size.
 *
 * <p>This is the only failure that aborts a captioning job outright. It is always raised before any
 * call to the audio understanding service is made.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
