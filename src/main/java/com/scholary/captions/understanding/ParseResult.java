package com.scholary.captions.understanding;

import java.util.List;

/**
 * Outcome of interpreting a reply from the audio understanding service.
 *
 * <p>Downstream code branches on {@link #status()} instead of assuming the reply has the shape that
 * was asked for.
 *
 * @param status what kind of reply it was
 * @param items the interpreted items, empty unless status is PARSED
 * @param detail short reason for UNPARSABLE or EMPTY, for logs
 */
public record ParseResult<T>(Status status, List<T> items, String detail) {

  public enum Status {
    /** At least one usable item. */
    PARSED,
    /** Text came back but could not be read as the requested structure. */
    UNPARSABLE,
    /** Nothing came back, or an empty structure. */
    EMPTY
  }

  public ParseResult {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static <T> ParseResult<T> parsed(List<T> items) {
    return new ParseResult<>(Status.PARSED, items, null);
  }

  public static <T> ParseResult<T> unparsable(String detail) {
    return new ParseResult<>(Status.UNPARSABLE, List.of(), detail);
  }

  public static <T> ParseResult<T> empty(String detail) {
    return new ParseResult<>(Status.EMPTY, List.of(), detail);
  }

  public boolean isParsed() {
    return status == Status.PARSED;
  }
}
