package com.scholary.captions.render;

import com.scholary.captions.segment.Segment;
import java.util.List;

/**
 * Serializes a finished timeline into one caption format.
 *
 * <p>Implementations are pure: the same segments always give the same document.
 */
public interface CaptionRenderer {

  CaptionFormat format();

  String render(List<Segment> segments);

  /** Decorated cue text with blank lines removed, since a blank line ends a cue. */
  static String cueText(Segment segment, CaptionFormat format) {
    String text = segment.text().replace("\r\n", "\n").replaceAll("\n\\s*\n+", "\n").trim();
    return CaptionDecorator.decorate(segment.contentType(), text, format);
  }
}
