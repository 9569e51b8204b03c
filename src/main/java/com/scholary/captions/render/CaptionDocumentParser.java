package com.scholary.captions.render;

import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.SegmentSource;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads SRT and WebVTT documents back into segments.
 *
 * <p>Content types are recovered from the decoration the renderers add. Cue numbers and
 * identifiers, WebVTT NOTE/STYLE blocks and cue settings after the end timestamp are ignored.
 */
@Component
public class CaptionDocumentParser {

  /**
   * Parse a caption document.
   *
   * @param document the document text
   * @param format the format it is written in
   * @return segments in document order
   * @throws CaptionParseException if a cue is malformed or the WebVTT header is missing
   */
  public List<Segment> parse(String document, CaptionFormat format) {
    String normalized = document.replace("\r\n", "\n").replace("\r", "\n");
    if (normalized.startsWith("\uFEFF")) {
      normalized = normalized.substring(1);
    }
    String[] blocks = normalized.split("\n\\s*\n");

    int first = 0;
    if (format == CaptionFormat.VTT) {
      if (blocks.length == 0 || !blocks[0].startsWith(WebVttRenderer.HEADER)) {
        throw new CaptionParseException("WebVTT document must start with " + WebVttRenderer.HEADER);
      }
      first = 1;
    }

    List<Segment> segments = new ArrayList<>();
    for (int b = first; b < blocks.length; b++) {
      String block = blocks[b].strip();
      if (block.isEmpty() || block.startsWith("NOTE") || block.startsWith("STYLE")) {
        continue;
      }
      segments.add(parseCue(block, format, segments.size() + 1));
    }
    return segments;
  }

  private static Segment parseCue(String block, CaptionFormat format, int cueNumber) {
    String[] lines = block.split("\n");
    int timing = -1;
    for (int i = 0; i < lines.length && i < 2; i++) {
      if (lines[i].contains("-->")) {
        timing = i;
        break;
      }
    }
    if (timing < 0) {
      throw new CaptionParseException("Cue " + cueNumber + " has no timing line");
    }

    String[] times = lines[timing].split("-->");
    double start = TimestampFormatter.parse(times[0]);
    String endToken = times[1].trim().split("\\s+")[0];
    double end = TimestampFormatter.parse(endToken);
    if (!(end > start)) {
      throw new CaptionParseException(
          String.format("Cue %d ends before it starts: %s", cueNumber, lines[timing]));
    }

    StringBuilder decorated = new StringBuilder();
    for (int i = timing + 1; i < lines.length; i++) {
      if (decorated.length() > 0) {
        decorated.append('\n');
      }
      decorated.append(lines[i]);
    }

    ContentType type = CaptionDecorator.classify(decorated.toString());
    String text = CaptionDecorator.strip(type, decorated.toString());
    if (format.supportsStyling()) {
      text = CaptionDecorator.unescapeMarkup(text);
    }
    return new Segment(start, end, text, type, SegmentSource.imported(cueNumber));
  }
}
