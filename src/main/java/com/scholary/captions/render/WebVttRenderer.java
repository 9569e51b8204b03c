package com.scholary.captions.render;

import com.scholary.captions.segment.Segment;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * WebVTT output with inline styling for music and sound cues.
 *
 * <pre>
 * WEBVTT
 *
 * cue-1
 * 00:00:00.000 --> 00:00:05.200
 * Hello world
 *
 * cue-2
 * 00:00:05.200 --> 00:00:08.000
 * &lt;i&gt;[♪ Upbeat jazz ♪]&lt;/i&gt;
 * </pre>
 */
@Component
public class WebVttRenderer implements CaptionRenderer {

  static final String HEADER = "WEBVTT";

  @Override
  public CaptionFormat format() {
    return CaptionFormat.VTT;
  }

  @Override
  public String render(List<Segment> segments) {
    StringBuilder vtt = new StringBuilder(HEADER).append("\n\n");
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      vtt.append("cue-").append(i + 1).append('\n');
      vtt.append(TimestampFormatter.format(segment.start(), CaptionFormat.VTT.millisSeparator()))
          .append(" --> ")
          .append(TimestampFormatter.format(segment.end(), CaptionFormat.VTT.millisSeparator()))
          .append('\n');
      vtt.append(CaptionRenderer.cueText(segment, CaptionFormat.VTT)).append('\n');
      vtt.append('\n');
    }
    return vtt.toString();
  }
}
