package com.scholary.captions.render;

import com.scholary.captions.segment.Segment;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * SubRip output.
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --> 00:00:08,000
 * [♪ Upbeat jazz ♪]
 * </pre>
 */
@Component
public class SrtRenderer implements CaptionRenderer {

  @Override
  public CaptionFormat format() {
    return CaptionFormat.SRT;
  }

  @Override
  public String render(List<Segment> segments) {
    StringBuilder srt = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      srt.append(i + 1).append('\n');
      srt.append(TimestampFormatter.format(segment.start(), CaptionFormat.SRT.millisSeparator()))
          .append(" --> ")
          .append(TimestampFormatter.format(segment.end(), CaptionFormat.SRT.millisSeparator()))
          .append('\n');
      srt.append(CaptionRenderer.cueText(segment, CaptionFormat.SRT)).append('\n');
      srt.append('\n');
    }
    return srt.toString();
  }
}
