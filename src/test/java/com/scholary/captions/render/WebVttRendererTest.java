package com.scholary.captions.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.SegmentSource;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebVttRendererTest {

  private WebVttRenderer renderer;

  @BeforeEach
  void setUp() {
    renderer = new WebVttRenderer();
  }

  @Test
  void render_shouldWriteHeaderCueIdsAndDotSeparator() {
    List<Segment> segments =
        List.of(
            new Segment(0.0, 5.2, "Hello world", ContentType.SPEECH, SegmentSource.chunk(0)),
            new Segment(5.2, 8.0, "Upbeat jazz", ContentType.MUSIC, SegmentSource.gap(0)),
            new Segment(8.0, 8.5, "Bang", ContentType.SOUND_EFFECT, SegmentSource.chunk(1)));

    String vtt = renderer.render(segments);

    assertThat(vtt)
        .isEqualTo(
            "WEBVTT\n\n"
                + "cue-1\n00:00:00.000 --> 00:00:05.200\nHello world\n\n"
                + "cue-2\n00:00:05.200 --> 00:00:08.000\n<i>[♪ Upbeat jazz ♪]</i>\n\n"
                + "cue-3\n00:00:08.000 --> 00:00:08.500\n<b>[Sound: Bang]</b>\n\n");
  }

  @Test
  void render_shouldEscapeMarkupInSpeech() {
    Segment segment =
        new Segment(0.0, 1.0, "Tom & Jerry <3", ContentType.SPEECH, SegmentSource.chunk(0));

    assertThat(renderer.render(List.of(segment))).contains("Tom &amp; Jerry &lt;3\n");
  }

  @Test
  void render_shouldBeDeterministic() {
    List<Segment> segments =
        List.of(new Segment(1.0, 2.0, "Same", ContentType.SPEECH, SegmentSource.chunk(0)));

    assertThat(renderer.render(segments)).isEqualTo(renderer.render(segments));
  }

  @Test
  void render_shouldWriteHeaderOnlyForNoSegments() {
    assertThat(renderer.render(List.of())).isEqualTo("WEBVTT\n\n");
  }
}
