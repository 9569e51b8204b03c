package com.scholary.captions.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SegmentTest {

  @Test
  void constructor_shouldTrimTextAndDefaultNullToEmpty() {
    Segment segment =
        new Segment(1.0, 2.0, "  Hello  ", ContentType.SPEECH, SegmentSource.chunk(0));
    Segment blank = new Segment(1.0, 2.0, null, ContentType.SILENCE, SegmentSource.gap(0));

    assertThat(segment.text()).isEqualTo("Hello");
    assertThat(blank.text()).isEmpty();
    assertThat(segment.duration()).isEqualTo(1.0);
  }

  @Test
  void constructor_shouldRejectZeroLengthAndReversedSegments() {
    assertThatThrownBy(
            () -> new Segment(2.0, 2.0, "x", ContentType.SPEECH, SegmentSource.chunk(0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be after start");
    assertThatThrownBy(
            () -> new Segment(3.0, 2.0, "x", ContentType.SPEECH, SegmentSource.chunk(0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(
            () -> new Segment(-0.5, 2.0, "x", ContentType.SPEECH, SegmentSource.chunk(0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cannot be negative");
  }

  @Test
  void withBounds_shouldKeepTextTypeAndSource() {
    Segment segment = new Segment(1.0, 5.0, "Theme", ContentType.MUSIC, SegmentSource.chunk(3));

    Segment moved = segment.withBounds(2.0, 4.0);

    assertThat(moved.start()).isEqualTo(2.0);
    assertThat(moved.end()).isEqualTo(4.0);
    assertThat(moved.text()).isEqualTo("Theme");
    assertThat(moved.contentType()).isEqualTo(ContentType.MUSIC);
    assertThat(moved.source()).isEqualTo(SegmentSource.chunk(3));
  }

  @Test
  void fromLabel_shouldAcceptKnownSpellings() {
    assertThat(ContentType.fromLabel("speech")).contains(ContentType.SPEECH);
    assertThat(ContentType.fromLabel(" Music ")).contains(ContentType.MUSIC);
    assertThat(ContentType.fromLabel("sound_effect")).contains(ContentType.SOUND_EFFECT);
    assertThat(ContentType.fromLabel("SFX")).contains(ContentType.SOUND_EFFECT);
    assertThat(ContentType.fromLabel("silence")).contains(ContentType.SILENCE);
    assertThat(ContentType.fromLabel("laughter")).isEmpty();
    assertThat(ContentType.fromLabel(null)).isEmpty();
  }
}
