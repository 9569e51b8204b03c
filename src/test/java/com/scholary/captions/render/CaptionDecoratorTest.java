package com.scholary.captions.render;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.segment.ContentType;
import org.junit.jupiter.api.Test;

class CaptionDecoratorTest {

  @Test
  void decorate_shouldMarkNonSpeechForSrt() {
    assertThat(CaptionDecorator.decorate(ContentType.SPEECH, "Hello", CaptionFormat.SRT))
        .isEqualTo("Hello");
    assertThat(CaptionDecorator.decorate(ContentType.MUSIC, "Upbeat jazz", CaptionFormat.SRT))
        .isEqualTo("[♪ Upbeat jazz ♪]");
    assertThat(CaptionDecorator.decorate(ContentType.SOUND_EFFECT, "Door", CaptionFormat.SRT))
        .isEqualTo("[Sound: Door]");
    assertThat(CaptionDecorator.decorate(ContentType.SILENCE, "Tense silence", CaptionFormat.SRT))
        .isEqualTo("[Tense silence]");
  }

  @Test
  void decorate_shouldStyleAndEscapeForWebVtt() {
    assertThat(CaptionDecorator.decorate(ContentType.MUSIC, "Jazz", CaptionFormat.VTT))
        .isEqualTo("<i>[♪ Jazz ♪]</i>");
    assertThat(CaptionDecorator.decorate(ContentType.SOUND_EFFECT, "Bang", CaptionFormat.VTT))
        .isEqualTo("<b>[Sound: Bang]</b>");
    assertThat(CaptionDecorator.decorate(ContentType.SPEECH, "a < b & c", CaptionFormat.VTT))
        .isEqualTo("a &lt; b &amp; c");
  }

  @Test
  void decorate_shouldUseDefaultTextForBlankSegments() {
    assertThat(CaptionDecorator.decorate(ContentType.MUSIC, " ", CaptionFormat.SRT))
        .isEqualTo("[♪ Music ♪]");
    assertThat(CaptionDecorator.decorate(ContentType.SILENCE, null, CaptionFormat.SRT))
        .isEqualTo("[Silence]");
  }

  @Test
  void strip_shouldRemoveExistingMarkers() {
    assertThat(CaptionDecorator.strip(ContentType.MUSIC, "[♪ Jazz ♪]")).isEqualTo("Jazz");
    assertThat(CaptionDecorator.strip(ContentType.MUSIC, "♪ Jazz ♪")).isEqualTo("Jazz");
    assertThat(CaptionDecorator.strip(ContentType.MUSIC, "[Jazz]")).isEqualTo("Jazz");
    assertThat(CaptionDecorator.strip(ContentType.SOUND_EFFECT, "<b>[Sound: Bang]</b>"))
        .isEqualTo("Bang");
    assertThat(CaptionDecorator.strip(ContentType.SILENCE, "[Pause]")).isEqualTo("Pause");
    assertThat(CaptionDecorator.strip(ContentType.SPEECH, "[laughs] ok")).isEqualTo("[laughs] ok");
  }

  @Test
  void decorate_shouldNotDoubleMarkersAfterStrip() {
    String text = CaptionDecorator.strip(ContentType.MUSIC, "[♪ Jazz ♪]");

    assertThat(CaptionDecorator.decorate(ContentType.MUSIC, text, CaptionFormat.SRT))
        .isEqualTo("[♪ Jazz ♪]");
  }

  @Test
  void classify_shouldRecognizeEachMarker() {
    assertThat(CaptionDecorator.classify("Hello")).isEqualTo(ContentType.SPEECH);
    assertThat(CaptionDecorator.classify("<i>[♪ Jazz ♪]</i>")).isEqualTo(ContentType.MUSIC);
    assertThat(CaptionDecorator.classify("[Sound: Bang]")).isEqualTo(ContentType.SOUND_EFFECT);
    assertThat(CaptionDecorator.classify("[Silence]")).isEqualTo(ContentType.SILENCE);
  }
}
