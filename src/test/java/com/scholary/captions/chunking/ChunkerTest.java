package com.scholary.captions.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.scholary.captions.config.ConfigurationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkerTest {

  private final Chunker chunker = new Chunker();

  @Test
  void planChunks_shouldSplitNinetySecondsIntoThreeChunks() {
    List<Chunk> chunks = chunker.planChunks(90, 30, 0);

    assertThat(chunks).hasSize(3);
    assertThat(chunks)
        .extracting(Chunk::start, Chunk::end)
        .containsExactly(
            tuple(0.0, 30.0),
            tuple(30.0, 60.0),
            tuple(60.0, 90.0));
    assertThat(chunks).extracting(Chunk::index).containsExactly(0, 1, 2);
  }

  @Test
  void planChunks_shouldTruncateFinalChunk() {
    List<Chunk> chunks = chunker.planChunks(75, 30, 0);

    assertThat(chunks).hasSize(3);
    assertThat(chunks.get(2).start()).isEqualTo(60.0);
    assertThat(chunks.get(2).end()).isEqualTo(75.0);
    assertThat(chunks.get(2).duration()).isEqualTo(15.0);
  }

  @Test
  void planChunks_shouldReturnSingleChunkForShortAudio() {
    List<Chunk> chunks = chunker.planChunks(12.5, 30, 0);

    assertThat(chunks).containsExactly(new Chunk(0, 0.0, 12.5));
  }

  @Test
  void planChunks_shouldCoverWholeDurationWithoutGapsOrOverlap() {
    double duration = 1234.567;
    List<Chunk> chunks = chunker.planChunks(duration, 37, 0);

    assertThat(chunks.get(0).start()).isEqualTo(0.0);
    assertThat(chunks.get(chunks.size() - 1).end()).isEqualTo(duration);
    for (int i = 1; i < chunks.size(); i++) {
      assertThat(chunks.get(i).start()).isEqualTo(chunks.get(i - 1).end());
    }
  }

  @Test
  void planChunks_shouldExtendChunksByOverlapButKeepNominalBoundaries() {
    List<Chunk> chunks = chunker.planChunks(90, 30, 2);

    assertThat(chunks).hasSize(3);
    assertThat(chunks.get(0).end()).isEqualTo(32.0);
    assertThat(chunks.get(0).nominalEnd()).isEqualTo(30.0);
    assertThat(chunks.get(0).hasOverlap()).isTrue();
    assertThat(chunks.get(1).start()).isEqualTo(30.0);
    // Last chunk cannot extend past the audio
    assertThat(chunks.get(2).end()).isEqualTo(90.0);
    assertThat(chunks.get(2).hasOverlap()).isFalse();
  }

  @Test
  void planChunks_shouldRejectInvalidInput() {
    assertThatThrownBy(() -> chunker.planChunks(0, 30, 0))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("duration");
    assertThatThrownBy(() -> chunker.planChunks(-5, 30, 0))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> chunker.planChunks(90, 0, 0))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Chunk size");
    assertThatThrownBy(() -> chunker.planChunks(90, 30, -1))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> chunker.planChunks(90, 30, 30))
        .isInstanceOf(ConfigurationException.class);
  }
}
