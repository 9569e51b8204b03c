package com.scholary.captions.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.SegmentSource;
import com.scholary.captions.transcript.ChunkTranscript;
import com.scholary.captions.understanding.TokenUsage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryChunkCacheTest {

  private InMemoryChunkCache cache;

  @BeforeEach
  void setUp() {
    cache = new InMemoryChunkCache(100, 1);
  }

  @Test
  void put_shouldStoreSuccessfulTranscript() {
    ChunkTranscript transcript = succeeded(0, 0, 30);
    String key = ChunkCache.generateKey("media", "a.mp3", new Chunk(0, 0, 30));

    cache.put(key, transcript);

    assertThat(cache.get(key)).contains(transcript);
    assertThat(cache.getStats()).contains("size=1");
  }

  @Test
  void put_shouldIgnoreFailedTranscript() {
    String key = ChunkCache.generateKey("media", "a.mp3", new Chunk(1, 30, 60));

    cache.put(key, ChunkTranscript.failed(1, 30, 60, TokenUsage.ZERO, "UNPARSABLE"));

    assertThat(cache.get(key)).isEmpty();
  }

  @Test
  void generateKey_shouldDependOnChunkWindow() {
    String plain = ChunkCache.generateKey("media", "a.mp3", new Chunk(0, 0, 30));
    String overlapped = ChunkCache.generateKey("media", "a.mp3", new Chunk(0, 0, 32, 30));

    assertThat(plain).isEqualTo("media:a.mp3:chunk-0:0.000-30.000");
    assertThat(overlapped).isNotEqualTo(plain);
  }

  @Test
  void evictFile_shouldDropOnlyThatFilesChunks() {
    String a0 = ChunkCache.generateKey("media", "a.mp3", new Chunk(0, 0, 30));
    String a1 = ChunkCache.generateKey("media", "a.mp3", new Chunk(1, 30, 60));
    String b0 = ChunkCache.generateKey("media", "b.mp3", new Chunk(0, 0, 30));
    cache.put(a0, succeeded(0, 0, 30));
    cache.put(a1, succeeded(1, 30, 60));
    cache.put(b0, succeeded(0, 0, 30));

    cache.evictFile("media", "a.mp3");

    assertThat(cache.get(a0)).isEmpty();
    assertThat(cache.get(a1)).isEmpty();
    assertThat(cache.get(b0)).isPresent();
  }

  private static ChunkTranscript succeeded(int index, double start, double end) {
    Segment segment =
        new Segment(start, end, "chunk " + index, ContentType.SPEECH, SegmentSource.chunk(index));
    return ChunkTranscript.succeeded(index, start, end, List.of(segment), new TokenUsage(10, 2));
  }
}
