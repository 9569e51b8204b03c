package com.scholary.captions.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.chunking.TimeRange;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class FfmpegMediaExtractorTest {

  @TempDir Path tempDir;

  private FfmpegMediaExtractor extractor;

  @BeforeEach
  void setUp() {
    MediaProperties properties =
        new MediaProperties(
            "/nonexistent/ffmpeg",
            "/nonexistent/ffprobe",
            16000,
            1,
            10,
            1,
            tempDir.resolve("media").toString());
    extractor = new FfmpegMediaExtractor(properties);
  }

  @Test
  void constructor_shouldCreateTempDirectory() {
    assertThat(tempDir.resolve("media")).isDirectory();
  }

  @Test
  void buildExtractCommand_shouldSeekAndEncodeMonoMp3() {
    Path source = Path.of("/data/episode.mp4");
    Path output = Path.of("/tmp/clip.mp3");

    List<String> command =
        extractor.buildExtractCommand(source, new TimeRange(30.0, 62.5), output);

    assertThat(command)
        .containsExactly(
            "/nonexistent/ffmpeg",
            "-nostdin",
            "-v", "error",
            "-ss", "30.000",
            "-t", "32.500",
            "-i", "/data/episode.mp4",
            "-vn",
            "-ac", "1",
            "-ar", "16000",
            "-f", "mp3",
            "-y",
            "/tmp/clip.mp3");
  }

  @Test
  void buildProbeCommand_shouldAskForFormatDurationOnly() {
    List<String> command = extractor.buildProbeCommand(Path.of("/data/episode.mp4"));

    assertThat(command)
        .startsWith("/nonexistent/ffprobe")
        .contains("format=duration", "default=noprint_wrappers=1:nokey=1")
        .endsWith("/data/episode.mp4");
  }

  @Test
  void parseDuration_shouldReadFfprobeOutput() {
    assertThat(FfmpegMediaExtractor.parseDuration("1234.567000\n")).isEqualTo(1234.567);
  }

  @Test
  void parseDuration_shouldRejectGarbageAndNonPositiveValues() {
    assertThatThrownBy(() -> FfmpegMediaExtractor.parseDuration("N/A"))
        .isInstanceOf(MediaExtractionException.class)
        .hasMessageContaining("N/A");
    assertThatThrownBy(() -> FfmpegMediaExtractor.parseDuration("0.000"))
        .isInstanceOf(MediaExtractionException.class)
        .hasMessageContaining("non-positive");
    assertThatThrownBy(() -> FfmpegMediaExtractor.parseDuration(null))
        .isInstanceOf(MediaExtractionException.class);
  }

  @Test
  void extract_shouldWrapFailureToStartFfmpeg() {
    assertThatThrownBy(
            () -> extractor.extract(tempDir.resolve("missing.mp3"), new TimeRange(0, 5)))
        .isInstanceOf(MediaExtractionException.class)
        .hasMessageContaining("[0.000-5.000]");
  }

  @Test
  void probeDuration_shouldWrapFailureToStartFfprobe() {
    assertThatThrownBy(() -> extractor.probeDuration(tempDir.resolve("missing.mp3")))
        .isInstanceOf(MediaExtractionException.class)
        .hasMessageContaining("ffprobe failed");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void extract_shouldNotStallWhenFfmpegFloodsStderr() throws IOException {
    Path ffmpeg =
        script(
            "ffmpeg",
            "i=0",
            "while [ $i -lt 4096 ]; do",
            "  echo \"frame=$i warning: decoder reported a recoverable error, continuing\" >&2",
            "  i=$((i+1))",
            "done",
            "for last; do :; done",
            "printf 'ID3fake' > \"$last\"");
    FfmpegMediaExtractor scripted = scriptedExtractor(ffmpeg.toString(), "/nonexistent/ffprobe", 0);

    AudioClip clip = scripted.extract(tempDir.resolve("episode.mp4"), new TimeRange(0, 5));

    assertThat(clip.data()).isEqualTo("ID3fake".getBytes(StandardCharsets.UTF_8));
    assertThat(clip.mimeType()).isEqualTo(AudioClip.MP3);
    try (var leftovers = Files.list(tempDir.resolve("scripted"))) {
      assertThat(leftovers).isEmpty();
    }
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void probeDuration_shouldIgnoreWarningsOnStderr() throws IOException {
    Path ffprobe =
        script(
            "ffprobe",
            "echo 'Guessed Channel Layout for Input Stream #0.0 : mono' >&2",
            "echo '12.500000'");
    FfmpegMediaExtractor scripted = scriptedExtractor("/nonexistent/ffmpeg", ffprobe.toString(), 0);

    assertThat(scripted.probeDuration(tempDir.resolve("episode.mp4"))).isEqualTo(12.5);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void extract_shouldReportStderrAndRetryOnFailure() throws IOException {
    Path attempts = tempDir.resolve("attempts.log");
    Path ffmpeg =
        script(
            "ffmpeg",
            "echo attempt >> '" + attempts + "'",
            "echo 'Invalid data found when processing input' >&2",
            "exit 1");
    FfmpegMediaExtractor scripted = scriptedExtractor(ffmpeg.toString(), "/nonexistent/ffprobe", 1);

    assertThatThrownBy(() -> scripted.extract(tempDir.resolve("episode.mp4"), new TimeRange(0, 5)))
        .isInstanceOf(MediaExtractionException.class)
        .hasMessageContaining("exited with code 1")
        .hasMessageContaining("Invalid data found");
    assertThat(Files.readAllLines(attempts)).hasSize(2);
  }

  @Test
  void tail_shouldKeepEndOfLongOutput() {
    String log = "x".repeat(FfmpegMediaExtractor.MAX_ERROR_CHARS) + "final error";

    assertThat(FfmpegMediaExtractor.tail(log))
        .startsWith("...")
        .endsWith("final error")
        .hasSize(FfmpegMediaExtractor.MAX_ERROR_CHARS + 3);
    assertThat(FfmpegMediaExtractor.tail("short")).isEqualTo("short");
  }

  private FfmpegMediaExtractor scriptedExtractor(String ffmpeg, String ffprobe, int maxRetries) {
    return new FfmpegMediaExtractor(
        new MediaProperties(
            ffmpeg, ffprobe, 16000, 1, 5, maxRetries, tempDir.resolve("scripted").toString()));
  }

  private Path script(String name, String... lines) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, "#!/bin/sh\n" + String.join("\n", lines) + "\n");
    assertThat(file.toFile().setExecutable(true)).isTrue();
    return file;
  }
}
