package com.scholary.captions.media;

import com.scholary.captions.chunking.TimeRange;
import com.scholary.captions.retry.RetryPolicy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Media extraction backed by the ffmpeg and ffprobe command line tools.
 *
 * <p>Each extraction writes a temporary MP3 (mono, fixed sample rate) and reads it back. The tools'
 * stdout and stderr go to separate temp files rather than pipes, so a chatty process never blocks
 * on a full pipe buffer and ffprobe's stdout holds nothing but the duration. Temp files are always
 * deleted.
 */
@Component
public class FfmpegMediaExtractor implements MediaExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaExtractor.class);

  /** Tail of stderr kept for error messages. */
  static final int MAX_ERROR_CHARS = 2000;

  private final MediaProperties properties;
  private final RetryPolicy retryPolicy;
  private final Path tempDir;

  public FfmpegMediaExtractor(MediaProperties properties) {
    this.properties = properties;
    this.retryPolicy =
        new RetryPolicy(
            properties.maxRetries() + 1, Duration.ofMillis(200), Duration.ofSeconds(2));
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new MediaExtractionException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public double probeDuration(Path source) {
    List<String> command = buildProbeCommand(source);
    LOGGER.debug("Probing duration: {}", command);

    try {
      ProcessOutput output = run(command);
      if (output.exitCode() != 0) {
        throw new MediaExtractionException(
            String.format(
                "ffprobe failed with exit code %d: %s", output.exitCode(), output.stderr()));
      }
      if (!output.stderr().isEmpty()) {
        LOGGER.debug("ffprobe stderr: {}", output.stderr());
      }
      double duration = parseDuration(output.stdout());
      LOGGER.info("Probed duration: file={}, duration={}s", source.getFileName(), duration);
      return duration;
    } catch (IOException e) {
      throw new MediaExtractionException("ffprobe failed for " + source, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaExtractionException("ffprobe interrupted", e);
    }
  }

  @Override
  public AudioClip extract(Path source, TimeRange range) {
    String callSite = String.format(Locale.ROOT, "extract-%.2f-%.2f", range.start(), range.end());
    try {
      return retryPolicy.execute(callSite, () -> extractOnce(source, range));
    } catch (IOException e) {
      throw new MediaExtractionException(
          String.format(
              Locale.ROOT,
              "Audio extraction failed for range [%.3f-%.3f]: %s",
              range.start(), range.end(), e.getMessage()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaExtractionException("Audio extraction interrupted", e);
    }
  }

  private AudioClip extractOnce(Path source, TimeRange range)
      throws IOException, InterruptedException {
    Path output = tempDir.resolve(String.format("clip_%s.mp3", UUID.randomUUID()));

    try {
      ProcessOutput result = run(buildExtractCommand(source, range, output));
      if (result.exitCode() != 0) {
        throw new IOException(
            String.format(
                "ffmpeg exited with code %d: %s", result.exitCode(), result.stderr()));
      }

      byte[] data = Files.readAllBytes(output);
      LOGGER.debug(
          "Extracted audio: range=[{}-{}], bytes={}", range.start(), range.end(), data.length);
      return new AudioClip(data, AudioClip.MP3);
    } finally {
      Files.deleteIfExists(output);
    }
  }

  List<String> buildExtractCommand(Path source, TimeRange range, Path output) {
    return List.of(
        properties.ffmpegPath(),
        "-nostdin",
        "-v", "error",
        "-ss", String.format(Locale.ROOT, "%.3f", range.start()),
        "-t", String.format(Locale.ROOT, "%.3f", range.duration()),
        "-i", source.toString(),
        "-vn",
        "-ac", String.valueOf(properties.channels()),
        "-ar", String.valueOf(properties.sampleRate()),
        "-f", "mp3",
        "-y",
        output.toString());
  }

  List<String> buildProbeCommand(Path source) {
    return List.of(
        properties.ffprobePath(),
        "-v", "error",
        "-show_entries", "format=duration",
        "-of", "default=noprint_wrappers=1:nokey=1",
        source.toString());
  }

  static double parseDuration(String output) {
    String trimmed = output == null ? "" : output.trim();
    try {
      double duration = Double.parseDouble(trimmed);
      if (!(duration > 0)) {
        throw new MediaExtractionException("ffprobe reported a non-positive duration: " + trimmed);
      }
      return duration;
    } catch (NumberFormatException e) {
      throw new MediaExtractionException("Failed to parse duration from ffprobe output: " + trimmed, e);
    }
  }

  private ProcessOutput run(List<String> command) throws IOException, InterruptedException {
    String id = UUID.randomUUID().toString();
    Path stdout = tempDir.resolve("proc_" + id + ".out");
    Path stderr = tempDir.resolve("proc_" + id + ".err");

    try {
      Process process =
          new ProcessBuilder(command)
              .redirectOutput(stdout.toFile())
              .redirectError(stderr.toFile())
              .start();
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            String.format(
                "%s timed out after %ds: %s",
                command.get(0), properties.timeoutSeconds(), tail(readText(stderr))));
      }
      return new ProcessOutput(process.exitValue(), readText(stdout), tail(readText(stderr)));
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }

  private static String readText(Path file) throws IOException {
    if (!Files.exists(file)) {
      return "";
    }
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
  }

  static String tail(String text) {
    if (text.length() <= MAX_ERROR_CHARS) {
      return text;
    }
    return "..." + text.substring(text.length() - MAX_ERROR_CHARS);
  }

  private record ProcessOutput(int exitCode, String stdout, String stderr) {}
}
