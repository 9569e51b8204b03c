package com.scholary.captions.transcript;

import com.scholary.captions.audit.AuditTrail;
import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.chunking.TimeRange;
import com.scholary.captions.job.CancellationToken;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.media.AudioClip;
import com.scholary.captions.media.MediaExtractionException;
import com.scholary.captions.media.MediaExtractor;
import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.SegmentSource;
import com.scholary.captions.segment.Timeline;
import com.scholary.captions.understanding.AudioUnderstandingService;
import com.scholary.captions.understanding.ParseResult;
import com.scholary.captions.understanding.ResponseParser;
import com.scholary.captions.understanding.SpanReply;
import com.scholary.captions.understanding.TokenUsage;
import com.scholary.captions.understanding.UnderstandingException;
import com.scholary.captions.understanding.UnderstandingRequest;
import com.scholary.captions.understanding.UnderstandingResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one chunk of audio into segments on the global timeline.
 *
 * <p>The service reports times relative to the chunk. Each span is clamped to the chunk window and
 * then shifted by the chunk start. Nothing here fails the job: extraction errors, service errors
 * and unreadable replies all produce a failed {@link ChunkTranscript} with no segments, and the
 * uncovered span is picked up by the gap pass.
 */
@Component
public class ChunkTranscriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriber.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String UNINTELLIGIBLE = "[unintelligible]";

  private final AudioUnderstandingService understandingService;
  private final MediaExtractor mediaExtractor;
  private final ResponseParser responseParser;

  public ChunkTranscriber(
      AudioUnderstandingService understandingService,
      MediaExtractor mediaExtractor,
      ResponseParser responseParser) {
    this.understandingService = understandingService;
    this.mediaExtractor = mediaExtractor;
    this.responseParser = responseParser;
  }

  /**
   * Transcribe one chunk.
   *
   * @param source the full source media file
   * @param chunk the window to transcribe
   * @param cancellation checked again once the audio is extracted
   * @param audit receives the chunk audio and raw reply
   * @return the chunk's segments in global coordinates, possibly none
   */
  public ChunkTranscript transcribe(
      Path source, Chunk chunk, CancellationToken cancellation, AuditTrail audit) {
    long startTime = System.currentTimeMillis();
    STRUCTURED_LOGGER.logChunkStarted(chunk.index(), chunk.start(), chunk.end());
    String callSite = "chunk-" + chunk.index();

    AudioClip clip;
    try {
      clip = mediaExtractor.extract(source, chunk.range());
    } catch (MediaExtractionException e) {
      return failed(chunk, TokenUsage.ZERO, "extraction failed: " + e.getMessage());
    }
    audit.recordAudio(callSite + ".mp3", clip);
    cancellation.throwIfCancelled(callSite);

    UnderstandingResponse response;
    try {
      response =
          understandingService.generate(
              UnderstandingRequest.withAudio(clip, Prompts.chunkTranscription(chunk), callSite)
                  .withCancellation(cancellation));
    } catch (UnderstandingException e) {
      return failed(chunk, TokenUsage.ZERO, "collaborator failed: " + e.getMessage());
    }
    audit.recordReply(callSite + ".txt", response.text());

    ParseResult<SpanReply> parsed = responseParser.parseSpans(response.text());
    if (!parsed.isParsed()) {
      return failed(chunk, response.usage(), parsed.status() + ": " + parsed.detail());
    }

    List<Segment> segments = toGlobal(chunk, parsed.items());
    if (segments.isEmpty()) {
      return failed(chunk, response.usage(), "no span fell inside the chunk window");
    }

    STRUCTURED_LOGGER.logChunkFinished(
        chunk.index(),
        chunk.start(),
        chunk.end(),
        segments.size(),
        System.currentTimeMillis() - startTime);
    return ChunkTranscript.succeeded(
        chunk.index(), chunk.start(), chunk.end(), segments, response.usage());
  }

  /**
   * Clamp chunk-relative spans to the window and move them onto the global timeline.
   *
   * <p>Spans that lie entirely outside the window collapse to nothing and are dropped. Reversed
   * spans are dropped too. Overlaps inside the chunk are left for the merge step.
   */
  List<Segment> toGlobal(Chunk chunk, List<SpanReply> spans) {
    double window = chunk.duration();
    TimeRange local = new TimeRange(0, window);
    List<Segment> segments = new ArrayList<>();

    for (SpanReply span : spans) {
      if (span.end() < span.start()) {
        LOGGER.warn(
            "Dropping reversed span in chunk {}: [{}-{}]", chunk.index(), span.start(), span.end());
        continue;
      }
      double localStart = local.clamp(span.start());
      double localEnd = local.clamp(span.end());
      if (localEnd - localStart < Timeline.MIN_DURATION) {
        LOGGER.warn(
            "Dropping span outside chunk {} window [0-{}] or under 1ms: [{}-{}]",
            chunk.index(),
            window,
            span.start(),
            span.end());
        continue;
      }
      if (localStart != span.start() || localEnd != span.end()) {
        LOGGER.debug(
            "Clamped span in chunk {} from [{}-{}] to [{}-{}]",
            chunk.index(),
            span.start(),
            span.end(),
            localStart,
            localEnd);
      }

      String text = span.text();
      if (span.contentType() == ContentType.SPEECH && (text == null || text.isBlank())) {
        text = UNINTELLIGIBLE;
      }
      segments.add(
          new Segment(
              chunk.start() + localStart,
              chunk.start() + localEnd,
              text,
              span.contentType(),
              SegmentSource.chunk(chunk.index())));
    }
    return segments;
  }

  private ChunkTranscript failed(Chunk chunk, TokenUsage usage, String reason) {
    STRUCTURED_LOGGER.logChunkFailed(chunk.index(), chunk.start(), chunk.end(), reason);
    return ChunkTranscript.failed(chunk.index(), chunk.start(), chunk.end(), usage, reason);
  }
}
