package com.scholary.captions.transcript;

import com.scholary.captions.audit.AuditTrail;
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
import com.scholary.captions.understanding.Classification;
import com.scholary.captions.understanding.ParseResult;
import com.scholary.captions.understanding.ResponseParser;
import com.scholary.captions.understanding.TokenUsage;
import com.scholary.captions.understanding.UnderstandingException;
import com.scholary.captions.understanding.UnderstandingRequest;
import com.scholary.captions.understanding.UnderstandingResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies each gap and splices exactly one segment per gap into the timeline.
 *
 * <p>Gaps are classified in parallel on the given executor. Worker tasks never see the timeline;
 * the calling thread waits for each result in gap order and inserts it through {@link
 * Timeline#insert}. Whenever a gap cannot be classified it becomes a silence segment over the whole
 * gap, so no gap is left unrepresented.
 */
@Component
public class GapFiller {

  private static final Logger LOGGER = LoggerFactory.getLogger(GapFiller.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String SILENCE_TEXT = "Silence";

  private final AudioUnderstandingService understandingService;
  private final MediaExtractor mediaExtractor;
  private final ResponseParser responseParser;

  public GapFiller(
      AudioUnderstandingService understandingService,
      MediaExtractor mediaExtractor,
      ResponseParser responseParser) {
    this.understandingService = understandingService;
    this.mediaExtractor = mediaExtractor;
    this.responseParser = responseParser;
  }

  private record GapOutcome(Gap gap, Segment segment, TokenUsage usage, boolean fallback) {}

  /**
   * Fill every gap.
   *
   * @param timeline the job's timeline, already holding the merged chunk segments
   * @param source the full source media file
   * @param gaps disjoint gaps found in the timeline
   * @param executor runs the classification calls
   * @param cancellation checked before each call
   * @param audit receives gap audio and replies
   * @return counts and token usage
   * @throws com.scholary.captions.job.CaptionJobCancelledException if cancelled before all gaps
   *     were classified
   */
  public GapFillResult fill(
      Timeline timeline,
      Path source,
      List<Gap> gaps,
      Executor executor,
      CancellationToken cancellation,
      AuditTrail audit) {
    if (gaps.isEmpty()) {
      return GapFillResult.none();
    }

    List<CompletableFuture<GapOutcome>> futures = new ArrayList<>(gaps.size());
    for (Gap gap : gaps) {
      futures.add(
          CompletableFuture.supplyAsync(() -> classify(source, gap, cancellation, audit), executor));
    }

    int filled = 0;
    int fallbacks = 0;
    TokenUsage usage = TokenUsage.ZERO;
    for (CompletableFuture<GapOutcome> future : futures) {
      GapOutcome outcome = await(future);
      timeline.insert(outcome.segment());
      usage = usage.plus(outcome.usage());
      if (outcome.fallback()) {
        fallbacks++;
      } else {
        filled++;
      }
      STRUCTURED_LOGGER.logGapFilled(
          outcome.gap().index(),
          outcome.gap().start(),
          outcome.gap().end(),
          outcome.segment().contentType().label(),
          outcome.fallback());
    }

    LOGGER.info(
        "Gap pass complete: gaps={}, classified={}, silenceFallbacks={}",
        gaps.size(),
        filled,
        fallbacks);
    return new GapFillResult(gaps.size(), filled, fallbacks, usage);
  }

  private GapOutcome classify(
      Path source, Gap gap, CancellationToken cancellation, AuditTrail audit) {
    String callSite = "gap-" + gap.index();
    cancellation.throwIfCancelled(callSite);

    AudioClip clip;
    try {
      clip = mediaExtractor.extract(source, gap.range());
    } catch (MediaExtractionException e) {
      LOGGER.warn("Could not extract audio for gap {}: {}", gap.index(), e.getMessage());
      return silence(gap, TokenUsage.ZERO);
    }
    audit.recordAudio(callSite + ".mp3", clip);

    UnderstandingResponse response;
    try {
      response =
          understandingService.generate(
              UnderstandingRequest.withAudio(clip, Prompts.gapClassification(gap), callSite)
                  .withCancellation(cancellation));
    } catch (UnderstandingException e) {
      LOGGER.warn("Could not classify gap {}: {}", gap.index(), e.getMessage());
      return silence(gap, TokenUsage.ZERO);
    }
    audit.recordReply(callSite + ".txt", response.text());

    ParseResult<Classification> parsed = responseParser.parseClassification(response.text());
    if (!parsed.isParsed()) {
      LOGGER.warn(
          "Unusable classification for gap {} ({}): {}",
          gap.index(),
          parsed.status(),
          parsed.detail());
      return silence(gap, response.usage());
    }

    Classification classification = parsed.items().get(0);
    String text = classification.text();
    if (classification.contentType() == ContentType.SPEECH && text.isBlank()) {
      text = ChunkTranscriber.UNINTELLIGIBLE;
    }
    Segment segment =
        new Segment(
            gap.start(),
            gap.end(),
            text,
            classification.contentType(),
            SegmentSource.gap(gap.index()));
    return new GapOutcome(gap, segment, response.usage(), false);
  }

  private static GapOutcome silence(Gap gap, TokenUsage usage) {
    Segment segment =
        new Segment(
            gap.start(), gap.end(), SILENCE_TEXT, ContentType.SILENCE, SegmentSource.gap(gap.index()));
    return new GapOutcome(gap, segment, usage, true);
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }
}
