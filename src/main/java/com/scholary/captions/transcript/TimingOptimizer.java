package com.scholary.captions.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.captions.audit.AuditTrail;
import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.config.CaptionProperties.TimingProperties;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.segment.ContentType;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.SegmentSource;
import com.scholary.captions.segment.Timeline;
import com.scholary.captions.segment.TimelineInvariantException;
import com.scholary.captions.understanding.AudioUnderstandingService;
import com.scholary.captions.understanding.ParseResult;
import com.scholary.captions.understanding.ResponseParser;
import com.scholary.captions.understanding.SpanReply;
import com.scholary.captions.understanding.UnderstandingException;
import com.scholary.captions.understanding.UnderstandingRequest;
import com.scholary.captions.understanding.UnderstandingResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holistic timing pass over the finished timeline.
 *
 * <p>The whole segment list goes to the service in one text-only request. The reply is accepted
 * only if it is a non-empty, sorted, non-overlapping list inside the audio bounds; otherwise the
 * input is returned unchanged. An accepted reply then goes through the {@link ReadabilityPass}.
 */
@Component
public class TimingOptimizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingOptimizer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String CALL_SITE = "timing-optimization";

  private final AudioUnderstandingService understandingService;
  private final ResponseParser responseParser;
  private final ObjectMapper objectMapper;
  private final TimingProperties rules;
  private final ReadabilityPass readabilityPass;

  @Autowired
  public TimingOptimizer(
      AudioUnderstandingService understandingService,
      ResponseParser responseParser,
      ObjectMapper objectMapper,
      CaptionProperties properties) {
    this(understandingService, responseParser, objectMapper, properties.timing());
  }

  public TimingOptimizer(
      AudioUnderstandingService understandingService,
      ResponseParser responseParser,
      ObjectMapper objectMapper,
      TimingProperties rules) {
    this.understandingService = understandingService;
    this.responseParser = responseParser;
    this.objectMapper = objectMapper;
    this.rules = rules;
    this.readabilityPass = new ReadabilityPass(rules);
  }

  /**
   * Optimize caption timing.
   *
   * @param segments sorted, non-overlapping, fully covering segments
   * @param totalDuration length of the source audio
   * @param audit receives the raw reply
   * @return the optimized segments, or the input with the reason it was kept
   */
  public TimingResult optimize(List<Segment> segments, double totalDuration, AuditTrail audit) {
    if (!rules.enabled()) {
      LOGGER.info("Timing optimization disabled, keeping {} segments", segments.size());
      return TimingResult.unchanged(segments, null, "disabled");
    }
    if (segments.isEmpty()) {
      return TimingResult.unchanged(segments, null, "nothing to optimize");
    }

    String prompt;
    try {
      prompt = Prompts.timingOptimization(toJson(segments), rules);
    } catch (JsonProcessingException e) {
      return fallback(segments, null, "could not serialize segments: " + e.getOriginalMessage());
    }

    UnderstandingResponse response;
    try {
      response = understandingService.generate(UnderstandingRequest.textOnly(prompt, CALL_SITE));
    } catch (UnderstandingException e) {
      return fallback(segments, null, "collaborator failed: " + e.getMessage());
    }
    audit.recordReply(CALL_SITE + ".txt", response.text());

    ParseResult<SpanReply> parsed = responseParser.parseSpans(response.text());
    if (!parsed.isParsed()) {
      return fallback(segments, response, parsed.status() + ": " + parsed.detail());
    }

    List<Segment> candidate = new ArrayList<>(parsed.items().size());
    for (SpanReply span : parsed.items()) {
      if (span.start() < 0 || !(span.end() > span.start())) {
        return fallback(
            segments,
            response,
            String.format("invalid span [%.3f-%.3f]", span.start(), span.end()));
      }
      String text = span.text();
      if (span.contentType() == ContentType.SPEECH && text.isBlank()) {
        text = ChunkTranscriber.UNINTELLIGIBLE;
      }
      candidate.add(
          new Segment(
              span.start(), span.end(), text, span.contentType(), SegmentSource.optimizer()));
    }

    try {
      Timeline.validate(candidate, totalDuration);
      List<Segment> readable = readabilityPass.apply(candidate, totalDuration);
      Timeline.validate(readable, totalDuration);
      LOGGER.info(
          "Timing optimization applied: {} segments in, {} segments out",
          segments.size(),
          readable.size());
      return TimingResult.applied(readable, response.usage());
    } catch (TimelineInvariantException e) {
      return fallback(segments, response, "inconsistent timeline: " + e.getMessage());
    }
  }

  private String toJson(List<Segment> segments) throws JsonProcessingException {
    ArrayNode array = objectMapper.createArrayNode();
    for (Segment segment : segments) {
      ObjectNode node = array.addObject();
      node.put("text", segment.text());
      node.put("start", Math.round(segment.start() * 1000) / 1000.0);
      node.put("end", Math.round(segment.end() * 1000) / 1000.0);
      node.put("type", segment.contentType().label());
    }
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
  }

  private TimingResult fallback(
      List<Segment> segments, UnderstandingResponse response, String reason) {
    STRUCTURED_LOGGER.logOptimizerFallback(segments.size(), reason);
    return TimingResult.unchanged(segments, response == null ? null : response.usage(), reason);
  }
}
