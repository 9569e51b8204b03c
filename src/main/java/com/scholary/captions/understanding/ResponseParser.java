package com.scholary.captions.understanding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.render.CaptionDecorator;
import com.scholary.captions.segment.ContentType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads structured data out of free-form model replies.
 *
 * <p>Models asked for JSON commonly wrap it in Markdown code fences or a sentence of prose, or stop
 * halfway. We try, in order: the whole text, the first fenced block, and the outermost bracketed
 * region. Whatever cannot be read becomes {@link ParseResult.Status#UNPARSABLE}; nothing here
 * throws.
 */
@Component
public class ResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseParser.class);

  private static final Pattern CODE_FENCE =
      Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);
  private static final Pattern CLOCK_TIME =
      Pattern.compile("^(?:(\\d+):)?(\\d{1,2}):(\\d{1,2}(?:[.,]\\d+)?)$");

  private final ObjectMapper objectMapper;

  public ResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse a reply that should be a JSON array of {@code {text, start, end, type}} objects.
   *
   * <p>Also accepts an object holding such an array under "segments", or a single span object.
   * Individual entries without usable times are skipped; if none survive the reply is
   * UNPARSABLE.
   */
  public ParseResult<SpanReply> parseSpans(String reply) {
    if (reply == null || reply.isBlank()) {
      return ParseResult.empty("blank reply");
    }
    Optional<JsonNode> json = extractJson(reply);
    if (json.isEmpty()) {
      return ParseResult.unparsable("no JSON found in reply");
    }

    JsonNode node = json.get();
    if (node.isObject() && node.has("segments")) {
      node = node.get("segments");
    } else if (node.isObject() && node.has("start")) {
      node = objectMapper.createArrayNode().add(node);
    }
    if (!node.isArray()) {
      return ParseResult.unparsable("expected a JSON array of segments");
    }
    if (node.isEmpty()) {
      return ParseResult.empty("empty segment array");
    }

    List<SpanReply> spans = new ArrayList<>();
    int skipped = 0;
    for (JsonNode entry : node) {
      Optional<SpanReply> span = toSpan(entry);
      if (span.isPresent()) {
        spans.add(span.get());
      } else {
        skipped++;
      }
    }
    if (skipped > 0) {
      LOGGER.warn("Skipped {} of {} reply entries without usable timing", skipped, node.size());
    }
    if (spans.isEmpty()) {
      return ParseResult.unparsable("no entry had usable start/end times");
    }
    return ParseResult.parsed(spans);
  }

  /**
   * Parse a reply that should be a single {@code {type, text}} object.
   *
   * <p>An array is accepted if its first element is such an object. The type must be recognised.
   */
  public ParseResult<Classification> parseClassification(String reply) {
    if (reply == null || reply.isBlank()) {
      return ParseResult.empty("blank reply");
    }
    Optional<JsonNode> json = extractJson(reply);
    if (json.isEmpty()) {
      return ParseResult.unparsable("no JSON found in reply");
    }

    JsonNode node = json.get();
    if (node.isArray()) {
      if (node.isEmpty()) {
        return ParseResult.empty("empty classification array");
      }
      node = node.get(0);
    }
    if (!node.isObject()) {
      return ParseResult.unparsable("expected a JSON object");
    }

    Optional<ContentType> type = ContentType.fromLabel(node.path("type").asText(null));
    if (type.isEmpty()) {
      return ParseResult.unparsable("unrecognised type: " + node.path("type").asText(""));
    }
    String text = CaptionDecorator.strip(type.get(), node.path("text").asText(""));
    return ParseResult.parsed(List.of(new Classification(type.get(), text)));
  }

  /**
   * Find and parse the JSON value in a reply.
   *
   * @return the parsed value, or empty if no candidate parses
   */
  public Optional<JsonNode> extractJson(String reply) {
    if (reply == null) {
      return Optional.empty();
    }
    List<String> candidates = new ArrayList<>();
    candidates.add(reply.trim());

    Matcher fence = CODE_FENCE.matcher(reply);
    if (fence.find()) {
      candidates.add(fence.group(1).trim());
    }
    bracketedRegion(reply).ifPresent(candidates::add);

    for (String candidate : candidates) {
      if (candidate.isEmpty()) {
        continue;
      }
      try {
        JsonNode node = objectMapper.readTree(candidate);
        if (node != null && (node.isArray() || node.isObject())) {
          return Optional.of(node);
        }
      } catch (JsonProcessingException e) {
        LOGGER.trace("Candidate is not JSON: {}", e.getOriginalMessage());
      }
    }
    return Optional.empty();
  }

  private Optional<SpanReply> toSpan(JsonNode entry) {
    if (!entry.isObject()) {
      return Optional.empty();
    }
    Double start = parseTime(entry.get("start"));
    Double end = parseTime(entry.get("end"));
    if (start == null || end == null) {
      return Optional.empty();
    }

    ContentType type = ContentType.fromLabel(entry.path("type").asText(null)).orElse(ContentType.SPEECH);
    String text = CaptionDecorator.strip(type, entry.path("text").asText(""));
    return Optional.of(new SpanReply(start, end, text, type));
  }

  /** Seconds as a number, a numeric string, or a clock string like "01:02.5" / "1:02:03,250". */
  static Double parseTime(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      double value = node.asDouble();
      return Double.isFinite(value) ? value : null;
    }
    if (!node.isTextual()) {
      return null;
    }
    String text = node.asText().trim();
    try {
      double value = Double.parseDouble(text);
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException e) {
      Matcher clock = CLOCK_TIME.matcher(text);
      if (!clock.matches()) {
        return null;
      }
      double hours = clock.group(1) == null ? 0 : Double.parseDouble(clock.group(1));
      double minutes = Double.parseDouble(clock.group(2));
      double seconds = Double.parseDouble(clock.group(3).replace(',', '.'));
      return hours * 3600 + minutes * 60 + seconds;
    }
  }

  private static Optional<String> bracketedRegion(String reply) {
    int arrayStart = reply.indexOf('[');
    int objectStart = reply.indexOf('{');
    int start;
    char close;
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      start = arrayStart;
      close = ']';
    } else if (objectStart >= 0) {
      start = objectStart;
      close = '}';
    } else {
      return Optional.empty();
    }
    int end = reply.lastIndexOf(close);
    return end > start ? Optional.of(reply.substring(start, end + 1)) : Optional.empty();
  }
}
