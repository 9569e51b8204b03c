package com.scholary.captions.understanding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.captions.retry.RetryPolicy;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a multimodal model exposed through the generateContent REST API.
 *
 * <p>Audio travels inline as base64 next to the text prompt:
 *
 * <pre>
 * POST {baseUrl}/v1beta/models/{model}:generateContent
 * {
 *   "contents": [{"role": "user", "parts": [
 *       {"inline_data": {"mime_type": "audio/mp3", "data": "..."}},
 *       {"text": "..."}]}],
 *   "generationConfig": {"temperature": 0.2}
 * }
 * </pre>
 *
 * <p>The reply text is the concatenation of {@code candidates[0].content.parts[*].text}; token
 * counts come from {@code usageMetadata}. Server errors, throttling and I/O failures are retried
 * per the configured {@link RetryPolicy}, up to {@code maxRetries} times after the first attempt
 * and never once the request's job is cancelled. Other client errors fail immediately.
 */
@Component
public class AudioUnderstandingClient implements AudioUnderstandingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioUnderstandingClient.class);

  private final HttpClient httpClient;
  private final UnderstandingProperties properties;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;

  @Autowired
  public AudioUnderstandingClient(UnderstandingProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  AudioUnderstandingClient(
      HttpClient httpClient, UnderstandingProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.retryPolicy =
        new RetryPolicy(
            properties.maxRetries() + 1,
            Duration.ofMillis(properties.initialBackoffMillis()),
            Duration.ofMillis(
                Math.max(properties.initialBackoffMillis(), properties.maxBackoffMillis())));

    LOGGER.info(
        "Initialized audio understanding client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public UnderstandingResponse generate(UnderstandingRequest request) {
    LOGGER.debug(
        "Calling audio understanding service: callSite={}, audioBytes={}",
        request.callSite(),
        request.hasAudio() ? request.audio().size() : 0);

    try {
      return retryPolicy.execute(
          request.callSite(),
          request.cancellation()::isCancelled,
          () -> attemptGenerate(request));
    } catch (IOException e) {
      if (request.cancellation().isCancelled()) {
        throw new UnderstandingException(
            "Audio understanding for " + request.callSite() + " abandoned: job cancelled", e);
      }
      throw new UnderstandingException(
          String.format(
              "Audio understanding failed for %s after %d attempts",
              request.callSite(), retryPolicy.maxAttempts()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UnderstandingException("Audio understanding interrupted: " + request.callSite(), e);
    }
  }

  private UnderstandingResponse attemptGenerate(UnderstandingRequest request)
      throws IOException, InterruptedException {
    String body = objectMapper.writeValueAsString(buildBody(request));

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(endpoint())
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("x-goog-api-key", properties.apiKey());
    }

    HttpResponse<String> response =
        httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status == 429 || status >= 500) {
      throw new IOException(
          String.format("Audio understanding service returned status %d: %s", status, response.body()));
    }
    if (status != 200) {
      throw new UnderstandingException(
          String.format("Audio understanding service rejected request with status %d: %s", status, response.body()));
    }

    return parseEnvelope(response.body(), request.callSite());
  }

  private URI endpoint() {
    String base = properties.baseUrl().replaceAll("/+$", "");
    return URI.create(base + "/v1beta/models/" + properties.model() + ":generateContent");
  }

  private ObjectNode buildBody(UnderstandingRequest request) {
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode content = root.putArray("contents").addObject();
    content.put("role", "user");
    ArrayNode parts = content.putArray("parts");

    if (request.hasAudio()) {
      ObjectNode inlineData = parts.addObject().putObject("inline_data");
      inlineData.put("mime_type", request.audio().mimeType());
      inlineData.put("data", Base64.getEncoder().encodeToString(request.audio().data()));
    }
    parts.addObject().put("text", request.prompt());

    root.putObject("generationConfig").put("temperature", 0.2);
    return root;
  }

  /**
   * Pull reply text and usage out of the response envelope.
   *
   * <p>An envelope without candidates (e.g. a blocked prompt) is an empty reply, not an error.
   */
  UnderstandingResponse parseEnvelope(String body, String callSite) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new UnderstandingException("Malformed response envelope for " + callSite, e);
    }
    if (root == null || !root.isObject()) {
      throw new UnderstandingException("Malformed response envelope for " + callSite);
    }

    StringBuilder text = new StringBuilder();
    JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
    for (JsonNode part : parts) {
      if (part.hasNonNull("text")) {
        text.append(part.get("text").asText());
      }
    }

    JsonNode usageNode = root.path("usageMetadata");
    TokenUsage usage =
        new TokenUsage(
            usageNode.path("promptTokenCount").asLong(0),
            usageNode.path("candidatesTokenCount").asLong(0));

    LOGGER.debug(
        "Audio understanding reply: callSite={}, chars={}, promptTokens={}, completionTokens={}",
        callSite,
        text.length(),
        usage.promptTokens(),
        usage.completionTokens());

    return new UnderstandingResponse(text.toString(), usage);
  }
}
