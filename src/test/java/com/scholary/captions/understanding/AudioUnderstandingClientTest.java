package com.scholary.captions.understanding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.job.CancellationToken;
import com.scholary.captions.media.AudioClip;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AudioUnderstandingClientTest {

  private static final String ENVELOPE =
      "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"[{\\\"text\\\":\"},"
          + "{\"text\":\"\\\"Hi\\\"}]\"}]}}],"
          + "\"usageMetadata\":{\"promptTokenCount\":120,\"candidatesTokenCount\":30}}";

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;
  @Mock private HttpResponse<String> secondResponse;

  private ObjectMapper objectMapper;
  private AudioUnderstandingClient client;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    UnderstandingProperties properties =
        new UnderstandingProperties(
            "http://localhost:9999/", "secret", "test-model", 1, 5, 2, 1, 1);
    client = new AudioUnderstandingClient(httpClient, properties, objectMapper);
  }

  @Test
  void generate_shouldSendAudioInlineAndReturnConcatenatedText() throws Exception {
    respond(response, 200, ENVELOPE);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    AudioClip clip = new AudioClip("mp3-bytes".getBytes(StandardCharsets.UTF_8), AudioClip.MP3);

    UnderstandingResponse result =
        client.generate(UnderstandingRequest.withAudio(clip, "Transcribe", "chunk-0"));

    assertThat(result.text()).isEqualTo("[{\"text\":\"Hi\"}]");
    assertThat(result.usage()).isEqualTo(new TokenUsage(120, 30));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    HttpRequest sent = captor.getValue();
    assertThat(sent.uri().toString())
        .isEqualTo("http://localhost:9999/v1beta/models/test-model:generateContent");
    assertThat(sent.headers().firstValue("x-goog-api-key")).contains("secret");
  }

  @Test
  void generate_shouldRetryServerErrorsThenSucceed() throws Exception {
    respond(response, 503, "busy");
    respond(secondResponse, 200, ENVELOPE);
    doReturn(response, secondResponse).when(httpClient).send(any(HttpRequest.class), any());

    UnderstandingResponse result =
        client.generate(UnderstandingRequest.textOnly("Optimize", "timing-optimization"));

    assertThat(result.usage().totalTokens()).isEqualTo(150);
    verify(httpClient, times(2)).send(any(HttpRequest.class), any());
  }

  @Test
  void generate_shouldRetryConfiguredNumberOfTimesAfterFirstAttempt() throws Exception {
    doThrow(new IOException("connection reset"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.generate(UnderstandingRequest.textOnly("x", "gap-1")))
        .isInstanceOf(UnderstandingException.class)
        .hasMessageContaining("gap-1")
        .hasMessageContaining("after 3 attempts");
    verify(httpClient, times(3)).send(any(HttpRequest.class), any());
  }

  @Test
  void generate_shouldStopRetryingOnceJobIsCancelled() throws Exception {
    CancellationToken token = new CancellationToken();
    respond(response, 503, "busy");
    doAnswer(
            invocation -> {
              token.cancel();
              return response;
            })
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(
            () ->
                client.generate(
                    UnderstandingRequest.textOnly("x", "chunk-5").withCancellation(token)))
        .isInstanceOf(UnderstandingException.class)
        .hasMessageContaining("chunk-5")
        .hasMessageContaining("cancelled");
    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void generate_shouldNotRetryClientErrors() throws Exception {
    respond(response, 400, "bad audio");
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> client.generate(UnderstandingRequest.textOnly("x", "chunk-2")))
        .isInstanceOf(UnderstandingException.class)
        .hasMessageContaining("status 400");
    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void parseEnvelope_shouldTreatMissingCandidatesAsEmptyReply() {
    UnderstandingResponse result =
        client.parseEnvelope("{\"promptFeedback\":{\"blockReason\":\"OTHER\"}}", "chunk-0");

    assertThat(result.text()).isEmpty();
    assertThat(result.usage()).isEqualTo(TokenUsage.ZERO);
  }

  @Test
  void parseEnvelope_shouldRejectMalformedBody() {
    assertThatThrownBy(() -> client.parseEnvelope("<html>oops</html>", "chunk-0"))
        .isInstanceOf(UnderstandingException.class)
        .hasMessageContaining("Malformed");
  }

  @Test
  void generate_shouldPostGenerateContentBody() throws Exception {
    respond(response, 200, ENVELOPE);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    AudioClip clip = new AudioClip(new byte[] {1, 2, 3}, AudioClip.MP3);

    client.generate(UnderstandingRequest.withAudio(clip, "Classify", "gap-0"));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    HttpRequest sent = captor.getValue();
    assertThat(sent.method()).isEqualTo("POST");
    assertThat(sent.headers().firstValue("Content-Type")).contains("application/json");

    JsonNode body = objectMapper.readTree(bodyOf(sent));
    JsonNode content = body.path("contents").get(0);
    assertThat(content.path("role").asText()).isEqualTo("user");
    JsonNode parts = content.path("parts");
    assertThat(parts).hasSize(2);
    assertThat(parts.get(0).path("inline_data").path("mime_type").asText()).isEqualTo("audio/mp3");
    assertThat(parts.get(0).path("inline_data").path("data").asText()).isEqualTo("AQID");
    assertThat(parts.get(1).path("text").asText()).isEqualTo("Classify");
    assertThat(body.path("generationConfig").path("temperature").asDouble()).isEqualTo(0.2);
  }

  @Test
  void generate_shouldOmitInlineDataForTextOnlyRequests() throws Exception {
    respond(response, 200, ENVELOPE);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    client.generate(UnderstandingRequest.textOnly("Optimize", "timing-optimization"));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    JsonNode body = objectMapper.readTree(bodyOf(captor.getValue()));
    JsonNode parts = body.path("contents").get(0).path("parts");
    assertThat(parts).hasSize(1);
    assertThat(parts.get(0).has("inline_data")).isFalse();
    assertThat(parts.get(0).path("text").asText()).isEqualTo("Optimize");
  }

  private static void respond(HttpResponse<String> mock, int status, String body) {
    when(mock.statusCode()).thenReturn(status);
    when(mock.body()).thenReturn(body);
  }

  private static String bodyOf(HttpRequest request) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    CompletableFuture<Void> done = new CompletableFuture<>();
    request
        .bodyPublisher()
        .orElseThrow()
        .subscribe(
            new Flow.Subscriber<ByteBuffer>() {
              @Override
              public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
              }

              @Override
              public void onNext(ByteBuffer item) {
                byte[] bytes = new byte[item.remaining()];
                item.get(bytes);
                out.write(bytes, 0, bytes.length);
              }

              @Override
              public void onError(Throwable throwable) {
                done.completeExceptionally(throwable);
              }

              @Override
              public void onComplete() {
                done.complete(null);
              }
            });
    done.join();
    return out.toString(StandardCharsets.UTF_8);
  }
}
