package com.scholary.captions.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.segment.Segment;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Writes caption output: SRT or WebVTT documents for viewers and a JSON export for machines.
 *
 * <p>The JSON export is lossless and can be read back with {@link #readJson}.
 */
@Component
public class CaptionWriter {

  static final Duration URL_TTL = Duration.ofDays(7);

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;
  private final Map<CaptionFormat, CaptionRenderer> renderers = new EnumMap<>(CaptionFormat.class);

  public CaptionWriter(
      ObjectMapper objectMapper,
      ObjectStoreClient objectStoreClient,
      List<CaptionRenderer> renderers) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
    for (CaptionRenderer renderer : renderers) {
      this.renderers.put(renderer.format(), renderer);
    }
  }

  /** Render segments in the given format. */
  public String render(List<Segment> segments, CaptionFormat format) {
    CaptionRenderer renderer = renderers.get(format);
    if (renderer == null) {
      throw new IllegalStateException("No renderer registered for " + format);
    }
    return renderer.render(segments);
  }

  /**
   * Write the JSON export.
   *
   * <pre>
   * {
   *   "durationSeconds": 90.0,
   *   "partial": false,
   *   "segments": [
   *     {"start": 0.0, "end": 5.2, "text": "Hello world", "contentType": "speech",
   *      "source": {"kind": "CHUNK_TRANSCRIPTION", "id": 0}}
   *   ],
   *   "usage": {...}
   * }
   * </pre>
   */
  public byte[] writeJson(CaptionExport export) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(export);
  }

  public CaptionExport readJson(byte[] json) throws IOException {
    return objectMapper.readValue(json, CaptionExport.class);
  }

  /**
   * Save the caption document and JSON export next to the source file.
   *
   * @param bucket the bucket name
   * @param originalKey the source file key
   * @param document the rendered document
   * @param format its format
   * @param export the JSON export
   * @return storage info with presigned URLs valid for seven days
   */
  public CaptionResponse.StorageInfo saveCaptions(
      String bucket, String originalKey, String document, CaptionFormat format, CaptionExport export)
      throws IOException {

    String baseKey = originalKey.replaceAll("\\.[^./]+$", "");
    String captionKey = baseKey + "_captions." + format.extension();
    String jsonKey = baseKey + "_captions.json";

    objectStoreClient.putBytes(
        bucket,
        captionKey,
        document.getBytes(StandardCharsets.UTF_8),
        format.contentType() + "; charset=utf-8");
    objectStoreClient.putBytes(bucket, jsonKey, writeJson(export), "application/json");

    URL captionUrl = objectStoreClient.presignGet(bucket, captionKey, URL_TTL);
    URL jsonUrl = objectStoreClient.presignGet(bucket, jsonKey, URL_TTL);

    return new CaptionResponse.StorageInfo(
        bucket, captionKey, jsonKey, captionUrl.toString(), jsonUrl.toString());
  }
}
