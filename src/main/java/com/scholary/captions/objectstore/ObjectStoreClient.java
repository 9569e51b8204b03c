package com.scholary.captions.objectstore;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Object storage operations used by caption jobs.
 *
 * <p>Source media is read from here, finished caption documents and audit records are written
 * here, and results are shared through presigned URLs.
 */
public interface ObjectStoreClient {

  /**
   * Open an object for reading. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /** Store a small object held in memory. */
  default void putBytes(String bucket, String key, byte[] data, String contentType) {
    putObject(bucket, key, new ByteArrayInputStream(data), data.length, contentType);
  }

  /**
   * Generate a presigned GET URL that expires after {@code ttl}.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Read size and content type without downloading.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  record ObjectMetadata(long contentLength, String contentType) {}
}
