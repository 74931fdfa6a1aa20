package com.scholary.transcriber.objectstore;

import java.io.InputStream;
import java.net.URL;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the archive stage from a specific backend (S3, MinIO, ...) and makes it easy to
 * mock in tests.
 */
public interface ObjectStoreClient {

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * The public URL of an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object's URL
   * @throws ObjectStoreException if the URL cannot be built
   */
  URL objectUrl(String bucket, String key);
}
