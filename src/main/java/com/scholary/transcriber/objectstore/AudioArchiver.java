package com.scholary.transcriber.objectstore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Uploads source audio to the archive bucket and hands back its URL. */
public class AudioArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioArchiver.class);
  private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;

  public AudioArchiver(ObjectStoreClient objectStoreClient, String bucket) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
  }

  /**
   * Upload a file under its own name.
   *
   * @param file the file to archive
   * @return the archived object's URL
   * @throws ArchiveException if the upload fails
   */
  public String archive(Path file) {
    String key = file.getFileName().toString();
    try (InputStream data = Files.newInputStream(file)) {
      objectStoreClient.putObject(bucket, key, data, Files.size(file), contentTypeOf(file));
      String url = objectStoreClient.objectUrl(bucket, key).toString();
      LOGGER.info("Archived {} to {}", key, url);
      return url;
    } catch (IOException | ObjectStoreException e) {
      throw new ArchiveException(
          String.format("Failed to archive %s to bucket %s: %s", key, bucket, e.getMessage()), e);
    }
  }

  private static String contentTypeOf(Path file) throws IOException {
    String probed = Files.probeContentType(file);
    return probed != null ? probed : DEFAULT_CONTENT_TYPE;
  }
}
