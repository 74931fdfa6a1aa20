package com.scholary.transcriber.download;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads audio over HTTP(S).
 *
 * <p>The body is streamed straight to disk. The local name is the last path segment of the URL
 * without its query string, plus a nanosecond timestamp so two downloads of the same URL never
 * collide.
 */
public class HttpAudioDownloader implements AudioDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpAudioDownloader.class);

  private final HttpClient httpClient;
  private final DownloaderProperties properties;

  public HttpAudioDownloader(DownloaderProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  @Override
  public Path fetch(String url, Path directory) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new DownloadException("Invalid audio URL: " + url, e);
    }
    if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
      throw new DownloadException("Unsupported audio URL: " + url);
    }

    Path target = directory.resolve(fileNameFor(url, System.nanoTime()));
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("User-Agent", properties.userAgent())
            .header("Accept", "*/*")
            .GET()
            .build();

    LOGGER.debug("Downloading {} to {}", url, target);

    try {
      HttpResponse<Path> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        Files.deleteIfExists(target);
        throw new DownloadException(
            String.format("HTTP download failed with status %d for %s", response.statusCode(), url));
      }
      LOGGER.info("Downloaded {} ({} bytes)", url, Files.size(target));
      return target;

    } catch (IOException e) {
      deletePartial(target);
      throw new DownloadException("Failed to download " + url + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deletePartial(target);
      throw new DownloadException("Download interrupted: " + url, e);
    }
  }

  static String fileNameFor(String url, long suffix) {
    String path = url;
    int query = path.indexOf('?');
    if (query >= 0) {
      path = path.substring(0, query);
    }
    int fragment = path.indexOf('#');
    if (fragment >= 0) {
      path = path.substring(0, fragment);
    }
    String name = path.substring(path.lastIndexOf('/') + 1);
    if (name.isBlank()) {
      name = "audio";
    }
    return name + suffix;
  }

  private static void deletePartial(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}", target, e);
    }
  }
}
