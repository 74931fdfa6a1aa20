package com.scholary.transcriber.download;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpAudioDownloaderTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private HttpAudioDownloader downloader;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/media/episode.mp3",
        exchange -> {
          byte[] bytes = "ID3 fake audio".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.createContext(
        "/media/missing.mp3",
        exchange -> {
          exchange.sendResponseHeaders(404, -1);
          exchange.close();
        });
    server.start();
    downloader = new HttpAudioDownloader(new DownloaderProperties(5, 5, "test-agent"));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private String url(String path) {
    return "http://127.0.0.1:" + server.getAddress().getPort() + path;
  }

  @Test
  void fetch_streamsBodyIntoDirectory() throws IOException {
    Path file = downloader.fetch(url("/media/episode.mp3?token=abc"), tempDir);

    assertThat(file.getParent()).isEqualTo(tempDir);
    assertThat(file.getFileName().toString()).startsWith("episode.mp3").doesNotContain("token");
    assertThat(Files.readString(file)).isEqualTo("ID3 fake audio");
  }

  @Test
  void fetch_non2xxLeavesNoFileBehind() throws IOException {
    assertThatThrownBy(() -> downloader.fetch(url("/media/missing.mp3"), tempDir))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("status 404");

    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  void fetch_rejectsNonHttpUrls() {
    assertThatThrownBy(() -> downloader.fetch("ftp://example.com/a.mp3", tempDir))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("Unsupported");
    assertThatThrownBy(() -> downloader.fetch("http://exa mple.com/a.mp3", tempDir))
        .isInstanceOf(DownloadException.class)
        .hasMessageContaining("Invalid");
  }

  @Test
  void fileNameFor_usesLastPathSegmentWithoutQuery() {
    assertThat(HttpAudioDownloader.fileNameFor("https://cdn.example.com/a/b/talk.mp3?x=1#t", 42))
        .isEqualTo("talk.mp342");
    assertThat(HttpAudioDownloader.fileNameFor("https://cdn.example.com/", 7)).isEqualTo("audio7");
  }
}
