package com.scholary.transcriber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.net.URL;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreClientTest {

  @Mock private S3Client s3Client;

  @Test
  void putObject_sendsKeyTypeAndLength() {
    S3ObjectStoreClient client = new S3ObjectStoreClient(s3Client);

    client.putObject(
        "audio-archive", "talk.mp3", new ByteArrayInputStream(new byte[4]), 4, "audio/mpeg");

    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().bucket()).isEqualTo("audio-archive");
    assertThat(request.getValue().key()).isEqualTo("talk.mp3");
    assertThat(request.getValue().contentType()).isEqualTo("audio/mpeg");
    assertThat(request.getValue().contentLength()).isEqualTo(4L);
  }

  @Test
  void putObject_wrapsS3Errors() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());
    S3ObjectStoreClient client = new S3ObjectStoreClient(s3Client);

    assertThatThrownBy(
            () ->
                client.putObject(
                    "audio-archive", "talk.mp3", new ByteArrayInputStream(new byte[1]), 1, "a/b"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("statusCode=403");
  }

  @Test
  void objectUrl_pointsAtConfiguredEndpoint() {
    try (S3ObjectStoreClient client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                true,
                "http://localhost:9000",
                "minioadmin",
                "minioadmin",
                "audio-archive",
                "us-east-1",
                true))) {

      URL url = client.objectUrl("audio-archive", "talk.mp3");

      assertThat(url.toString())
          .startsWith("http://")
          .contains("localhost:9000")
          .contains("audio-archive")
          .endsWith("/talk.mp3");
    }
  }
}
