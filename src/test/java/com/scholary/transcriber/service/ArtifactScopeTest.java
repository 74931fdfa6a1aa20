package com.scholary.transcriber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactScopeTest {

  @TempDir Path tempDir;

  @Test
  void close_deletesTrackedFilesAndOwnedDirectory() throws IOException {
    Path directory;
    try (ArtifactScope scope = ArtifactScope.open(tempDir, "task-1")) {
      directory = scope.directory();
      scope.track(Files.writeString(directory.resolve("raw.mp3"), "raw"));
      scope.track(Files.writeString(directory.resolve("raw.mp3.wav"), "wav"));
      assertThat(scope.tracked()).hasSize(2);
    }

    assertThat(directory).doesNotExist();
    assertThat(tempDir).isEmptyDirectory();
  }

  @Test
  void close_runsWhenBlockThrows() throws IOException {
    Path[] directory = new Path[1];

    assertThatThrownBy(
            () -> {
              try (ArtifactScope scope = ArtifactScope.open(tempDir, "task-2")) {
                directory[0] = scope.directory();
                scope.track(Files.writeString(directory[0].resolve("raw.mp3"), "raw"));
                throw new IllegalStateException("stage failed");
              }
            })
        .isInstanceOf(IllegalStateException.class);

    assertThat(directory[0]).doesNotExist();
  }

  @Test
  void close_removesUntrackedLeftovers() throws IOException {
    Path directory;
    try (ArtifactScope scope = ArtifactScope.open(tempDir, "task-3")) {
      directory = scope.directory();
      Files.writeString(directory.resolve("stray.tmp"), "stray");
    }

    assertThat(directory).doesNotExist();
  }

  @Test
  void child_releasesOnlyItsOwnFiles() throws IOException {
    try (ArtifactScope scope = ArtifactScope.open(tempDir, "task-4")) {
      Path resampled = scope.track(Files.writeString(scope.directory().resolve("a.wav"), "wav"));
      Path segment;
      try (ArtifactScope child = scope.child()) {
        segment = child.track(Files.writeString(scope.directory().resolve("a.0s-10s.wav"), "s"));
        assertThat(child.directory()).isEqualTo(scope.directory());
      }

      assertThat(segment).doesNotExist();
      assertThat(resampled).exists();
      assertThat(scope.directory()).exists();
    }
  }

  @Test
  void close_toleratesFilesAlreadyGone() throws IOException {
    Path directory;
    try (ArtifactScope scope = ArtifactScope.open(tempDir, "task-5")) {
      directory = scope.directory();
      scope.track(directory.resolve("never-created.flac"));
    }

    assertThat(directory).doesNotExist();
  }

  @Test
  void track_afterCloseIsRejected() throws IOException {
    ArtifactScope scope = ArtifactScope.open(tempDir, "task-6");
    scope.close();

    assertThatThrownBy(() -> scope.track(tempDir.resolve("late.wav")))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void open_refusesExistingDirectory() throws IOException {
    Files.createDirectory(tempDir.resolve("task-7"));

    assertThatThrownBy(() -> ArtifactScope.open(tempDir, "task-7")).isInstanceOf(IOException.class);
  }
}
