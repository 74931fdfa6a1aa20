package com.scholary.transcriber.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the temporary files of a task, or of one segment of a task.
 *
 * <p>Files are registered with {@link #track(Path)} the moment they are created and deleted in
 * reverse order when the scope closes, whichever way the enclosing block exits. A task scope also
 * owns its working directory and removes it, with anything left inside, after its tracked files.
 * Child scopes share the parent's directory but release only their own files.
 *
 * <p>Closing never throws; a file that cannot be deleted is logged.
 */
public final class ArtifactScope implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactScope.class);

  private final Path directory;
  private final boolean ownsDirectory;
  private final Deque<Path> artifacts = new ArrayDeque<>();
  private boolean closed;

  private ArtifactScope(Path directory, boolean ownsDirectory) {
    this.directory = directory;
    this.ownsDirectory = ownsDirectory;
  }

  /**
   * Create a fresh working directory {@code parent/name} and a scope owning it.
   *
   * @throws IOException if the directory cannot be created
   */
  public static ArtifactScope open(Path parent, String name) throws IOException {
    Path directory = Files.createDirectories(parent).resolve(name);
    Files.createDirectory(directory);
    return new ArtifactScope(directory, true);
  }

  /** A scope for short-lived files in this scope's directory. */
  public ArtifactScope child() {
    return new ArtifactScope(directory, false);
  }

  public Path directory() {
    return directory;
  }

  /** Register a file for deletion when this scope closes. Returns the same path. */
  public synchronized Path track(Path artifact) {
    if (closed) {
      throw new IllegalStateException("Scope already closed, cannot track " + artifact);
    }
    artifacts.push(artifact);
    return artifact;
  }

  public synchronized List<Path> tracked() {
    return List.copyOf(artifacts);
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    while (!artifacts.isEmpty()) {
      delete(artifacts.pop());
    }
    if (ownsDirectory) {
      deleteDirectory();
    }
  }

  private void deleteDirectory() {
    if (!Files.exists(directory)) {
      return;
    }
    try (Stream<Path> leftovers = Files.walk(directory)) {
      leftovers
          .sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                if (!path.equals(directory)) {
                  LOGGER.warn("Removing untracked file {}", path);
                }
                delete(path);
              });
    } catch (IOException e) {
      LOGGER.warn("Could not list working directory {}", directory, e);
    }
  }

  private static void delete(Path path) {
    try {
      if (Files.deleteIfExists(path)) {
        LOGGER.debug("Deleted {}", path);
      }
    } catch (IOException e) {
      LOGGER.warn("Could not delete {}", path, e);
    }
  }
}
