package com.scholary.transcriber.ffmpeg;

import com.scholary.transcriber.chunking.AudioFormat;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AudioTranscoder} backed by the ffmpeg command-line tool.
 *
 * <p>Two invocations are used:
 *
 * <ul>
 *   <li>resample: {@code ffmpeg -y -i in -ar <rate> -ac <channels> out.<ext>}
 *   <li>extract: {@code ffmpeg -y -i in -ss <start> -t <duration> out}
 * </ul>
 *
 * <p>stderr is merged into stdout and kept, so a failure carries ffmpeg's own explanation.
 */
public class FfmpegTranscoder implements AudioTranscoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegTranscoder.class);
  private static final int OUTPUT_SNIPPET_MAX = 4_000;

  private final FfmpegProperties properties;
  private final AudioFormat format;

  public FfmpegTranscoder(FfmpegProperties properties, AudioFormat format) {
    this.properties = properties;
    this.format = format;
  }

  @Override
  public Path resample(Path source, AudioContainer container) {
    Path target = source.resolveSibling(source.getFileName() + "." + container.extension());

    // -ar sets the sample rate, -ac the channel count
    List<String> command =
        List.of(
            properties.binary(),
            "-y",
            "-i",
            source.toString(),
            "-ar",
            String.valueOf(format.sampleRate()),
            "-ac",
            String.valueOf(format.channels()),
            target.toString());

    run(command, target);
    LOGGER.debug("Resampled {} to {}", source.getFileName(), target.getFileName());
    return target;
  }

  @Override
  public Path extract(Path source, int startSecond, int durationSeconds) {
    Path target =
        source.resolveSibling(
            String.format("%s.%ds-%ds%s", stem(source), startSecond, durationSeconds, suffix(source)));

    // -ss: starting second, -t: duration in seconds
    List<String> command =
        List.of(
            properties.binary(),
            "-y",
            "-i",
            source.toString(),
            "-ss",
            String.valueOf(startSecond),
            "-t",
            String.valueOf(durationSeconds),
            target.toString());

    run(command, target);
    LOGGER.debug(
        "Extracted {}s+{}s of {} to {}",
        startSecond,
        durationSeconds,
        source.getFileName(),
        target.getFileName());
    return target;
  }

  private void run(List<String> command, Path target) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessResult result;
    try {
      Files.deleteIfExists(target);
      result = runProcess(command, properties.timeoutMinutes());
    } catch (IOException e) {
      deleteQuietly(target);
      throw new TranscodeException("Failed to start " + properties.binary(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(target);
      throw new TranscodeException("Interrupted while running " + properties.binary(), e);
    }

    if (result.timedOut()) {
      deleteQuietly(target);
      throw new TranscodeException(
          String.format(
              "%s timed out after %d minutes", properties.binary(), properties.timeoutMinutes()),
          truncate(result.output()));
    }
    if (result.code() != 0 || !Files.exists(target)) {
      deleteQuietly(target);
      throw new TranscodeException(
          String.format("%s exited with code %d", properties.binary(), result.code()),
          truncate(result.output()));
    }
  }

  /** Runs the command, collecting merged output. Overridden in tests. */
  protected ProcessResult runProcess(List<String> command, long timeoutMinutes)
      throws IOException, InterruptedException {
    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    StringJoiner output = new StringJoiner(System.lineSeparator());
    Thread reader =
        new Thread(
            () -> {
              try (BufferedReader buffered =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                  output.add(line);
                }
              } catch (IOException e) {
                LOGGER.debug("Stopped reading ffmpeg output: {}", e.getMessage());
              }
            },
            "ffmpeg-output");
    reader.start();

    boolean finished = process.waitFor(timeoutMinutes, TimeUnit.MINUTES);
    if (!finished) {
      process.destroyForcibly();
      process.waitFor(5, TimeUnit.SECONDS);
    }
    reader.join();
    return new ProcessResult(finished ? process.exitValue() : -1, output.toString(), !finished);
  }

  private static String stem(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static String suffix(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot) : "";
  }

  private static String truncate(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    if (output.length() <= OUTPUT_SNIPPET_MAX) {
      return output;
    }
    // the tail is where ffmpeg prints the actual error
    return "..." + output.substring(output.length() - OUTPUT_SNIPPET_MAX);
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Could not delete partial output {}", path, e);
    }
  }

  protected record ProcessResult(int code, String output, boolean timedOut) {}
}
