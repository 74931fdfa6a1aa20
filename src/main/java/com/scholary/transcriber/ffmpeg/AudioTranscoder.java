package com.scholary.transcriber.ffmpeg;

import java.nio.file.Path;

/**
 * Re-encodes and trims audio files.
 *
 * <p>Every output is written next to its input under a new name; the caller owns the returned
 * file and is responsible for deleting it.
 */
public interface AudioTranscoder {

  /**
   * Convert a file to the pipeline's fixed sample rate and channel count.
   *
   * @param source the file to convert
   * @param container the target container
   * @return the path of the new file
   * @throws TranscodeException if the tool fails
   */
  Path resample(Path source, AudioContainer container);

  /**
   * Copy the {@code [startSecond, startSecond + durationSeconds)} window of a file.
   *
   * @param source the file to cut from
   * @param startSecond offset of the window
   * @param durationSeconds length of the window
   * @return the path of the new file
   * @throws TranscodeException if the tool fails
   */
  Path extract(Path source, int startSecond, int durationSeconds);
}
