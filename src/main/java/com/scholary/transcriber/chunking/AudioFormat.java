package com.scholary.transcriber.chunking;

/**
 * PCM format of the resampled working copy.
 *
 * <p>The transcoder resamples with these values and the chunk planner derives its segment
 * duration from them, so both sides always agree on how many bytes one second of audio takes.
 */
public record AudioFormat(int sampleRate, int channels, int bitDepth) {

  public static final AudioFormat SPEECH_16K_MONO = new AudioFormat(16000, 1, 16);

  public AudioFormat {
    if (sampleRate <= 0 || channels <= 0 || bitDepth <= 0 || bitDepth % 8 != 0) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid audio format: sampleRate=%d, channels=%d, bitDepth=%d",
              sampleRate, channels, bitDepth));
    }
  }

  public long bytesPerSecond() {
    return (long) sampleRate * (bitDepth / 8) * channels;
  }

  /**
   * Whole seconds of audio that fit in {@code byteBudget} bytes.
   *
   * <p>For 16 kHz, 16-bit mono and a 95,000,000 byte budget this is 2968.
   */
  public int secondsFor(long byteBudget) {
    return (int) (byteBudget / bytesPerSecond());
  }
}
