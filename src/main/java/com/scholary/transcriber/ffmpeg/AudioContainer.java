package com.scholary.transcriber.ffmpeg;

/** Output containers the transcoder can produce. */
public enum AudioContainer {
  WAV("wav", "audio/wav"),
  FLAC("flac", "audio/flac");

  private final String extension;
  private final String mimeType;

  AudioContainer(String extension, String mimeType) {
    this.extension = extension;
    this.mimeType = mimeType;
  }

  public String extension() {
    return extension;
  }

  public String mimeType() {
    return mimeType;
  }
}
