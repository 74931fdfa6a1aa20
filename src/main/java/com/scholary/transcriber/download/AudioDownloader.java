package com.scholary.transcriber.download;

import java.nio.file.Path;

/** Fetches source audio into a local directory. */
public interface AudioDownloader {

  /**
   * Download {@code url} into {@code directory}.
   *
   * @param url where the audio lives
   * @param directory the task's working directory
   * @return the downloaded file, owned by the caller
   * @throws DownloadException on network or filesystem errors
   */
  Path fetch(String url, Path directory);
}
