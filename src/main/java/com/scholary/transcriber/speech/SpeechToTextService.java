package com.scholary.transcriber.speech;

import com.scholary.transcriber.transcript.SegmentResult;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for speech-to-text providers.
 *
 * <p>Implementations send one audio file per call. The file must already respect the
 * provider's size limit.
 */
public interface SpeechToTextService {

  /**
   * Transcribe one segment file.
   *
   * @param audioFile the encoded segment
   * @param keywords words to spot, may be empty
   * @return transcript, word timings, confidences and keyword matches
   * @throws TranscriptionException if the call fails
   */
  SegmentResult transcribe(Path audioFile, List<String> keywords);
}
