package com.scholary.transcriber.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for previewing the segment plan of a resampled file without processing anything.
 *
 * @param byteSize size of the resampled audio in bytes, at most one terabyte
 */
public record ChunkPreviewRequest(
    @NotNull @PositiveOrZero @Max(ChunkPreviewRequest.MAX_BYTE_SIZE) Long byteSize) {

  public static final long MAX_BYTE_SIZE = 1_000_000_000_000L;
}
