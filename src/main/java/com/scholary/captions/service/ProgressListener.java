package com.scholary.captions.service;

/** Receives coarse progress of one engine run. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (phase, percent) -> {};

  /**
   * @param phase "chunks", "gaps", "timing" or "done"
   * @param percent overall progress, 0-100
   */
  void onProgress(String phase, int percent);
}
