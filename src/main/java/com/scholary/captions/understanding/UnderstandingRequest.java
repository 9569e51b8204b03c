package com.scholary.captions.understanding;

import com.scholary.captions.job.CancellationToken;
import com.scholary.captions.media.AudioClip;

/**
 * A single call to the audio understanding service.
 *
 * @param audio the audio to analyze, or null for text-only requests such as timing optimization
 * @param prompt the instructions
 * @param callSite short label for logs, e.g. "chunk-3" or "gap-0"
 * @param cancellation stops retries once the owning job is cancelled
 */
public record UnderstandingRequest(
    AudioClip audio, String prompt, String callSite, CancellationToken cancellation) {

  public UnderstandingRequest {
    if (cancellation == null) {
      cancellation = CancellationToken.none();
    }
  }

  public static UnderstandingRequest withAudio(AudioClip audio, String prompt, String callSite) {
    return new UnderstandingRequest(audio, prompt, callSite, null);
  }

  public static UnderstandingRequest textOnly(String prompt, String callSite) {
    return new UnderstandingRequest(null, prompt, callSite, null);
  }

  public UnderstandingRequest withCancellation(CancellationToken token) {
    return new UnderstandingRequest(audio, prompt, callSite, token);
  }

  public boolean hasAudio() {
    return audio != null;
  }
}
