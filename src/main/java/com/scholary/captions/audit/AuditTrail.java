package com.scholary.captions.audit;

import com.scholary.captions.media.AudioClip;

/**
 * Receives the raw material of one job for later inspection: the audio sent to the collaborator
 * and the text it replied with.
 *
 * <p>Implementations must not throw. Losing an audit record never fails a job.
 */
public interface AuditTrail {

  /** Trail that records nothing. */
  AuditTrail NONE =
      new AuditTrail() {
        @Override
        public void recordAudio(String name, AudioClip clip) {}

        @Override
        public void recordReply(String name, String reply) {}
      };

  void recordAudio(String name, AudioClip clip);

  void recordReply(String name, String reply);
}
