package com.scholary.captions.understanding;

/**
 * Interface for the audio understanding collaborator.
 *
 * <p>Implementations are stateless and shared across chunk, gap and optimization calls of all
 * jobs.
 */
public interface AudioUnderstandingService {

  /**
   * Send audio (optional) and instructions, and return the model's raw reply.
   *
   * @param request the request
   * @return the reply text and token usage
   * @throws UnderstandingException if the service stays unavailable after retries
   */
  UnderstandingResponse generate(UnderstandingRequest request);
}
