package com.scholary.captions.service;

import com.scholary.captions.cache.ChunkCache;
import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.chunking.Chunker;
import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.job.CaptionJobCancelledException;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.segment.Segment;
import com.scholary.captions.segment.Timeline;
import com.scholary.captions.transcript.ChunkTranscriber;
import com.scholary.captions.transcript.ChunkTranscript;
import com.scholary.captions.transcript.Gap;
import com.scholary.captions.transcript.GapDetector;
import com.scholary.captions.transcript.GapFillResult;
import com.scholary.captions.transcript.GapFiller;
import com.scholary.captions.transcript.TimelineMerger;
import com.scholary.captions.transcript.TimingOptimizer;
import com.scholary.captions.transcript.TimingResult;
import com.scholary.captions.understanding.TokenUsage;
import com.scholary.captions.understanding.UsageReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Builds a caption timeline from source audio.
 *
 * <p>Pipeline: plan chunks, transcribe them in parallel, merge the results into one timeline,
 * fill the gaps, then run the timing pass. Only invalid chunking parameters fail a run; every
 * collaborator failure degrades the result instead. The timeline is created and mutated only on
 * the calling thread.
 *
 * <p>Cancellation is checked before every collaborator call. A cancelled run either throws {@link
 * CaptionJobCancelledException} or, if the request allows partial results, returns the merged
 * chunk results received so far without gap fill or timing.
 */
@Service
public class CaptionAssemblyEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionAssemblyEngine.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Chunker chunker;
  private final ChunkTranscriber chunkTranscriber;
  private final TimelineMerger merger;
  private final GapDetector gapDetector;
  private final GapFiller gapFiller;
  private final TimingOptimizer timingOptimizer;
  private final ChunkCache chunkCache;
  private final Executor workerExecutor;
  private final double gapThresholdSeconds;

  public CaptionAssemblyEngine(
      Chunker chunker,
      ChunkTranscriber chunkTranscriber,
      TimelineMerger merger,
      GapDetector gapDetector,
      GapFiller gapFiller,
      TimingOptimizer timingOptimizer,
      ChunkCache chunkCache,
      @Qualifier("captionWorkerExecutor") Executor workerExecutor,
      CaptionProperties properties) {
    this.chunker = chunker;
    this.chunkTranscriber = chunkTranscriber;
    this.merger = merger;
    this.gapDetector = gapDetector;
    this.gapFiller = gapFiller;
    this.timingOptimizer = timingOptimizer;
    this.chunkCache = chunkCache;
    this.workerExecutor = workerExecutor;
    this.gapThresholdSeconds = properties.gaps().thresholdSeconds();
  }

  /**
   * Run the whole pipeline.
   *
   * @param request source, chunking and job options
   * @param progress receives coarse progress
   * @return the final timeline with usage and diagnostics
   * @throws com.scholary.captions.config.ConfigurationException if the chunking parameters are
   *     invalid; raised before any collaborator call
   * @throws CaptionJobCancelledException if cancelled and partial results were not requested
   */
  public AssemblyResult assemble(AssemblyRequest request, ProgressListener progress) {
    double duration = request.totalDuration();
    List<Chunk> chunks =
        chunker.planChunks(duration, request.chunkSeconds(), request.overlapSeconds());
    LOGGER.info(
        "Assembling captions: duration={}s, chunks={}, chunkSeconds={}, overlapSeconds={}",
        duration,
        chunks.size(),
        request.chunkSeconds(),
        request.overlapSeconds());

    // Chunk pass
    ChunkPass chunkPass = transcribeChunks(request, chunks, progress);
    TokenUsage chunkUsage = TokenUsage.ZERO;
    List<Integer> failedChunks = new ArrayList<>();
    for (ChunkTranscript transcript : chunkPass.transcripts()) {
      chunkUsage = chunkUsage.plus(transcript.usage());
      if (transcript.failed()) {
        failedChunks.add(transcript.chunkIndex());
      }
    }

    List<Segment> merged = merger.merge(chunkPass.transcripts(), duration);
    if (chunkPass.cancelled()) {
      return partialOrThrow(request, merged, chunkUsage, chunks.size(), failedChunks, chunkPass);
    }

    Timeline timeline = new Timeline(duration);
    timeline.replaceAll(merged);

    // Gap pass
    List<Gap> gaps = gapDetector.detect(timeline.snapshot(), duration, gapThresholdSeconds);
    progress.onProgress("gaps", 70);
    GapFillResult gapResult;
    try {
      gapResult =
          gapFiller.fill(
              timeline,
              request.source(),
              gaps,
              workerExecutor,
              request.cancellation(),
              request.audit());
    } catch (CaptionJobCancelledException e) {
      return partialOrThrow(request, merged, chunkUsage, chunks.size(), failedChunks, chunkPass);
    }
    if (request.cancellation().isCancelled()) {
      return partialOrThrow(request, merged, chunkUsage, chunks.size(), failedChunks, chunkPass);
    }

    // Timing pass
    progress.onProgress("timing", 90);
    TimingResult timing =
        timingOptimizer.optimize(timeline.snapshot(), duration, request.audit());
    if (timing.applied()) {
      timeline.replaceAll(timing.segments());
    }
    progress.onProgress("done", 100);

    UsageReport usage = new UsageReport(chunkUsage, gapResult.usage(), timing.usage());
    List<Segment> segments = timeline.snapshot();
    LOGGER.info(
        "Captions assembled: segments={}, failedChunks={}, gaps={}, optimized={}, tokens={}",
        segments.size(),
        failedChunks.size(),
        gapResult.detected(),
        timing.applied(),
        usage.total().totalTokens());

    return new AssemblyResult(
        segments,
        usage,
        false,
        chunks.size(),
        failedChunks,
        chunkPass.cachedChunks(),
        gapResult,
        timing.applied(),
        timing.fallbackReason());
  }

  private record ChunkPass(List<ChunkTranscript> transcripts, int cachedChunks, boolean cancelled) {}

  /**
   * Transcribe all chunks on the worker executor.
   *
   * <p>Results are collected in chunk order; the merge sorts by time anyway, so completion order
   * never matters.
   */
  private ChunkPass transcribeChunks(
      AssemblyRequest request, List<Chunk> chunks, ProgressListener progress) {
    AtomicInteger done = new AtomicInteger();
    List<ChunkTranscript> cached = new ArrayList<>();
    List<CompletableFuture<ChunkTranscript>> futures = new ArrayList<>();
    List<Chunk> submitted = new ArrayList<>();

    if (request.refresh() && request.cacheable()) {
      chunkCache.evictFile(request.bucket(), request.key());
    }

    for (Chunk chunk : chunks) {
      Optional<ChunkTranscript> hit =
          request.cacheable()
              ? chunkCache.get(ChunkCache.generateKey(request.bucket(), request.key(), chunk))
              : Optional.empty();
      if (hit.isPresent()) {
        cached.add(hit.get());
        done.incrementAndGet();
        continue;
      }
      submitted.add(chunk);
      futures.add(
          CompletableFuture.supplyAsync(
              () -> {
                request.cancellation().throwIfCancelled("chunk-" + chunk.index());
                ChunkTranscript transcript =
                    chunkTranscriber.transcribe(
                        request.source(), chunk, request.cancellation(), request.audit());
                progress.onProgress("chunks", done.incrementAndGet() * 70 / chunks.size());
                return transcript;
              },
              workerExecutor));
    }
    if (!cached.isEmpty()) {
      LOGGER.info("Reusing {} cached chunks of {}", cached.size(), chunks.size());
    }
    LOGGER.debug("{}", chunkCache.getStats());

    List<ChunkTranscript> transcripts = new ArrayList<>(cached);
    boolean cancelled = false;
    for (int i = 0; i < futures.size(); i++) {
      Chunk chunk = submitted.get(i);
      try {
        ChunkTranscript transcript = futures.get(i).join();
        transcripts.add(transcript);
        if (request.cacheable() && !transcript.failed()) {
          chunkCache.put(
              ChunkCache.generateKey(request.bucket(), request.key(), chunk), transcript);
        }
      } catch (CompletionException e) {
        if (e.getCause() instanceof CaptionJobCancelledException) {
          cancelled = true;
        } else {
          String reason = "unexpected error: " + e.getCause();
          LOGGER.error("Chunk {} failed unexpectedly", chunk.index(), e.getCause());
          STRUCTURED_LOGGER.logChunkFailed(chunk.index(), chunk.start(), chunk.end(), reason);
          transcripts.add(
              ChunkTranscript.failed(chunk.index(), chunk.start(), chunk.end(), null, reason));
        }
      }
    }
    return new ChunkPass(
        transcripts, cached.size(), cancelled || request.cancellation().isCancelled());
  }

  private AssemblyResult partialOrThrow(
      AssemblyRequest request,
      List<Segment> merged,
      TokenUsage chunkUsage,
      int chunkCount,
      List<Integer> failedChunks,
      ChunkPass chunkPass) {
    if (!request.allowPartial()) {
      LOGGER.info("Caption assembly cancelled, discarding {} merged segments", merged.size());
      throw new CaptionJobCancelledException("Caption job cancelled");
    }
    LOGGER.info("Caption assembly cancelled, returning {} merged segments", merged.size());
    return new AssemblyResult(
        merged,
        new UsageReport(chunkUsage, TokenUsage.ZERO, TokenUsage.ZERO),
        true,
        chunkCount,
        failedChunks,
        chunkPass.cachedChunks(),
        GapFillResult.none(),
        false,
        "cancelled");
  }
}
