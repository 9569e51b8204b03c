package com.scholary.captions.render;

import com.scholary.captions.segment.Segment;
import com.scholary.captions.understanding.UsageReport;
import java.util.List;

/**
 * Lossless JSON form of a finished job: every segment field including provenance, plus usage.
 *
 * @param durationSeconds length of the source audio
 * @param partial whether the job was cancelled and only partial results were kept
 * @param segments the final timeline
 * @param usage token usage by phase
 */
public record CaptionExport(
    double durationSeconds, boolean partial, List<Segment> segments, UsageReport usage) {}
