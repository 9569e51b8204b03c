package com.scholary.captions.understanding;

import com.scholary.captions.segment.ContentType;

/**
 * One timed span as reported by the service.
 *
 * <p>Times are whatever the service sent: chunk-relative for transcription replies, absolute for
 * timing optimization replies. They have not been validated against any window yet.
 */
public record SpanReply(double start, double end, String text, ContentType contentType) {}
