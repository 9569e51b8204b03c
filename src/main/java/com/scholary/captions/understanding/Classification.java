package com.scholary.captions.understanding;

import com.scholary.captions.segment.ContentType;

/** Classification of an untimed stretch of audio, as returned for gap analysis. */
public record Classification(ContentType contentType, String text) {}
