package com.scholary.captions.api;

/** Response for an accepted caption job: the ID to poll. */
public record AsyncJobResponse(String jobId, String statusUrl) {}
