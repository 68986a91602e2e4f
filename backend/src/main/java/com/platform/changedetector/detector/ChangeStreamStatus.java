package com.platform.changedetector.detector;

import java.time.Instant;

/**
 * Point-in-time view of a running change stream.
 */
public record ChangeStreamStatus(
    String stream,
    long completedCycles,
    long failedFetches,
    int trackedResources,
    Instant lastSuccessfulFetch,
    Instant lastFailedFetch
) {}
