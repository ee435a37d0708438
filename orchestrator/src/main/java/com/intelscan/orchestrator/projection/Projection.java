package com.intelscan.orchestrator.projection;

/**
 * Display state derived from one job record.
 *
 * @param progress  0..100, a pipeline-position marker rather than a completion fraction
 * @param unparsed  raw lines that did not parse, never negative
 * @param recognized false when the phase was unknown and the projection fell back to PENDING/0
 */
public record Projection(DisplayStatus status, int progress, long unparsed, boolean recognized) {
}
