package com.resonance.matrix.governor;

/**
 * Heap usage at one point in time.
 *
 * @param usedMb heap in use, in megabytes
 * @param maxMb  maximum heap, in megabytes, or -1 when undefined
 */
public record MemorySample(long usedMb, long maxMb) {
}
