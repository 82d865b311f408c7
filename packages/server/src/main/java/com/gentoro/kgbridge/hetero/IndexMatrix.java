package com.gentoro.kgbridge.hetero;

import java.util.Arrays;

/** 2×E edge index: row 0 holds source positions, row 1 destination positions. Immutable. */
public final class IndexMatrix {
  private final long[] sources;
  private final long[] destinations;

  IndexMatrix(long[] sources, long[] destinations) {
    if (sources.length != destinations.length) {
      throw new IllegalArgumentException("index rows differ in length");
    }
    this.sources = sources.clone();
    this.destinations = destinations.clone();
  }

  public int edgeCount() {
    return sources.length;
  }

  public long source(int edge) {
    return sources[edge];
  }

  public long destination(int edge) {
    return destinations[edge];
  }

  public long[] sources() {
    return sources.clone();
  }

  public long[] destinations() {
    return destinations.clone();
  }

  @Override
  public String toString() {
    return "IndexMatrix[2x" + sources.length + "] " + Arrays.toString(sources) + " -> "
        + Arrays.toString(destinations);
  }
}
