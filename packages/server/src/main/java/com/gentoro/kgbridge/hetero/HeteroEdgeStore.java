package com.gentoro.kgbridge.hetero;

import com.gentoro.kgbridge.export.TripletKey;
import java.util.Optional;

/** Edges of one (source type, relation, destination type) triplet. */
public final class HeteroEdgeStore {
  private final TripletKey triplet;
  private final IndexMatrix index;
  private final FloatMatrix features;

  HeteroEdgeStore(TripletKey triplet, IndexMatrix index, FloatMatrix features) {
    this.triplet = triplet;
    this.index = index;
    this.features = features;
  }

  public TripletKey triplet() {
    return triplet;
  }

  public IndexMatrix index() {
    return index;
  }

  public int edgeCount() {
    return index.edgeCount();
  }

  /** E×F edge features; empty when the export carried none. */
  public Optional<FloatMatrix> features() {
    return Optional.ofNullable(features);
  }
}
