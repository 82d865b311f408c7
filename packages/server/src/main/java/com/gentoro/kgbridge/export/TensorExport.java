package com.gentoro.kgbridge.export;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw buffers of a tensor-mode export, exactly as parsed: nothing here checks widths or index
 * bounds. Map iteration order follows the document.
 *
 * @param nodeFeatures node type to feature rows
 * @param nodeLabels node type to row-aligned display labels (may be empty)
 * @param edgeIndices type triplet to the two index rows (source, destination)
 * @param edgeFeatures type triplet to per-edge feature rows (may be empty)
 */
public record TensorExport(
    Map<String, List<double[]>> nodeFeatures,
    Map<String, List<String>> nodeLabels,
    Map<TripletKey, List<long[]>> edgeIndices,
    Map<TripletKey, List<double[]>> edgeFeatures) {

  public TensorExport {
    nodeFeatures = freeze(nodeFeatures);
    nodeLabels = freeze(nodeLabels);
    edgeIndices = freeze(edgeIndices);
    edgeFeatures = freeze(edgeFeatures);
  }

  private static <K, V> Map<K, V> freeze(Map<K, V> in) {
    return in == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }
}
