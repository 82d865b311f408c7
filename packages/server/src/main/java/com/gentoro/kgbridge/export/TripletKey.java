package com.gentoro.kgbridge.export;

import com.gentoro.kgbridge.exception.MalformedExportException;
import java.util.Map;

/** (source type, relation type, destination type) grouping key for heterogeneous edges. */
public record TripletKey(String source, String relation, String destination) {

  /** Parse the comma-joined form used by exports, e.g. {@code "Person,knows,Person"}. */
  public static TripletKey parse(String key) {
    String[] parts = key == null ? new String[0] : key.split(",", -1);
    if (parts.length != 3
        || parts[0].isBlank()
        || parts[1].isBlank()
        || parts[2].isBlank()) {
      throw new MalformedExportException(
          "Edge key must be 'srcType,relType,dstType'", Map.of("key", String.valueOf(key)));
    }
    return new TripletKey(parts[0].trim(), parts[1].trim(), parts[2].trim());
  }

  @Override
  public String toString() {
    return "(" + source + ") --[" + relation + "]--> (" + destination + ")";
  }
}
