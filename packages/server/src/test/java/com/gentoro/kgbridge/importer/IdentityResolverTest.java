package com.gentoro.kgbridge.importer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kgbridge.exception.ValidationException;
import com.gentoro.kgbridge.export.ExportedRelationship;
import com.gentoro.kgbridge.export.PropertyValue;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IdentityResolverTest {

  @Test
  void explainsWhichEndpointIsMissing() {
    IdentityResolver resolver = new IdentityResolver("_id");
    resolver.recordCreated(PropertyValue.ofInteger(1));
    resolver.recordCreated(PropertyValue.ofString("b"));

    assertEquals(
        "endpoints not found in the store by _id",
        resolver.describeUnresolved(rel(PropertyValue.ofInteger(1), PropertyValue.ofString("b"))));
    assertEquals(
        "start node 2 was not created in this import",
        resolver.describeUnresolved(rel(PropertyValue.ofInteger(2), PropertyValue.ofString("b"))));
    assertEquals(
        "end node 1 was not created in this import",
        resolver.describeUnresolved(rel(PropertyValue.ofString("b"), PropertyValue.ofString("1"))));
  }

  @Test
  void blankMarkerIsRejected() {
    assertThrows(ValidationException.class, () -> new IdentityResolver(" "));
  }

  private static ExportedRelationship rel(PropertyValue start, PropertyValue end) {
    return new ExportedRelationship("R", start, end, Map.of());
  }
}
