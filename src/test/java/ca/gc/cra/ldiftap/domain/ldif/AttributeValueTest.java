package ca.gc.cra.ldiftap.domain.ldif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class AttributeValueTest {

  @Test
  void appendPromotesSingleToMultiInOrder() {
    AttributeValue value = AttributeValue.of("a");

    AttributeValue promoted = value.append("b").append("c");

    assertInstanceOf(AttributeValue.Multi.class, promoted);
    assertEquals(List.of("a", "b", "c"), promoted.values());
  }

  @Test
  void recordValueCollapsesSingleElement() {
    assertEquals("only", AttributeValue.of("only").toRecordValue());
    assertEquals(List.of("x", "y"), AttributeValue.of("x").append("y").toRecordValue());
  }

  @Test
  void frozenMultiRejectsFurtherValues() {
    AttributeValue frozen = AttributeValue.of("a").append("b").freeze();

    assertThrows(UnsupportedOperationException.class, () -> frozen.append("c"));
    assertEquals(List.of("a", "b"), frozen.values());
  }

  @Test
  void rejectsNullValues() {
    assertThrows(NullPointerException.class, () -> AttributeValue.of(null));
    assertThrows(NullPointerException.class, () -> AttributeValue.of("a").append(null));
  }
}
