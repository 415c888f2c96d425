package ca.gc.cra.formdata.domain.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class FormDataEncodingExceptionTest {
  @Test
  void rootNotKeyedHasNoPath() {
    FormDataEncodingException ex = FormDataEncodingException.rootNotKeyed("a sequence");

    assertEquals(FormDataEncodingException.Reason.ROOT_NOT_KEYED, ex.reason());
    assertEquals(Optional.empty(), ex.path());
    assertTrue(ex.getMessage().endsWith("was a sequence"));
  }

  @Test
  void boundaryCollisionNamesPartAndOffset() {
    FormDataEncodingException ex = FormDataEncodingException.boundaryCollision("doc", 17);

    assertEquals(FormDataEncodingException.Reason.BOUNDARY_COLLISION, ex.reason());
    assertEquals(Optional.of("doc"), ex.path());
    assertEquals("Body of part 'doc' contains the boundary delimiter at offset 17", ex.getMessage());
  }

  @Test
  void traversalFailureKeepsCauseAndLabelsRoot() {
    IllegalStateException cause = new IllegalStateException("boom");
    FormDataEncodingException atRoot = FormDataEncodingException.traversalFailure("", "broken", cause);
    FormDataEncodingException nested =
        FormDataEncodingException.traversalFailure("address[city]", "broken", null);

    assertSame(cause, atRoot.getCause());
    assertEquals("Failed to traverse value at <root>: broken", atRoot.getMessage());
    assertEquals(Optional.empty(), atRoot.path());
    assertEquals(Optional.of("address[city]"), nested.path());
  }

  @Test
  void invalidPartNameCarriesDetail() {
    FormDataEncodingException ex = FormDataEncodingException.invalidPartName("", "must not be empty");

    assertEquals(FormDataEncodingException.Reason.INVALID_PART_NAME, ex.reason());
    assertEquals("Invalid part name '': must not be empty", ex.getMessage());
  }
}
