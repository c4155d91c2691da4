//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import org.junit.*;
import static org.junit.Assert.*;

public class NameClassifierTest {

  private final NameClassifier names = NameClassifier.CONVENTION;

  @Test public void testPrivate () {
    assertTrue(names.isPrivate("__secret"));
    assertTrue(names.isPrivate("___triple"));
    assertTrue(names.isPrivate("__trailing_"));
    assertFalse(names.isPrivate("__init__"));
    assertFalse(names.isPrivate("_single"));
    assertFalse(names.isPrivate("__"));
    assertFalse(names.isPrivate("public"));
  }

  @Test public void testProtected () {
    assertTrue(names.isProtected("_single"));
    assertTrue(names.isProtected("_x"));
    assertFalse(names.isProtected("_"));
    assertFalse(names.isProtected("__secret"));
    assertFalse(names.isProtected("__init__"));
    assertFalse(names.isProtected("public_"));
  }

  @Test public void testPublic () {
    assertTrue(names.isPublic("Widget"));
    assertTrue(names.isPublic("__call__"));
    assertTrue(names.isPublic("_"));
    assertTrue(names.isPublic("__"));
    assertFalse(names.isPublic("_Widget"));
    assertFalse(names.isPublic("__widget"));
  }
}
