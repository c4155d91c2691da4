//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

/**
 * Decides the visibility of an identifier from its spelling alone. No semantic analysis is
 * involved.
 */
public interface NameClassifier {

  /** Python naming conventions: {@code __name} is private, {@code _name} is protected. Dunder
    * names like {@code __init__} are public. */
  NameClassifier CONVENTION = new NameClassifier() {
    @Override public boolean isPrivate (String name) {
      return name.length() > 2 && name.startsWith("__") && !name.endsWith("__");
    }
    @Override public boolean isProtected (String name) {
      return name.length() > 1 && name.startsWith("_") && !name.startsWith("__");
    }
  };

  /** Returns true if {@code name} is private by convention. */
  boolean isPrivate (String name);

  /** Returns true if {@code name} is protected by convention. */
  boolean isProtected (String name);

  /** Returns true if {@code name} is neither private nor protected. */
  default boolean isPublic (String name) {
    return !isPrivate(name) && !isProtected(name);
  }
}
