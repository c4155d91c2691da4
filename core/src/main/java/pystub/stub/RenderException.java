//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

/**
 * Thrown when an expression cannot be rendered as source text. Stub generation for the affected
 * file is abandoned.
 */
public class RenderException extends RuntimeException {

  public RenderException (String message) {
    super(message);
  }
}
