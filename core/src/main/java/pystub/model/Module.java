//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The root of a parsed source file. Modules are produced by an upstream parser and are never
 * modified once built.
 */
public final class Module {

  /** The top-level statements of this module, in source order. */
  public final List<Stmt> statements;

  public Module (List<? extends Stmt> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  @Override public String toString () {
    return "Module" + statements;
  }
}
