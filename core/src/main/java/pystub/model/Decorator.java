//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A decorator applied to a class or function, i.e. {@code @property} or
 * {@code @functools.lru_cache(maxsize=None)}.
 */
public final class Decorator {

  /** The decorator expression before any call syntax. */
  public final Expr target;

  /** The call arguments, or null if the decorator is a bare reference. An empty list means the
    * decorator was written with empty parentheses. */
  public final List<Argument> arguments;

  /** Returns a decorator with no call syntax. */
  public static Decorator bare (Expr target) {
    return new Decorator(target, null);
  }

  public Decorator (Expr target, List<Argument> arguments) {
    this.target = Preconditions.checkNotNull(target);
    this.arguments = (arguments == null) ? null : ImmutableList.copyOf(arguments);
  }

  @Override public String toString () {
    return "@" + target + (arguments == null ? "" : arguments.toString());
  }
}
