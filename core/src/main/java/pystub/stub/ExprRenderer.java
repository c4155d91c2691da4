//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import java.util.List;
import pystub.model.Argument;
import pystub.model.Expr;

/**
 * Renders an expression subtree as source text.
 */
public interface ExprRenderer {

  /**
   * Returns the canonical source text of {@code expr}.
   * @throws RenderException if {@code expr} cannot be rendered.
   */
  String render (Expr expr);

  /**
   * Renders {@code args} comma separated, each as its {@linkplain Argument#prefix prefix}
   * followed by its value.
   * @throws RenderException if an argument value cannot be rendered.
   */
  default String renderArguments (List<Argument> args) {
    return Joiner.on(", ").join(Iterables.transform(args, a -> a.prefix() + render(a.value)));
  }
}
