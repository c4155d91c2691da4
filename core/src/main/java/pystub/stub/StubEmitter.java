//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;
import pystub.model.Decorator;
import pystub.model.Module;
import pystub.model.ModuleName;
import pystub.model.Parameter;
import pystub.model.Stmt;

/**
 * Renders a module's syntax tree as stub text: the classes, functions and imports that make up
 * its public API, with bodies replaced by {@code ...}. The walk applies these rules:
 *
 * <ul>
 * <li>A class is emitted unless its name is private or protected. Its body is walked.</li>
 * <li>A function is emitted if its name is public and it is not nested in another function. Its
 * body is walked, but functions found there are never emitted.</li>
 * <li>An import is emitted only at module scope.</li>
 * <li>Nothing else is emitted, and the walk does not descend into other statements.</li>
 * </ul>
 *
 * Every emitted class and function gets a body: if nothing in its suite survives filtering, the
 * suite is a single {@code ...} line.
 *
 * <p>An emitter holds no per-module state; each call to {@link #emit} starts a fresh pass, so one
 * emitter may be shared between threads.</p>
 */
public class StubEmitter {

  /** The lines written at the top of every stub. */
  public static final List<String> HEADER = ImmutableList.of(
    "\"\"\"", "This type stub file was generated by pystub.", "\"\"\"", "");

  /** The body of a suite with no surviving members. */
  public static final String PLACEHOLDER = "...";

  /** Returns an emitter that uses Python naming conventions and the default expression printer. */
  public static StubEmitter forPython () {
    return new StubEmitter(NameClassifier.CONVENTION, new ExprPrinter());
  }

  public StubEmitter (NameClassifier names, ExprRenderer exprs) {
    _names = Preconditions.checkNotNull(names);
    _exprs = Preconditions.checkNotNull(exprs);
  }

  /**
   * Renders {@code module} as stub text, using the line terminator and indentation of
   * {@code format}.
   * @throws RenderException if an expression in a declaration cannot be rendered.
   */
  public String emit (Module module, Formatting format) {
    Pass pass = new Pass(format);
    for (String line : HEADER) pass.emitLine(line);
    pass.walk(module.statements);
    return pass.text();
  }

  /** Renders {@code module} with {@link Formatting#DEFAULT}. */
  public String emit (Module module) {
    return emit(module, Formatting.DEFAULT);
  }

  /** Renders a decorator line: {@code @target} or {@code @target(args)}. */
  protected String printDecorator (Decorator deco) {
    String line = "@" + _exprs.render(deco.target);
    if (deco.arguments != null) line += "(" + _exprs.renderArguments(deco.arguments) + ")";
    return line;
  }

  /** Renders a parameter. Defaults are never rendered, only marked with {@code ...}. */
  protected String printParameter (Parameter param) {
    StringBuilder sb = new StringBuilder(param.category.sigil);
    if (param.name != null) sb.append(param.name);
    else if (param.category == Parameter.Category.SIMPLE) sb.append('/'); // positional-only marker
    if (param.annotation != null) sb.append(": ").append(_exprs.render(param.annotation));
    if (param.defaultValue != null) sb.append(param.annotation != null ? " = ..." : "=...");
    return sb.toString();
  }

  protected String printModuleName (ModuleName name) {
    return Strings.repeat(".", name.leadingDots) + DOT.join(name.nameParts);
  }

  protected String printImport (Stmt.Import node) {
    return "import " + COMMA.join(Iterables.transform(node.entries, e -> {
      String text = printModuleName(e.module);
      return (e.alias == null) ? text : text + " as " + e.alias;
    }));
  }

  protected String printImportFrom (Stmt.ImportFrom node) {
    String line = "from " + printModuleName(node.module) + " import ";
    if (node.isWildcard) return line + "*";
    return line + COMMA.join(Iterables.transform(
      node.entries, e -> (e.alias == null) ? e.name : e.name + " as " + e.alias));
  }

  /** The state of a single rendering of a single module. */
  private class Pass implements Stmt.Visitor<Void> {

    Pass (Formatting format) {
      _format = Preconditions.checkNotNull(format);
    }

    void walk (List<Stmt> stmts) {
      for (Stmt stmt : stmts) stmt.accept(this);
    }

    String text () {
      return _out.toString();
    }

    @Override public Void visitClass (Stmt.ClassDef node) {
      if (!_names.isPublic(node.name)) return null;

      _suiteHasContent = true;
      emitDecorators(node.decorators);
      String line = "class " + node.name;
      if (!node.arguments.isEmpty()) line += "(" + _exprs.renderArguments(node.arguments) + ")";
      emitLine(line + ":");

      emitSuite(() -> {
        _classDepth++;
        try {
          walk(node.body);
        } finally {
          _classDepth--;
        }
      });

      emitLine("");
      emitLine("");
      return null;
    }

    @Override public Void visitFunction (Stmt.FunctionDef node) {
      // nested functions are never part of the API, whatever their name
      if (_functionDepth > 0 || !_names.isPublic(node.name)) return null;

      _suiteHasContent = true;
      emitDecorators(node.decorators);
      StringBuilder line = new StringBuilder();
      if (node.isAsync) line.append("async ");
      line.append("def ").append(node.name);
      line.append('(').append(COMMA.join(Iterables.transform(
        node.parameters, StubEmitter.this::printParameter))).append(')');
      if (node.returnAnnotation != null) {
        line.append(" -> ").append(_exprs.render(node.returnAnnotation));
      }
      emitLine(line.append(':').toString());

      emitSuite(() -> {
        _functionDepth++;
        try {
          walk(node.body);
        } finally {
          _functionDepth--;
        }
      });

      emitLine("");
      return null;
    }

    @Override public Void visitImport (Stmt.Import node) {
      if (atModuleScope()) {
        _suiteHasContent = true;
        emitLine(printImport(node));
      }
      return null;
    }

    @Override public Void visitImportFrom (Stmt.ImportFrom node) {
      if (atModuleScope()) {
        _suiteHasContent = true;
        emitLine(printImportFrom(node));
      }
      return null;
    }

    @Override public Void visitOther (Stmt.Other node) {
      return null; // executable code never appears in a stub
    }

    boolean atModuleScope () {
      return _classDepth == 0 && _functionDepth == 0;
    }

    void emitDecorators (List<Decorator> decorators) {
      for (Decorator deco : decorators) emitLine(printDecorator(deco));
    }

    /**
     * Emits an indented suite whose contents are produced by {@code body}, followed by the
     * placeholder if {@code body} emitted nothing. The enclosing suite's content flag and the
     * indent are restored on every exit path.
     */
    void emitSuite (Runnable body) {
      boolean outerHasContent = _suiteHasContent;
      _suiteHasContent = false;
      _indent++;
      try {
        body.run();
        if (!_suiteHasContent) emitLine(PLACEHOLDER);
      } finally {
        _indent--;
        _suiteHasContent = outerHasContent;
      }
    }

    void emitLine (String line) {
      // blank lines carry no indentation
      if (!line.isEmpty()) for (int ii = 0; ii < _indent; ii++) _out.append(_format.indent);
      _out.append(line).append(_format.lineEnd);
    }

    private final Formatting _format;
    private final StringBuilder _out = new StringBuilder();
    private int _indent;
    private int _classDepth;
    private int _functionDepth;
    private boolean _suiteHasContent;
  }

  private final NameClassifier _names;
  private final ExprRenderer _exprs;

  private static final Joiner COMMA = Joiner.on(", ");
  private static final Joiner DOT = Joiner.on('.');
}
