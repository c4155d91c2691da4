//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A statement in a module, class body or function body. The set of statement kinds is closed:
 * consumers dispatch via {@link Visitor}, which has one method per kind.
 */
public abstract class Stmt {

  /** Dispatches on the kind of a statement. */
  public interface Visitor<R> {
    R visitClass (ClassDef node);
    R visitFunction (FunctionDef node);
    R visitImport (Import node);
    R visitImportFrom (ImportFrom node);
    R visitOther (Other node);
  }

  /** A class declaration: {@code class Name(bases): body}. */
  public static final class ClassDef extends Stmt {

    public final String name;
    public final List<Decorator> decorators;
    /** Base classes and keyword arguments such as {@code metaclass=ABCMeta}. */
    public final List<Argument> arguments;
    public final List<Stmt> body;

    public ClassDef (String name, List<Decorator> decorators, List<Argument> arguments,
                     List<? extends Stmt> body) {
      this.name = Preconditions.checkNotNull(name);
      this.decorators = ImmutableList.copyOf(decorators);
      this.arguments = ImmutableList.copyOf(arguments);
      this.body = ImmutableList.copyOf(body);
    }

    @Override public <R> R accept (Visitor<R> visitor) {
      return visitor.visitClass(this);
    }

    @Override public String toString () {
      return "class " + name;
    }
  }

  /** A function or method declaration: {@code [async] def name(params) [-> ret]: body}. */
  public static final class FunctionDef extends Stmt {

    public final String name;
    public final boolean isAsync;
    public final List<Decorator> decorators;
    public final List<Parameter> parameters;
    /** The return annotation, or null. */
    public final Expr returnAnnotation;
    public final List<Stmt> body;

    public FunctionDef (String name, boolean isAsync, List<Decorator> decorators,
                        List<Parameter> parameters, Expr returnAnnotation,
                        List<? extends Stmt> body) {
      this.name = Preconditions.checkNotNull(name);
      this.isAsync = isAsync;
      this.decorators = ImmutableList.copyOf(decorators);
      this.parameters = ImmutableList.copyOf(parameters);
      this.returnAnnotation = returnAnnotation;
      this.body = ImmutableList.copyOf(body);
    }

    @Override public <R> R accept (Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }

    @Override public String toString () {
      return (isAsync ? "async def " : "def ") + name;
    }
  }

  /** {@code import a.b as c, d}. */
  public static final class Import extends Stmt {

    /** One comma separated entry of an import statement. */
    public static final class Entry {
      public final ModuleName module;
      /** The {@code as} name, or null. */
      public final String alias;

      public Entry (ModuleName module, String alias) {
        this.module = Preconditions.checkNotNull(module);
        this.alias = alias;
      }
    }

    public final List<Entry> entries;

    public Import (List<Entry> entries) {
      Preconditions.checkArgument(!entries.isEmpty(), "Import with no entries");
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override public <R> R accept (Visitor<R> visitor) {
      return visitor.visitImport(this);
    }

    @Override public String toString () {
      return "import " + entries.get(0).module + (entries.size() > 1 ? ", ..." : "");
    }
  }

  /** {@code from module import x as y, z} or {@code from module import *}. */
  public static final class ImportFrom extends Stmt {

    /** One imported name. */
    public static final class Entry {
      public final String name;
      /** The {@code as} name, or null. */
      public final String alias;

      public Entry (String name, String alias) {
        this.name = Preconditions.checkNotNull(name);
        this.alias = alias;
      }
    }

    public final ModuleName module;
    public final boolean isWildcard;
    /** The imported names. Empty for a wildcard import. */
    public final List<Entry> entries;

    /** Returns {@code from module import *}. */
    public static ImportFrom wildcard (ModuleName module) {
      return new ImportFrom(module, true, ImmutableList.<Entry>of());
    }

    public ImportFrom (ModuleName module, boolean isWildcard, List<Entry> entries) {
      Preconditions.checkArgument(isWildcard ? entries.isEmpty() : !entries.isEmpty(),
                                  "Wildcard imports have no entries, others need at least one");
      this.module = Preconditions.checkNotNull(module);
      this.isWildcard = isWildcard;
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override public <R> R accept (Visitor<R> visitor) {
      return visitor.visitImportFrom(this);
    }

    @Override public String toString () {
      return "from " + module + " import " + (isWildcard ? "*" : "...");
    }
  }

  /**
   * Any statement that is not a declaration or import: assignments, expression statements,
   * control flow and so on. Its contents are opaque.
   */
  public static final class Other extends Stmt {

    /** A short description of the statement, i.e. {@code "assign"} or {@code "if"}. */
    public final String kind;

    public Other (String kind) {
      this.kind = Preconditions.checkNotNull(kind);
    }

    @Override public <R> R accept (Visitor<R> visitor) {
      return visitor.visitOther(this);
    }

    @Override public String toString () {
      return kind;
    }
  }

  /** Dispatches this statement to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  private Stmt () {} // seal it!
}
