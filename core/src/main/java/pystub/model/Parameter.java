//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Preconditions;

/**
 * A parameter in a function signature.
 */
public final class Parameter {

  public static enum Category {
    SIMPLE(""),
    /** {@code *args}, or a bare {@code *} keyword-only separator when unnamed. */
    VAR_ARGS("*"),
    /** {@code **kwargs}. */
    VAR_KWARGS("**");

    public final String sigil;

    Category (String sigil) {
      this.sigil = sigil;
    }
  }

  public final Category category;

  /** The parameter name. Null for the separators: a bare {@code *} has category
    * {@link Category#VAR_ARGS}, the positional-only {@code /} has {@link Category#SIMPLE}. */
  public final String name;

  /** The type annotation, or null. */
  public final Expr annotation;

  /** The default value, or null. Stubs only ever reveal whether this is present. */
  public final Expr defaultValue;

  /** The positional-only separator {@code /}. */
  public static final Parameter POSITIONAL_ONLY = new Parameter(Category.SIMPLE, null, null, null);

  /** The keyword-only separator {@code *}. */
  public static final Parameter KEYWORD_ONLY = new Parameter(Category.VAR_ARGS, null, null, null);

  /** Returns a plain parameter with no annotation or default. */
  public static Parameter simple (String name) {
    return new Parameter(Category.SIMPLE, Preconditions.checkNotNull(name), null, null);
  }

  public Parameter (Category category, String name, Expr annotation, Expr defaultValue) {
    Preconditions.checkArgument(name != null || category != Category.VAR_KWARGS,
                                "A ** parameter must be named");
    this.category = Preconditions.checkNotNull(category);
    this.name = name;
    this.annotation = annotation;
    this.defaultValue = defaultValue;
  }

  /** Returns a copy of this parameter with {@code annotation} as its type annotation. */
  public Parameter annotated (Expr annotation) {
    return new Parameter(category, name, annotation, defaultValue);
  }

  /** Returns a copy of this parameter with {@code defaultValue} as its default. */
  public Parameter withDefault (Expr defaultValue) {
    return new Parameter(category, name, annotation, defaultValue);
  }

  @Override public String toString () {
    return category.sigil + (name == null ? "" : name);
  }
}
