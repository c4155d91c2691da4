//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Preconditions;

/**
 * An argument in a call: a base class list, a decorator call or a call expression.
 */
public final class Argument {

  /** Distinguishes plain arguments from unpacked ones. */
  public static enum Category {
    /** {@code value} or {@code name=value}. */
    SIMPLE(""),
    /** {@code *value}. */
    UNPACKED_LIST("*"),
    /** {@code **value}. */
    UNPACKED_DICT("**");

    /** The sigil written before an argument of this category. */
    public final String sigil;

    Category (String sigil) {
      this.sigil = sigil;
    }
  }

  public final Category category;

  /** The keyword name, or null for a positional or unpacked argument. */
  public final String name;

  public final Expr value;

  /** Returns a positional argument. */
  public static Argument positional (Expr value) {
    return new Argument(Category.SIMPLE, null, value);
  }

  /** Returns a {@code name=value} argument. */
  public static Argument keyword (String name, Expr value) {
    return new Argument(Category.SIMPLE, Preconditions.checkNotNull(name), value);
  }

  public Argument (Category category, String name, Expr value) {
    this.category = Preconditions.checkNotNull(category);
    this.name = name;
    this.value = Preconditions.checkNotNull(value);
  }

  /**
   * Returns the text that precedes the rendered value: the unpack sigil, if any, followed by the
   * keyword name and {@code =}, if any.
   */
  public String prefix () {
    return (name == null) ? category.sigil : category.sigil + name + "=";
  }

  @Override public String toString () {
    return prefix() + value;
  }
}
