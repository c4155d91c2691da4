//
// Pystub - declaration stubs for analyzed Python code

package pystub.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * An expression subtree. Stubs only render expressions that form part of a declaration:
 * annotations, decorator targets and arguments, base class lists. The set of kinds is closed;
 * consumers dispatch via {@link Visitor}.
 */
public abstract class Expr {

  /** Dispatches on the kind of an expression. */
  public interface Visitor<R> {
    R visitName (Name node);
    R visitMember (Member node);
    R visitCall (Call node);
    R visitIndex (Index node);
    R visitConstant (Constant node);
    R visitNumber (Number node);
    R visitStr (Str node);
    R visitTuple (Tuple node);
    R visitList (ListExpr node);
    R visitDict (Dict node);
    R visitUnary (Unary node);
    R visitBinary (Binary node);
    R visitEllipsis (Ellipsis node);
    R visitError (Error node);
  }

  /** A bare identifier. */
  public static final class Name extends Expr {
    public final String id;
    public Name (String id) {
      this.id = Preconditions.checkNotNull(id);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitName(this); }
  }

  /** {@code left.member}. */
  public static final class Member extends Expr {
    public final Expr left;
    public final String member;
    public Member (Expr left, String member) {
      this.left = Preconditions.checkNotNull(left);
      this.member = Preconditions.checkNotNull(member);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitMember(this); }
  }

  /** {@code callee(arguments)}. */
  public static final class Call extends Expr {
    public final Expr callee;
    public final List<Argument> arguments;
    public Call (Expr callee, List<Argument> arguments) {
      this.callee = Preconditions.checkNotNull(callee);
      this.arguments = ImmutableList.copyOf(arguments);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitCall(this); }
  }

  /** {@code base[items]}, i.e. {@code Dict[str, int]}. */
  public static final class Index extends Expr {
    public final Expr base;
    public final List<Expr> items;
    public Index (Expr base, List<? extends Expr> items) {
      Preconditions.checkArgument(!items.isEmpty(), "Subscript with no items");
      this.base = Preconditions.checkNotNull(base);
      this.items = ImmutableList.copyOf(items);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitIndex(this); }
  }

  /** A keyword constant: {@code None}, {@code True}, {@code False} or {@code __debug__}. */
  public static final class Constant extends Expr {
    public static final Set<String> KEYWORDS = ImmutableSet.of("None", "True", "False", "__debug__");
    public final String keyword;
    public Constant (String keyword) {
      Preconditions.checkArgument(KEYWORDS.contains(keyword), "Not a keyword constant: %s", keyword);
      this.keyword = keyword;
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitConstant(this); }
  }

  /** A numeric literal, kept as its source text so that {@code 0x1F} stays {@code 0x1F}. */
  public static final class Number extends Expr {
    public final String text;
    public Number (String text) {
      this.text = Preconditions.checkNotNull(text);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitNumber(this); }
  }

  /** A string literal. The value is unescaped; the prefix holds any {@code r}, {@code b},
    * {@code u} or {@code f} flags. */
  public static final class Str extends Expr {
    public final String prefix;
    public final String value;
    public Str (String prefix, String value) {
      this.prefix = Preconditions.checkNotNull(prefix);
      this.value = Preconditions.checkNotNull(value);
    }
    public Str (String value) {
      this("", value);
    }
    /** Whether backslashes in the value are literal. */
    public boolean isRaw () {
      return prefix.indexOf('r') >= 0 || prefix.indexOf('R') >= 0;
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitStr(this); }
  }

  public static final class Tuple extends Expr {
    public final List<Expr> items;
    public Tuple (List<? extends Expr> items) {
      this.items = ImmutableList.copyOf(items);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitTuple(this); }
  }

  public static final class ListExpr extends Expr {
    public final List<Expr> items;
    public ListExpr (List<? extends Expr> items) {
      this.items = ImmutableList.copyOf(items);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitList(this); }
  }

  public static final class Dict extends Expr {
    /** One {@code key: value} pair. */
    public static final class Entry {
      public final Expr key;
      public final Expr value;
      public Entry (Expr key, Expr value) {
        this.key = Preconditions.checkNotNull(key);
        this.value = Preconditions.checkNotNull(value);
      }
    }
    public final List<Entry> entries;
    public Dict (List<Entry> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitDict(this); }
  }

  /** A prefix operator: {@code -x}, {@code ~x}, {@code not x}. */
  public static final class Unary extends Expr {
    public final String operator;
    public final Expr operand;
    public Unary (String operator, Expr operand) {
      Preconditions.checkArgument(!operator.isEmpty(), "Empty unary operator");
      this.operator = operator;
      this.operand = Preconditions.checkNotNull(operand);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitUnary(this); }
  }

  /** An infix operator, i.e. the {@code |} of {@code int | None}. */
  public static final class Binary extends Expr {
    public final Expr left;
    public final String operator;
    public final Expr right;
    public Binary (Expr left, String operator, Expr right) {
      this.left = Preconditions.checkNotNull(left);
      this.operator = Preconditions.checkNotNull(operator);
      this.right = Preconditions.checkNotNull(right);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitBinary(this); }
  }

  /** The {@code ...} literal. */
  public static final class Ellipsis extends Expr {
    public static final Ellipsis INSTANCE = new Ellipsis();
    private Ellipsis () {}
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitEllipsis(this); }
  }

  /** A subtree the parser could not make sense of. */
  public static final class Error extends Expr {
    public final String message;
    public Error (String message) {
      this.message = Preconditions.checkNotNull(message);
    }
    @Override public <R> R accept (Visitor<R> visitor) { return visitor.visitError(this); }
  }

  /** Returns a {@link Name}, or a chain of {@link Member}s for a dotted name like
    * {@code typing.Optional}. */
  public static Expr dotted (String name) {
    String[] parts = name.split("\\.");
    Expr expr = new Name(parts[0]);
    for (int ii = 1; ii < parts.length; ii++) expr = new Member(expr, parts[ii]);
    return expr;
  }

  /** Returns {@code base[items]}. */
  public static Index index (Expr base, Expr... items) {
    return new Index(base, Arrays.asList(items));
  }

  /** Dispatches this expression to the appropriate method of {@code visitor}. */
  public abstract <R> R accept (Visitor<R> visitor);

  private Expr () {} // seal it!
}
