//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.Map;
import pystub.model.Expr;

/**
 * Renders expressions in their canonical Python form. Operator operands are parenthesized where
 * Python's precedence rules would otherwise regroup them, so {@code (a + b) * c} keeps its
 * grouping; no other parentheses are added.
 */
public class ExprPrinter implements ExprRenderer, Expr.Visitor<String> {

  @Override public String render (Expr expr) {
    return expr.accept(this);
  }

  @Override public String visitName (Expr.Name node) {
    return node.id;
  }

  @Override public String visitMember (Expr.Member node) {
    return render(node.left) + "." + node.member;
  }

  @Override public String visitCall (Expr.Call node) {
    return render(node.callee) + "(" + renderArguments(node.arguments) + ")";
  }

  @Override public String visitIndex (Expr.Index node) {
    return render(node.base) + "[" + printAll(node.items) + "]";
  }

  @Override public String visitConstant (Expr.Constant node) {
    return node.keyword;
  }

  @Override public String visitNumber (Expr.Number node) {
    return node.text;
  }

  @Override public String visitStr (Expr.Str node) {
    if (node.isRaw()) {
      String quote = rawQuote(node.value);
      if (quote != null) return node.prefix + quote + node.value + quote;
      // no quoting keeps this raw value intact, so write it as an escaped literal instead
      return escaped(CharMatcher.anyOf("rR").removeFrom(node.prefix), node.value);
    }
    return escaped(node.prefix, node.value);
  }

  @Override public String visitTuple (Expr.Tuple node) {
    // a one element tuple needs its trailing comma
    if (node.items.size() == 1) return "(" + render(node.items.get(0)) + ",)";
    return "(" + printAll(node.items) + ")";
  }

  @Override public String visitList (Expr.ListExpr node) {
    return "[" + printAll(node.items) + "]";
  }

  @Override public String visitDict (Expr.Dict node) {
    return "{" + COMMA.join(Iterables.transform(
      node.entries, e -> render(e.key) + ": " + render(e.value))) + "}";
  }

  @Override public String visitUnary (Expr.Unary node) {
    String op = node.operator;
    boolean word = Character.isLetter(op.charAt(op.length()-1));
    // a unary operand of equal precedence needs no grouping: -(-a) is --a
    return op + (word ? " " : "") + operand(node.operand, precedence(node) - 1);
  }

  @Override public String visitBinary (Expr.Binary node) {
    int prec = precedence(node);
    // comparisons chain rather than associate, ** associates to the right, the rest to the left
    boolean chains = (prec == COMPARISON), rightAssoc = node.operator.equals("**");
    int leftMin = (chains || rightAssoc) ? prec : prec - 1;
    int rightMin = (chains || !rightAssoc) ? prec : prec - 1;
    return operand(node.left, leftMin) + " " + node.operator + " " + operand(node.right, rightMin);
  }

  @Override public String visitEllipsis (Expr.Ellipsis node) {
    return "...";
  }

  @Override public String visitError (Expr.Error node) {
    throw new RenderException("Unrenderable expression: " + node.message);
  }

  protected String printAll (List<Expr> exprs) {
    return COMMA.join(Iterables.transform(exprs, this::render));
  }

  /** Renders {@code expr}, parenthesized unless it binds tighter than {@code groupedAt}. */
  protected String operand (Expr expr, int groupedAt) {
    String text = render(expr);
    return (precedence(expr) <= groupedAt) ? "(" + text + ")" : text;
  }

  /** Returns how tightly {@code expr} binds; higher binds tighter. Atoms bind tightest. */
  protected static int precedence (Expr expr) {
    if (expr instanceof Expr.Binary) {
      String op = ((Expr.Binary)expr).operator;
      Integer prec = BINARY_PRECEDENCE.get(op);
      if (prec == null) throw new RenderException("Unknown binary operator: " + op);
      return prec;
    }
    if (expr instanceof Expr.Unary) return ((Expr.Unary)expr).operator.equals("not") ? 3 : 11;
    return ATOM;
  }

  /** Returns {@code value} quoted for a raw literal, or null if no quoting can hold it. */
  protected static String rawQuote (String value) {
    // an odd run of trailing backslashes would escape the closing quote
    int trailing = value.length() - 1 - CharMatcher.isNot('\\').lastIndexIn(value);
    if (trailing % 2 == 1) return null;
    if (!CharMatcher.anyOf("\r\n").matchesAnyOf(value)) {
      if (value.indexOf('\'') < 0) return "'";
      if (value.indexOf('"') < 0) return "\"";
    }
    for (String quote : TRIPLE_QUOTES) {
      if (!value.contains(quote) && !value.endsWith(quote.substring(0, 1))) return quote;
    }
    return null;
  }

  protected static String escaped (String prefix, String value) {
    StringBuilder sb = new StringBuilder(prefix).append('\'');
    for (int ii = 0, ll = value.length(); ii < ll; ii++) {
      char c = value.charAt(ii);
      switch (c) {
      case '\\': sb.append("\\\\"); break;
      case '\'': sb.append("\\'"); break;
      case '\n': sb.append("\\n"); break;
      case '\r': sb.append("\\r"); break;
      case '\t': sb.append("\\t"); break;
      default:   sb.append(c); break;
      }
    }
    return sb.append('\'').toString();
  }

  protected static final Joiner COMMA = Joiner.on(", ");

  protected static final int COMPARISON = 4;
  protected static final int ATOM = Integer.MAX_VALUE;

  protected static final Map<String,Integer> BINARY_PRECEDENCE =
    ImmutableMap.<String,Integer>builder()
    .put("or", 1).put("and", 2)
    .put("in", COMPARISON).put("not in", COMPARISON).put("is", COMPARISON)
    .put("is not", COMPARISON).put("<", COMPARISON).put("<=", COMPARISON)
    .put(">", COMPARISON).put(">=", COMPARISON).put("==", COMPARISON).put("!=", COMPARISON)
    .put("|", 5).put("^", 6).put("&", 7).put("<<", 8).put(">>", 8)
    .put("+", 9).put("-", 9)
    .put("*", 10).put("@", 10).put("/", 10).put("//", 10).put("%", 10)
    .put("**", 12)
    .build();

  private static final String[] TRIPLE_QUOTES = { "'''", "\"\"\"" };
}
