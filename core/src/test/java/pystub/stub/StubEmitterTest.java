//
// Pystub - declaration stubs for analyzed Python code

package pystub.stub;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.Arrays;
import pystub.model.Argument;
import pystub.model.Decorator;
import pystub.model.Expr;
import pystub.model.Module;
import pystub.model.Parameter;
import pystub.model.Stmt;
import org.junit.*;
import static org.junit.Assert.*;
import static pystub.model.Trees.*;

public class StubEmitterTest {

  /** Joins {@code lines} after the standard header, terminating each with a newline. */
  public static String stub (String... lines) {
    return Joiner.on("\n").join(Iterables.concat(StubEmitter.HEADER, Arrays.asList(lines))) + "\n";
  }

  private final StubEmitter emitter = StubEmitter.forPython();

  @Test public void testEmptyModule () {
    assertEquals(stub(), emitter.emit(module()));
  }

  @Test public void testRoundTripShape () {
    Module mod = module(
      cls("Foo",
          def("bar", ImmutableList.of(param("self")), name("int")),
          method("__secret")),
      def("_helper"));
    assertEquals(stub("class Foo:",
                      "    def bar(self) -> int:",
                      "        ...",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testPrivateAndProtectedClassesOmitted () {
    Module mod = module(
      cls("_Hidden", method("visible")),
      cls("__Secret", method("visible")),
      cls("Visible"));
    String out = emitter.emit(mod);
    assertEquals(stub("class Visible:",
                      "    ...",
                      "",
                      ""), out);
    assertFalse(out.contains("Hidden"));
    assertFalse(out.contains("Secret"));
    assertFalse(out.contains("def"));
  }

  @Test public void testDunderMethodsArePublic () {
    Module mod = module(cls("Point", method("__init__"), method("_norm"), method("__repr__")));
    assertEquals(stub("class Point:",
                      "    def __init__(self):",
                      "        ...",
                      "",
                      "    def __repr__(self):",
                      "        ...",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testNestedFunctionsErased () {
    Module mod = module(
      def("outer", ImmutableList.of(param("x")), null,
          other("assign"),
          def("inner", def("innermost")),
          def("_private_inner"),
          other("return")));
    String out = emitter.emit(mod);
    assertEquals(stub("def outer(x):",
                      "    ...",
                      ""), out);
    assertFalse(out.contains("inner"));
  }

  @Test public void testMethodBodiesDropNestedFunctions () {
    Module mod = module(cls("Service", method("run", def("callback"))));
    assertEquals(stub("class Service:",
                      "    def run(self):",
                      "        ...",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testClassInsideFunctionKeepsClassButNotMethods () {
    Module mod = module(def("factory", cls("Product", method("make"))));
    assertEquals(stub("def factory():",
                      "    class Product:",
                      "        ...",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testImportScoping () {
    Module mod = module(
      imp("os"),
      from("typing", "List"),
      cls("C",
          imp("json"),
          from("typing", "Dict"),
          method("m", from("collections", "deque"), imp("re"))),
      def("f", imp("sys")));
    String out = emitter.emit(mod);
    assertEquals(stub("import os",
                      "from typing import List",
                      "class C:",
                      "    def m(self):",
                      "        ...",
                      "",
                      "",
                      "",
                      "def f():",
                      "    ...",
                      ""), out);
    assertFalse(out.contains("json"));
    assertFalse(out.contains("Dict"));
    assertFalse(out.contains("deque"));
    assertFalse(out.contains("sys"));
  }

  @Test public void testClassWithOnlyImportsGetsPlaceholder () {
    Module mod = module(cls("Config", imp("os"), other("assign")));
    assertEquals(stub("class Config:",
                      "    ...",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testNestedSuitesTrackEmptinessIndependently () {
    Module mod = module(
      cls("Outer",
          cls("Empty", method("_hidden")),
          cls("Full", method("shown")),
          cls("AlsoEmpty")));
    assertEquals(stub("class Outer:",
                      "    class Empty:",
                      "        ...",
                      "",
                      "",
                      "    class Full:",
                      "        def shown(self):",
                      "            ...",
                      "",
                      "",
                      "",
                      "    class AlsoEmpty:",
                      "        ...",
                      "",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testParameterDefaultsRedacted () {
    Module mod = module(def(
      "configure",
      ImmutableList.of(
        param("self"),
        param("x").annotated(name("int")).withDefault(new Expr.Number("5")),
        param("y").withDefault(new Expr.Str("secret-default")),
        new Parameter(Parameter.Category.VAR_ARGS, "args", name("str"), null),
        param("key").annotated(Expr.index(name("Optional"), name("str")))
                    .withDefault(new Expr.Constant("None")),
        new Parameter(Parameter.Category.VAR_KWARGS, "kwargs", null, null)),
      new Expr.Constant("None")));
    String out = emitter.emit(mod);
    assertEquals(stub("def configure(self, x: int = ..., y=..., *args: str, " +
                      "key: Optional[str] = ..., **kwargs) -> None:",
                      "    ...",
                      ""), out);
    assertFalse(out.contains("5"));
    assertFalse(out.contains("secret-default"));
  }

  @Test public void testParameterSeparators () {
    Module mod = module(def(
      "g", ImmutableList.of(param("a"), Parameter.POSITIONAL_ONLY, param("b"),
                            Parameter.KEYWORD_ONLY, param("c").withDefault(new Expr.Number("1"))),
      null));
    assertEquals(stub("def g(a, /, b, *, c=...):",
                      "    ...",
                      ""), emitter.emit(mod));
  }

  @Test public void testDecoratorsAndArguments () {
    Stmt.FunctionDef getter = new Stmt.FunctionDef(
      "name", true, ImmutableList.of(Decorator.bare(name("property"))),
      ImmutableList.of(param("self")), name("str"), ImmutableList.<Stmt>of());
    Module mod = module(cls(
      "Config",
      ImmutableList.of(
        Decorator.bare(name("dataclass")),
        new Decorator(name("functools.lru_cache"),
                      ImmutableList.of(Argument.keyword("maxsize", new Expr.Constant("None")))),
        new Decorator(name("register"), ImmutableList.of(
          new Argument(Argument.Category.UNPACKED_LIST, null, name("handlers")),
          new Argument(Argument.Category.UNPACKED_DICT, null, name("options")))),
        new Decorator(name("pytest.fixture"), ImmutableList.<Argument>of()),
        Decorator.bare(name("_internal"))),
      ImmutableList.of(Argument.positional(name("Base")),
                       Argument.keyword("metaclass", name("abc.ABCMeta"))),
      getter));
    assertEquals(stub("@dataclass",
                      "@functools.lru_cache(maxsize=None)",
                      "@register(*handlers, **options)",
                      "@pytest.fixture()",
                      "@_internal",
                      "class Config(Base, metaclass=abc.ABCMeta):",
                      "    @property",
                      "    async def name(self) -> str:",
                      "        ...",
                      "",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testDecoratorsOfFilteredDeclarationsOmitted () {
    Stmt.FunctionDef hidden = new Stmt.FunctionDef(
      "_hidden", false, ImmutableList.of(Decorator.bare(name("staticmethod"))),
      ImmutableList.<Parameter>of(), null, ImmutableList.<Stmt>of());
    String out = emitter.emit(module(hidden));
    assertEquals(stub(), out);
  }

  @Test public void testBaseClassArgumentsRenderedVerbatim () {
    Module mod = module(cls(
      "Point", ImmutableList.<Decorator>of(),
      ImmutableList.of(Argument.positional(Expr.index(name("NamedTuple"), name("int"))),
                       Argument.keyword("total", new Expr.Constant("False")))));
    assertEquals(stub("class Point(NamedTuple[int], total=False):",
                      "    ...",
                      "",
                      ""), emitter.emit(mod));
  }

  @Test public void testImportForms () {
    Module mod = module(
      new Stmt.Import(ImmutableList.of(
        new Stmt.Import.Entry(moduleName("os.path"), "osp"),
        new Stmt.Import.Entry(moduleName("sys"), null))),
      from(".", "sibling"),
      new Stmt.ImportFrom(moduleName("..pkg.mod"), false, ImmutableList.of(
        new Stmt.ImportFrom.Entry("a", "b"),
        new Stmt.ImportFrom.Entry("c", null))),
      Stmt.ImportFrom.wildcard(moduleName("typing")));
    assertEquals(stub("import os.path as osp, sys",
                      "from . import sibling",
                      "from ..pkg.mod import a as b, c",
                      "from typing import *"), emitter.emit(mod));
  }

  @Test public void testFormattingApplied () {
    Module mod = module(cls("A", method("m")));
    String out = emitter.emit(mod, new Formatting("\r\n", "\t"));
    String expect = Joiner.on("\r\n").join(Iterables.concat(
      StubEmitter.HEADER, ImmutableList.of("class A:", "\tdef m(self):", "\t\t...", "", "", ""))) +
      "\r\n";
    assertEquals(expect, out);
  }

  @Test public void testOtherStatementsIgnored () {
    Module mod = module(other("assign"), other("if"), def("f", other("return")), other("expr"));
    assertEquals(stub("def f():",
                      "    ...",
                      ""), emitter.emit(mod));
  }

  @Test(expected = RenderException.class)
  public void testRenderFailurePropagates () {
    emitter.emit(module(cls("Broken", ImmutableList.<Decorator>of(),
                            ImmutableList.of(Argument.positional(new Expr.Error("bad token"))))));
  }

  @Test public void testFailureInsideSuiteDoesNotPoisonNextEmit () {
    Module bad = module(cls("A", def("m", ImmutableList.of(param("self")),
                                     new Expr.Error("bad annotation"))));
    try {
      emitter.emit(bad);
      fail("Expected render failure");
    } catch (RenderException e) {
      // expected
    }
    assertEquals(stub("class B:",
                      "    ...",
                      "",
                      ""), emitter.emit(module(cls("B"))));
  }

  @Test public void testIdempotent () {
    Module mod = module(
      imp("os"),
      cls("Foo", method("bar"), method("_baz"), cls("Inner")),
      def("top", ImmutableList.of(param("x").withDefault(new Expr.Number("3"))), null));
    String first = emitter.emit(mod);
    assertEquals(first, emitter.emit(mod));
    assertEquals(first, StubEmitter.forPython().emit(mod));
  }

  @Test public void testInjectedCollaborators () {
    NameClassifier onlyHidden = new NameClassifier() {
      @Override public boolean isPrivate (String name) { return name.equals("hidden"); }
      @Override public boolean isProtected (String name) { return false; }
    };
    StubEmitter custom = new StubEmitter(onlyHidden, expr -> "T");
    Module mod = module(
      cls("_Shown", def("hidden"), def("_kept", ImmutableList.of(param("a")), name("int"))));
    assertEquals(stub("class _Shown:",
                      "    def _kept(a) -> T:",
                      "        ...",
                      "",
                      "",
                      ""), custom.emit(mod));
  }
}
