/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.formc.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.formc.ast.ExprBuilder.dsl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.ast.Measure;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Pos;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.ast.Side;
import net.hydromatic.formc.compile.ShapeException;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.Family;
import net.hydromatic.formc.element.FiniteElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads a form file.
 *
 * <p>A form file is a sequence of assignments {@code name = expression},
 * one per line; a line ends inside parentheses or brackets only when they
 * are closed. {@code #} starts a comment. For example:
 *
 * <blockquote><pre>
 * element = FiniteElement("Lagrange", triangle, 1)
 * u = TrialFunction(element)
 * v = TestFunction(element)
 * f = Coefficient(element)
 * a = inner(grad(u), grad(v))*dx
 * L = f*v*dx
 * </pre></blockquote>
 *
 * <p>Forms bound to "a", "L" and "M" are the forms of the file. The element
 * bound to "element", or else the first element created, is the driving
 * element of the file.
 *
 * <p>{@link FormParserImpl}, generated by JavaCC, recognizes the syntax and
 * calls this class to evaluate each construct: to look up names, apply
 * operators and call built-in functions.
 */
public class FormParser {
  private final String fileName;

  /** Values of variables, in order of first assignment. */
  private final Map<String, Object> bindings = new LinkedHashMap<>();
  /** Name of the variable being assigned; names new coefficients. */
  private @Nullable String target;
  private int coefficientCount;
  private @Nullable FiniteElement firstElement;

  private static final ImmutableMap<String, Builtin> BUILTINS;

  static {
    final ImmutableMap.Builder<String, Builtin> b = ImmutableMap.builder();
    b.put("Mesh", (p, c) -> {
      c.checkCount(1, 2);
      final Cell cell = c.cell(0);
      return Domain.of(cell, c.size() > 1 ? c.intValue(1) : 1);
    });
    b.put("FiniteElement", (p, c) -> {
      c.checkCount(3, 3);
      return p.element(
          Elements.create(c.family(0), c.domain(1), c.intValue(2)));
    });
    b.put("VectorElement", (p, c) -> {
      c.checkCount(3, 4);
      final Domain domain = c.domain(1);
      return p.element(
          Elements.vector(c.family(0), domain, c.intValue(2),
              c.size() > 3 ? c.intValue(3) : domain.dimension()));
    });
    b.put("TestFunction", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.testFunction(c.element(0));
    });
    b.put("TrialFunction", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.trialFunction(c.element(0));
    });
    final Builtin coefficient = (p, c) -> {
      c.checkCount(1, 1);
      final int count = p.coefficientCount++;
      return dsl.coefficient(count, p.coefficientName(count),
          c.element(0));
    };
    b.put("Coefficient", coefficient);
    b.put("Function", coefficient);
    b.put("Constant", (p, c) -> {
      c.checkCount(1, 1);
      final int count = p.coefficientCount++;
      return dsl.constant(count, p.coefficientName(count), c.domain(0));
    });
    b.put("FacetNormal", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.facetNormal(c.domain(0));
    });
    b.put("SpatialCoordinate", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.spatialCoordinate(c.domain(0));
    });
    for (Op op
        : ImmutableList.of(Op.GRAD, Op.DIV, Op.CURL, Op.TRANSPOSE, Op.SQRT,
            Op.EXP, Op.LN, Op.SIN, Op.COS, Op.ABS, Op.SIGN)) {
      b.put(op.padded.trim(), (p, c) -> {
        c.checkCount(1, 1);
        return dsl.call(op, c.expr(0));
      });
    }
    for (Op op : ImmutableList.of(Op.INNER, Op.DOT, Op.OUTER)) {
      b.put(op.padded.trim(), (p, c) -> {
        c.checkCount(2, 2);
        return dsl.call(op, c.expr(0), c.expr(1));
      });
    }
    b.put("tr", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.tr(c.expr(0));
    });
    b.put("avg", (p, c) -> {
      c.checkCount(1, 1);
      return dsl.avg(c.expr(0));
    });
    b.put("jump", (p, c) -> {
      c.checkCount(1, 2);
      return c.size() == 1
          ? dsl.jump(c.expr(0))
          : dsl.jump(c.expr(0), c.expr(1));
    });
    BUILTINS = b.build();
  }

  private FormParser(String fileName) {
    this.fileName = requireNonNull(fileName);
  }

  /** Parses the text of a form file. */
  public static FormFile parse(String fileName, String text) {
    final FormParser evaluator = new FormParser(fileName);
    final FormParserImpl parser = new FormParserImpl(new StringReader(text));
    parser.setEvaluator(evaluator);
    try {
      return parser.fileEof();
    } catch (ParseException e) {
      throw evaluator.syntaxError(e);
    }
  }

  /** Reads and parses a form file. */
  public static FormFile parse(File file) throws IOException {
    final String text =
        new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    return parse(file.getName(), text);
  }

  /** Returns a file name without directory or extension; for example,
   * "demo/poisson.form" becomes "poisson". */
  public static String stem(String fileName) {
    String s = new File(fileName).getName();
    final int dot = s.lastIndexOf('.');
    if (dot > 0) {
      s = s.substring(0, dot);
    }
    return s;
  }

  /** Returns the position of a token. */
  Pos pos(Token t) {
    return Pos.of(fileName, t.beginLine, t.beginColumn, t.endColumn + 1);
  }

  /** Converts an error from the generated parser, which has the token
   * that it did not expect. */
  private FormParseException syntaxError(ParseException e) {
    final Token t = e.currentToken.next;
    switch (t.kind) {
      case FormParserImplConstants.UNEXPECTED_CHAR:
        return new FormParseException("unexpected character '" + t.image
            + "'", pos(t));
      case FormParserImplConstants.UNTERMINATED_STRING:
        return new FormParseException("unterminated string",
            Pos.of(fileName, t.beginLine, t.beginColumn,
                t.beginColumn + 1));
      case FormParserImplConstants.NEWLINE:
        return new FormParseException("unexpected end of line", pos(t));
      case FormParserImplConstants.EOF:
        return new FormParseException("unexpected end of file", pos(t));
      default:
        return new FormParseException("unexpected '" + t.image + "'",
            pos(t));
    }
  }

  /** Builds the file, after the last statement. */
  FormFile file() {
    final Map<String, Form> forms = new LinkedHashMap<>();
    for (String formName : FormFile.FORM_NAMES) {
      final Object value = bindings.get(formName);
      if (value != null) {
        forms.put(formName, (Form) value);
      }
    }
    final Object element = bindings.get("element");
    return FormFile.of(stem(fileName), forms,
        element instanceof FiniteElement
            ? (FiniteElement) element
            : firstElement);
  }

  void beginStatement(String name) {
    target = name;
  }

  /** Binds a variable to the value of an assignment.
   *
   * @param name Variable name
   * @param pos Position of the start of the expression
   * @param value Value of the expression
   */
  void endStatement(String name, Pos pos, Object value) {
    target = null;
    if (FormFile.FORM_NAMES.contains(name) && !(value instanceof Form)) {
      throw new FormParseException("'" + name + "' must be a form, but is "
          + describe(value), pos);
    }
    bindings.put(name, value);
  }

  Object number(Pos pos, String text) {
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw new FormParseException("invalid number '" + text + "'", pos);
    }
  }

  Object negate(Pos pos, Object a) {
    if (a instanceof Double) {
      return -(Double) a;
    }
    final Expr e = toExpr(a, pos);
    return withPos(pos, () -> dsl.negate(e));
  }

  Object power(Pos pos, Object a, Object exponent) {
    if (!(exponent instanceof Double)) {
      throw new FormParseException("exponent must be a number, but is "
          + describe(exponent), pos);
    }
    final double x = (Double) exponent;
    if (a instanceof Double) {
      return Math.pow((Double) a, x);
    }
    final Expr e = toExpr(a, pos);
    return withPos(pos, () -> dsl.power(e, x));
  }

  Object index(Pos pos, Object a, Object index) {
    final Expr e = toExpr(a, pos);
    final int component = intValue(index, pos);
    return withPos(pos, () -> dsl.index(e, component));
  }

  /** Adds a positional argument to a call. */
  void positional(Pos pos, List<Object> args,
      Map<String, Object> keywordArgs, Object value) {
    if (!keywordArgs.isEmpty()) {
      throw new FormParseException("positional argument follows keyword "
          + "argument", pos);
    }
    args.add(value);
  }

  Object lookup(Pos pos, String name) {
    final Object value = bindings.get(name);
    if (value != null) {
      return value;
    }
    final Builtin builtin = BUILTINS.get(name);
    if (builtin != null) {
      return builtin;
    }
    final Cell cell = Cell.lookup(name);
    if (cell != null) {
      return cell;
    }
    switch (name) {
      case "dx":
        return dsl.dx();
      case "ds":
        return dsl.ds();
      case "dS":
        return dsl.dS();
      default:
        throw new FormParseException("unknown name '" + name + "'", pos);
    }
  }

  /** Applies a function, measure or restriction to arguments. */
  Object call(Pos start, Object f, Call c) {
    if (f instanceof Builtin) {
      return withPos(start, () -> ((Builtin) f).apply(this, c));
    }
    if (f instanceof Measure) {
      return measure((Measure) f, c);
    }
    if (f instanceof Expr) {
      c.checkCount(1, 1);
      final String symbol = c.string(0);
      for (Side side : Side.values()) {
        if (side.symbol.equals(symbol)) {
          return withPos(start, () -> dsl.restrict((Expr) f, side));
        }
      }
      throw new FormParseException("invalid side '" + symbol
          + "'; expected '+' or '-'", c.pos);
    }
    throw new FormParseException("cannot call " + describe(f), start);
  }

  /** Applies options to a measure, as in
   * {@code dx(1, degree=2, representation="tensor")}. */
  private Measure measure(Measure measure, Call c) {
    c.checkPositional(0, 1);
    Measure m = measure;
    if (c.size() > 0) {
      m = m.withSubdomain(c.intValue(0));
    }
    for (Map.Entry<String, Object> e : c.keywordArgs.entrySet()) {
      switch (e.getKey()) {
        case "subdomain_id":
          m = m.withSubdomain(intValue(e.getValue(), c.pos));
          break;
        case "degree":
          m = m.withDegree(intValue(e.getValue(), c.pos));
          break;
        case "representation":
          m = m.withRepresentation(
              representation(e.getValue(), c.pos));
          break;
        default:
          throw new FormParseException("unknown measure option '"
              + e.getKey() + "'", c.pos);
      }
    }
    return m;
  }

  private static Representation representation(Object value, Pos pos) {
    if (value instanceof String) {
      for (Representation r : Representation.values()) {
        if (r.name().toLowerCase(Locale.ROOT).equals(value)) {
          return r;
        }
      }
    }
    throw new FormParseException("invalid representation " + describe(value)
        + "; expected \"tensor\", \"quadrature\" or \"auto\"", pos);
  }

  /** Applies a binary operator: "+", "-", "*" or "/". */
  Object binary(Pos pos, String op, Object a0, Object a1) {
    if (a0 instanceof Double && a1 instanceof Double) {
      final double x0 = (Double) a0;
      final double x1 = (Double) a1;
      switch (op) {
        case "+":
          return x0 + x1;
        case "-":
          return x0 - x1;
        case "*":
          return x0 * x1;
        default:
          if (x1 == 0d) {
            throw new FormParseException("division by zero", pos);
          }
          return x0 / x1;
      }
    }
    if (a0 instanceof Form && a1 instanceof Form && op.equals("+")) {
      return ((Form) a0).plus((Form) a1);
    }
    if (a1 instanceof Measure && op.equals("*")) {
      final Expr integrand = toExpr(a0, pos);
      return withPos(pos, () ->
          dsl.form(dsl.integral(integrand, (Measure) a1)));
    }
    if (!isExpr(a0) || !isExpr(a1)) {
      throw new FormParseException("cannot apply '" + op + "' to "
          + describe(a0) + " and " + describe(a1), pos);
    }
    final Expr e0 = toExpr(a0, pos);
    final Expr e1 = toExpr(a1, pos);
    switch (op) {
      case "+":
        return withPos(pos, () -> dsl.plus(e0, e1));
      case "-":
        return withPos(pos, () -> dsl.minus(e0, e1));
      case "*":
        return withPos(pos, () -> dsl.times(e0, e1));
      default:
        return withPos(pos, () -> dsl.divide(e0, e1));
    }
  }

  // helpers

  /** Evaluates an action, attaching a position to any shape error. */
  private static <T> T withPos(Pos pos, Supplier<T> action) {
    try {
      return action.get();
    } catch (ShapeException e) {
      throw e.pos() == Pos.ZERO ? e.withPos(pos) : e;
    }
  }

  private FiniteElement element(FiniteElement element) {
    if (firstElement == null) {
      firstElement = element;
    }
    return element;
  }

  private String coefficientName(int count) {
    return target != null ? target : "w" + count;
  }

  private static boolean isExpr(Object o) {
    return o instanceof Expr || o instanceof Double;
  }

  private static Expr toExpr(Object o, Pos pos) {
    if (o instanceof Expr) {
      return (Expr) o;
    }
    if (o instanceof Double) {
      return dsl.real((Double) o);
    }
    throw new FormParseException("expected an expression, but got "
        + describe(o), pos);
  }

  private static int intValue(Object o, Pos pos) {
    if (o instanceof Double) {
      final double d = (Double) o;
      if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
        return (int) d;
      }
    }
    throw new FormParseException("expected an integer, but got "
        + describe(o), pos);
  }

  private static String describe(Object o) {
    if (o instanceof Double) {
      return "number " + o;
    } else if (o instanceof String) {
      return "string \"" + o + "\"";
    } else if (o instanceof Cell) {
      return "cell " + ((Cell) o).lowerName();
    } else if (o instanceof Domain) {
      return "mesh " + o;
    } else if (o instanceof FiniteElement) {
      return "element " + o;
    } else if (o instanceof Expr) {
      return "expression " + o;
    } else if (o instanceof Measure) {
      return "measure " + o;
    } else if (o instanceof Form) {
      return "form";
    } else {
      return "function";
    }
  }

  /** Built-in function. */
  @FunctionalInterface
  private interface Builtin {
    Object apply(FormParser parser, Call call);
  }

  /** Arguments of a call, with accessors that check their kinds. */
  static class Call {
    /** Position of the opening parenthesis. */
    final Pos pos;
    final List<Object> args;
    final Map<String, Object> keywordArgs;

    Call(Pos pos, List<Object> args, Map<String, Object> keywordArgs) {
      this.pos = pos;
      this.args = args;
      this.keywordArgs = keywordArgs;
    }

    int size() {
      return args.size();
    }

    /** Checks the number of positional arguments, and that there are no
     * keyword arguments. */
    void checkCount(int min, int max) {
      checkPositional(min, max);
      if (!keywordArgs.isEmpty()) {
        throw new FormParseException("unexpected keyword argument '"
            + keywordArgs.keySet().iterator().next() + "'", pos);
      }
    }

    void checkPositional(int min, int max) {
      if (args.size() < min || args.size() > max) {
        throw new FormParseException("expected "
            + (min == max ? String.valueOf(min) : min + " to " + max)
            + " arguments, got " + args.size(), pos);
      }
    }

    Object get(int i) {
      return args.get(i);
    }

    Expr expr(int i) {
      return toExpr(get(i), pos);
    }

    int intValue(int i) {
      return FormParser.intValue(get(i), pos);
    }

    String string(int i) {
      if (get(i) instanceof String) {
        return (String) get(i);
      }
      throw new FormParseException("expected a string, but got "
          + describe(get(i)), pos);
    }

    Cell cell(int i) {
      if (get(i) instanceof Cell) {
        return (Cell) get(i);
      }
      throw new FormParseException("expected a cell, but got "
          + describe(get(i)), pos);
    }

    /** Returns a domain; a cell denotes its affine domain. */
    Domain domain(int i) {
      if (get(i) instanceof Domain) {
        return (Domain) get(i);
      }
      if (get(i) instanceof Cell) {
        return Domain.of((Cell) get(i));
      }
      throw new FormParseException("expected a cell or mesh, but got "
          + describe(get(i)), pos);
    }

    Family family(int i) {
      final Family family = Family.lookup(string(i));
      if (family == null) {
        throw new FormParseException("unknown element family '" + get(i)
            + "'", pos);
      }
      return family;
    }

    FiniteElement element(int i) {
      if (get(i) instanceof FiniteElement) {
        return (FiniteElement) get(i);
      }
      throw new FormParseException("expected an element, but got "
          + describe(get(i)), pos);
    }
  }
}

// End FormParser.java
