/*
 * Copyright 2026 The Minipy Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.minipy.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A syntax tree construction helper class.
 *
 * <p>Child layouts, with {@code ?} marking children that are {@link Token#EMPTY} when absent:
 *
 * <pre>
 * MODULE          stmt*
 * FUNCTION_DEF    DECORATORS ARGUMENTS returns? BLOCK           (name; IS_ASYNC)
 * CLASS_DEF       DECORATORS ARG_LIST BLOCK                      (name)
 * ASSIGN          target+ value
 * AUG_ASSIGN      target value                                   (OPERATOR)
 * ANN_ASSIGN      target annotation value?                       (SIMPLE)
 * FOR             target iter BLOCK orelse?                      (IS_ASYNC)
 * WHILE, IF       test BLOCK orelse?
 * WITH            WITH_ITEM+ BLOCK                               (IS_ASYNC)
 * WITH_ITEM       context vars?
 * MATCH           subject MATCH_CASE+
 * MATCH_CASE      pattern guard? BLOCK
 * TRY             BLOCK handlers(BLOCK) orelse? finally?         (IS_STAR)
 * EXCEPT_HANDLER  type? BLOCK                                    (optional name)
 * IMPORT_FROM     ALIAS+                                         (MODULE_NAME, LEVEL)
 * DICT            (key? value)*                                  key absent for **mapping
 * COMPREHENSION   target iter if*                                (IS_ASYNC)
 * COMPARE         left comparator+                               (COMPARE_OPS)
 * CALL            func arg* KEYWORD*
 * FORMATTED_VALUE value JOINED_STR?                              (CONVERSION)
 * SLICE           lower? upper? step?
 * PARAM           annotation? default?                           (name; PARAM_KIND)
 * MATCH_MAPPING   (key pattern)*                                 (AS_NAME for **rest)
 * MATCH_CLASS     cls pattern* MATCH_KEYWORD*
 * </pre>
 *
 * @see Node
 */
public class IR {

  private static final ImmutableSet<Token> STATEMENTS =
      Sets.immutableEnumSet(
          Token.FUNCTION_DEF,
          Token.CLASS_DEF,
          Token.RETURN,
          Token.DELETE,
          Token.ASSIGN,
          Token.AUG_ASSIGN,
          Token.ANN_ASSIGN,
          Token.FOR,
          Token.WHILE,
          Token.IF,
          Token.WITH,
          Token.MATCH,
          Token.RAISE,
          Token.TRY,
          Token.ASSERT,
          Token.IMPORT,
          Token.IMPORT_FROM,
          Token.GLOBAL,
          Token.NONLOCAL,
          Token.EXPR,
          Token.PASS,
          Token.BREAK,
          Token.CONTINUE);

  private static final ImmutableSet<Token> PATTERNS =
      Sets.immutableEnumSet(
          Token.MATCH_VALUE,
          Token.MATCH_SINGLETON,
          Token.MATCH_SEQUENCE,
          Token.MATCH_MAPPING,
          Token.MATCH_CLASS,
          Token.MATCH_STAR,
          Token.MATCH_AS,
          Token.MATCH_OR);

  private static final ImmutableSet<Token> NON_EXPRESSIONS =
      Sets.immutableEnumSet(
          Token.MODULE,
          Token.BLOCK,
          Token.EMPTY,
          Token.DECORATORS,
          Token.ARG_LIST,
          Token.WITH_ITEM,
          Token.MATCH_CASE,
          Token.EXCEPT_HANDLER,
          Token.ALIAS,
          Token.COMPREHENSION,
          Token.KEYWORD,
          Token.ARGUMENTS,
          Token.PARAM,
          Token.MATCH_KEYWORD,
          Token.EQ,
          Token.NOT_EQ,
          Token.LT,
          Token.LT_E,
          Token.GT,
          Token.GT_E,
          Token.IS,
          Token.IS_NOT,
          Token.IN,
          Token.NOT_IN);

  private static final ImmutableSet<Token> BINARY_OPERATORS =
      Sets.immutableEnumSet(
          Token.ADD,
          Token.SUB,
          Token.MULT,
          Token.MAT_MULT,
          Token.DIV,
          Token.MOD,
          Token.POW,
          Token.LSHIFT,
          Token.RSHIFT,
          Token.BIT_OR,
          Token.BIT_XOR,
          Token.BIT_AND,
          Token.FLOOR_DIV);

  private static final ImmutableSet<Token> UNARY_OPERATORS =
      Sets.immutableEnumSet(Token.INVERT, Token.NOT, Token.UADD, Token.USUB);

  private static final ImmutableSet<Token> COMPARISON_OPERATORS =
      Sets.immutableEnumSet(
          Token.EQ,
          Token.NOT_EQ,
          Token.LT,
          Token.LT_E,
          Token.GT,
          Token.GT_E,
          Token.IS,
          Token.IS_NOT,
          Token.IN,
          Token.NOT_IN);

  private IR() {}

  public static boolean mayBeStatement(Node n) {
    return STATEMENTS.contains(n.getToken());
  }

  public static boolean mayBeExpression(Node n) {
    return !STATEMENTS.contains(n.getToken())
        && !PATTERNS.contains(n.getToken())
        && !NON_EXPRESSIONS.contains(n.getToken());
  }

  public static boolean mayBePattern(Node n) {
    return PATTERNS.contains(n.getToken());
  }

  public static boolean isBinaryOperator(Token token) {
    return BINARY_OPERATORS.contains(token);
  }

  public static boolean isUnaryOperator(Token token) {
    return UNARY_OPERATORS.contains(token);
  }

  public static boolean isComparisonOperator(Token token) {
    return COMPARISON_OPERATORS.contains(token);
  }

  private static Node orEmpty(@Nullable Node n) {
    return n == null ? empty() : n;
  }

  private static Node expressionOrEmpty(@Nullable Node n) {
    checkState(n == null || mayBeExpression(n), n);
    return orEmpty(n);
  }

  private static Node blockOrEmpty(@Nullable Node n) {
    checkState(n == null || n.isBlock(), n);
    return orEmpty(n);
  }

  private static void addExpressions(Node parent, Iterable<Node> children) {
    for (Node child : children) {
      checkState(mayBeExpression(child), "%s cannot contain %s", parent.getToken(), child);
      parent.addChildToBack(child);
    }
  }

  private static void addPatterns(Node parent, Iterable<Node> children) {
    for (Node child : children) {
      checkState(mayBePattern(child), "%s cannot contain %s", parent.getToken(), child);
      parent.addChildToBack(child);
    }
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node module(Node... stmts) {
    return module(ImmutableList.copyOf(stmts));
  }

  public static Node module(List<Node> stmts) {
    Node module = new Node(Token.MODULE);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Module cannot contain %s", stmt.getToken());
      module.addChildToBack(stmt);
    }
    return module;
  }

  public static Node block(Node... stmts) {
    return block(ImmutableList.copyOf(stmts));
  }

  public static Node block(List<Node> stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  // Statements

  public static Node decorators(Node... decorators) {
    Node n = new Node(Token.DECORATORS);
    addExpressions(n, ImmutableList.copyOf(decorators));
    return n;
  }

  public static Node function(
      String name, Node decorators, Node arguments, @Nullable Node returns, Node body) {
    checkState(decorators.getToken() == Token.DECORATORS, decorators);
    checkState(arguments.getToken() == Token.ARGUMENTS, arguments);
    checkState(body.isBlock(), body);
    Node n = Node.newString(Token.FUNCTION_DEF, name);
    n.addChildToBack(decorators);
    n.addChildToBack(arguments);
    n.addChildToBack(expressionOrEmpty(returns));
    n.addChildToBack(body);
    return n;
  }

  public static Node asyncFunction(
      String name, Node decorators, Node arguments, @Nullable Node returns, Node body) {
    Node n = function(name, decorators, arguments, returns, body);
    n.putBooleanProp(Node.Prop.IS_ASYNC, true);
    return n;
  }

  /** Bases and keywords of a class definition. */
  public static Node argList(Node... args) {
    Node n = new Node(Token.ARG_LIST);
    for (Node arg : args) {
      checkState(arg.isKeyword() || mayBeExpression(arg), arg);
      n.addChildToBack(arg);
    }
    return n;
  }

  public static Node classDef(String name, Node decorators, Node argList, Node body) {
    checkState(decorators.getToken() == Token.DECORATORS, decorators);
    checkState(argList.getToken() == Token.ARG_LIST, argList);
    checkState(body.isBlock(), body);
    Node n = Node.newString(Token.CLASS_DEF, name);
    n.addChildToBack(decorators);
    n.addChildToBack(argList);
    n.addChildToBack(body);
    return n;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.RETURN, value);
  }

  public static Node delete(Node... targets) {
    checkArgument(targets.length > 0);
    Node n = new Node(Token.DELETE);
    addExpressions(n, ImmutableList.copyOf(targets));
    return n;
  }

  public static Node assign(Node target, Node value) {
    return assign(ImmutableList.of(target), value);
  }

  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty());
    Node n = new Node(Token.ASSIGN);
    addExpressions(n, targets);
    addExpressions(n, ImmutableList.of(value));
    return n;
  }

  public static Node augAssign(Token operator, Node target, Node value) {
    checkState(isBinaryOperator(operator), operator);
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(value), value);
    Node n = new Node(Token.AUG_ASSIGN, target, value);
    n.putProp(Node.Prop.OPERATOR, operator);
    return n;
  }

  public static Node annAssign(
      Node target, Node annotation, @Nullable Node value, boolean simple) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(annotation), annotation);
    Node n = new Node(Token.ANN_ASSIGN, target, annotation, expressionOrEmpty(value));
    n.putBooleanProp(Node.Prop.SIMPLE, simple);
    return n;
  }

  public static Node forNode(Node target, Node iter, Node body, @Nullable Node orelse) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(iter), iter);
    checkState(body.isBlock(), body);
    return new Node(Token.FOR, target, iter, body, blockOrEmpty(orelse));
  }

  public static Node asyncFor(Node target, Node iter, Node body, @Nullable Node orelse) {
    Node n = forNode(target, iter, body, orelse);
    n.putBooleanProp(Node.Prop.IS_ASYNC, true);
    return n;
  }

  public static Node whileNode(Node test, Node body, @Nullable Node orelse) {
    checkState(mayBeExpression(test), test);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, test, body, blockOrEmpty(orelse));
  }

  public static Node ifNode(Node test, Node body) {
    return ifNode(test, body, null);
  }

  public static Node ifNode(Node test, Node body, @Nullable Node orelse) {
    checkState(mayBeExpression(test), test);
    checkState(body.isBlock(), body);
    return new Node(Token.IF, test, body, blockOrEmpty(orelse));
  }

  public static Node withItem(Node context, @Nullable Node vars) {
    checkState(mayBeExpression(context), context);
    return new Node(Token.WITH_ITEM, context, expressionOrEmpty(vars));
  }

  public static Node with(List<Node> items, Node body) {
    checkArgument(!items.isEmpty());
    checkState(body.isBlock(), body);
    Node n = new Node(Token.WITH);
    for (Node item : items) {
      checkState(item.getToken() == Token.WITH_ITEM, item);
      n.addChildToBack(item);
    }
    n.addChildToBack(body);
    return n;
  }

  public static Node asyncWith(List<Node> items, Node body) {
    Node n = with(items, body);
    n.putBooleanProp(Node.Prop.IS_ASYNC, true);
    return n;
  }

  public static Node match(Node subject, Node... cases) {
    checkState(mayBeExpression(subject), subject);
    checkArgument(cases.length > 0);
    Node n = new Node(Token.MATCH, subject);
    for (Node matchCase : cases) {
      checkState(matchCase.getToken() == Token.MATCH_CASE, matchCase);
      n.addChildToBack(matchCase);
    }
    return n;
  }

  public static Node matchCase(Node pattern, @Nullable Node guard, Node body) {
    checkState(mayBePattern(pattern), pattern);
    checkState(body.isBlock(), body);
    return new Node(Token.MATCH_CASE, pattern, expressionOrEmpty(guard), body);
  }

  public static Node raise() {
    return new Node(Token.RAISE);
  }

  public static Node raise(Node exception) {
    checkState(mayBeExpression(exception), exception);
    return new Node(Token.RAISE, exception);
  }

  public static Node raise(Node exception, Node cause) {
    checkState(mayBeExpression(exception), exception);
    checkState(mayBeExpression(cause), cause);
    return new Node(Token.RAISE, exception, cause);
  }

  public static Node tryNode(
      Node body, List<Node> handlers, @Nullable Node orelse, @Nullable Node finallyBody) {
    checkState(body.isBlock(), body);
    checkState(!handlers.isEmpty() || finallyBody != null, "try without except or finally");
    Node handlerBlock = new Node(Token.BLOCK);
    for (Node handler : handlers) {
      checkState(handler.getToken() == Token.EXCEPT_HANDLER, handler);
      handlerBlock.addChildToBack(handler);
    }
    return new Node(
        Token.TRY, body, handlerBlock, blockOrEmpty(orelse), blockOrEmpty(finallyBody));
  }

  public static Node tryStar(
      Node body, List<Node> handlers, @Nullable Node orelse, @Nullable Node finallyBody) {
    checkArgument(!handlers.isEmpty());
    Node n = tryNode(body, handlers, orelse, finallyBody);
    n.putBooleanProp(Node.Prop.IS_STAR, true);
    return n;
  }

  public static Node exceptHandler(@Nullable Node type, @Nullable String name, Node body) {
    checkState(body.isBlock(), body);
    checkState(name == null || type != null, "except without a type cannot bind a name");
    Node n =
        name == null
            ? new Node(Token.EXCEPT_HANDLER)
            : Node.newString(Token.EXCEPT_HANDLER, name);
    n.addChildToBack(expressionOrEmpty(type));
    n.addChildToBack(body);
    return n;
  }

  public static Node assertNode(Node test) {
    checkState(mayBeExpression(test), test);
    return new Node(Token.ASSERT, test);
  }

  public static Node assertNode(Node test, Node message) {
    checkState(mayBeExpression(test), test);
    checkState(mayBeExpression(message), message);
    return new Node(Token.ASSERT, test, message);
  }

  public static Node alias(String name) {
    return Node.newString(Token.ALIAS, name);
  }

  public static Node alias(String name, @Nullable String asName) {
    Node n = alias(name);
    n.putProp(Node.Prop.AS_NAME, asName);
    return n;
  }

  public static Node importNode(Node... aliases) {
    checkArgument(aliases.length > 0);
    Node n = new Node(Token.IMPORT);
    for (Node alias : aliases) {
      checkState(alias.getToken() == Token.ALIAS, alias);
      n.addChildToBack(alias);
    }
    return n;
  }

  public static Node importFrom(@Nullable String module, int level, Node... aliases) {
    checkArgument(aliases.length > 0);
    checkArgument(level >= 0);
    checkState(module != null || level > 0, "from-import needs a module or a level");
    Node n = new Node(Token.IMPORT_FROM);
    for (Node alias : aliases) {
      checkState(alias.getToken() == Token.ALIAS, alias);
      n.addChildToBack(alias);
    }
    n.putProp(Node.Prop.MODULE_NAME, module);
    n.putIntProp(Node.Prop.LEVEL, level);
    return n;
  }

  public static Node global(String... names) {
    return nameList(Token.GLOBAL, names);
  }

  public static Node nonlocal(String... names) {
    return nameList(Token.NONLOCAL, names);
  }

  private static Node nameList(Token token, String... names) {
    checkArgument(names.length > 0);
    Node n = new Node(token);
    for (String name : names) {
      n.addChildToBack(name(name));
    }
    return n;
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR, expr);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  // Expressions

  public static Node and(Node... values) {
    return boolOp(Token.AND, values);
  }

  public static Node or(Node... values) {
    return boolOp(Token.OR, values);
  }

  private static Node boolOp(Token token, Node... values) {
    checkArgument(values.length >= 2, "%s needs two operands", token);
    Node n = new Node(token);
    addExpressions(n, ImmutableList.copyOf(values));
    return n;
  }

  public static Node namedExpr(Node target, Node value) {
    checkState(target.isName(), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.NAMED_EXPR, target, value);
  }

  public static Node binaryOp(Token operator, Node left, Node right) {
    checkState(isBinaryOperator(operator), operator);
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(operator, left, right);
  }

  public static Node unaryOp(Token operator, Node operand) {
    checkState(isUnaryOperator(operator), operator);
    checkState(mayBeExpression(operand), operand);
    return new Node(operator, operand);
  }

  public static Node lambda(Node arguments, Node body) {
    checkState(arguments.getToken() == Token.ARGUMENTS, arguments);
    checkState(mayBeExpression(body), body);
    return new Node(Token.LAMBDA, arguments, body);
  }

  public static Node ifExp(Node test, Node body, Node orelse) {
    checkState(mayBeExpression(test), test);
    checkState(mayBeExpression(body), body);
    checkState(mayBeExpression(orelse), orelse);
    return new Node(Token.IF_EXP, test, body, orelse);
  }

  /**
   * Builds a dict display from alternating keys and values. A key of {@link #empty()} unpacks
   * the following value with {@code **}.
   */
  public static Node dict(Node... keysAndValues) {
    checkArgument(keysAndValues.length % 2 == 0, "unpaired dict key");
    Node n = new Node(Token.DICT);
    for (int i = 0; i < keysAndValues.length; i += 2) {
      Node key = keysAndValues[i];
      checkState(key.isEmpty() || mayBeExpression(key), key);
      n.addChildToBack(key);
      addExpressions(n, ImmutableList.of(keysAndValues[i + 1]));
    }
    return n;
  }

  public static Node set(Node... elements) {
    Node n = new Node(Token.SET);
    addExpressions(n, ImmutableList.copyOf(elements));
    return n;
  }

  public static Node list(Node... elements) {
    Node n = new Node(Token.LIST);
    addExpressions(n, ImmutableList.copyOf(elements));
    return n;
  }

  public static Node tuple(Node... elements) {
    Node n = new Node(Token.TUPLE);
    for (Node element : elements) {
      // Slices are only allowed as tuple elements inside subscripts.
      checkState(mayBeExpression(element), element);
      n.addChildToBack(element);
    }
    return n;
  }

  public static Node comprehension(Node target, Node iter, Node... ifs) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(iter), iter);
    Node n = new Node(Token.COMPREHENSION, target, iter);
    addExpressions(n, ImmutableList.copyOf(ifs));
    return n;
  }

  public static Node asyncComprehension(Node target, Node iter, Node... ifs) {
    Node n = comprehension(target, iter, ifs);
    n.putBooleanProp(Node.Prop.IS_ASYNC, true);
    return n;
  }

  private static Node comprehensionExpr(Token token, List<Node> elements, Node... generators) {
    checkArgument(generators.length > 0, "%s needs a generator", token);
    Node n = new Node(token);
    addExpressions(n, elements);
    for (Node generator : generators) {
      checkState(generator.getToken() == Token.COMPREHENSION, generator);
      n.addChildToBack(generator);
    }
    return n;
  }

  public static Node listComp(Node element, Node... generators) {
    return comprehensionExpr(Token.LIST_COMP, ImmutableList.of(element), generators);
  }

  public static Node setComp(Node element, Node... generators) {
    return comprehensionExpr(Token.SET_COMP, ImmutableList.of(element), generators);
  }

  public static Node generatorExp(Node element, Node... generators) {
    return comprehensionExpr(Token.GENERATOR_EXP, ImmutableList.of(element), generators);
  }

  public static Node dictComp(Node key, Node value, Node... generators) {
    return comprehensionExpr(Token.DICT_COMP, ImmutableList.of(key, value), generators);
  }

  public static Node await(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.AWAIT, value);
  }

  public static Node yield() {
    return new Node(Token.YIELD);
  }

  public static Node yield(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.YIELD, value);
  }

  public static Node yieldFrom(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.YIELD_FROM, value);
  }

  public static Node compare(Node left, List<Token> operators, List<Node> comparators) {
    checkArgument(!operators.isEmpty());
    checkArgument(operators.size() == comparators.size(), "operator/comparator mismatch");
    for (Token operator : operators) {
      checkState(isComparisonOperator(operator), operator);
    }
    Node n = new Node(Token.COMPARE);
    addExpressions(n, ImmutableList.of(left));
    addExpressions(n, comparators);
    n.putProp(Node.Prop.COMPARE_OPS, ImmutableList.copyOf(operators));
    return n;
  }

  public static Node compare(Node left, Token operator, Node right) {
    return compare(left, ImmutableList.of(operator), ImmutableList.of(right));
  }

  /** Builds a call. Positional arguments must precede the {@link #keyword} arguments. */
  public static Node call(Node func, Node... args) {
    checkState(mayBeExpression(func), func);
    Node n = new Node(Token.CALL, func);
    boolean sawKeyword = false;
    for (Node arg : args) {
      if (arg.isKeyword()) {
        sawKeyword = true;
      } else {
        checkState(!sawKeyword, "positional argument %s after keyword", arg);
        checkState(mayBeExpression(arg), arg);
      }
      n.addChildToBack(arg);
    }
    return n;
  }

  /** A keyword argument, or {@code **value} when {@code name} is null. */
  public static Node keyword(@Nullable String name, Node value) {
    checkState(mayBeExpression(value), value);
    Node n = name == null ? new Node(Token.KEYWORD) : Node.newString(Token.KEYWORD, name);
    n.addChildToBack(value);
    return n;
  }

  public static Node joinedStr(Node... parts) {
    Node n = new Node(Token.JOINED_STR);
    for (Node part : parts) {
      checkState(part.isString() || part.getToken() == Token.FORMATTED_VALUE, part);
      n.addChildToBack(part);
    }
    return n;
  }

  /**
   * A replacement field of an f-string.
   *
   * @param conversion one of {@code 's'}, {@code 'r'}, {@code 'a'}, or -1 for none
   */
  public static Node formattedValue(Node value, int conversion, @Nullable Node formatSpec) {
    checkState(mayBeExpression(value), value);
    checkState(
        conversion == -1 || conversion == 's' || conversion == 'r' || conversion == 'a',
        "bad conversion %s",
        conversion);
    checkState(formatSpec == null || formatSpec.getToken() == Token.JOINED_STR, formatSpec);
    Node n = new Node(Token.FORMATTED_VALUE, value, orEmpty(formatSpec));
    n.putIntProp(Node.Prop.CONVERSION, conversion);
    return n;
  }

  public static Node attribute(Node value, String attr) {
    checkState(mayBeExpression(value), value);
    Node n = Node.newString(Token.ATTRIBUTE, attr);
    n.addChildToBack(value);
    return n;
  }

  public static Node subscript(Node value, Node slice) {
    checkState(mayBeExpression(value), value);
    checkState(mayBeExpression(slice), slice);
    return new Node(Token.SUBSCRIPT, value, slice);
  }

  public static Node starred(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.STARRED, value);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node slice(@Nullable Node lower, @Nullable Node upper, @Nullable Node step) {
    return new Node(
        Token.SLICE, expressionOrEmpty(lower), expressionOrEmpty(upper), expressionOrEmpty(step));
  }

  // Literals

  public static Node number(long value) {
    return Node.newInt(BigInteger.valueOf(value));
  }

  public static Node number(BigInteger value) {
    return Node.newInt(value);
  }

  public static Node floatNode(double value) {
    return Node.newFloat(value);
  }

  public static Node imaginary(double value) {
    return Node.newImaginary(value);
  }

  public static Node string(String value) {
    return Node.newString(Token.STRING, value);
  }

  /** A string literal written with the {@code u} prefix. */
  public static Node uString(String value) {
    Node n = string(value);
    n.putBooleanProp(Node.Prop.U_PREFIX, true);
    return n;
  }

  public static Node bytes(byte[] value) {
    return Node.newBytes(value);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node none() {
    return new Node(Token.NONE);
  }

  public static Node ellipsis() {
    return new Node(Token.ELLIPSIS);
  }

  // Parameters

  /** Builds a parameter list. Parameters must be given in {@link ParamKind} order. */
  public static Node arguments(Node... params) {
    Node n = new Node(Token.ARGUMENTS);
    ParamKind previous = ParamKind.POSITIONAL_ONLY;
    for (Node param : params) {
      checkState(param.getToken() == Token.PARAM, param);
      ParamKind kind = param.getParamKind();
      checkState(kind.compareTo(previous) >= 0, "%s out of order", param);
      checkState(
          kind != previous || (kind != ParamKind.VAR_POSITIONAL && kind != ParamKind.VAR_KEYWORD),
          "duplicate %s",
          kind);
      previous = kind;
      n.addChildToBack(param);
    }
    return n;
  }

  public static Node param(String name) {
    return param(name, ParamKind.POSITIONAL_OR_KEYWORD, null, null);
  }

  public static Node param(
      String name, ParamKind kind, @Nullable Node annotation, @Nullable Node defaultValue) {
    checkState(
        defaultValue == null || (kind != ParamKind.VAR_POSITIONAL && kind != ParamKind.VAR_KEYWORD),
        "%s cannot have a default",
        kind);
    Node n = Node.newString(Token.PARAM, name);
    n.addChildToBack(expressionOrEmpty(annotation));
    n.addChildToBack(expressionOrEmpty(defaultValue));
    n.putProp(Node.Prop.PARAM_KIND, kind);
    return n;
  }

  // Patterns

  public static Node matchValue(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.MATCH_VALUE, value);
  }

  public static Node matchSingleton(Node value) {
    Token token = value.getToken();
    checkState(token == Token.TRUE || token == Token.FALSE || token == Token.NONE, value);
    return new Node(Token.MATCH_SINGLETON, value);
  }

  public static Node matchSequence(Node... patterns) {
    Node n = new Node(Token.MATCH_SEQUENCE);
    addPatterns(n, ImmutableList.copyOf(patterns));
    return n;
  }

  public static Node matchMapping(List<Node> keys, List<Node> patterns, @Nullable String rest) {
    checkArgument(keys.size() == patterns.size(), "key/pattern mismatch");
    Node n = new Node(Token.MATCH_MAPPING);
    for (int i = 0; i < keys.size(); i++) {
      addExpressions(n, ImmutableList.of(keys.get(i)));
      addPatterns(n, ImmutableList.of(patterns.get(i)));
    }
    n.putProp(Node.Prop.AS_NAME, rest);
    return n;
  }

  public static Node matchClass(Node cls, List<Node> patterns, List<Node> keywordPatterns) {
    checkState(mayBeExpression(cls), cls);
    Node n = new Node(Token.MATCH_CLASS, cls);
    addPatterns(n, patterns);
    for (Node keyword : keywordPatterns) {
      checkState(keyword.getToken() == Token.MATCH_KEYWORD, keyword);
      n.addChildToBack(keyword);
    }
    return n;
  }

  public static Node matchKeyword(String attr, Node pattern) {
    checkState(mayBePattern(pattern), pattern);
    Node n = Node.newString(Token.MATCH_KEYWORD, attr);
    n.addChildToBack(pattern);
    return n;
  }

  /** {@code *name} inside a sequence pattern; {@code *_} when name is null. */
  public static Node matchStar(@Nullable String name) {
    return name == null ? new Node(Token.MATCH_STAR) : Node.newString(Token.MATCH_STAR, name);
  }

  /** {@code pattern as name}, a capture when pattern is null, the wildcard when both are. */
  public static Node matchAs(@Nullable Node pattern, @Nullable String name) {
    checkState(pattern == null || name != null, "as-pattern without a name");
    Node n = name == null ? new Node(Token.MATCH_AS) : Node.newString(Token.MATCH_AS, name);
    if (pattern != null) {
      addPatterns(n, ImmutableList.of(pattern));
    }
    return n;
  }

  public static Node matchOr(Node... patterns) {
    checkArgument(patterns.length >= 2, "or-pattern needs two alternatives");
    Node n = new Node(Token.MATCH_OR);
    addPatterns(n, ImmutableList.copyOf(patterns));
    return n;
  }
}
