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

package io.minipy.compiler;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import io.minipy.ast.IR;
import io.minipy.ast.Node;
import io.minipy.ast.ParamKind;
import io.minipy.ast.Token;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * CodeGenerator generates Python code from a syntax tree, sending it to the specified
 * CodeConsumer.
 *
 * <p>Every expression is rendered with the minimum precedence its position accepts; it gets
 * parentheses exactly when it binds looser than that.
 */
public class CodeGenerator {

  private static final ImmutableList<String> FSTRING_QUOTES =
      ImmutableList.of("'", "\"", "'''", "\"\"\"");

  private final CodeConsumer cc;
  private final StatementHooks hooks;

  // Import coalescing and literal rewrites.
  private final boolean compact;

  // Aliases of consecutive import statements of the body being rendered.
  private final List<Node> pendingImports = new ArrayList<>();

  CodeGenerator(CodeConsumer consumer, StatementHooks hooks, boolean compact) {
    this.cc = consumer;
    this.hooks = hooks;
    this.compact = compact;
  }

  /** Renders a module, a block, a statement, an expression or a pattern. */
  public void add(Node n) {
    switch (n.getToken()) {
      case MODULE:
        addBody(n.children(), true);
        break;
      case BLOCK:
        addBody(n.children(), false);
        break;
      default:
        if (IR.mayBeStatement(n)) {
          addBody(ImmutableList.of(n), false);
        } else if (IR.mayBePattern(n)) {
          addPattern(n, Precedence.NAMED_EXPR);
        } else {
          addExpr(n, Precedence.NAMED_EXPR);
        }
    }
  }

  void add(String str) {
    cc.add(str);
  }

  private void addBody(List<Node> statements, boolean allowDocstring) {
    for (int i = 0; i < statements.size(); i++) {
      Node statement = statements.get(i);
      if (compact && statement.isImport()) {
        // Terminated by flushImports, whatever the hooks say.
        pendingImports.addAll(statement.children());
        continue;
      }
      flushImports();
      if (i == 0 && allowDocstring && NodeUtil.isDocstring(statement)) {
        addDocstring(statement);
        hooks.afterStatement(statement, cc);
      } else {
        addStatement(statement);
      }
    }
    flushImports();
  }

  private void addBlock(Node block, boolean allowDocstring) {
    checkState(block.isBlock() && block.hasChildren(), "Empty body %s", block);
    cc.beginBlock();
    addBody(block.children(), allowDocstring);
    cc.endBlock();
  }

  /** Writes the buffered aliases as one import statement. */
  private void flushImports() {
    if (pendingImports.isEmpty()) {
      return;
    }
    cc.startStatement("import");
    addAliases(pendingImports);
    cc.endStatement();
    pendingImports.clear();
  }

  private void addDocstring(Node statement) {
    Node str = statement.getFirstChild();
    String text = CharMatcher.is('\n').trimFrom(PyLiterals.dedent(str.getString()));
    cc.startStatement("");
    add((str.getBooleanProp(Node.Prop.U_PREFIX) ? "u" : "") + PyLiterals.repr(text));
  }

  private void addStatement(Node n) {
    Node first = n.getFirstChild();
    switch (n.getToken()) {
      case FUNCTION_DEF:
        addDecorators(first);
        if (n.getBooleanProp(Node.Prop.IS_ASYNC)) {
          cc.startStatement("async");
          add("def");
        } else {
          cc.startStatement("def");
        }
        add(n.getString());
        add("(");
        addParams(n.getSecondChild());
        add(")");
        Node returns = n.getChildAtIndex(2);
        if (!returns.isEmpty()) {
          cc.addOp("->", true);
          addExpr(returns, Precedence.TEST);
        }
        addBlock(n.getLastChild(), true);
        break;

      case CLASS_DEF:
        addDecorators(first);
        cc.startStatement("class");
        add(n.getString());
        Node bases = n.getSecondChild();
        if (bases.hasChildren()) {
          add("(");
          addArgs(bases.children());
          add(")");
        }
        addBlock(n.getLastChild(), true);
        break;

      case RETURN:
        cc.startStatement("return");
        if (first != null) {
          cc.maybeInsertSpace();
          addExpr(first, first.isTuple() ? Precedence.TUPLE : Precedence.TEST);
        }
        break;

      case DELETE:
        cc.startStatement("del");
        cc.maybeInsertSpace();
        addList(n.children(), Precedence.TEST);
        break;

      case ASSIGN:
        cc.startStatement("");
        for (Node part : n.children()) {
          if (part != first) {
            cc.addOp("=", true);
          }
          addExpr(part, Precedence.TUPLE);
        }
        break;

      case AUG_ASSIGN:
        cc.startStatement("");
        addExpr(first, Precedence.TUPLE);
        Token operator = (Token) n.getProp(Node.Prop.OPERATOR);
        cc.addOp(NodeUtil.opToStrNoFail(operator) + "=", true);
        addExpr(n.getSecondChild(), Precedence.TUPLE);
        break;

      case ANN_ASSIGN:
        cc.startStatement("");
        if (first.isName() && !n.getBooleanProp(Node.Prop.SIMPLE)) {
          add("(");
          add(first.getString());
          add(")");
        } else {
          addExpr(first, Precedence.TEST);
        }
        add(":");
        cc.maybeInsertSpace();
        addExpr(n.getSecondChild(), Precedence.TEST);
        if (!n.getLastChild().isEmpty()) {
          cc.addOp("=", true);
          addExpr(n.getLastChild(), Precedence.TUPLE);
        }
        break;

      case FOR:
        if (n.getBooleanProp(Node.Prop.IS_ASYNC)) {
          cc.startStatement("async");
          add("for");
        } else {
          cc.startStatement("for");
        }
        cc.maybeInsertSpace();
        addExpr(first, Precedence.TUPLE);
        cc.addOp("in", true);
        addExpr(n.getSecondChild(), Precedence.TEST);
        addBlock(n.getChildAtIndex(2), false);
        addElse(n.getChildAtIndex(3));
        break;

      case WHILE:
        cc.startStatement("while");
        addCondition(first);
        addBlock(n.getSecondChild(), false);
        addElse(n.getChildAtIndex(2));
        break;

      case IF:
        addIf(n, false);
        break;

      case WITH:
        if (n.getBooleanProp(Node.Prop.IS_ASYNC)) {
          cc.startStatement("async");
          add("with");
        } else {
          cc.startStatement("with");
        }
        cc.maybeInsertSpace();
        for (int i = 0; i < n.getChildCount() - 1; i++) {
          if (i > 0) {
            cc.listSeparator();
          }
          Node item = n.getChildAtIndex(i);
          addExpr(item.getFirstChild(), Precedence.TEST);
          if (!item.getSecondChild().isEmpty()) {
            cc.addOp("as", true);
            addExpr(item.getSecondChild(), Precedence.TEST);
          }
        }
        addBlock(n.getLastChild(), false);
        break;

      case MATCH:
        cc.startStatement("match");
        cc.maybeInsertSpace();
        addExpr(first, Precedence.TEST);
        cc.beginBlock();
        for (Node matchCase : n.children().subList(1, n.getChildCount())) {
          addMatchCase(matchCase);
        }
        cc.endBlock();
        break;

      case RAISE:
        cc.startStatement("raise");
        if (first != null) {
          cc.maybeInsertSpace();
          addExpr(first, Precedence.TEST);
          if (n.getChildCount() > 1) {
            cc.addOp("from", true);
            addExpr(n.getSecondChild(), Precedence.TEST);
          }
        }
        break;

      case TRY:
        cc.startStatement("try");
        addBlock(first, false);
        for (Node handler : n.getSecondChild().children()) {
          addExceptHandler(handler, n.getBooleanProp(Node.Prop.IS_STAR));
        }
        addElse(n.getChildAtIndex(2));
        Node finallyBody = n.getChildAtIndex(3);
        if (!finallyBody.isEmpty()) {
          cc.startStatement("finally");
          addBlock(finallyBody, false);
        }
        break;

      case ASSERT:
        cc.startStatement("assert");
        cc.maybeInsertSpace();
        addExpr(first, Precedence.TEST);
        if (n.getChildCount() > 1) {
          cc.listSeparator();
          addExpr(n.getSecondChild(), Precedence.TEST);
        }
        break;

      case IMPORT:
        cc.startStatement("import");
        cc.maybeInsertSpace();
        addAliases(n.children());
        break;

      case IMPORT_FROM:
        cc.startStatement("from");
        cc.maybeInsertSpace();
        add(".".repeat(n.getIntProp(Node.Prop.LEVEL, 0)));
        String module = n.getStringProp(Node.Prop.MODULE_NAME);
        if (module != null) {
          add(module);
        }
        cc.addOp("import", true);
        addAliases(n.children());
        break;

      case GLOBAL:
      case NONLOCAL:
        cc.startStatement(n.getToken() == Token.GLOBAL ? "global" : "nonlocal");
        cc.maybeInsertSpace();
        addList(n.children(), Precedence.ATOM);
        break;

      case EXPR:
        cc.startStatement("");
        addExpr(first, Precedence.TUPLE);
        break;

      case PASS:
        cc.startStatement("pass");
        break;

      case BREAK:
        cc.startStatement("break");
        break;

      case CONTINUE:
        cc.startStatement("continue");
        break;

      default:
        throw new IllegalStateException("Unexpected statement: " + n);
    }
    hooks.afterStatement(n, cc);
  }

  private void addDecorators(Node decorators) {
    for (Node decorator : decorators.children()) {
      cc.startStatement("@");
      addExpr(decorator, Precedence.TEST);
    }
  }

  /** Conditions may be bare named expressions. */
  private void addCondition(Node test) {
    cc.maybeInsertSpace();
    addExpr(
        test, test.getToken() == Token.NAMED_EXPR ? Precedence.NAMED_EXPR : Precedence.TEST);
  }

  private void addIf(Node n, boolean elif) {
    cc.startStatement(elif ? "elif" : "if");
    addCondition(n.getFirstChild());
    addBlock(n.getSecondChild(), false);
    Node orelse = n.getChildAtIndex(2);
    if (!orelse.isEmpty() && orelse.getChildCount() == 1 && orelse.getFirstChild().isIf()) {
      Node chained = orelse.getFirstChild();
      addIf(chained, true);
      hooks.afterStatement(chained, cc);
    } else {
      addElse(orelse);
    }
  }

  private void addElse(Node orelse) {
    if (!orelse.isEmpty()) {
      cc.startStatement("else");
      addBlock(orelse, false);
    }
  }

  private void addExceptHandler(Node handler, boolean star) {
    cc.startStatement("except");
    if (star) {
      add("*");
    }
    Node type = handler.getFirstChild();
    if (!type.isEmpty()) {
      cc.maybeInsertSpace();
      addExpr(type, Precedence.TEST);
      if (handler.hasString()) {
        cc.addOp("as", true);
        add(handler.getString());
      }
    }
    addBlock(handler.getLastChild(), false);
  }

  private void addMatchCase(Node matchCase) {
    cc.startStatement("case");
    cc.maybeInsertSpace();
    addPattern(matchCase.getFirstChild(), Precedence.NAMED_EXPR);
    Node guard = matchCase.getSecondChild();
    if (!guard.isEmpty()) {
      cc.addOp("if", true);
      addExpr(
          guard, guard.getToken() == Token.NAMED_EXPR ? Precedence.NAMED_EXPR : Precedence.TEST);
    }
    addBlock(matchCase.getLastChild(), false);
  }

  private void addAliases(List<Node> aliases) {
    boolean first = true;
    for (Node alias : aliases) {
      if (!first) {
        cc.listSeparator();
      }
      first = false;
      add(alias.getString());
      String asName = alias.getStringProp(Node.Prop.AS_NAME);
      if (asName != null) {
        cc.addOp("as", true);
        add(asName);
      }
    }
  }

  private void addParams(Node arguments) {
    List<Node> params = arguments.children();
    boolean first = true;
    boolean sawStar = false;
    for (int i = 0; i < params.size(); i++) {
      Node param = params.get(i);
      ParamKind kind = param.getParamKind();
      if (kind == ParamKind.KEYWORD_ONLY && !sawStar) {
        // Bare star before the first keyword-only parameter.
        if (!first) {
          cc.listSeparator();
        }
        first = false;
        add("*");
        sawStar = true;
      }
      if (!first) {
        cc.listSeparator();
      }
      first = false;
      if (kind == ParamKind.VAR_POSITIONAL) {
        add("*");
        sawStar = true;
      } else if (kind == ParamKind.VAR_KEYWORD) {
        add("**");
      }
      add(param.getString());
      Node annotation = param.getFirstChild();
      if (!annotation.isEmpty()) {
        add(":");
        cc.maybeInsertSpace();
        addExpr(annotation, Precedence.TEST);
      }
      Node defaultValue = param.getSecondChild();
      if (!defaultValue.isEmpty()) {
        if (annotation.isEmpty()) {
          add("=");
        } else {
          cc.addOp("=", true);
        }
        addExpr(defaultValue, Precedence.TEST);
      }
      if (kind == ParamKind.POSITIONAL_ONLY
          && (i + 1 == params.size()
              || params.get(i + 1).getParamKind() != ParamKind.POSITIONAL_ONLY)) {
        cc.listSeparator();
        add("/");
      }
    }
  }

  /** Call arguments and class bases: positional ones, then keywords. */
  private void addArgs(List<Node> args) {
    boolean first = true;
    for (Node arg : args) {
      if (!first) {
        cc.listSeparator();
      }
      first = false;
      if (arg.isKeyword()) {
        if (arg.hasString()) {
          add(arg.getString());
          add("=");
          addExpr(arg.getFirstChild(), Precedence.TEST);
        } else {
          add("**");
          addExpr(arg.getFirstChild(), Precedence.EXPR);
        }
      } else {
        addExpr(arg, Precedence.TEST);
      }
    }
  }

  private void addList(List<Node> nodes, Precedence precedence) {
    boolean first = true;
    for (Node n : nodes) {
      if (!first) {
        cc.listSeparator();
      }
      first = false;
      addExpr(n, precedence);
    }
  }

  private void addTupleElements(Node tuple) {
    addList(tuple.children(), Precedence.TEST);
    if (tuple.getChildCount() == 1) {
      add(",");
    }
  }

  /** Renders {@code n}, parenthesized if it binds looser than {@code minPrecedence}. */
  void addExpr(Node n, Precedence minPrecedence) {
    if (n.isInt()) {
      addInt(n.getBigInteger(), minPrecedence);
    } else if (NodeUtil.precedence(n).isLowerThan(minPrecedence)) {
      add("(");
      addExprNoParens(n);
      add(")");
    } else {
      addExprNoParens(n);
    }
  }

  private void addExprNoParens(Node n) {
    Token type = n.getToken();
    Node first = n.getFirstChild();
    switch (type) {
      case AND:
      case OR:
        {
          Precedence p = NodeUtil.precedence(type);
          for (Node value : n.children()) {
            if (value != first) {
              cc.addOp(NodeUtil.opToStrNoFail(type), true);
            }
            addExpr(value, p.next());
          }
          break;
        }

      case NAMED_EXPR:
        addExpr(first, Precedence.ATOM);
        cc.addOp(":=", true);
        addExpr(n.getSecondChild(), Precedence.TEST);
        break;

      case ADD:
      case SUB:
      case MULT:
      case MAT_MULT:
      case DIV:
      case MOD:
      case LSHIFT:
      case RSHIFT:
      case BIT_OR:
      case BIT_XOR:
      case BIT_AND:
      case FLOOR_DIV:
      case POW:
        {
          Precedence p = NodeUtil.precedence(type);
          boolean rightAssociative = NodeUtil.isRightAssociative(type);
          addExpr(first, rightAssociative ? p.next() : p);
          cc.addOp(NodeUtil.opToStrNoFail(type), true);
          Precedence right = rightAssociative ? p : p.next();
          if (type == Token.POW) {
            // The exponent may be a signed operand: 2**-1.
            right = Precedence.FACTOR;
          }
          addExpr(n.getSecondChild(), right);
          break;
        }

      case NOT:
        cc.addOp("not", false);
        cc.maybeInsertSpace();
        addExpr(first, Precedence.NOT);
        break;

      case INVERT:
      case UADD:
      case USUB:
        cc.addOp(NodeUtil.opToStrNoFail(type), false);
        addExpr(first, Precedence.FACTOR);
        break;

      case LAMBDA:
        add("lambda");
        if (first.hasChildren()) {
          cc.maybeInsertSpace();
          addParams(first);
        }
        add(":");
        cc.maybeInsertSpace();
        addExpr(n.getSecondChild(), Precedence.TEST);
        break;

      case IF_EXP:
        addExpr(n.getSecondChild(), Precedence.TEST.next());
        cc.addOp("if", true);
        addExpr(first, Precedence.TEST.next());
        cc.addOp("else", true);
        addExpr(n.getLastChild(), Precedence.TEST);
        break;

      case DICT:
        add("{");
        for (int i = 0; i < n.getChildCount(); i += 2) {
          if (i > 0) {
            cc.listSeparator();
          }
          Node key = n.getChildAtIndex(i);
          Node value = n.getChildAtIndex(i + 1);
          if (key.isEmpty()) {
            add("**");
            addExpr(value, Precedence.EXPR);
          } else {
            addExpr(key, Precedence.TEST);
            add(":");
            cc.maybeInsertSpace();
            addExpr(value, Precedence.TEST);
          }
        }
        add("}");
        break;

      case SET:
        if (n.hasChildren()) {
          add("{");
          addList(n.children(), Precedence.TEST);
          add("}");
        } else {
          add("{*()}");
        }
        break;

      case LIST:
        add("[");
        addList(n.children(), Precedence.TEST);
        add("]");
        break;

      case TUPLE:
        if (n.hasChildren()) {
          addTupleElements(n);
        } else {
          add("()");
        }
        break;

      case LIST_COMP:
        add("[");
        addExpr(first, Precedence.TEST);
        addComprehensions(n, 1);
        add("]");
        break;

      case SET_COMP:
        add("{");
        addExpr(first, Precedence.TEST);
        addComprehensions(n, 1);
        add("}");
        break;

      case GENERATOR_EXP:
        add("(");
        addExpr(first, Precedence.TEST);
        addComprehensions(n, 1);
        add(")");
        break;

      case DICT_COMP:
        add("{");
        addExpr(first, Precedence.TEST);
        add(":");
        cc.maybeInsertSpace();
        addExpr(n.getSecondChild(), Precedence.TEST);
        addComprehensions(n, 2);
        add("}");
        break;

      case AWAIT:
        add("await");
        cc.maybeInsertSpace();
        addExpr(first, Precedence.ATOM);
        break;

      case YIELD:
        add("yield");
        if (first != null) {
          cc.maybeInsertSpace();
          addExpr(first, Precedence.TUPLE);
        }
        break;

      case YIELD_FROM:
        add("yield");
        cc.addOp("from", true);
        addExpr(first, Precedence.TEST);
        break;

      case COMPARE:
        {
          List<Token> operators = n.getCompareOps();
          checkState(operators.size() == n.getChildCount() - 1, "Malformed comparison %s", n);
          addExpr(first, Precedence.CMP.next());
          for (int i = 0; i < operators.size(); i++) {
            cc.addOp(NodeUtil.opToStrNoFail(operators.get(i)), true);
            addExpr(n.getChildAtIndex(i + 1), Precedence.CMP.next());
          }
          break;
        }

      case CALL:
        {
          addExpr(first, Precedence.ATOM);
          List<Node> args = n.children().subList(1, n.getChildCount());
          if (args.size() == 1 && args.get(0).isGeneratorExp()) {
            // The generator expression brings its own parentheses.
            addExprNoParens(args.get(0));
          } else {
            add("(");
            addArgs(args);
            add(")");
          }
          break;
        }

      case JOINED_STR:
        addFString(n);
        break;

      case ATTRIBUTE:
        addExpr(first, Precedence.ATOM);
        if (first.isInt() && Character.isDigit(cc.getLastChar())) {
          // "1.real" would read as a float.
          cc.append(" ");
        }
        add(".");
        add(n.getString());
        break;

      case SUBSCRIPT:
        {
          addExpr(first, Precedence.ATOM);
          add("[");
          Node slice = n.getSecondChild();
          if (slice.isTuple() && slice.hasChildren()) {
            addTupleElements(slice);
          } else {
            addExpr(slice, Precedence.TEST);
          }
          add("]");
          break;
        }

      case SLICE:
        {
          if (!first.isEmpty()) {
            addExpr(first, Precedence.TEST);
          }
          add(":");
          Node upper = n.getSecondChild();
          if (!upper.isEmpty()) {
            addExpr(upper, Precedence.TEST);
          }
          Node step = n.getLastChild();
          if (!step.isEmpty()) {
            add(":");
            addExpr(step, Precedence.TEST);
          }
          break;
        }

      case STARRED:
        add("*");
        addExpr(first, Precedence.EXPR);
        break;

      case NAME:
        add(n.getString());
        break;

      case FLOAT:
        cc.addNumber(
            compact ? PyLiterals.formatFloat(n.getDouble()) : PyLiterals.reprFloat(n.getDouble()));
        break;

      case IMAGINARY:
        cc.addNumber(
            compact
                ? PyLiterals.formatImaginary(n.getDouble())
                : PyLiterals.reprImaginary(n.getDouble()));
        break;

      case STRING:
        add((n.getBooleanProp(Node.Prop.U_PREFIX) ? "u" : "") + PyLiterals.repr(n.getString()));
        break;

      case BYTES:
        add(PyLiterals.reprBytes(n.getBytes()));
        break;

      case TRUE:
        add("True");
        break;

      case FALSE:
        add("False");
        break;

      case NONE:
        add("None");
        break;

      case ELLIPSIS:
        add("...");
        break;

      default:
        throw new IllegalStateException("Unexpected expression: " + n);
    }
  }

  /**
   * Writes an integer literal. Large exact powers of ten or two become {@code 10**k} or
   * {@code 2**k} when that is shorter, counting any parentheses the position requires.
   */
  private void addInt(BigInteger value, Precedence minPrecedence) {
    String literal = value.toString();
    if (value.signum() < 0) {
      boolean parens = Precedence.FACTOR.isLowerThan(minPrecedence);
      add(parens ? "(" : "");
      cc.addNumber(literal);
      add(parens ? ")" : "");
      return;
    }
    if (compact) {
      int base = 10;
      int exponent = PyLiterals.exactPower(value, 10);
      if (exponent < 5) {
        base = 2;
        exponent = PyLiterals.exactPower(value, 2);
        if (exponent < 17) {
          exponent = -1;
        }
      }
      if (exponent > 0) {
        boolean parens = Precedence.POWER.isLowerThan(minPrecedence);
        String power = base + "**" + exponent;
        if (power.length() + (parens ? 2 : 0) < literal.length()) {
          add(parens ? "(" : "");
          cc.addNumber(Integer.toString(base));
          cc.addOp("**", true);
          cc.addNumber(Integer.toString(exponent));
          add(parens ? ")" : "");
          return;
        }
      }
    }
    cc.addNumber(literal);
  }

  private void addComprehensions(Node n, int firstGenerator) {
    for (Node generator : n.children().subList(firstGenerator, n.getChildCount())) {
      checkState(generator.getToken() == Token.COMPREHENSION, generator);
      if (generator.getBooleanProp(Node.Prop.IS_ASYNC)) {
        cc.addOp("async", true);
        add("for");
      } else {
        cc.addOp("for", true);
      }
      addExpr(generator.getFirstChild(), Precedence.TUPLE);
      cc.addOp("in", true);
      addExpr(generator.getSecondChild(), Precedence.TEST.next());
      for (Node condition : generator.children().subList(2, generator.getChildCount())) {
        cc.addOp("if", true);
        addExpr(condition, Precedence.TEST.next());
      }
    }
  }

  private void addPattern(Node n, Precedence minPrecedence) {
    boolean parens = NodeUtil.precedence(n).isLowerThan(minPrecedence);
    if (parens) {
      add("(");
    }
    Node first = n.getFirstChild();
    switch (n.getToken()) {
      case MATCH_VALUE:
        addExpr(first, Precedence.TEST);
        break;

      case MATCH_SINGLETON:
        addExpr(first, Precedence.ATOM);
        break;

      case MATCH_SEQUENCE:
        add("[");
        addPatterns(n.children());
        add("]");
        break;

      case MATCH_MAPPING:
        {
          add("{");
          for (int i = 0; i < n.getChildCount(); i += 2) {
            if (i > 0) {
              cc.listSeparator();
            }
            addExpr(n.getChildAtIndex(i), Precedence.TEST);
            add(":");
            cc.maybeInsertSpace();
            addPattern(n.getChildAtIndex(i + 1), Precedence.TEST);
          }
          String rest = n.getStringProp(Node.Prop.AS_NAME);
          if (rest != null) {
            if (n.hasChildren()) {
              cc.listSeparator();
            }
            add("**");
            add(rest);
          }
          add("}");
          break;
        }

      case MATCH_CLASS:
        addExpr(first, Precedence.ATOM);
        add("(");
        addPatterns(n.children().subList(1, n.getChildCount()));
        add(")");
        break;

      case MATCH_KEYWORD:
        add(n.getString());
        add("=");
        addPattern(first, Precedence.TEST);
        break;

      case MATCH_STAR:
        add("*");
        add(n.hasString() ? n.getString() : "_");
        break;

      case MATCH_AS:
        if (first == null) {
          add(n.hasString() ? n.getString() : "_");
        } else {
          addPattern(first, Precedence.BOR);
          cc.addOp("as", true);
          add(n.getString());
        }
        break;

      case MATCH_OR:
        for (Node alternative : n.children()) {
          if (alternative != first) {
            cc.addOp("|", true);
          }
          addPattern(alternative, Precedence.BOR.next());
        }
        break;

      default:
        throw new IllegalStateException("Unexpected pattern: " + n);
    }
    if (parens) {
      add(")");
    }
  }

  private void addPatterns(List<Node> patterns) {
    boolean first = true;
    for (Node pattern : patterns) {
      if (!first) {
        cc.listSeparator();
      }
      first = false;
      addPattern(pattern, Precedence.TEST);
    }
  }

  /** A piece of f-string text. Only expressions and constants constrain the quote. */
  private static final class FStringPiece {
    enum Kind {
      CONSTANT,
      EXPRESSION,
      SYNTAX
    }

    final Kind kind;
    final String text;

    FStringPiece(Kind kind, String text) {
      this.kind = kind;
      this.text = text;
    }
  }

  private void addFString(Node joinedStr) {
    List<FStringPiece> pieces = new ArrayList<>();
    collectFStringPieces(joinedStr, pieces);

    String quote = null;
    boolean escapeQuote = false;
    for (String candidate : FSTRING_QUOTES) {
      if (!containsQuote(pieces, candidate, FStringPiece.Kind.EXPRESSION)
          && !containsQuote(pieces, candidate.substring(0, 1), FStringPiece.Kind.CONSTANT)) {
        quote = candidate;
        break;
      }
    }
    if (quote == null) {
      for (String candidate : FSTRING_QUOTES) {
        if (!containsQuote(pieces, candidate, FStringPiece.Kind.EXPRESSION)) {
          quote = candidate;
          escapeQuote = true;
          break;
        }
      }
    }
    checkState(quote != null, "No quote fits f-string %s", joinedStr);

    String quoteChar = quote.substring(0, 1);
    StringBuilder sb = new StringBuilder("f").append(quote);
    for (FStringPiece piece : pieces) {
      if (escapeQuote && piece.kind == FStringPiece.Kind.CONSTANT) {
        sb.append(piece.text.replace(quoteChar, "\\" + quoteChar));
      } else {
        sb.append(piece.text);
      }
    }
    add(sb.append(quote).toString());
  }

  private static boolean containsQuote(
      List<FStringPiece> pieces, String quote, FStringPiece.Kind kind) {
    for (FStringPiece piece : pieces) {
      if (piece.kind == kind && piece.text.contains(quote)) {
        return true;
      }
    }
    return false;
  }

  private void collectFStringPieces(Node joinedStr, List<FStringPiece> pieces) {
    for (Node part : joinedStr.children()) {
      if (part.isString()) {
        String text = PyLiterals.escape(part.getString(), (char) 0);
        pieces.add(
            new FStringPiece(
                FStringPiece.Kind.CONSTANT, text.replace("{", "{{").replace("}", "}}")));
        continue;
      }
      checkState(part.getToken() == Token.FORMATTED_VALUE, "Unexpected f-string part %s", part);
      CodeConsumer nested = cc.createNested();
      new CodeGenerator(nested, StatementHooks.none(), compact)
          .addExpr(part.getFirstChild(), Precedence.TEST.next());
      String expression = nested.getCode();
      checkState(expression.indexOf('\\') < 0, "Backslash in f-string expression %s", expression);
      // "{{" would read as an escaped brace.
      pieces.add(
          new FStringPiece(FStringPiece.Kind.SYNTAX, expression.startsWith("{") ? "{ " : "{"));
      pieces.add(new FStringPiece(FStringPiece.Kind.EXPRESSION, expression));
      int conversion = part.getIntProp(Node.Prop.CONVERSION, -1);
      if (conversion != -1) {
        pieces.add(new FStringPiece(FStringPiece.Kind.SYNTAX, "!" + (char) conversion));
      }
      Node formatSpec = part.getSecondChild();
      if (!formatSpec.isEmpty()) {
        pieces.add(new FStringPiece(FStringPiece.Kind.SYNTAX, ":"));
        collectFStringPieces(formatSpec, pieces);
      }
      pieces.add(new FStringPiece(FStringPiece.Kind.SYNTAX, "}"));
    }
  }
}
