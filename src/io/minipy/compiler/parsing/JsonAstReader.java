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

package io.minipy.compiler.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.BaseEncoding;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.minipy.ast.IR;
import io.minipy.ast.Node;
import io.minipy.ast.ParamKind;
import io.minipy.ast.Token;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads a Python syntax tree serialized as JSON in the {@code ast2json} layout: every node is an
 * object whose {@code _type} is the Python {@code ast} class name and whose other keys are that
 * class's fields. Context fields ({@code ctx}) and position attributes are ignored.
 *
 * <p>Constant values that JSON cannot express are objects of their own:
 *
 * <pre>
 * {"_type": "bytes", "hex": "00ff"}
 * {"_type": "complex", "real": 0.0, "imag": 2.0}
 * {"_type": "float", "repr": "inf"}
 * {"_type": "Ellipsis"}
 * </pre>
 *
 * A JSON number is an int unless it has a fraction or an exponent.
 */
public final class JsonAstReader {

  private static final ImmutableMap<String, Token> BINARY_OPERATORS =
      ImmutableMap.<String, Token>builder()
          .put("Add", Token.ADD)
          .put("Sub", Token.SUB)
          .put("Mult", Token.MULT)
          .put("MatMult", Token.MAT_MULT)
          .put("Div", Token.DIV)
          .put("Mod", Token.MOD)
          .put("Pow", Token.POW)
          .put("LShift", Token.LSHIFT)
          .put("RShift", Token.RSHIFT)
          .put("BitOr", Token.BIT_OR)
          .put("BitXor", Token.BIT_XOR)
          .put("BitAnd", Token.BIT_AND)
          .put("FloorDiv", Token.FLOOR_DIV)
          .buildOrThrow();

  private static final ImmutableMap<String, Token> UNARY_OPERATORS =
      ImmutableMap.of(
          "Invert", Token.INVERT, "Not", Token.NOT, "UAdd", Token.UADD, "USub", Token.USUB);

  private static final ImmutableMap<String, Token> COMPARISON_OPERATORS =
      ImmutableMap.<String, Token>builder()
          .put("Eq", Token.EQ)
          .put("NotEq", Token.NOT_EQ)
          .put("Lt", Token.LT)
          .put("LtE", Token.LT_E)
          .put("Gt", Token.GT)
          .put("GtE", Token.GT_E)
          .put("Is", Token.IS)
          .put("IsNot", Token.IS_NOT)
          .put("In", Token.IN)
          .put("NotIn", Token.NOT_IN)
          .buildOrThrow();

  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  private JsonAstReader() {}

  /** Reads a {@code Module} document. */
  public static Node read(String json) throws AstReadException {
    try {
      return readModule(JsonParser.parseString(json));
    } catch (JsonParseException e) {
      throw new AstReadException("JSON parse exception: " + e.getMessage(), e);
    }
  }

  public static Node read(Reader reader) throws AstReadException {
    try {
      return readModule(JsonParser.parseReader(reader));
    } catch (JsonParseException e) {
      throw new AstReadException("JSON parse exception: " + e.getMessage(), e);
    }
  }

  private static Node readModule(JsonElement root) throws AstReadException {
    if (!root.isJsonObject()) {
      throw new AstReadException("Expected a Module object, got " + root);
    }
    JsonObject module = root.getAsJsonObject();
    if (!type(module).equals("Module")) {
      throw new AstReadException("Expected a Module, got " + type(module));
    }
    try {
      return IR.module(statements(module, "body"));
    } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException e) {
      // Layout violations caught by IR, or JSON values of the wrong shape.
      throw new AstReadException("Malformed syntax tree: " + e.getMessage(), e);
    }
  }

  private static String type(JsonObject o) throws AstReadException {
    JsonElement type = o.get("_type");
    if (type == null || !type.isJsonPrimitive()) {
      throw new AstReadException("Node without _type: " + o);
    }
    return type.getAsString();
  }

  private static JsonElement field(JsonObject o, String name) throws AstReadException {
    JsonElement value = o.get(name);
    if (value == null || value.isJsonNull()) {
      throw new AstReadException("Missing field '" + name + "' in " + type(o));
    }
    return value;
  }

  private static JsonObject object(JsonObject o, String name) throws AstReadException {
    return field(o, name).getAsJsonObject();
  }

  private static @Nullable JsonObject optObject(JsonObject o, String name) {
    JsonElement value = o.get(name);
    return value == null || value.isJsonNull() ? null : value.getAsJsonObject();
  }

  private static String string(JsonObject o, String name) throws AstReadException {
    return field(o, name).getAsString();
  }

  private static @Nullable String optString(JsonObject o, String name) {
    JsonElement value = o.get(name);
    return value == null || value.isJsonNull() ? null : value.getAsString();
  }

  private static int optInt(JsonObject o, String name, int defaultValue) {
    JsonElement value = o.get(name);
    return value == null || value.isJsonNull() ? defaultValue : value.getAsInt();
  }

  /** Python writes some flags as 0/1 and some as booleans. */
  private static boolean flag(JsonObject o, String name) {
    JsonElement value = o.get(name);
    if (value == null || value.isJsonNull()) {
      return false;
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    return primitive.isBoolean() ? primitive.getAsBoolean() : primitive.getAsInt() != 0;
  }

  private static JsonArray array(JsonObject o, String name) {
    JsonElement value = o.get(name);
    return value == null || value.isJsonNull() ? new JsonArray() : value.getAsJsonArray();
  }

  private static ImmutableList<Node> statements(JsonObject o, String name)
      throws AstReadException {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (JsonElement each : array(o, name)) {
      result.add(statement(each.getAsJsonObject()));
    }
    return result.build();
  }

  private static Node block(JsonObject o, String name) throws AstReadException {
    return IR.block(statements(o, name));
  }

  private static @Nullable Node optBlock(JsonObject o, String name) throws AstReadException {
    ImmutableList<Node> statements = statements(o, name);
    return statements.isEmpty() ? null : IR.block(statements);
  }

  private static ImmutableList<Node> expressions(JsonObject o, String name)
      throws AstReadException {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (JsonElement each : array(o, name)) {
      result.add(expression(each.getAsJsonObject()));
    }
    return result.build();
  }

  private static Node expression(JsonObject o, String name) throws AstReadException {
    return expression(object(o, name));
  }

  private static @Nullable Node optExpression(JsonObject o, String name)
      throws AstReadException {
    JsonObject value = optObject(o, name);
    return value == null ? null : expression(value);
  }

  private static ImmutableList<Node> patterns(JsonObject o, String name)
      throws AstReadException {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (JsonElement each : array(o, name)) {
      result.add(pattern(each.getAsJsonObject()));
    }
    return result.build();
  }

  private static Node[] toArray(List<Node> nodes) {
    return nodes.toArray(new Node[0]);
  }

  private static Token operator(JsonObject o, String name, ImmutableMap<String, Token> table)
      throws AstReadException {
    String op = type(object(o, name));
    Token token = table.get(op);
    if (token == null) {
      throw new AstReadException("Unknown operator " + op + " in " + type(o));
    }
    return token;
  }

  private static Node statement(JsonObject o) throws AstReadException {
    String type = type(o);
    switch (type) {
      case "FunctionDef":
      case "AsyncFunctionDef":
        {
          Node decorators = IR.decorators(toArray(expressions(o, "decorator_list")));
          Node arguments = arguments(object(o, "args"));
          Node returns = optExpression(o, "returns");
          Node body = block(o, "body");
          return type.equals("FunctionDef")
              ? IR.function(string(o, "name"), decorators, arguments, returns, body)
              : IR.asyncFunction(string(o, "name"), decorators, arguments, returns, body);
        }
      case "ClassDef":
        {
          List<Node> args = new ArrayList<>(expressions(o, "bases"));
          args.addAll(keywords(o));
          return IR.classDef(
              string(o, "name"),
              IR.decorators(toArray(expressions(o, "decorator_list"))),
              IR.argList(toArray(args)),
              block(o, "body"));
        }
      case "Return":
        {
          Node value = optExpression(o, "value");
          return value == null ? IR.returnNode() : IR.returnNode(value);
        }
      case "Delete":
        return IR.delete(toArray(expressions(o, "targets")));
      case "Assign":
        return IR.assign(expressions(o, "targets"), expression(o, "value"));
      case "AugAssign":
        return IR.augAssign(
            operator(o, "op", BINARY_OPERATORS),
            expression(o, "target"),
            expression(o, "value"));
      case "AnnAssign":
        return IR.annAssign(
            expression(o, "target"),
            expression(o, "annotation"),
            optExpression(o, "value"),
            flag(o, "simple"));
      case "For":
      case "AsyncFor":
        {
          Node target = expression(o, "target");
          Node iter = expression(o, "iter");
          Node body = block(o, "body");
          Node orelse = optBlock(o, "orelse");
          return type.equals("For")
              ? IR.forNode(target, iter, body, orelse)
              : IR.asyncFor(target, iter, body, orelse);
        }
      case "While":
        return IR.whileNode(expression(o, "test"), block(o, "body"), optBlock(o, "orelse"));
      case "If":
        return IR.ifNode(expression(o, "test"), block(o, "body"), optBlock(o, "orelse"));
      case "With":
      case "AsyncWith":
        {
          ImmutableList.Builder<Node> items = ImmutableList.builder();
          for (JsonElement each : array(o, "items")) {
            JsonObject item = each.getAsJsonObject();
            items.add(
                IR.withItem(
                    expression(item, "context_expr"), optExpression(item, "optional_vars")));
          }
          return type.equals("With")
              ? IR.with(items.build(), block(o, "body"))
              : IR.asyncWith(items.build(), block(o, "body"));
        }
      case "Match":
        {
          List<Node> cases = new ArrayList<>();
          for (JsonElement each : array(o, "cases")) {
            JsonObject matchCase = each.getAsJsonObject();
            cases.add(
                IR.matchCase(
                    pattern(object(matchCase, "pattern")),
                    optExpression(matchCase, "guard"),
                    block(matchCase, "body")));
          }
          return IR.match(expression(o, "subject"), toArray(cases));
        }
      case "Raise":
        {
          Node exception = optExpression(o, "exc");
          Node cause = optExpression(o, "cause");
          if (exception == null) {
            return IR.raise();
          }
          return cause == null ? IR.raise(exception) : IR.raise(exception, cause);
        }
      case "Try":
      case "TryStar":
        {
          ImmutableList.Builder<Node> handlers = ImmutableList.builder();
          for (JsonElement each : array(o, "handlers")) {
            JsonObject handler = each.getAsJsonObject();
            handlers.add(
                IR.exceptHandler(
                    optExpression(handler, "type"),
                    optString(handler, "name"),
                    block(handler, "body")));
          }
          Node body = block(o, "body");
          Node orelse = optBlock(o, "orelse");
          Node finallyBody = optBlock(o, "finalbody");
          return type.equals("Try")
              ? IR.tryNode(body, handlers.build(), orelse, finallyBody)
              : IR.tryStar(body, handlers.build(), orelse, finallyBody);
        }
      case "Assert":
        {
          Node message = optExpression(o, "msg");
          Node test = expression(o, "test");
          return message == null ? IR.assertNode(test) : IR.assertNode(test, message);
        }
      case "Import":
        return IR.importNode(aliases(o));
      case "ImportFrom":
        return IR.importFrom(optString(o, "module"), optInt(o, "level", 0), aliases(o));
      case "Global":
        return IR.global(names(o));
      case "Nonlocal":
        return IR.nonlocal(names(o));
      case "Expr":
        return IR.exprResult(expression(o, "value"));
      case "Pass":
        return IR.pass();
      case "Break":
        return IR.breakNode();
      case "Continue":
        return IR.continueNode();
      default:
        throw new AstReadException("Unsupported statement " + type);
    }
  }

  private static Node[] aliases(JsonObject o) throws AstReadException {
    List<Node> aliases = new ArrayList<>();
    for (JsonElement each : array(o, "names")) {
      JsonObject alias = each.getAsJsonObject();
      aliases.add(IR.alias(string(alias, "name"), optString(alias, "asname")));
    }
    return toArray(aliases);
  }

  private static String[] names(JsonObject o) {
    JsonArray names = array(o, "names");
    String[] result = new String[names.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = names.get(i).getAsString();
    }
    return result;
  }

  private static ImmutableList<Node> keywords(JsonObject o) throws AstReadException {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (JsonElement each : array(o, "keywords")) {
      JsonObject keyword = each.getAsJsonObject();
      result.add(IR.keyword(optString(keyword, "arg"), expression(keyword, "value")));
    }
    return result.build();
  }

  private static Node arguments(JsonObject o) throws AstReadException {
    List<Node> params = new ArrayList<>();
    JsonArray positionalOnly = array(o, "posonlyargs");
    JsonArray positional = array(o, "args");
    JsonArray defaults = array(o, "defaults");
    int positionalCount = positionalOnly.size() + positional.size();
    // Defaults belong to the last positional parameters.
    int firstDefault = positionalCount - defaults.size();
    for (int i = 0; i < positionalCount; i++) {
      boolean only = i < positionalOnly.size();
      JsonObject arg =
          (only ? positionalOnly.get(i) : positional.get(i - positionalOnly.size()))
              .getAsJsonObject();
      Node defaultValue =
          i >= firstDefault ? expression(defaults.get(i - firstDefault).getAsJsonObject()) : null;
      params.add(
          param(
              arg,
              only ? ParamKind.POSITIONAL_ONLY : ParamKind.POSITIONAL_OR_KEYWORD,
              defaultValue));
    }
    JsonObject vararg = optObject(o, "vararg");
    if (vararg != null) {
      params.add(param(vararg, ParamKind.VAR_POSITIONAL, null));
    }
    JsonArray keywordOnly = array(o, "kwonlyargs");
    JsonArray keywordDefaults = array(o, "kw_defaults");
    for (int i = 0; i < keywordOnly.size(); i++) {
      JsonElement defaultValue = i < keywordDefaults.size() ? keywordDefaults.get(i) : null;
      params.add(
          param(
              keywordOnly.get(i).getAsJsonObject(),
              ParamKind.KEYWORD_ONLY,
              defaultValue == null || defaultValue.isJsonNull()
                  ? null
                  : expression(defaultValue.getAsJsonObject())));
    }
    JsonObject kwarg = optObject(o, "kwarg");
    if (kwarg != null) {
      params.add(param(kwarg, ParamKind.VAR_KEYWORD, null));
    }
    return IR.arguments(toArray(params));
  }

  private static Node param(JsonObject arg, ParamKind kind, @Nullable Node defaultValue)
      throws AstReadException {
    return IR.param(string(arg, "arg"), kind, optExpression(arg, "annotation"), defaultValue);
  }

  private static Node expression(JsonObject o) throws AstReadException {
    String type = type(o);
    switch (type) {
      case "BoolOp":
        {
          Node[] values = toArray(expressions(o, "values"));
          String op = type(object(o, "op"));
          if (op.equals("And")) {
            return IR.and(values);
          } else if (op.equals("Or")) {
            return IR.or(values);
          }
          throw new AstReadException("Unknown boolean operator " + op);
        }
      case "NamedExpr":
        return IR.namedExpr(expression(o, "target"), expression(o, "value"));
      case "BinOp":
        return IR.binaryOp(
            operator(o, "op", BINARY_OPERATORS), expression(o, "left"), expression(o, "right"));
      case "UnaryOp":
        return IR.unaryOp(operator(o, "op", UNARY_OPERATORS), expression(o, "operand"));
      case "Lambda":
        return IR.lambda(arguments(object(o, "args")), expression(o, "body"));
      case "IfExp":
        return IR.ifExp(expression(o, "test"), expression(o, "body"), expression(o, "orelse"));
      case "Dict":
        {
          JsonArray keys = array(o, "keys");
          ImmutableList<Node> values = expressions(o, "values");
          if (keys.size() != values.size()) {
            throw new AstReadException("Dict with " + keys.size() + " keys and " + values.size());
          }
          List<Node> keysAndValues = new ArrayList<>();
          for (int i = 0; i < keys.size(); i++) {
            JsonElement key = keys.get(i);
            keysAndValues.add(key.isJsonNull() ? IR.empty() : expression(key.getAsJsonObject()));
            keysAndValues.add(values.get(i));
          }
          return IR.dict(toArray(keysAndValues));
        }
      case "Set":
        return IR.set(toArray(expressions(o, "elts")));
      case "List":
        return IR.list(toArray(expressions(o, "elts")));
      case "Tuple":
        return IR.tuple(toArray(expressions(o, "elts")));
      case "ListComp":
        return IR.listComp(expression(o, "elt"), comprehensions(o));
      case "SetComp":
        return IR.setComp(expression(o, "elt"), comprehensions(o));
      case "GeneratorExp":
        return IR.generatorExp(expression(o, "elt"), comprehensions(o));
      case "DictComp":
        return IR.dictComp(expression(o, "key"), expression(o, "value"), comprehensions(o));
      case "Await":
        return IR.await(expression(o, "value"));
      case "Yield":
        {
          Node value = optExpression(o, "value");
          return value == null ? IR.yield() : IR.yield(value);
        }
      case "YieldFrom":
        return IR.yieldFrom(expression(o, "value"));
      case "Compare":
        {
          List<Token> operators = new ArrayList<>();
          for (JsonElement each : array(o, "ops")) {
            String op = type(each.getAsJsonObject());
            Token token = COMPARISON_OPERATORS.get(op);
            if (token == null) {
              throw new AstReadException("Unknown comparison operator " + op);
            }
            operators.add(token);
          }
          return IR.compare(expression(o, "left"), operators, expressions(o, "comparators"));
        }
      case "Call":
        {
          List<Node> args = new ArrayList<>(expressions(o, "args"));
          args.addAll(keywords(o));
          return IR.call(expression(o, "func"), toArray(args));
        }
      case "FormattedValue":
        {
          JsonObject formatSpec = optObject(o, "format_spec");
          return IR.formattedValue(
              expression(o, "value"),
              optInt(o, "conversion", -1),
              formatSpec == null ? null : expression(formatSpec));
        }
      case "JoinedStr":
        return IR.joinedStr(toArray(expressions(o, "values")));
      case "Constant":
        // None is serialized as JSON null.
        return constant(
            o.has("value") ? o.get("value") : JsonNull.INSTANCE, optString(o, "kind"));
      case "Attribute":
        return IR.attribute(expression(o, "value"), string(o, "attr"));
      case "Subscript":
        return IR.subscript(expression(o, "value"), expression(o, "slice"));
      case "Index":
        // Python 3.8 and older wrap plain subscripts.
        return expression(o, "value");
      case "ExtSlice":
        return IR.tuple(toArray(expressions(o, "dims")));
      case "Starred":
        return IR.starred(expression(o, "value"));
      case "Name":
        return IR.name(string(o, "id"));
      case "Slice":
        return IR.slice(
            optExpression(o, "lower"), optExpression(o, "upper"), optExpression(o, "step"));
      default:
        throw new AstReadException("Unsupported expression " + type);
    }
  }

  private static Node[] comprehensions(JsonObject o) throws AstReadException {
    List<Node> generators = new ArrayList<>();
    for (JsonElement each : array(o, "generators")) {
      JsonObject generator = each.getAsJsonObject();
      Node target = expression(generator, "target");
      Node iter = expression(generator, "iter");
      Node[] ifs = toArray(expressions(generator, "ifs"));
      generators.add(
          flag(generator, "is_async")
              ? IR.asyncComprehension(target, iter, ifs)
              : IR.comprehension(target, iter, ifs));
    }
    return toArray(generators);
  }

  private static Node constant(JsonElement value, @Nullable String kind)
      throws AstReadException {
    if (value.isJsonNull()) {
      return IR.none();
    }
    if (value.isJsonObject()) {
      return wrappedConstant(value.getAsJsonObject());
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean() ? IR.trueNode() : IR.falseNode();
    }
    if (primitive.isString()) {
      String str = primitive.getAsString();
      return "u".equals(kind) ? IR.uString(str) : IR.string(str);
    }
    String number = primitive.getAsString();
    if (number.indexOf('.') >= 0 || number.indexOf('e') >= 0 || number.indexOf('E') >= 0) {
      return IR.floatNode(Double.parseDouble(number));
    }
    return IR.number(new BigInteger(number));
  }

  private static Node wrappedConstant(JsonObject o) throws AstReadException {
    String type = type(o);
    switch (type) {
      case "bytes":
        return IR.bytes(HEX.decode(string(o, "hex")));
      case "complex":
        {
          if (o.has("real") && o.get("real").getAsDouble() != 0) {
            throw new AstReadException("Complex constant with a real part: " + o);
          }
          return IR.imaginary(parseFloat(field(o, "imag")));
        }
      case "float":
        return IR.floatNode(parseFloat(field(o, "repr")));
      case "Ellipsis":
        return IR.ellipsis();
      default:
        throw new AstReadException("Unsupported constant " + type);
    }
  }

  /** Accepts JSON numbers and Python's float reprs, including inf and nan. */
  private static double parseFloat(JsonElement value) {
    String text = value.getAsString();
    switch (text) {
      case "inf":
        return Double.POSITIVE_INFINITY;
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      case "nan":
        return Double.NaN;
      default:
        return Double.parseDouble(text);
    }
  }

  private static Node pattern(JsonObject o) throws AstReadException {
    String type = type(o);
    switch (type) {
      case "MatchValue":
        return IR.matchValue(expression(o, "value"));
      case "MatchSingleton":
        {
          JsonElement value = o.has("value") ? o.get("value") : JsonNull.INSTANCE;
          return IR.matchSingleton(constant(value, null));
        }
      case "MatchSequence":
        return IR.matchSequence(toArray(patterns(o, "patterns")));
      case "MatchMapping":
        return IR.matchMapping(
            expressions(o, "keys"), patterns(o, "patterns"), optString(o, "rest"));
      case "MatchClass":
        {
          JsonArray attrs = array(o, "kwd_attrs");
          ImmutableList<Node> keywordPatterns = patterns(o, "kwd_patterns");
          if (attrs.size() != keywordPatterns.size()) {
            throw new AstReadException("MatchClass keyword mismatch: " + o);
          }
          List<Node> keywords = new ArrayList<>();
          for (int i = 0; i < attrs.size(); i++) {
            keywords.add(IR.matchKeyword(attrs.get(i).getAsString(), keywordPatterns.get(i)));
          }
          return IR.matchClass(expression(o, "cls"), patterns(o, "patterns"), keywords);
        }
      case "MatchStar":
        return IR.matchStar(optString(o, "name"));
      case "MatchAs":
        {
          JsonObject pattern = optObject(o, "pattern");
          return IR.matchAs(pattern == null ? null : pattern(pattern), optString(o, "name"));
        }
      case "MatchOr":
        return IR.matchOr(toArray(patterns(o, "patterns")));
      default:
        throw new AstReadException("Unsupported pattern " + type);
    }
  }
}
