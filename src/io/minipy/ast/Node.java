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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the syntax tree handed over by the parser.
 *
 * <p>A node is a {@link Token} tag with an ordered list of children. Optional children that are
 * absent are represented by {@link Token#EMPTY} nodes so that every kind has a fixed layout; see
 * {@link IR} for the layout of each kind. Literal and identifier payloads live in private
 * subclasses, everything else in the property map.
 */
public class Node {

  /** Properties that can be attached to a node. */
  public enum Prop {
    IS_ASYNC, // async def, async for, async with, async comprehension
    IS_STAR, // try/except*
    U_PREFIX, // u'...' string literal
    SIMPLE, // annotated assignment to a bare name
    CONVERSION, // f-string conversion character, -1 if none
    LEVEL, // number of leading dots of a relative import
    AS_NAME, // "as" name of an import alias, rest name of a mapping pattern
    MODULE_NAME, // module of a from-import
    PARAM_KIND,
    COMPARE_OPS, // ImmutableList<Token> of a COMPARE
    OPERATOR, // binary operator Token of an AUG_ASSIGN
  }

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    public boolean hasString() {
      return true;
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return node instanceof StringNode && str.equals(node.getString());
    }
  }

  private static final class IntNode extends Node {
    private final BigInteger value;

    IntNode(BigInteger value) {
      super(Token.INT);
      this.value = checkNotNull(value);
    }

    @Override
    public BigInteger getBigInteger() {
      return value;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return node instanceof IntNode && value.equals(node.getBigInteger());
    }
  }

  private static final class FloatNode extends Node {
    private final double value;

    FloatNode(Token token, double value) {
      super(token);
      this.value = value;
    }

    @Override
    public double getDouble() {
      return value;
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return node instanceof FloatNode
          && Double.doubleToLongBits(value) == Double.doubleToLongBits(node.getDouble());
    }
  }

  private static final class BytesNode extends Node {
    private final byte[] value;

    BytesNode(byte[] value) {
      super(Token.BYTES);
      this.value = value.clone();
    }

    @Override
    public byte[] getBytes() {
      return value.clone();
    }

    @Override
    boolean isPayloadEquivalentTo(Node node) {
      return node instanceof BytesNode && Arrays.equals(value, ((BytesNode) node).value);
    }
  }

  private final Token token;
  private final List<Node> children = new ArrayList<>();
  private final Map<Prop, Object> props = new EnumMap<>(Prop.class);
  private @Nullable Node parent;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newInt(BigInteger value) {
    return new IntNode(value);
  }

  public static Node newFloat(double value) {
    return new FloatNode(Token.FLOAT, value);
  }

  public static Node newImaginary(double value) {
    return new FloatNode(Token.IMAGINARY, value);
  }

  public static Node newBytes(byte[] value) {
    return new BytesNode(value);
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return !children.isEmpty();
  }

  public final int getChildCount() {
    return children.size();
  }

  public final @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public final @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public final @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public final Node getChildAtIndex(int i) {
    return children.get(i);
  }

  /** Returns a read-only view of the children. */
  public final List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /** Returns the next sibling, or null for the last child or a root. */
  public final @Nullable Node getNext() {
    if (parent == null) {
      return null;
    }
    int index = parent.children.indexOf(this);
    return index + 1 < parent.children.size() ? parent.children.get(index + 1) : null;
  }

  public final void addChildToBack(Node child) {
    checkState(child.parent == null, "%s already has a parent", child);
    child.parent = this;
    children.add(child);
  }

  public final void addChildrenToBack(Iterable<Node> newChildren) {
    for (Node child : newChildren) {
      addChildToBack(child);
    }
  }

  /** Whether this node carries an identifier or string payload. */
  public boolean hasString() {
    return false;
  }

  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public BigInteger getBigInteger() {
    throw new UnsupportedOperationException(this + " is not an int node");
  }

  public double getDouble() {
    throw new UnsupportedOperationException(this + " is not a float node");
  }

  public byte[] getBytes() {
    throw new UnsupportedOperationException(this + " is not a bytes node");
  }

  public final @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  public final void putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
  }

  public final boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(props.get(prop));
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    putProp(prop, value ? Boolean.TRUE : null);
  }

  public final int getIntProp(Prop prop, int defaultValue) {
    Object value = props.get(prop);
    return value == null ? defaultValue : (Integer) value;
  }

  public final void putIntProp(Prop prop, int value) {
    props.put(prop, value);
  }

  public final @Nullable String getStringProp(Prop prop) {
    return (String) props.get(prop);
  }

  @SuppressWarnings("unchecked")
  public final ImmutableList<Token> getCompareOps() {
    Object ops = props.get(Prop.COMPARE_OPS);
    return ops == null ? ImmutableList.of() : (ImmutableList<Token>) ops;
  }

  public final ParamKind getParamKind() {
    return (ParamKind) checkNotNull(props.get(Prop.PARAM_KIND), this);
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  public final boolean isInt() {
    return token == Token.INT;
  }

  public final boolean isTuple() {
    return token == Token.TUPLE;
  }

  public final boolean isStarred() {
    return token == Token.STARRED;
  }

  public final boolean isImport() {
    return token == Token.IMPORT;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isExprStatement() {
    return token == Token.EXPR;
  }

  public final boolean isKeyword() {
    return token == Token.KEYWORD;
  }

  public final boolean isGeneratorExp() {
    return token == Token.GENERATOR_EXP;
  }

  boolean isPayloadEquivalentTo(Node node) {
    return node.getClass() == Node.class;
  }

  /** Returns whether this tree and {@code node} have the same shape, payloads and properties. */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || children.size() != node.children.size()
        || !isPayloadEquivalentTo(node)
        || !Objects.equals(props, node.props)) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isEquivalentTo(node.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof IntNode) {
      sb.append(' ').append(getBigInteger());
    } else if (this instanceof FloatNode) {
      sb.append(' ').append(getDouble());
    }
    if (!props.isEmpty()) {
      sb.append(' ').append(props);
    }
    return sb.toString();
  }

  /** Prints the whole subtree, one node per line. Used for debugging and test failures. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
