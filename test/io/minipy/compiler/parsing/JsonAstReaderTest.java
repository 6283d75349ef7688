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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import io.minipy.ast.IR;
import io.minipy.ast.Node;
import io.minipy.ast.ParamKind;
import io.minipy.ast.Token;
import io.minipy.compiler.Minimizer;
import io.minipy.compiler.MinimizerOptions;
import java.io.StringReader;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JsonAstReaderTest {

  /** Lets fixtures use single quotes; none of them contains a quote character. */
  private static String json(String text) {
    return text.replace('\'', '"');
  }

  private static Node module(String... statements) throws AstReadException {
    return JsonAstReader.read(
        json("{'_type':'Module','body':[" + String.join(",", statements) + "]}"));
  }

  private static Node expr(String expression) throws AstReadException {
    return module("{'_type':'Expr','value':" + expression + "}")
        .getFirstChild()
        .getFirstChild();
  }

  private static String name(String id) {
    return "{'_type':'Name','id':'" + id + "','ctx':{'_type':'Load'}}";
  }

  private static String constant(String value) {
    return "{'_type':'Constant','value':" + value + "}";
  }

  private static String minimize(Node tree) {
    MinimizerOptions options = new MinimizerOptions();
    options.setCompress(false);
    return new Minimizer(options).minimize(tree);
  }

  @Test
  public void testIfWithTwoStatements() throws AstReadException {
    String assignX =
        "{'_type':'Assign','targets':[" + name("x") + "],'value':" + constant("1") + "}";
    String assignY =
        "{'_type':'Assign','targets':[" + name("y") + "],'value':" + constant("2") + "}";
    Node tree =
        module(
            "{'_type':'If','test':"
                + constant("true")
                + ",'body':["
                + assignX
                + ","
                + assignY
                + "],'orelse':[]}");
    Node expected =
        IR.module(
            IR.ifNode(
                IR.trueNode(),
                IR.block(
                    IR.assign(IR.name("x"), IR.number(1)),
                    IR.assign(IR.name("y"), IR.number(2)))));
    assertThat(tree.isEquivalentTo(expected)).isTrue();
    assertThat(minimize(tree)).isEqualTo("if True:x=1;y=2");
  }

  @Test
  public void testReadFromReader() throws AstReadException {
    Node tree =
        JsonAstReader.read(
            new StringReader(json("{'_type':'Module','body':[{'_type':'Pass'}]}")));
    assertThat(tree.isEquivalentTo(IR.module(IR.pass()))).isTrue();
  }

  @Test
  public void testConstants() throws AstReadException {
    assertThat(expr(constant("null")).getToken()).isEqualTo(Token.NONE);
    assertThat(expr(constant("false")).getToken()).isEqualTo(Token.FALSE);
    assertThat(expr(constant("12345678901234567890")).getBigInteger())
        .isEqualTo(new BigInteger("12345678901234567890"));
    assertThat(expr(constant("1.5")).getDouble()).isEqualTo(1.5);
    assertThat(expr(constant("1e3")).getToken()).isEqualTo(Token.FLOAT);
    assertThat(expr(constant("'abc'")).getString()).isEqualTo("abc");
    assertThat(expr(constant("{'_type':'Ellipsis'}")).getToken()).isEqualTo(Token.ELLIPSIS);
  }

  @Test
  public void testNoneInProgram() throws AstReadException {
    String isNone =
        "{'_type':'Compare','left':"
            + name("x")
            + ",'ops':[{'_type':'Is'}],'comparators':["
            + constant("null")
            + "]}";
    Node tree =
        module(
            "{'_type':'Assign','targets':[" + name("x") + "],'value':" + constant("null") + "}",
            "{'_type':'If','test':" + isNone + ",'body':[{'_type':'Pass'}],'orelse':[]}");
    Node expected =
        IR.module(
            IR.assign(IR.name("x"), IR.none()),
            IR.ifNode(
                IR.compare(IR.name("x"), Token.IS, IR.none()), IR.block(IR.pass())));
    assertThat(tree.isEquivalentTo(expected)).isTrue();
    assertThat(minimize(tree)).isEqualTo("x=None\nif x is None:pass");
  }

  @Test
  public void testConstantWithoutValueIsNone() throws AstReadException {
    assertThat(expr("{'_type':'Constant'}").getToken()).isEqualTo(Token.NONE);
  }

  @Test
  public void testUnicodeStringKind() throws AstReadException {
    Node str = expr("{'_type':'Constant','value':'a','kind':'u'}");
    assertThat(str.getBooleanProp(Node.Prop.U_PREFIX)).isTrue();
  }

  @Test
  public void testWrappedConstants() throws AstReadException {
    assertThat(expr(constant("{'_type':'bytes','hex':'00ff'}")).getBytes())
        .isEqualTo(new byte[] {0, (byte) 0xff});
    Node imaginary = expr(constant("{'_type':'complex','real':0.0,'imag':2.0}"));
    assertThat(imaginary.getToken()).isEqualTo(Token.IMAGINARY);
    assertThat(imaginary.getDouble()).isEqualTo(2.0);
    assertThat(expr(constant("{'_type':'float','repr':'inf'}")).getDouble())
        .isEqualTo(Double.POSITIVE_INFINITY);
    assertThrows(
        AstReadException.class,
        () -> expr(constant("{'_type':'complex','real':1.0,'imag':2.0}")));
  }

  @Test
  public void testOperators() throws AstReadException {
    Node tree =
        expr(
            "{'_type':'BinOp','op':{'_type':'Pow'},'left':"
                + name("a")
                + ",'right':{'_type':'UnaryOp','op':{'_type':'USub'},'operand':"
                + name("b")
                + "}}");
    assertThat(tree.getToken()).isEqualTo(Token.POW);
    assertThat(tree.getSecondChild().getToken()).isEqualTo(Token.USUB);

    Node compare =
        expr(
            "{'_type':'Compare','left':"
                + name("a")
                + ",'ops':[{'_type':'Lt'},{'_type':'NotIn'}],'comparators':["
                + name("b")
                + ","
                + name("c")
                + "]}");
    assertThat(compare.getCompareOps()).containsExactly(Token.LT, Token.NOT_IN).inOrder();
  }

  @Test
  public void testFunctionArguments() throws AstReadException {
    String arg = "{'_type':'arg','arg':'%s'}";
    String function =
        "{'_type':'FunctionDef','name':'f','decorator_list':[],'body':[{'_type':'Pass'}],"
            + "'args':{'_type':'arguments',"
            + "'posonlyargs':["
            + String.format(arg, "a")
            + "],'args':["
            + String.format(arg, "b")
            + ","
            + String.format(arg, "c")
            + "],'defaults':["
            + constant("1")
            + "],'vararg':"
            + String.format(arg, "args")
            + ",'kwonlyargs':["
            + String.format(arg, "d")
            + ","
            + String.format(arg, "e")
            + "],'kw_defaults':[null,"
            + constant("2")
            + "],'kwarg':"
            + String.format(arg, "kw")
            + "}}";
    Node tree = module(function);
    Node params = tree.getFirstChild().getSecondChild();
    assertThat(params.getChildCount()).isEqualTo(7);
    assertThat(params.getFirstChild().getParamKind()).isEqualTo(ParamKind.POSITIONAL_ONLY);
    assertThat(params.getChildAtIndex(1).getSecondChild().isEmpty()).isTrue();
    assertThat(params.getChildAtIndex(2).getSecondChild().isInt()).isTrue();
    assertThat(params.getChildAtIndex(4).getSecondChild().isEmpty()).isTrue();
    assertThat(minimize(tree)).isEqualTo("def f(a,/,b,c=1,*args,d,e=2,**kw):pass");
  }

  @Test
  public void testImports() throws AstReadException {
    Node tree =
        module(
            "{'_type':'Import','names':[{'_type':'alias','name':'os'}]}",
            "{'_type':'ImportFrom','module':null,'level':2,"
                + "'names':[{'_type':'alias','name':'x','asname':'y'}]}");
    assertThat(minimize(tree)).isEqualTo("import os;from..import x as y");
  }

  @Test
  public void testSubscriptsOfOlderPythons() throws AstReadException {
    Node tree =
        module(
            "{'_type':'Expr','value':{'_type':'Subscript','value':"
                + name("x")
                + ",'slice':{'_type':'ExtSlice','dims':[{'_type':'Slice'},"
                + "{'_type':'Index','value':"
                + constant("1")
                + "}]}}}");
    assertThat(minimize(tree)).isEqualTo("x[:,1]");
  }

  @Test
  public void testDictUnpacking() throws AstReadException {
    Node dict = expr("{'_type':'Dict','keys':[null],'values':[" + name("b") + "]}");
    assertThat(dict.getFirstChild().isEmpty()).isTrue();
  }

  @Test
  public void testMatchPatterns() throws AstReadException {
    Node tree =
        module(
            "{'_type':'Match','subject':"
                + name("x")
                + ",'cases':[{'_type':'match_case','pattern':"
                + "{'_type':'MatchMapping','keys':["
                + constant("'k'")
                + "],'patterns':[{'_type':'MatchAs','name':'v'}],'rest':'r'},"
                + "'body':[{'_type':'Pass'}]},"
                + "{'_type':'match_case','pattern':{'_type':'MatchSingleton','value':null},"
                + "'body':[{'_type':'Pass'}]}]}");
    assertThat(minimize(tree)).isEqualTo("match x:\n case{'k':v,**r}:pass\n case None:pass");
  }

  @Test
  public void testMalformedInput() {
    assertThrows(AstReadException.class, () -> JsonAstReader.read("{"));
    assertThrows(AstReadException.class, () -> JsonAstReader.read("[]"));
    assertThrows(AstReadException.class, () -> JsonAstReader.read(json("{'_type':'Expr'}")));
    assertThrows(AstReadException.class, () -> module("{'_type':'Frobnicate'}"));
    assertThrows(AstReadException.class, () -> module("{'body':[]}"));
    assertThrows(AstReadException.class, () -> module("{'_type':'Expr'}"));
    String badOperator =
        "{'_type':'BinOp','op':{'_type':'Spam'},'left':"
            + name("a")
            + ",'right':"
            + name("b")
            + "}";
    assertThrows(AstReadException.class, () -> expr(badOperator));
  }

  @Test
  public void testLayoutViolationIsReported() {
    // A statement where an expression belongs.
    AstReadException e =
        assertThrows(
            AstReadException.class,
            () -> module("{'_type':'Expr','value':{'_type':'Pass'}}"));
    assertThat(e).hasMessageThat().contains("Unsupported expression Pass");
    // Bytes that are not hex.
    e =
        assertThrows(
            AstReadException.class,
            () -> expr(constant("{'_type':'bytes','hex':'zz'}")));
    assertThat(e).hasMessageThat().startsWith("Malformed syntax tree");
  }
}
