/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.fjc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ExprIR.Assignment;
import exm.fjc.ic.tree.ExprIR.Binary;
import exm.fjc.ic.tree.ExprIR.FunctionExpr;
import exm.fjc.ic.tree.ExprIR.Identifier;
import exm.fjc.ic.tree.ExprIR.InstanceCreation;
import exm.fjc.ic.tree.ExprIR.PropertyAccess;
import exm.fjc.ic.tree.ExprIR.Unary;
import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.StmtIR.ExpressionStmt;
import exm.fjc.ic.tree.StmtIR.VarDecl;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.ic.tree.VariableDecl;
import exm.fjc.parser.Lexer;
import exm.fjc.parser.Parser;

public class ASTWalkerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ASTWalkerTest.fjc.log", true);
  }

  private static List<Declaration> walk(String text) {
    Diagnostics diags = new Diagnostics();
    return new ASTWalker(diags).walk(Parser.parse("test.dart",
        Lexer.tokenize("test.dart", text, diags), diags).getAST());
  }

  private static ExprIR firstExpr(MethodDecl m) {
    StmtIR s = m.getBody().getBlock().getStatements().get(0);
    return ((ExpressionStmt) s).getExpr();
  }

  @Test
  public void testBareMemberNamesResolveToReceivers() {
    ClassDecl c = (ClassDecl) walk(
        "class C {\n" +
        "  int count = 0;\n" +
        "  static int total = 0;\n" +
        "  void inc() { count++; }\n" +
        "  static void bump() { total++; }\n" +
        "}\n").get(0);

    Unary inc = (Unary) firstExpr(c.getMethods().get(0));
    PropertyAccess count = (PropertyAccess) inc.getOperand();
    assertEquals("count", count.getName());
    Identifier self = (Identifier) count.getTarget();
    assertTrue(self.isThis());
    assertEquals(new TypeIR("C"), self.getType());

    Unary bump = (Unary) firstExpr(c.getMethods().get(1));
    PropertyAccess total = (PropertyAccess) bump.getOperand();
    Identifier cls = (Identifier) total.getTarget();
    assertTrue("Static members go through the class", cls.isTypeReference());
    assertEquals("C", cls.getName());
  }

  @Test
  public void testLocalShadowsMember() {
    ClassDecl c = (ClassDecl) walk(
        "class C {\n" +
        "  int x;\n" +
        "  void m(int x) { x = 1; }\n" +
        "}\n").get(0);
    Assignment a = (Assignment) firstExpr(c.getMethods().get(0));
    assertEquals(ExprKind.IDENTIFIER, a.getTarget().getKind());
    assertEquals(TypeIR.INT, a.getTarget().getType());
  }

  @Test
  public void testSuperclassMembersVisible() {
    List<Declaration> decls = walk(
        "class Base { int size = 0; }\n" +
        "class Derived extends Base { int twice() => size * 2; }\n");
    ClassDecl derived = (ClassDecl) decls.get(1);
    ExprIR e = derived.getMethods().get(0).getBody().getExpr();
    PropertyAccess size = (PropertyAccess) ((Binary) e).getLeft();
    assertEquals("size", size.getName());
  }

  @Test
  public void testClosureCaptures() {
    FunctionDecl f = (FunctionDecl) walk(
        "f(int a) {\n" +
        "  var b = 2;\n" +
        "  var g = (c) => a + b + c;\n" +
        "}\n").get(0);
    VarDecl g = (VarDecl) f.getBody().getBlock().getStatements().get(1);
    FunctionExpr fn = (FunctionExpr) g.getDeclarators().get(0).getInit();
    assertEquals("Own parameter is not a capture", ImmutableSet.of("a", "b"),
                 fn.getCaptured());
  }

  @Test
  public void testConstructorCalls() {
    List<Declaration> decls = walk(
        "class P { P.origin(); }\n" +
        "a() => P.origin();\n" +
        "b() => Text('x');\n" +
        "c() => new P();\n");
    InstanceCreation named = (InstanceCreation)
        ((FunctionDecl) decls.get(1)).getBody().getExpr();
    assertEquals("origin", named.getConstructorName());
    assertEquals("P", named.getCreatedType().getName());

    InstanceCreation implicit = (InstanceCreation)
        ((FunctionDecl) decls.get(2)).getBody().getExpr();
    assertNull(implicit.getConstructorName());
    assertEquals("Text", implicit.getCreatedType().getName());

    assertEquals(ExprKind.INSTANCE_CREATION,
        ((FunctionDecl) decls.get(3)).getBody().getExpr().getKind());
  }

  @Test
  public void testDeclarationsWithErrorsSkipped() {
    List<Declaration> decls = walk(
        "void broken() { var x = ; }\n" +
        "void ok() {}\n" +
        "var top = 1, other;\n");
    assertEquals(3, decls.size());
    assertEquals("ok", decls.get(0).getName());
    assertEquals("top", decls.get(1).getName());
    assertEquals(TypeIR.INT, ((VariableDecl) decls.get(1)).getType());
    assertEquals("other", decls.get(2).getName());
  }

  @Test
  public void testExternalFunctionHasNoBody() {
    FunctionDecl f = (FunctionDecl) walk("external void now();\n").get(0);
    assertNull(f.getBody());
    assertEquals(Collections.emptyList(), f.getParams());
  }
}
