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
package exm.fjc.ic.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.IRSchemaException;
import exm.fjc.frontend.ASTWalker;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.parser.Lexer;
import exm.fjc.parser.Parser;

public class IRJsonTest {

  private static final String PROGRAM =
      "class Point {\n" +
      "  final int x;\n" +
      "  final int y;\n" +
      "  const Point(this.x, this.y);\n" +
      "  Point.origin() : this(0, 0);\n" +
      "  int get sum => x + y;\n" +
      "  Point plus(Point o) => Point(x + o.x, y + o.y);\n" +
      "}\n" +
      "var names = <String>['a', 'b'];\n" +
      "String describe(Point p, {bool verbose = false}) {\n" +
      "  if (verbose) {\n" +
      "    return 'Point(${p.x}, ${p.y})';\n" +
      "  }\n" +
      "  for (var n in names) { print(n); }\n" +
      "  return (p is Point) ? '${p.sum}' : 'none';\n" +
      "}\n";

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("IRJsonTest.fjc.log", true);
  }

  private static List<Declaration> walk(String text) {
    Diagnostics diags = new Diagnostics();
    List<Declaration> decls = new ASTWalker(diags).walk(
        Parser.parse("test.dart", Lexer.tokenize("test.dart", text, diags),
                     diags).getAST());
    assertTrue(diags.getAll().toString(), !diags.hasErrors());
    return decls;
  }

  private static List<String> names(List<Declaration> decls) {
    List<String> result = new ArrayList<String>();
    for (Declaration d: decls) {
      result.add(d.kindName() + ":" + d.getName());
    }
    return result;
  }

  private static IRSchemaException readError(String json) {
    try {
      IRJson.fromJson(json);
    } catch (IRSchemaException e) {
      return e;
    }
    fail("Expected schema error for " + json);
    return null;
  }

  @Test
  public void testReadBackWrittenIR() throws Exception {
    List<Declaration> decls = walk(PROGRAM);
    String json = IRJson.toJson(decls);
    List<Declaration> read = IRJson.fromJson(json);

    assertEquals(names(decls), names(read));
    ClassDecl before = (ClassDecl) decls.get(0);
    ClassDecl after = (ClassDecl) read.get(0);
    assertEquals(before.getConstructors().size(),
                 after.getConstructors().size());
    assertEquals(before.getMethods().size(), after.getMethods().size());
    assertEquals(before.getLocation(), after.getLocation());

    assertEquals("Written JSON should be stable", json, IRJson.toJson(read));
  }

  @Test
  public void testDocumentHeader() throws Exception {
    String json = IRJson.toJson(walk("var x = 1;\n"));
    assertTrue(json, json.contains("\"schemaVersion\": 1"));
    assertTrue(json, json.contains("\"declarations\""));
  }

  @Test
  public void testLocationIsOptional() throws Exception {
    List<Declaration> decls = IRJson.fromJson(
        "{\"schemaVersion\": 1, \"declarations\": [" +
        "{\"kind\": \"FUNCTION\", \"id\": 1, \"name\": \"f\"}]}");
    assertEquals(1, decls.size());
    FunctionDecl f = (FunctionDecl) decls.get(0);
    assertEquals("f", f.getName());
    assertEquals(SourceLocation.UNKNOWN, f.getLocation());
    assertTrue(f.getParams().isEmpty());
    assertNull(f.getBody());
  }

  @Test
  public void testMissingKind() {
    IRSchemaException e = readError(
        "{\"schemaVersion\": 1, \"declarations\": [" +
        "{\"id\": 1, \"name\": \"f\"}]}");
    assertEquals("$.declarations[0]", e.getPath());
    assertTrue(e.getMessage(),
               e.getMessage().contains("missing required field \"kind\""));
  }

  @Test
  public void testUnknownKind() {
    IRSchemaException e = readError(
        "{\"schemaVersion\": 1, \"declarations\": [" +
        "{\"kind\": \"ENUM\", \"id\": 1, \"name\": \"E\"}]}");
    assertEquals("$.declarations[0]", e.getPath());
    assertTrue(e.getMessage(), e.getMessage().contains("unknown kind \"ENUM\""));
  }

  @Test
  public void testMissingRequiredFieldNamesPath() {
    IRSchemaException e = readError(
        "{\"schemaVersion\": 1, \"declarations\": [" +
        "{\"kind\": \"VARIABLE\", \"id\": 1, \"name\": \"v\"}," +
        "{\"kind\": \"FUNCTION\", \"id\": 2, \"name\": \"f\"," +
        " \"body\": {\"kind\": \"BINARY\", \"id\": 3," +
        "  \"left\": {\"kind\": \"LITERAL\", \"id\": 4," +
        "    \"literalKind\": \"INT\", \"value\": 1}," +
        "  \"operator\": \"+\"}}]}");
    assertEquals("$.declarations[1].body", e.getPath());
    assertTrue(e.getMessage(), e.getMessage().contains(
        "missing required field \"right\" of BINARY"));
  }

  @Test
  public void testNewerSchemaVersion() {
    IRSchemaException e = readError(
        "{\"schemaVersion\": 2, \"declarations\": []}");
    assertEquals("$.schemaVersion", e.getPath());
    assertTrue(e.getMessage(), e.getMessage().contains(
        "schema version 2 is newer than supported version 1"));
  }

  @Test
  public void testInvalidSchemaVersion() {
    IRSchemaException e = readError(
        "{\"schemaVersion\": 0, \"declarations\": []}");
    assertTrue(e.getMessage(),
               e.getMessage().contains("invalid schema version 0"));
  }

  @Test
  public void testMissingDeclarations() {
    IRSchemaException e = readError("{\"schemaVersion\": 1}");
    assertEquals("$", e.getPath());
    assertTrue(e.getMessage(), e.getMessage().contains(
        "missing required field \"declarations\""));
  }

  @Test
  public void testMalformedJson() {
    IRSchemaException e = readError("{\"schemaVersion\": 1, ");
    assertEquals("$", e.getPath());
    assertTrue(e.getMessage(), e.getMessage().contains("malformed JSON"));
  }

  @Test
  public void testRootMustBeObject() {
    IRSchemaException e = readError("[1, 2]");
    assertEquals("$: document must be a JSON object", e.getMessage());
  }
}
