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
package exm.fjc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import exm.fjc.common.Logging;
import exm.fjc.common.exceptions.FJCFatal;
import exm.fjc.frontend.AnalysisOptions;
import exm.fjc.jsbackend.GenConfig;
import exm.fjc.jsbackend.GenerationResult;
import exm.fjc.jsbackend.JSGenerator;

public class FJCompilerTest {

  private static final String APP =
      "import 'package:flutter/material.dart';\n" +
      "\n" +
      "class MyApp extends StatelessWidget {\n" +
      "  build(context) { return Text('Hi'); }\n" +
      "}\n" +
      "\n" +
      "main() { runApp(MyApp()); }\n";

  private static Logger logger;

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("FJCompilerTest.fjc.log", true);
  }

  private File source(String text) throws Exception {
    File f = tmp.newFile("app.fjs");
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  private static int exitCode(FJCompiler compiler, File in, File out) {
    try {
      compiler.compile(in.getPath(), out.getPath(), false,
                       new PrintStream(new ByteArrayOutputStream()));
    } catch (FJCFatal e) {
      return e.exitCode;
    }
    fail("Expected compilation of " + in + " to fail");
    return -1;
  }

  @Test
  public void testAnalyze() {
    AnalysisReport report = new FJCompiler(logger).analyze(APP,
        AnalysisOptions.builder().fileName("app.fjs").build());
    assertFalse(report.getDiagnostics().toString(), report.hasErrors());
    assertEquals("main", report.getEntryPoint());
    assertEquals("MyApp", report.getRootWidget());
    assertEquals(1, report.getWidgets().size());
    assertEquals(2, report.getDeclarations().size());
  }

  @Test
  public void testAnalyzeNeverThrows() {
    AnalysisReport report = new FJCompiler(logger).analyze("class {{ #",
        AnalysisOptions.builder().fileName("bad.fjs").build());
    assertTrue(report.hasParseErrors());
    assertTrue(report.hasErrors());
    assertNull(report.getEntryPoint());
  }

  @Test
  public void testAnalyzeBadUnicodeEscape() {
    AnalysisReport report = new FJCompiler(logger).analyze(
        "main() { var s = '\\u{110000}'; }",
        AnalysisOptions.builder().fileName("esc.fjs").build());
    assertTrue(report.hasParseErrors());
  }

  @Test
  public void testGenerate() {
    FJCompiler compiler = new FJCompiler(logger);
    AnalysisReport report = compiler.analyze(APP,
        AnalysisOptions.builder().fileName("app.fjs").build());
    GenerationResult result = compiler.generate(report.getDeclarations(),
                                                GenConfig.defaults());
    assertFalse(result.hasErrors());
    assertTrue(result.getCode(), result.getCode().contains(
        "function main() {\n  runApp(new MyApp());\n}\n"));
  }

  @Test
  public void testCompileWritesOutput() throws Exception {
    File in = source(APP);
    File out = new File(tmp.getRoot(), "app.js");
    new FJCompiler(logger).compile(in.getPath(), out.getPath(), false,
                                   System.out);
    String js = FileUtils.readFileToString(out, StandardCharsets.UTF_8);
    assertTrue(js, js.startsWith(JSGenerator.HEADER));
    assertTrue(js, js.contains("class MyApp extends StatelessWidget {"));
  }

  @Test
  public void testAnalyzeOnlyPrintsReport() throws Exception {
    File in = source(APP);
    File out = new File(tmp.getRoot(), "app.js");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream ps = new PrintStream(bytes, true, "UTF-8");
    new FJCompiler(logger).compile(in.getPath(), out.getPath(), true, ps);

    assertFalse("No output is written", out.exists());
    JsonObject report = JsonParser.parseString(
        bytes.toString("UTF-8")).getAsJsonObject();
    assertEquals("main", report.get("entryPoint").getAsString());
    assertEquals("MyApp", report.get("rootWidget").getAsString());
    JsonObject widget = report.getAsJsonArray("widgets").get(0)
                              .getAsJsonObject();
    assertEquals("stateless", widget.get("kind").getAsString());
    assertEquals("package:flutter/material.dart",
        report.getAsJsonArray("externalDependencies").get(0).getAsString());
    assertTrue(report.has("diagnostics"));
  }

  @Test
  public void testParseErrorExitCode() throws Exception {
    File out = new File(tmp.getRoot(), "bad.js");
    assertEquals(ExitCode.ERROR_PARSER.code(), exitCode(
        new FJCompiler(logger), source("class {\n"), out));
    assertFalse(out.exists());
  }

  @Test
  public void testCodeGenErrorExitCode() throws Exception {
    File out = new File(tmp.getRoot(), "ext.js");
    assertEquals(ExitCode.ERROR_USER.code(), exitCode(
        new FJCompiler(logger), source("external void now();\n"), out));
    assertFalse(out.exists());
  }

  @Test
  public void testMissingInput() {
    File missing = new File(tmp.getRoot(), "missing.fjs");
    assertEquals(ExitCode.ERROR_IO.code(), exitCode(
        new FJCompiler(logger), missing, new File(tmp.getRoot(), "m.js")));
  }

  @Test
  public void testDefaultOutput() {
    assertEquals("app.js", Main.defaultOutput("app.fjs"));
    assertEquals("dir/app.out.js", Main.defaultOutput("dir/app.js"));
  }

  @Test
  public void testBadCommandLine() {
    assertEquals(ExitCode.ERROR_COMMAND.code(), Main.run(new String[0]));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"a", "b", "c"}));
    assertEquals(ExitCode.SUCCESS.code(), Main.run(new String[] {"-h"}));
  }
}
