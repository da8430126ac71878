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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.fjc.ast.WidgetAST;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.FJCFatal;
import exm.fjc.common.exceptions.UserException;
import exm.fjc.frontend.ASTWalker;
import exm.fjc.frontend.AnalysisOptions;
import exm.fjc.frontend.ContextAnalysis;
import exm.fjc.frontend.ContextAnalyzer;
import exm.fjc.frontend.SSRAnalysis;
import exm.fjc.frontend.SSRAnalyzer;
import exm.fjc.frontend.StateAnalysis;
import exm.fjc.frontend.StateAnalyzer;
import exm.fjc.frontend.WidgetAnalysis;
import exm.fjc.frontend.WidgetAnalyzer;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.jsbackend.GenConfig;
import exm.fjc.jsbackend.GenerationResult;
import exm.fjc.jsbackend.JSGenerator;
import exm.fjc.parser.Lexer;
import exm.fjc.parser.ParseResult;
import exm.fjc.parser.Parser;

/**
 * This is the main entry point to the compiler.  Each stage consumes the
 * output of the previous one and reports problems to a shared sink.
 */
public class FJCompiler {

  private final Logger logger;

  public FJCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Lex, parse, analyze and lower one unit.  Never throws for bad input.
   */
  public AnalysisReport analyze(String sourceText, AnalysisOptions options) {
    Diagnostics diagnostics = new Diagnostics();
    String file = options.getFileName();

    ParseResult parsed = Parser.parse(file,
        Lexer.tokenize(file, sourceText, diagnostics), diagnostics);
    WidgetAST ast = parsed.getAST();
    logger.debug("Parsed " + file + " with " + parsed.getErrorCount() +
                 " errors");

    WidgetAnalysis widgets =
        new WidgetAnalyzer(options, diagnostics).analyze(ast);
    StateAnalysis state = new StateAnalyzer(options, diagnostics)
                                    .link(widgets.getWidgets(), ast);
    ContextAnalysis context =
        new ContextAnalyzer(diagnostics).analyze(widgets, state);
    SSRAnalysis ssr = new SSRAnalyzer(diagnostics)
                                    .analyze(widgets.getWidgets());
    List<Declaration> decls = new ASTWalker(diagnostics).walk(ast);

    logger.debug("Analysis of " + file + " done: " + diagnostics.size() +
                 " diagnostics, " + decls.size() + " declarations");
    return new AnalysisReport(ast, diagnostics.getAll(), widgets, state,
                              context, ssr, decls);
  }

  public GenerationResult generate(List<Declaration> decls,
                                   GenConfig config) {
    return JSGenerator.generate(decls, config);
  }

  /**
   * Compile inputFile to outputFile, or print the analysis report to
   * reportOut if analyzeOnly.
   *
   * @throws FJCFatal with the exit code on any failure
   */
  public void compile(String inputFile, String outputFile,
                      boolean analyzeOnly, PrintStream reportOut) {
    try {
      String source = readInput(inputFile);
      AnalysisReport report = analyze(source,
                                      AnalysisOptions.fromSettings(inputFile));
      List<Diagnostic> diagnostics =
          new ArrayList<Diagnostic>(report.getDiagnostics());

      GenerationResult result = null;
      if (analyzeOnly) {
        reportOut.println(ReportWriter.toJson(report));
      } else {
        result = generate(report.getDeclarations(), GenConfig.fromSettings());
        diagnostics.addAll(result.getErrors());
        diagnostics.addAll(result.getWarnings());
      }
      printDiagnostics(diagnostics);

      if (report.hasParseErrors()) {
        throw new FJCFatal(ExitCode.ERROR_PARSER.code());
      } else if (report.hasErrors() ||
                 (result != null && result.hasErrors())) {
        throw new FJCFatal(ExitCode.ERROR_USER.code());
      }
      if (result != null) {
        writeOutput(outputFile, result.getCode());
      }
      logger.debug("fjc done: " + inputFile);
    } catch (FJCFatal e) {
      throw e;
    } catch (UserException e) {
      System.err.println("fjc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug(ExceptionUtils.getStackTrace(e));
      }
      throw new FJCFatal(ExitCode.ERROR_USER.code());
    } catch (Throwable e) {
      reportInternalError(logger, e);
      throw new FJCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private static String readInput(String inputFile) {
    try {
      return FileUtils.readFileToString(new File(inputFile),
                                        StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Could not read input file " + inputFile + ": " +
                         e.getMessage());
      throw new FJCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void writeOutput(String outputFile, String code) {
    try {
      FileUtils.writeStringToFile(new File(outputFile), code,
                                  StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("I/O error while writing to " + outputFile);
      System.err.println(e.getMessage());
      throw new FJCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void printDiagnostics(List<Diagnostic> diagnostics) {
    for (Diagnostic d: diagnostics) {
      System.err.println(d);
    }
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    System.err.println("FJC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
    logger.error("Internal error", e);
  }
}
