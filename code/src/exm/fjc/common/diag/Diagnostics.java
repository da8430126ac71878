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
package exm.fjc.common.diag;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.Logging;

/**
 * Append-only diagnostics sink for one compilation run.  Not shared
 * between units, so not synchronized.
 */
public class Diagnostics {
  private static final Logger logger = Logging.getFJCLogger();

  private final List<Diagnostic> entries = new ArrayList<Diagnostic>();

  public void report(Diagnostic d) {
    entries.add(d);
    logger.log(logLevel(d.getSeverity()), d.toString());
  }

  public void report(DiagnosticKind kind, String message,
                     SourceLocation location) {
    report(new Diagnostic(kind, message, location));
  }

  public void report(DiagnosticKind kind, Severity severity, String message,
                     SourceLocation location) {
    report(new Diagnostic(kind, severity, message, location));
  }

  public void addAll(Iterable<Diagnostic> ds) {
    for (Diagnostic d: ds) {
      report(d);
    }
  }

  /**
   * @return snapshot of all diagnostics in report order
   */
  public List<Diagnostic> getAll() {
    return ImmutableList.copyOf(entries);
  }

  public List<Diagnostic> getErrors() {
    return filter(Severity.ERROR);
  }

  public List<Diagnostic> getWarnings() {
    return filter(Severity.WARNING);
  }

  public List<Diagnostic> ofKind(DiagnosticKind kind) {
    ImmutableList.Builder<Diagnostic> res = ImmutableList.builder();
    for (Diagnostic d: entries) {
      if (d.getKind() == kind) {
        res.add(d);
      }
    }
    return res.build();
  }

  public boolean hasErrors() {
    for (Diagnostic d: entries) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  public int size() {
    return entries.size();
  }

  private List<Diagnostic> filter(Severity severity) {
    ImmutableList.Builder<Diagnostic> res = ImmutableList.builder();
    for (Diagnostic d: entries) {
      if (d.getSeverity() == severity) {
        res.add(d);
      }
    }
    return res.build();
  }

  /**
   * Diagnostics go back to the caller, so only log them at debug level.
   */
  private static Level logLevel(Severity severity) {
    return severity == Severity.INFO ? Level.TRACE : Level.DEBUG;
  }
}
