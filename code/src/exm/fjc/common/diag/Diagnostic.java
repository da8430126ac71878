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

import exm.fjc.ast.SourceLocation;

/**
 * A lex, parse, analysis or code generation finding.  Immutable.
 */
public class Diagnostic {
  private final DiagnosticKind kind;
  private final Severity severity;
  private final String message;
  private final SourceLocation location;

  public Diagnostic(DiagnosticKind kind, Severity severity, String message,
                    SourceLocation location) {
    assert(kind != null && severity != null && message != null);
    this.kind = kind;
    this.severity = severity;
    this.message = message;
    this.location = location == null ? SourceLocation.UNKNOWN : location;
  }

  public Diagnostic(DiagnosticKind kind, String message,
                    SourceLocation location) {
    this(kind, kind.defaultSeverity(), message, location);
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public int hashCode() {
    return ((kind.hashCode() * 31 + severity.hashCode()) * 31 +
            message.hashCode()) * 31 + location.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic) obj;
    return kind == other.kind && severity == other.severity &&
           message.equals(other.message) && location.equals(other.location);
  }

  @Override
  public String toString() {
    return location + ": " + severity.name().toLowerCase() + ": " + message +
           " [" + kind + "]";
  }
}
