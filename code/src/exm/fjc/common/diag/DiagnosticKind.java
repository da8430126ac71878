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

/**
 * Which stage produced a diagnostic, and its default severity.
 */
public enum DiagnosticKind {
  /** Malformed token; lexing continued */
  LEX_ERROR(Severity.ERROR),
  /** Unexpected token; parser resynchronized */
  PARSE_ERROR(Severity.ERROR),
  ANALYSIS_WARNING(Severity.WARNING),
  ANALYSIS_ERROR(Severity.ERROR),
  /** Declaration could not be emitted */
  CODEGEN_ERROR(Severity.ERROR),
  CODEGEN_WARNING(Severity.WARNING);

  private final Severity defaultSeverity;

  private DiagnosticKind(Severity defaultSeverity) {
    this.defaultSeverity = defaultSeverity;
  }

  public Severity defaultSeverity() {
    return defaultSeverity;
  }
}
