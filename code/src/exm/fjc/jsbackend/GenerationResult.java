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
package exm.fjc.jsbackend;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.common.diag.Diagnostic;

/**
 * Generated code with the diagnostics raised while generating it.
 * Declarations that failed are missing from the code.
 */
public class GenerationResult {
  private final String code;
  private final List<Diagnostic> errors;
  private final List<Diagnostic> warnings;

  public GenerationResult(String code, List<Diagnostic> errors,
                          List<Diagnostic> warnings) {
    this.code = code;
    this.errors = ImmutableList.copyOf(errors);
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public String getCode() {
    return code;
  }

  public List<Diagnostic> getErrors() {
    return errors;
  }

  public List<Diagnostic> getWarnings() {
    return warnings;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
