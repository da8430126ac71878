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

import exm.fjc.common.Settings;
import exm.fjc.common.exceptions.InvalidOptionException;
import exm.fjc.frontend.imports.ImportResolver;

/**
 * Names the analyzers look for, and the resolver to check imports with.
 */
public class AnalysisOptions {
  private final String fileName;
  private final String entryFunction;
  private final String bootstrapCall;
  private final String stateMutationCall;
  private final ImportResolver importResolver;

  private AnalysisOptions(Builder b) {
    this.fileName = b.fileName;
    this.entryFunction = b.entryFunction;
    this.bootstrapCall = b.bootstrapCall;
    this.stateMutationCall = b.stateMutationCall;
    this.importResolver = b.importResolver != null ? b.importResolver :
                          ImportResolver.builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static AnalysisOptions fromSettings(String fileName)
      throws InvalidOptionException {
    return builder()
        .fileName(fileName)
        .entryFunction(Settings.get(Settings.ENTRY_FUNCTION))
        .bootstrapCall(Settings.get(Settings.BOOTSTRAP_CALL))
        .stateMutationCall(Settings.get(Settings.STATE_MUTATION_CALL))
        .importResolver(ImportResolver.fromSettings())
        .build();
  }

  public String getFileName() {
    return fileName;
  }

  public String getEntryFunction() {
    return entryFunction;
  }

  public String getBootstrapCall() {
    return bootstrapCall;
  }

  public String getStateMutationCall() {
    return stateMutationCall;
  }

  public ImportResolver getImportResolver() {
    return importResolver;
  }

  public static class Builder {
    private String fileName = "<input>";
    private String entryFunction = "main";
    private String bootstrapCall = "runApp";
    private String stateMutationCall = "setState";
    private ImportResolver importResolver = null;

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    public Builder entryFunction(String entryFunction) {
      this.entryFunction = entryFunction;
      return this;
    }

    public Builder bootstrapCall(String bootstrapCall) {
      this.bootstrapCall = bootstrapCall;
      return this;
    }

    public Builder stateMutationCall(String stateMutationCall) {
      this.stateMutationCall = stateMutationCall;
      return this;
    }

    public Builder importResolver(ImportResolver importResolver) {
      this.importResolver = importResolver;
      return this;
    }

    public AnalysisOptions build() {
      return new AnalysisOptions(this);
    }
  }
}
