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

import java.util.Arrays;

import exm.fjc.common.Settings;
import exm.fjc.common.exceptions.InvalidOptionException;

/**
 * Options controlling the shape of generated code
 */
public class GenConfig {

  public static enum FieldInitPolicy {
    /** Instance field initializers become class field declarations */
    CLASS_BODY,
    /** Instance field initializers are assigned in the constructor */
    CONSTRUCTOR;
  }

  public static enum AccessorPolicy {
    /** get x() / set x(v) */
    NATIVE,
    /** getX() / setX(v) */
    METHODS;
  }

  private final String indent;
  private final FieldInitPolicy fieldInit;
  private final AccessorPolicy accessors;
  private final boolean headerComment;

  private GenConfig(Builder b) {
    this.indent = b.indent;
    this.fieldInit = b.fieldInit;
    this.accessors = b.accessors;
    this.headerComment = b.headerComment;
  }

  public static GenConfig defaults() {
    return builder().build();
  }

  public static GenConfig fromSettings() throws InvalidOptionException {
    Settings.checkOneOf(Settings.FIELD_INIT, Arrays.asList(
        Settings.FIELD_INIT_CLASS_BODY, Settings.FIELD_INIT_CONSTRUCTOR));
    Settings.checkOneOf(Settings.ACCESSORS, Arrays.asList(
        Settings.ACCESSORS_NATIVE, Settings.ACCESSORS_METHODS));
    String indent = Settings.get(Settings.INDENT);
    if (indent.isEmpty() || !indent.trim().isEmpty()) {
      throw new InvalidOptionException("option " + Settings.INDENT +
          " must be non-empty whitespace, but was '" + indent + "'");
    }
    return builder()
        .indent(indent)
        .fieldInit(Settings.get(Settings.FIELD_INIT).equalsIgnoreCase(
            Settings.FIELD_INIT_CONSTRUCTOR) ?
                FieldInitPolicy.CONSTRUCTOR : FieldInitPolicy.CLASS_BODY)
        .accessors(Settings.get(Settings.ACCESSORS).equalsIgnoreCase(
            Settings.ACCESSORS_METHODS) ?
                AccessorPolicy.METHODS : AccessorPolicy.NATIVE)
        .headerComment(Settings.getBoolean(Settings.HEADER_COMMENT))
        .build();
  }

  public String getIndent() {
    return indent;
  }

  public FieldInitPolicy getFieldInit() {
    return fieldInit;
  }

  public AccessorPolicy getAccessors() {
    return accessors;
  }

  public boolean isHeaderComment() {
    return headerComment;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String indent = "  ";
    private FieldInitPolicy fieldInit = FieldInitPolicy.CLASS_BODY;
    private AccessorPolicy accessors = AccessorPolicy.NATIVE;
    private boolean headerComment = true;

    public Builder indent(String indent) {
      this.indent = indent;
      return this;
    }

    public Builder fieldInit(FieldInitPolicy fieldInit) {
      this.fieldInit = fieldInit;
      return this;
    }

    public Builder accessors(AccessorPolicy accessors) {
      this.accessors = accessors;
      return this;
    }

    public Builder headerComment(boolean headerComment) {
      this.headerComment = headerComment;
      return this;
    }

    public GenConfig build() {
      return new GenConfig(this);
    }
  }
}
