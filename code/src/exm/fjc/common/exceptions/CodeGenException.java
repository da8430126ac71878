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
package exm.fjc.common.exceptions;

import exm.fjc.ast.SourceLocation;

/**
 * A node could not be lowered to target code.  Aborts emission of the
 * enclosing top-level declaration only.
 */
public class CodeGenException extends UserException {
  private final int nodeId;
  private final String nodeKind;
  private final String enclosingDecl;
  private final String suggestion;
  private final String detail;

  public CodeGenException(SourceLocation location, int nodeId,
        String nodeKind, String enclosingDecl, String message,
        String suggestion) {
    super(location, summary(nodeId, nodeKind, enclosingDecl, message,
                            suggestion));
    this.nodeId = nodeId;
    this.nodeKind = nodeKind;
    this.enclosingDecl = enclosingDecl;
    this.suggestion = suggestion;
    this.detail = message;
  }

  public int getNodeId() {
    return nodeId;
  }

  public String getNodeKind() {
    return nodeKind;
  }

  public String getEnclosingDecl() {
    return enclosingDecl;
  }

  public String getSuggestion() {
    return suggestion;
  }

  /**
   * Fill in the declaration name once the error reaches the
   * declaration-level emitter.
   */
  public CodeGenException inDeclaration(String declName) {
    if (enclosingDecl != null) {
      return this;
    }
    return new CodeGenException(getLocation(), nodeId, nodeKind, declName,
                                detail, suggestion);
  }

  private static String summary(int nodeId, String nodeKind,
      String enclosingDecl, String message, String suggestion) {
    return message + " [node " + nodeId + " " + nodeKind +
          (enclosingDecl == null ? "" : " in " + enclosingDecl) + "]" +
          (suggestion == null ? "" : " (" + suggestion + ")");
  }

  /**
   * @return message with node information but no location
   */
  public String getSummary() {
    return summary(nodeId, nodeKind, enclosingDecl, detail, suggestion);
  }

  /**
   * @return message without location and node information
   */
  public String getDetail() {
    return detail;
  }

  private static final long serialVersionUID = 1L;
}
