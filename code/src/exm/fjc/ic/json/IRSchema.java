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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;

import exm.fjc.common.exceptions.IRSchemaException;

/**
 * Versioned schema of the IR JSON format.
 *
 * Every node object carries a "kind" tag and an "id".  The fields listed
 * here for each kind must be present.  All other fields are optional:
 * boolean flags default to false, lists to empty, types to dynamic,
 * "loc" to an unknown location, and nullable children to null.
 */
public class IRSchema {

  public static final int SCHEMA_VERSION = 1;

  public static final String VERSION_FIELD = "schemaVersion";
  public static final String DECLARATIONS_FIELD = "declarations";
  public static final String KIND_FIELD = "kind";

  /** Kinds of nodes that are not expressions, statements or declarations */
  public static final String FIELD = "FIELD";
  public static final String METHOD = "METHOD";
  public static final String CONSTRUCTOR = "CONSTRUCTOR";
  public static final String PARAM = "PARAM";
  public static final String INIT = "INIT";

  private static final Map<String, List<String>> REQUIRED =
      ImmutableMap.<String, List<String>>builder()
      // Declarations
      .put("CLASS", fields("id", "name"))
      .put("FUNCTION", fields("id", "name"))
      .put("VARIABLE", fields("id", "name"))
      .put(FIELD, fields("id", "name"))
      .put(METHOD, fields("id", "name"))
      .put(CONSTRUCTOR, fields("id", "className"))
      .put(PARAM, fields("id", "name", "paramKind", "origin"))
      .put(INIT, fields("initKind"))
      // Expressions
      .put("LITERAL", fields("id", "literalKind"))
      .put("IDENTIFIER", fields("id", "name"))
      .put("BINARY", fields("id", "left", "operator", "right"))
      .put("UNARY", fields("id", "operator", "operand"))
      .put("METHOD_CALL", fields("id", "name"))
      .put("PROPERTY_ACCESS", fields("id", "name"))
      .put("INDEX_ACCESS", fields("id", "index"))
      .put("CONDITIONAL", fields("id", "condition", "then", "else"))
      .put("FUNCTION_EXPR", fields("id", "body"))
      .put("LIST_LITERAL", fields("id", "literalKind"))
      .put("MAP_LITERAL", fields("id"))
      .put("AWAIT", fields("id", "expr"))
      .put("CAST", fields("id", "expr", "targetType"))
      .put("TYPE_CHECK", fields("id", "expr", "checkedType"))
      .put("INTERPOLATED_STRING", fields("id", "parts"))
      .put("ASSIGNMENT", fields("id", "target", "value", "op"))
      .put("CASCADE", fields("id", "target", "sections"))
      .put("INSTANCE_CREATION", fields("id", "createdType"))
      .put("INVOCATION", fields("id", "callee"))
      .put("THROW", fields("id", "expr"))
      // Statements
      .put("BLOCK", fields("id"))
      .put("EXPRESSION", fields("id", "expr"))
      .put("VAR_DECL", fields("id", "declarators"))
      .put("IF", fields("id", "condition", "then"))
      .put("FOR", fields("id", "body"))
      .put("FOR_IN", fields("id", "varName", "iterable", "body"))
      .put("WHILE", fields("id", "condition", "body"))
      .put("DO_WHILE", fields("id", "body", "condition"))
      .put("SWITCH", fields("id", "subject"))
      .put("RETURN", fields("id"))
      .put("BREAK", fields("id"))
      .put("CONTINUE", fields("id"))
      .put("TRY", fields("id", "body"))
      .put("YIELD", fields("id", "value"))
      .put("ASSERT", fields("id", "condition"))
      .build();

  private static List<String> fields(String... names) {
    return ImmutableList.copyOf(names);
  }

  public static boolean isKnownKind(String kind) {
    return REQUIRED.containsKey(kind);
  }

  public static List<String> requiredFields(String kind) {
    List<String> result = REQUIRED.get(kind);
    assert(result != null) : kind;
    return result;
  }

  /**
   * Check the kind tag is known and all required fields are present.
   * @return the kind
   */
  public static String check(JsonObject obj, String path)
      throws IRSchemaException {
    if (!obj.has(KIND_FIELD) || obj.get(KIND_FIELD).isJsonNull()) {
      throw new IRSchemaException(path, "missing required field \"" +
                                  KIND_FIELD + "\"");
    }
    String kind = obj.get(KIND_FIELD).getAsString();
    if (!isKnownKind(kind)) {
      throw new IRSchemaException(path, "unknown kind \"" + kind + "\"");
    }
    for (String field: requiredFields(kind)) {
      if (!obj.has(field) || obj.get(field).isJsonNull()) {
        throw new IRSchemaException(path, "missing required field \"" +
                                    field + "\" of " + kind);
      }
    }
    return kind;
  }
}
