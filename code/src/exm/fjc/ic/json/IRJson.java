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

import org.apache.log4j.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import exm.fjc.common.Logging;
import exm.fjc.common.exceptions.IRSchemaException;
import exm.fjc.ic.tree.Declaration;

/**
 * Reads and writes IR declarations as JSON documents of the form
 * <code>{"schemaVersion": 1, "declarations": [...]}</code>.
 */
public class IRJson {
  private static final Logger logger = Logging.getFJCLogger();

  private static final Gson gson =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  public static String toJson(List<Declaration> decls) {
    String result = gson.toJson(new IRJsonWriter().document(decls));
    logger.debug("Wrote IR JSON for " + decls.size() + " declarations");
    return result;
  }

  public static List<Declaration> fromJson(String json)
      throws IRSchemaException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new IRSchemaException("$", "malformed JSON: " + e.getMessage());
    }
    if (!root.isJsonObject()) {
      throw new IRSchemaException("$", "document must be a JSON object");
    }
    List<Declaration> decls = new IRJsonReader().document(
                                                root.getAsJsonObject());
    logger.debug("Read IR JSON with " + decls.size() + " declarations");
    return decls;
  }
}
