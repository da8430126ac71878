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
package exm.fjc.jsbackend.tree;

import java.util.ArrayList;
import java.util.List;

import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * One or more braced blocks joined on the closing brace, e.g.
 * <pre>
 * if (c) {
 *   ...
 * } else {
 *   ...
 * }
 * </pre>
 * A header of "" gives a bare block.  The suffix follows the last closing
 * brace, e.g. " while (c);" for do-while or ")(x);" for an
 * immediately-invoked function.
 */
public class Compound extends JSTree {
  private final List<String> headers = new ArrayList<String>();
  private final List<Sequence> bodies = new ArrayList<Sequence>();
  private String suffix = "";

  public Compound(String header) {
    this(header, new Sequence());
  }

  public Compound(String header, Sequence body) {
    addPart(header, body);
  }

  /**
   * Add a part, e.g. "else" or "catch (e)"
   */
  public Sequence addPart(String header, Sequence body) {
    headers.add(header);
    bodies.add(body);
    return body;
  }

  public Sequence addPart(String header) {
    return addPart(header, new Sequence());
  }

  /** Body of first part */
  public Sequence getBody() {
    return bodies.get(0);
  }

  public void setSuffix(String suffix) {
    this.suffix = suffix;
  }

  @Override
  public void appendTo(CodeBuffer out) {
    if (headers.isEmpty()) {
      throw new FJCRuntimeError("compound statement with no parts");
    }
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      String open = header.isEmpty() ? "{" : header + " {";
      out.line(i == 0 ? open : "} " + open);
      out.indent();
      bodies.get(i).appendTo(out);
      out.dedent();
    }
    out.line("}" + suffix);
  }
}
