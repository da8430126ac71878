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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import exm.fjc.ic.tree.TypeIR;

/**
 * Lexical scope of local variables.  Function scopes record which names
 * from enclosing functions are referenced inside them.
 */
public class Scope {
  private final Scope parent;
  private final Map<String, TypeIR> vars = new HashMap<String, TypeIR>();
  /** Non-null for function scopes */
  private final Set<String> captured;
  /** Non-null for the outermost scope of a member */
  private final MemberContext members;

  private Scope(Scope parent, boolean function, MemberContext members) {
    this.parent = parent;
    this.captured = function ? new TreeSet<String>() : null;
    this.members = members;
  }

  /**
   * @param members class context, or null outside classes
   */
  public static Scope root(MemberContext members) {
    return new Scope(null, true, members);
  }

  public Scope block() {
    return new Scope(this, false, null);
  }

  public Scope function() {
    return new Scope(this, true, null);
  }

  public void declare(String name, TypeIR type) {
    vars.put(name, type == null ? TypeIR.DYNAMIC : type);
  }

  /**
   * Look up a local variable, noting captures on the way.
   * @return declared type, or null if not a local
   */
  public TypeIR lookup(String name) {
    Scope s = this;
    while (s != null) {
      TypeIR t = s.vars.get(name);
      if (t != null) {
        // Every function scope crossed before s captures the name
        for (Scope f = this; f != s; f = f.parent) {
          if (f.captured != null) {
            f.captured.add(name);
          }
        }
        return t;
      }
      s = s.parent;
    }
    return null;
  }

  /** Names captured so far by this function scope */
  public Set<String> getCaptured() {
    assert(captured != null);
    return captured;
  }

  public MemberContext getMembers() {
    Scope s = this;
    while (s.parent != null) {
      s = s.parent;
    }
    return s.members;
  }
}
