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
package exm.fjc.ic.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Type reference by display name.  No resolution is done: two types are
 * the same if they are spelled the same.  Immutable, so instances are
 * shared freely between IR nodes.
 */
public class TypeIR {
  public static final TypeIR DYNAMIC = new TypeIR("dynamic");
  public static final TypeIR VOID = new TypeIR("void");
  public static final TypeIR STRING = new TypeIR("String");
  public static final TypeIR INT = new TypeIR("int");
  public static final TypeIR DOUBLE = new TypeIR("double");
  public static final TypeIR BOOL = new TypeIR("bool");
  public static final TypeIR NULL = new TypeIR("Null");
  public static final TypeIR FUNCTION = new TypeIR("Function");
  public static final TypeIR LIST = new TypeIR("List");
  public static final TypeIR MAP = new TypeIR("Map");
  public static final TypeIR SET = new TypeIR("Set");

  private final String name;
  private final List<TypeIR> typeArgs;
  private final boolean nullable;

  public TypeIR(String name) {
    this(name, ImmutableList.<TypeIR>of(), false);
  }

  public TypeIR(String name, List<TypeIR> typeArgs, boolean nullable) {
    this.name = name;
    this.typeArgs = ImmutableList.copyOf(typeArgs);
    this.nullable = nullable;
  }

  public static TypeIR generic(String name, TypeIR... args) {
    return new TypeIR(name, ImmutableList.copyOf(args), false);
  }

  public String getName() {
    return name;
  }

  public List<TypeIR> getTypeArgs() {
    return typeArgs;
  }

  public boolean isNullable() {
    return nullable;
  }

  public boolean isDynamic() {
    return name.equals(DYNAMIC.name);
  }

  /**
   * @return same type without generic arguments or nullability
   */
  public TypeIR erased() {
    if (typeArgs.isEmpty() && !nullable) {
      return this;
    }
    return new TypeIR(name);
  }

  /**
   * A single upper-case letter, e.g. the T of List&lt;T&gt;
   */
  public boolean isTypeVariable() {
    return name.length() == 1 && Character.isUpperCase(name.charAt(0));
  }

  @Override
  public int hashCode() {
    return (name.hashCode() * 31 + typeArgs.hashCode()) * 2 +
           (nullable ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeIR)) {
      return false;
    }
    TypeIR other = (TypeIR) obj;
    return name.equals(other.name) && typeArgs.equals(other.typeArgs) &&
           nullable == other.nullable;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name);
    if (!typeArgs.isEmpty()) {
      sb.append('<');
      for (int i = 0; i < typeArgs.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(typeArgs.get(i));
      }
      sb.append('>');
    }
    if (nullable) {
      sb.append('?');
    }
    return sb.toString();
  }
}
