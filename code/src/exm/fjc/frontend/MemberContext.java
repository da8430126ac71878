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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Members visible by bare name inside a class body.
 */
public class MemberContext {
  /**
   * Members that classes with an external superclass get from the
   * framework base classes.
   */
  public static final Set<String> FRAMEWORK_MEMBERS = ImmutableSet.of(
      "setState", "widget", "context", "mounted", "initState", "dispose",
      "didChangeDependencies", "didUpdateWidget", "notifyListeners",
      "addListener", "removeListener");

  private final String className;
  private final boolean isStatic;
  private final Set<String> instanceMembers;
  private final Set<String> staticMembers;

  public MemberContext(String className, boolean isStatic,
      Set<String> instanceMembers, Set<String> staticMembers) {
    this.className = className;
    this.isStatic = isStatic;
    this.instanceMembers = ImmutableSet.copyOf(instanceMembers);
    this.staticMembers = ImmutableSet.copyOf(staticMembers);
  }

  public String getClassName() {
    return className;
  }

  /** True in static methods, factories and field initializers */
  public boolean isStatic() {
    return isStatic;
  }

  public boolean isInstanceMember(String name) {
    return !isStatic && instanceMembers.contains(name);
  }

  public boolean isStaticMember(String name) {
    return staticMembers.contains(name);
  }

  /** Same class, different static-ness */
  public MemberContext withStatic(boolean newStatic) {
    return new MemberContext(className, newStatic, instanceMembers,
                             staticMembers);
  }
}
