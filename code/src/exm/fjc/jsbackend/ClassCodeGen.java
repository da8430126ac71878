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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.ConstructorDecl;
import exm.fjc.ic.tree.ConstructorInit;
import exm.fjc.ic.tree.FieldDecl;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.jsbackend.GenConfig.FieldInitPolicy;
import exm.fjc.jsbackend.tree.Compound;
import exm.fjc.jsbackend.tree.JSTree;
import exm.fjc.jsbackend.tree.Line;
import exm.fjc.jsbackend.tree.Sequence;

/**
 * Emits a class.  Members come out in a fixed order regardless of source
 * order: instance fields, constructors, instance methods, static fields,
 * static methods.
 *
 * Only the unnamed generative constructor maps onto the JavaScript
 * constructor.  Named and factory constructors become static methods;
 * named generative ones start from an instance built by the unnamed
 * constructor.  A class with no unnamed generative constructor gets a
 * synthesized one.
 */
class ClassCodeGen {
  /** Static method standing in for an unnamed factory constructor */
  static final String UNNAMED_FACTORY = "create";

  private static final String INSTANCE = "instance";

  private final GenContext ctx;

  ClassCodeGen(GenContext ctx) {
    this.ctx = ctx;
  }

  JSTree generate(ClassDecl cls) throws CodeGenException {
    ctx.setCurrentClass(cls);
    try {
      return generateClass(cls);
    } finally {
      ctx.setCurrentClass(null);
    }
  }

  private JSTree generateClass(ClassDecl cls) throws CodeGenException {
    TypeIR sup = cls.getSuperclass();
    if (!cls.getMixins().isEmpty()) {
      ctx.warn("Mixins of " + cls.getName() + " are not applied",
               cls.getLocation());
    }
    checkStaticNames(cls);

    String header = "class " + cls.getName() +
                    (sup == null ? "" : " extends " + sup.getName());
    Compound c = new Compound(header);
    Members body = new Members(c.getBody());

    if (ctx.config.getFieldInit() == FieldInitPolicy.CLASS_BODY) {
      for (FieldDecl f: cls.getInstanceFields()) {
        body.add(field(f));
      }
    }

    if (!cls.hasUnnamedGenerativeConstructor()) {
      body.add(synthesizedConstructor(cls));
    }
    for (ConstructorDecl ctor: cls.getConstructors()) {
      body.add(constructor(cls, ctor));
    }

    for (MethodDecl m: cls.getInstanceMethods()) {
      body.add(ctx.functions.method(m));
    }
    for (FieldDecl f: cls.getStaticFields()) {
      body.add(field(f));
    }
    for (MethodDecl m: cls.getStaticMethods()) {
      body.add(ctx.functions.method(m));
    }
    return c;
  }

  /**
   * Class members separated by blank lines
   */
  private static class Members {
    private final Sequence seq;
    private JSTree previous = null;

    Members(Sequence seq) {
      this.seq = seq;
    }

    void add(JSTree member) {
      if (member == null) {
        return;
      }
      // Consecutive fields stay together
      if (previous != null &&
          !(previous instanceof Line && member instanceof Line)) {
        seq.add(Line.BLANK);
      }
      seq.add(member);
      previous = member;
    }
  }

  /**
   * Named and factory constructors share the static namespace
   */
  private void checkStaticNames(ClassDecl cls) throws CodeGenException {
    Set<String> statics = new HashSet<String>();
    for (MethodDecl m: cls.getStaticMethods()) {
      statics.add(m.getName());
    }
    for (FieldDecl f: cls.getStaticFields()) {
      statics.add(f.getName());
    }
    for (ConstructorDecl ctor: cls.getConstructors()) {
      String name = staticName(ctor);
      if (name != null && !statics.add(name)) {
        throw ctx.error(ctor, "Constructor " + ctor.getDisplayName() +
            " clashes with static member " + name,
            "Rename the constructor or the static member");
      }
    }
  }

  /**
   * @return name of the static method for ctor, or null for the unnamed
   *         generative constructor
   */
  private static String staticName(ConstructorDecl ctor) {
    if (ctor.isNamed()) {
      return ctor.getName();
    }
    return ctor.isFactory() ? UNNAMED_FACTORY : null;
  }

  private JSTree field(FieldDecl f) throws CodeGenException {
    String init = f.getInit() == null ? "null" : ctx.exprs.gen(f.getInit());
    return new Line((f.isStatic() ? "static " : "") + f.getName() + " = " +
                    init + ";");
  }

  /**
   * Field initializers run in the constructor under the constructor
   * policy
   */
  private Sequence constructorFieldInits(ClassDecl cls)
      throws CodeGenException {
    Sequence seq = new Sequence();
    if (ctx.config.getFieldInit() == FieldInitPolicy.CONSTRUCTOR) {
      for (FieldDecl f: cls.getInstanceFields()) {
        String init = f.getInit() == null ? "null" :
                                            ctx.exprs.gen(f.getInit());
        seq.add("this." + f.getName() + " = " + init + ";");
      }
    }
    return seq;
  }

  private JSTree synthesizedConstructor(ClassDecl cls)
      throws CodeGenException {
    Compound c = new Compound("constructor()");
    if (cls.getSuperclass() != null) {
      c.getBody().add("super();");
    }
    c.getBody().append(constructorFieldInits(cls));
    return c;
  }

  private JSTree constructor(ClassDecl cls, ConstructorDecl ctor)
      throws CodeGenException {
    if (ctor.isFactory()) {
      return factory(ctor);
    } else if (ctor.isNamed()) {
      return namedConstructor(cls, ctor);
    }
    return unnamedConstructor(cls, ctor);
  }

  private JSTree unnamedConstructor(ClassDecl cls, ConstructorDecl ctor)
      throws CodeGenException {
    Compound c = new Compound("constructor(" +
        ctx.params.declaration(ctor.getParams()) + ")");
    Sequence body = c.getBody();
    ConstructorInit superInit = ctor.getSuperInit();
    if (cls.getSuperclass() != null) {
      if (superInit != null && superInit.getConstructorName() != null) {
        ctx.warn("Call of superclass constructor " +
            superInit.getConstructorName() + " lowered to super()",
            superInit.getLocation());
      }
      body.add("super(" + ctx.params.superArgs(ctor.getParams(), superInit) +
               ");");
    } else if (superInit != null ||
               ParameterCodeGen.hasSuperParams(ctor.getParams())) {
      throw ctx.error(ctor, "Superclass constructor call in " +
          cls.getName() + ", which has no superclass",
          "Add an extends clause or remove the super initializer");
    }
    ConstructorInit redirect = ctor.getRedirect();
    if (redirect != null) {
      body.add("return " + redirectCall(cls, redirect) + ";");
      return c;
    }
    body.append(constructorFieldInits(cls));
    body.append(ctx.params.fieldAssignments(ctor.getParams(), "this"));
    body.append(initializers(ctor, "this"));
    if (ctor.getBody() != null) {
      body.append(ctx.functions.body(ctor.getBody()));
    }
    return c;
  }

  private JSTree namedConstructor(ClassDecl cls, ConstructorDecl ctor)
      throws CodeGenException {
    Compound c = new Compound("static " + ctor.getName() + "(" +
        ctx.params.declaration(ctor.getParams()) + ")");
    Sequence body = c.getBody();
    ConstructorInit redirect = ctor.getRedirect();
    if (redirect != null) {
      body.add("return " + redirectCall(cls, redirect) + ";");
      return c;
    }
    if (ctor.getSuperInit() != null ||
        ParameterCodeGen.hasSuperParams(ctor.getParams())) {
      ctx.warn("Superclass arguments of " + ctor.getDisplayName() +
               " are dropped", ctor.getLocation());
    }
    body.add("const " + INSTANCE + " = new " + cls.getName() + "();");
    body.append(ctx.params.fieldAssignments(ctor.getParams(), INSTANCE));
    body.append(initializers(ctor, INSTANCE));
    if (ctor.getBody() != null) {
      Sequence inner = ctx.functions.body(ctor.getBody());
      if (!inner.isEmpty()) {
        Compound call = new Compound("(function()", inner);
        call.setSuffix(").call(" + INSTANCE + ");");
        body.add(call);
      }
    }
    body.add("return " + INSTANCE + ";");
    return c;
  }

  private JSTree factory(ConstructorDecl ctor) throws CodeGenException {
    if (ctor.getBody() == null) {
      throw ctx.error(ctor, "Factory constructor " + ctor.getDisplayName() +
          " has no body", "Give the factory a body that returns an instance");
    }
    Compound c = new Compound("static " + staticName(ctor) + "(" +
        ctx.params.declaration(ctor.getParams()) + ")");
    c.getBody().append(ctx.functions.body(ctor.getBody()));
    return c;
  }

  private String redirectCall(ClassDecl cls, ConstructorInit redirect)
      throws CodeGenException {
    String args = "(" + ctx.exprs.args(redirect.getArgs()) + ")";
    if (redirect.getConstructorName() == null) {
      return "new " + cls.getName() + args;
    }
    return cls.getName() + "." + redirect.getConstructorName() + args;
  }

  private Sequence initializers(ConstructorDecl ctor, String receiver)
      throws CodeGenException {
    Sequence seq = new Sequence();
    List<ConstructorInit> inits = ctor.getInitializers();
    for (ConstructorInit init: inits) {
      switch (init.getKind()) {
        case FIELD:
          seq.add(receiver + "." + init.getFieldName() + " = " +
                  ctx.exprs.gen(init.getValue()) + ";");
          break;
        case ASSERT:
          String args = ctx.exprs.gen(init.getCondition());
          if (init.getMessage() != null) {
            args += ", " + ctx.exprs.gen(init.getMessage());
          }
          seq.add("console.assert(" + args + ");");
          break;
        default:
          // super and redirect calls are placed by the caller
          break;
      }
    }
    return seq;
  }
}
