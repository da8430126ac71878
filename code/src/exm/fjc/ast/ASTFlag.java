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
package exm.fjc.ast;

/**
 * Modifiers and syntactic markers attached to AST nodes.
 */
public enum ASTFlag {
  ABSTRACT,
  STATIC,
  FINAL,
  CONST,
  LATE,
  VAR,
  EXTERNAL,
  FACTORY,
  GETTER,
  SETTER,
  ASYNC,
  GENERATOR,
  /** yield* or await for */
  STAR,
  NULLABLE,
  /** Parameter in {} */
  NAMED,
  /** Parameter in [] */
  OPTIONAL,
  REQUIRED,
  /** this.x parameter */
  FIELD_PARAM,
  /** super.x parameter */
  SUPER_PARAM,
  PREFIX,
  POSTFIX,
  NULL_AWARE,
  NEGATED,
  /** Written with the new keyword */
  NEW_KEYWORD,
  /** Import written in module syntax: import x from 'y' */
  MODULE_SYNTAX;
}
