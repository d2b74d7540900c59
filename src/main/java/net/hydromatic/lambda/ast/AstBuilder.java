/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lambda.ast;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import net.hydromatic.lambda.type.Type;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a variable. */
  public Ast.Id id(String name) {
    return new Ast.Id(name);
  }

  /** Creates a lambda, "{@code (λparam: paramType. body)}". */
  public Ast.Fn fn(String param, Type paramType, Ast.Exp body) {
    return new Ast.Fn(param, paramType, body);
  }

  /** Creates an application of a function to an argument. */
  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(fn, arg);
  }

  /**
   * Creates a chain of applications, "{@code ((f a) b)}", applying {@code
   * fn} to each argument in turn.
   */
  public Ast.Apply apply(Ast.Exp fn, List<? extends Ast.Exp> args) {
    checkArgument(!args.isEmpty(), "no arguments");
    Ast.Exp e = fn;
    for (Ast.Exp arg : args) {
      e = apply(e, arg);
    }
    return (Ast.Apply) e;
  }

  /** Creates an expression evaluated under a named effect. */
  public Ast.Effect effect(String effect, Ast.Exp exp) {
    return new Ast.Effect(effect, exp);
  }
}

// End AstBuilder.java
