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

import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

import net.hydromatic.lambda.type.Type;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /**
   * Base class of expression ASTs.
   *
   * <p>The set of sub-classes is closed: {@link Id}, {@link Fn}, {@link Apply}
   * and {@link Effect}. An expression has no type of its own; its type depends
   * on the environment in which it is resolved.
   */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }
  }

  /** Parse tree node of an identifier, "{@code x}". */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Lambda expression, "{@code (λx: Int. body)}".
   *
   * <p>Binds {@code param} at type {@code paramType} within {@code body}.
   */
  public static class Fn extends Exp {
    public final String param;
    public final Type paramType;
    public final Exp body;

    Fn(String param, Type paramType, Exp body) {
      super(Op.FN);
      this.param = requireNonNull(param);
      this.paramType = requireNonNull(paramType);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return hash(param, paramType, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
              && param.equals(((Fn) o).param)
              && paramType.equals(((Fn) o).paramType)
              && body.equals(((Fn) o).body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(λ")
          .id(param)
          .append(": ")
          .append(paramType)
          .append(op.padded)
          .append(body, 0, 0)
          .append(")");
    }
  }

  /** Application of a function to an argument, "{@code (f a)}". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Exp fn, Exp arg) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && fn.equals(((Apply) o).fn)
              && arg.equals(((Apply) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }
  }

  /**
   * Expression evaluated under a named side effect, "{@code [IO] exp}".
   *
   * <p>Its type is the type of {@code exp} wrapped in an effect type. The
   * effect name is not checked against any known set.
   */
  public static class Effect extends Exp {
    public final String effect;
    public final Exp exp;

    Effect(String effect, Exp exp) {
      super(Op.EFFECT);
      this.effect = requireNonNull(effect);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return hash(effect, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Effect
              && effect.equals(((Effect) o).effect)
              && exp.equals(((Effect) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[")
          .append(effect)
          .append("] ")
          .append(exp, 0, right);
    }
  }
}

// End Ast.java
