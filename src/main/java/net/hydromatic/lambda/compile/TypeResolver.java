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
package net.hydromatic.lambda.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.lambda.ast.Ast;
import net.hydromatic.lambda.type.FnType;
import net.hydromatic.lambda.type.LinearType;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deduces the type of an expression.
 *
 * <p>Resolution is a single top-down pass over the expression tree. Each
 * sub-expression is fully typed before its parent; there are no type
 * variables and no unification.
 *
 * <p>A resolver has no mutable state, so one instance may resolve many
 * expressions, concurrently if need be.
 */
public class TypeResolver {
  final TypeSystem typeSystem;
  final Tracer tracer;
  private final boolean linearityCheck;

  private TypeResolver(
      TypeSystem typeSystem, Map<Prop, Object> propMap, Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.tracer = requireNonNull(tracer);
    this.linearityCheck = Prop.LINEARITY_CHECK.booleanValue(propMap);
  }

  /** Creates a TypeResolver. */
  public static TypeResolver create(
      TypeSystem typeSystem, Map<Prop, Object> propMap, Tracer tracer) {
    return new TypeResolver(typeSystem, ImmutableMap.copyOf(propMap), tracer);
  }

  /**
   * Deduces the type of an expression, using default properties and no
   * tracing.
   */
  public static Type deduceType(
      TypeSystem typeSystem, Environment env, Ast.Exp exp) {
    return create(typeSystem, ImmutableMap.of(), Tracers.empty())
        .infer(exp, env);
  }

  /**
   * Deduces the type of an expression in a given environment.
   *
   * @throws TypeException if the expression is not well-typed
   */
  public Type infer(Ast.Exp exp, Environment env) {
    try {
      return deduceType(env, exp);
    } catch (TypeException e) {
      tracer.onTypeException(e);
      throw e;
    }
  }

  private Type deduceType(Environment env, Ast.Exp exp) {
    final Type type = deduceType0(env, exp);
    tracer.onType(exp, type);
    return type;
  }

  private Type deduceType0(Environment env, Ast.Exp exp) {
    switch (exp.op) {
      case ID:
        final Ast.Id id = (Ast.Id) exp;
        final Type type = env.getOpt(id.name);
        if (type == null) {
          throw new TypeException(Kind.UNBOUND_VARIABLE, id.name, null, null);
        }
        return type;

      case FN:
        final Ast.Fn fn = (Ast.Fn) exp;
        // Inside the body, a linear parameter has its base type; the
        // obligation to use it is carried by the function type.
        final Type bindType =
            fn.paramType instanceof LinearType
                ? ((LinearType) fn.paramType).baseType
                : fn.paramType;
        final Environment env2 = env.bind(fn.param, bindType);
        final Type bodyType = deduceType(env2, fn.body);
        if (fn.paramType instanceof LinearType && linearityCheck) {
          // Textual approximation of "used exactly once". A parameter "x"
          // is satisfied by any occurrence of "x" in the printed body,
          // even inside "max", and is never rejected for occurring twice.
          if (!fn.body.toString().contains(fn.param)) {
            throw new TypeException(
                Kind.LINEARITY_VIOLATION, fn.param, null, null);
          }
        }
        return typeSystem.fnType(fn.paramType, bodyType);

      case APPLY:
        final Ast.Apply apply = (Ast.Apply) exp;
        final Type fnType = deduceType(env, apply.fn);
        final Type argType = deduceType(env, apply.arg);
        if (fnType instanceof FnType && fnType.canCallArgOf(argType)) {
          return ((FnType) fnType).resultType;
        }
        throw new TypeException(Kind.TYPE_MISMATCH, null, fnType, argType);

      case EFFECT:
        final Ast.Effect effect = (Ast.Effect) exp;
        final Type baseType = deduceType(env, effect.exp);
        return typeSystem.effectType(effect.effect, baseType);

      default:
        throw new TypeException(
            Kind.UNKNOWN_EXPRESSION_SHAPE, exp.toString(), null, null);
    }
  }

  /** Kind of type error. */
  public enum Kind {
    /** A variable is not bound in the environment. */
    UNBOUND_VARIABLE,
    /** A variable bound at a linear type does not occur in the body. */
    LINEARITY_VIOLATION,
    /**
     * The function in an application does not have a function type, or its
     * parameter type is not the type of the argument.
     */
    TYPE_MISMATCH,
    /** The expression is not of a kind the resolver knows. */
    UNKNOWN_EXPRESSION_SHAPE
  }

  /** Error while deducing type. */
  public static class TypeException extends RuntimeException {
    public final Kind kind;

    /**
     * Name of the unbound or linear variable; the description of the
     * expression if the kind is {@link Kind#UNKNOWN_EXPRESSION_SHAPE}.
     */
    public final @Nullable String name;

    /** Type of the function, if the kind is {@link Kind#TYPE_MISMATCH}. */
    public final @Nullable Type expected;

    /** Type of the argument, if the kind is {@link Kind#TYPE_MISMATCH}. */
    public final @Nullable Type actual;

    public TypeException(
        Kind kind,
        @Nullable String name,
        @Nullable Type expected,
        @Nullable Type actual) {
      super(message(kind, name, expected, actual));
      this.kind = requireNonNull(kind);
      this.name = name;
      this.expected = expected;
      this.actual = actual;
    }

    private static String message(
        Kind kind,
        @Nullable String name,
        @Nullable Type expected,
        @Nullable Type actual) {
      switch (kind) {
        case UNBOUND_VARIABLE:
          return "Unbound variable: " + name;
        case LINEARITY_VIOLATION:
          return "Linear variable " + name + " must be used exactly once";
        case TYPE_MISMATCH:
          return "Type mismatch: "
              + requireNonNull(expected).moniker()
              + " cannot be applied to "
              + requireNonNull(actual).moniker();
        case UNKNOWN_EXPRESSION_SHAPE:
          return "Unknown expression type: " + name;
        default:
          throw new AssertionError(kind);
      }
    }
  }
}

// End TypeResolver.java
