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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.lambda.ast.Ast;
import net.hydromatic.lambda.type.Type;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each expression and its
   * type, then calls the underlying tracer.
   */
  public static Tracer withOnType(
      Tracer tracer, BiConsumer<Ast.Exp, Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onType(Ast.Exp exp, Type type) {
        consumer.accept(exp, type);
        super.onType(exp, type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a type exception, then
   * calls the underlying tracer.
   */
  public static Tracer withOnTypeException(
      Tracer tracer, Consumer<TypeResolver.TypeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onTypeException(TypeResolver.TypeException e) {
        consumer.accept(e);
        super.onTypeException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onType(Ast.Exp exp, Type type) {}

    @Override
    public boolean onTypeException(TypeResolver.TypeException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onType(Ast.Exp exp, Type type) {
      tracer.onType(exp, type);
    }

    @Override
    public boolean onTypeException(TypeResolver.TypeException e) {
      return tracer.onTypeException(e);
    }
  }
}

// End Tracers.java
