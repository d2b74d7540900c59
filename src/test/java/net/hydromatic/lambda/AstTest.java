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
package net.hydromatic.lambda;

import static net.hydromatic.lambda.Matchers.isAst;
import static net.hydromatic.lambda.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.lambda.ast.Ast;
import net.hydromatic.lambda.ast.Op;
import net.hydromatic.lambda.type.PrimitiveType;
import net.hydromatic.lambda.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for building and printing expressions. */
public class AstTest {
  private final TypeSystem typeSystem = new TypeSystem();

  @Test
  void testUnparse() {
    assertThat(ast.id("x"), isAst(Ast.Id.class, "x"));
    assertThat(
        ast.fn("x", PrimitiveType.INT, ast.id("x")),
        isAst(Ast.Fn.class, "(λx: Int. x)"));
    assertThat(
        ast.fn("x", typeSystem.linearType(PrimitiveType.INT), ast.id("y")),
        isAst(Ast.Fn.class, "(λx: Linear[Int]. y)"));
    assertThat(
        ast.apply(ast.fn("x", PrimitiveType.INT, ast.id("x")), ast.id("x")),
        isAst(Ast.Apply.class, "((λx: Int. x) x)"));
    assertThat(
        ast.effect("IO", ast.id("x")), isAst(Ast.Effect.class, "[IO] x"));
    assertThat(
        ast.fn(
            "f",
            typeSystem.fnType(PrimitiveType.BOOL, PrimitiveType.INT),
            ast.effect("IO", ast.apply(ast.id("f"), ast.id("b")))),
        isAst(Ast.Fn.class, "(λf: (Bool -> Int). [IO] (f b))"));
    assertThat(
        ast.apply(
            ast.id("f"),
            ImmutableList.of(ast.id("a"), ast.id("b"), ast.id("c"))),
        isAst(Ast.Apply.class, "(((f a) b) c)"));
  }

  @Test
  void testOp() {
    assertThat(ast.id("x").op, is(Op.ID));
    assertThat(ast.fn("x", PrimitiveType.INT, ast.id("x")).op, is(Op.FN));
    assertThat(ast.apply(ast.id("f"), ast.id("x")).op, is(Op.APPLY));
    assertThat(ast.effect("IO", ast.id("x")).op, is(Op.EFFECT));

    // only operators written between two operands have padding
    assertThat(Op.APPLY.padded, is(" "));
    assertThat(Op.FUNCTION_TYPE.padded, is(" -> "));
    assertThat(Op.EFFECT.padded, is(""));
    assertThat(Op.LINEAR_TYPE.padded, is(""));
    assertThat(Op.EFFECT_TYPE.padded, is(""));
    assertThat(
        ast.effect("IO", ast.effect("Log", ast.id("x"))),
        isAst(Ast.Effect.class, "[IO] [Log] x"));
  }

  /** Expressions are values; equal trees are equal. */
  @Test
  void testEquals() {
    final Ast.Exp e1 =
        ast.fn(
            "x",
            typeSystem.linearType(PrimitiveType.INT),
            ast.effect("IO", ast.apply(ast.id("f"), ast.id("x"))));
    final Ast.Exp e2 =
        ast.fn(
            "x",
            typeSystem.linearType(PrimitiveType.INT),
            ast.effect("IO", ast.apply(ast.id("f"), ast.id("x"))));
    assertThat(e1, is(e2));
    assertThat(e1.hashCode(), is(e2.hashCode()));
    assertThat(
        e1,
        not(
            ast.fn(
                "x",
                PrimitiveType.INT,
                ast.effect("IO", ast.apply(ast.id("f"), ast.id("x"))))));
    assertThat(
        ast.effect("IO", ast.id("x")), not(ast.effect("IO2", ast.id("x"))));
  }

  @Test
  void testApplyNoArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ast.apply(ast.id("f"), ImmutableList.of()));
  }
}

// End AstTest.java
