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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lambda.compile.Environment;
import net.hydromatic.lambda.compile.Environments;
import net.hydromatic.lambda.type.PrimitiveType;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Environment}. */
public class EnvironmentTest {
  private final TypeSystem typeSystem = new TypeSystem();

  /** Binding a variable does not change the original environment. */
  @Test
  void testBindDoesNotMutate() {
    final Environment env = Environments.empty();
    assertThat(env.getOpt("x"), nullValue());
    final Environment env2 = env.bind("x", PrimitiveType.INT);
    assertThat(env2.getOpt("x"), is(PrimitiveType.INT));
    assertThat(env.getOpt("x"), nullValue());
    assertThat(env.has("x"), is(false));
    assertThat(env2.has("x"), is(true));
  }

  @Test
  void testShadow() {
    final Environment env =
        Environments.of(
            ImmutableMap.of("x", PrimitiveType.INT, "y", PrimitiveType.BOOL));
    final Type linearBool = typeSystem.linearType(PrimitiveType.BOOL);
    final Environment env2 = env.bind("x", linearBool);
    assertThat(env2.getOpt("x"), is(linearBool));
    assertThat(env2.getOpt("y"), is(PrimitiveType.BOOL));
    assertThat(env.getOpt("x"), is(PrimitiveType.INT));
    assertThat(env2.asString(), is("x : Linear[Bool]\ny : Bool\n"));
    assertThat(env.asString(), is("x : Int\ny : Bool\n"));

    // obscured bindings are not visited
    final List<String> names = new ArrayList<>();
    env2.forEachType((name, type) -> names.add(name + ":" + type));
    assertThat(names.size(), is(2));
    assertThat(env2.getTypeMap().get("x"), is(linearBool));
  }

  @Test
  void testBindAll() {
    final Environment env =
        Environments.empty()
            .bind("a", PrimitiveType.INT)
            .bindAll(
                ImmutableMap.of(
                    "a", PrimitiveType.BOOL, "b", PrimitiveType.INT));
    assertThat(env.getOpt("a"), is(PrimitiveType.BOOL));
    assertThat(env.getOpt("b"), is(PrimitiveType.INT));
    assertThat(env.getOpt("c"), nullValue());
    assertThat(Environments.empty().asString(), is(""));
  }

  /** Each visible name is listed once, in order, however often bound. */
  @Test
  void testNames() {
    assertThat(Environments.empty().names().isEmpty(), is(true));
    final Environment env =
        Environments.empty()
            .bind("y", PrimitiveType.INT)
            .bind("x", PrimitiveType.BOOL)
            .bind("y", typeSystem.linearType(PrimitiveType.INT));
    assertThat(env.names().toString(), is("[x, y]"));
    assertThat(env.names().first(), is("x"));

    // binding a new name leaves the old environment's names alone
    final Environment env2 = env.bind("a", PrimitiveType.INT);
    assertThat(env2.names().toString(), is("[a, x, y]"));
    assertThat(env.names().toString(), is("[x, y]"));
  }
}

// End EnvironmentTest.java
