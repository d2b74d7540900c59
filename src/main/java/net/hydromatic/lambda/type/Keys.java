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
package net.hydromatic.lambda.type;

import static java.util.Objects.hash;
import static java.util.Objects.requireNonNull;

import net.hydromatic.lambda.ast.Op;

/** Type keys. */
public class Keys {
  private Keys() {}

  /** Returns a key that identifies types by name. */
  public static Type.Key name(String name) {
    return new NameKey(name);
  }

  /** Returns a key that identifies a {@link FnType}. */
  public static Type.Key fn(Type.Key paramType, Type.Key resultType) {
    return new FnKey(paramType, resultType);
  }

  /** Returns a key that identifies a {@link LinearType}. */
  public static Type.Key linear(Type.Key baseType) {
    return new LinearKey(baseType);
  }

  /** Returns a key that identifies an {@link EffectType}. */
  public static Type.Key effect(String effect, Type.Key baseType) {
    return new EffectKey(effect, baseType);
  }

  /** Returns a key that identifies an {@link IndexedType}. */
  public static Type.Key indexed(String name, String index) {
    return new IndexedKey(name, index);
  }

  /**
   * Returns a key that identifies a {@link DependentFnType}.
   *
   * <p>Unlike the other keys, it is equal only to keys of the same type
   * object.
   */
  public static Type.Key dependentFn(DependentFnType type) {
    return new DependentFnKey(type);
  }

  /** Key that identifies a type by name. */
  private static class NameKey extends Type.Key {
    private final String name;

    NameKey(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof NameKey && ((NameKey) obj).name.equals(name);
    }
  }

  /** Key of a function type. */
  private static class FnKey extends Type.Key {
    private final Type.Key paramType;
    private final Type.Key resultType;

    FnKey(Type.Key paramType, Type.Key resultType) {
      super(Op.FUNCTION_TYPE);
      this.paramType = requireNonNull(paramType);
      this.resultType = requireNonNull(resultType);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      buf.append('(');
      paramType.describe(buf);
      buf.append(op.padded);
      resultType.describe(buf);
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return hash(paramType, resultType);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof FnKey
              && ((FnKey) obj).paramType.equals(paramType)
              && ((FnKey) obj).resultType.equals(resultType);
    }
  }

  /** Key of a linear type. */
  private static class LinearKey extends Type.Key {
    private final Type.Key baseType;

    LinearKey(Type.Key baseType) {
      super(Op.LINEAR_TYPE);
      this.baseType = requireNonNull(baseType);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      buf.append("Linear[");
      baseType.describe(buf);
      return buf.append(']');
    }

    @Override
    public int hashCode() {
      return hash(op, baseType);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof LinearKey
              && ((LinearKey) obj).baseType.equals(baseType);
    }
  }

  /** Key of an effect type. */
  private static class EffectKey extends Type.Key {
    private final String effect;
    private final Type.Key baseType;

    EffectKey(String effect, Type.Key baseType) {
      super(Op.EFFECT_TYPE);
      this.effect = requireNonNull(effect);
      this.baseType = requireNonNull(baseType);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      buf.append("Effect[").append(effect).append(", ");
      baseType.describe(buf);
      return buf.append(']');
    }

    @Override
    public int hashCode() {
      return hash(effect, baseType);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof EffectKey
              && ((EffectKey) obj).effect.equals(effect)
              && ((EffectKey) obj).baseType.equals(baseType);
    }
  }

  /** Key of a type family applied to a value name, e.g. "Vector(n)". */
  private static class IndexedKey extends Type.Key {
    private final String name;
    private final String index;

    IndexedKey(String name, String index) {
      super(Op.INDEXED_TYPE);
      this.name = requireNonNull(name);
      this.index = requireNonNull(index);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return buf.append(name).append('(').append(index).append(')');
    }

    @Override
    public int hashCode() {
      return hash(name, index);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IndexedKey
              && ((IndexedKey) obj).name.equals(name)
              && ((IndexedKey) obj).index.equals(index);
    }
  }

  /** Key of a dependent function type. Compares by identity of the type. */
  private static class DependentFnKey extends Type.Key {
    private final DependentFnType type;

    DependentFnKey(DependentFnType type) {
      super(Op.DEPENDENT_FUNCTION_TYPE);
      this.type = requireNonNull(type);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      buf.append("(Π ").append(type.paramName).append(": ");
      type.paramType.key().describe(buf);
      buf.append(op.padded);
      type.returnType().key().describe(buf);
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(type);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof DependentFnKey
              && ((DependentFnKey) obj).type == type;
    }
  }
}

// End Keys.java
