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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls type resolution.
 *
 * <p>Values live in a {@code Map<Prop, Object>} passed to
 * {@link TypeResolver#create}; a property absent from the map has its default
 * value.
 */
public enum Prop {
  /**
   * Boolean property "linearityCheck" controls whether to check that a
   * variable bound at a linear type occurs in the body of its lambda. Default
   * is true.
   *
   * <p>The check is textual: it passes if the parameter name is a substring
   * of the printed body.
   */
  LINEARITY_CHECK("linearityCheck", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Properties keyed by both {@link #name()} and {@link #camelName}. */
  private static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : values()) {
      b.put(prop.name(), prop);
      b.put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /**
   * Looks up a property by its upper-case or camel-case name.
   *
   * @throws IllegalArgumentException if there is no such property
   */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of this property, or its default if not set. */
  public Object get(Map<Prop, Object> map) {
    final Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkArgument(
        type == Boolean.class,
        "invalid type %s for property %s",
        type,
        camelName);
    return (Boolean) get(map);
  }

  /**
   * Sets the value of this property. A null value removes it, so that it
   * reverts to its default.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property must have type " + type);
    } else {
      map.put(this, value);
    }
  }
}

// End Prop.java
