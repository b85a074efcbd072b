/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package com.cleversafe.phaselock;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Primitives;

/**
 * Reflection helpers shared by option classes: populate fluent setters from properties named
 * {@code <prefix><setterName>}, copy fields, and print fields.
 */
final class OptionsUtil {
  private OptionsUtil() {}

  private static final Logger LOGGER = LoggerFactory.getLogger(OptionsUtil.class);

  @SuppressWarnings("unchecked")
  static <T> T populateFromProperties(final String prefix, final T object) {
    return populateFromProperties(System.getProperties(), prefix, (Class<T>) object.getClass(),
        object);
  }

  static <T> T populateFromProperties(final Properties properties, final String prefix,
      final Class<T> clazz, final T object) {
    for (final Entry<String, List<Method>> setters : setterMap(clazz, prefix).entrySet()) {
      final String value = properties.getProperty(setters.getKey());
      if (value != null && !applyProperty(object, setters.getValue(), value)) {
        LOGGER.warn("ignoring unusable option {}={}", setters.getKey(), value);
      }
    }
    return object;
  }

  private static boolean applyProperty(final Object target, final List<Method> setters,
      final String value) {
    final String[] args = value.split(",", -1);
    for (final Method m : setters) {
      final Class<?>[] paramTypes = m.getParameterTypes();
      if (paramTypes.length != args.length) {
        continue;
      }
      final Object[] parsed = new Object[args.length];
      boolean usable = true;
      for (int i = 0; i < args.length && usable; i++) {
        try {
          parsed[i] = parseArgument(paramTypes[i], args[i]);
        } catch (final ReflectiveOperationException | IllegalArgumentException e) {
          LOGGER.debug("{} is not a {}", args[i], paramTypes[i].getSimpleName(), e);
          usable = false;
        }
      }
      if (!usable) {
        continue;
      }
      try {
        m.invoke(target, parsed);
        return true;
      } catch (IllegalAccessException | IllegalArgumentException | InvocationTargetException e) {
        LOGGER.debug("setter {} rejected {}", m.getName(), value, e);
      }
    }
    return false;
  }

  /**
   * Parses one argument as a string, a primitive or enum via {@code valueOf}, the literal
   * {@code null}, or a no-arg static factory given as {@code fully.qualified.Class.method}.
   */
  private static Object parseArgument(final Class<?> type, final String arg)
      throws ReflectiveOperationException {
    if (type == String.class) {
      return arg;
    }
    final Method valueOf = valueOfMethod(type);
    if (valueOf != null) {
      try {
        return valueOf.invoke(null, arg);
      } catch (final InvocationTargetException e) {
        throw new IllegalArgumentException("cannot parse " + arg + " as " + type, e.getCause());
      }
    }
    if ("null".equals(arg)) {
      if (type.isPrimitive()) {
        throw new IllegalArgumentException("null given for primitive " + type);
      }
      return null;
    }
    final int methodIndex = arg.lastIndexOf('.');
    if (methodIndex < 0) {
      throw new IllegalArgumentException("cannot parse " + arg + " as " + type);
    }
    final Object made = Class.forName(arg.substring(0, methodIndex))
        .getDeclaredMethod(arg.substring(methodIndex + 1)).invoke(null);
    if (!type.isInstance(made)) {
      throw new IllegalArgumentException(arg + " did not produce a " + type);
    }
    return made;
  }

  private static Method valueOfMethod(final Class<?> type) {
    for (final Method m : Primitives.wrap(type).getMethods()) {
      if (m.getName().equals("valueOf") && Modifier.isStatic(m.getModifiers())
          && Arrays.equals(m.getParameterTypes(), new Class<?>[] {String.class})) {
        return m;
      }
    }
    return null;
  }

  private static Map<String, List<Method>> setterMap(final Class<?> clazz,
      final String paramPrefix) {
    final Map<String, List<Method>> map = new HashMap<>();
    for (final Method m : clazz.getMethods()) {
      // only consider instance methods which require parameters
      if (!m.getDeclaringClass().equals(clazz) || m.getParameterTypes().length == 0
          || Modifier.isStatic(m.getModifiers())) {
        continue;
      }
      map.computeIfAbsent(paramPrefix + m.getName(), k -> new ArrayList<>()).add(m);
    }
    return map;
  }

  static <T> void copyFields(final Class<T> clazz, final T from, final T to) {
    if (from == null || to == null) {
      return;
    }
    for (final Field f : instanceFields(clazz)) {
      try {
        f.set(to, f.get(from));
      } catch (IllegalArgumentException | IllegalAccessException e) {
        throw new Error(e);
      }
    }
  }

  static String toString(final Object opt) {
    final Class<?> clazz = opt.getClass();
    final StringBuilder sb = new StringBuilder(clazz.getSimpleName()).append(" [");
    for (final Field f : instanceFields(clazz)) {
      sb.append(f.getName()).append('=');
      try {
        sb.append(f.get(opt));
      } catch (IllegalArgumentException | IllegalAccessException e) {
        throw new Error(e);
      }
      sb.append(", ");
    }
    sb.setLength(sb.length() - 2);
    return sb.append(']').toString();
  }

  private static List<Field> instanceFields(final Class<?> clazz) {
    final List<Field> fields = new ArrayList<>();
    for (final Field f : clazz.getDeclaredFields()) {
      final int mods = f.getModifiers();
      if (Modifier.isFinal(mods) || Modifier.isStatic(mods)) {
        continue;
      }
      f.setAccessible(true);
      fields.add(f);
    }
    return fields;
  }
}
