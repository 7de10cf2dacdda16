/*
 * Copyright (c) 2026 QANWP Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.qanwp.stats.helper;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.qanwp.stats.exception.InvalidParameterException;

/**
 * Base class for algorithm arguments.
 *
 * <p>Subclasses declare one public field per parameter, annotated with
 * {@link Doc} and {@link Optional}; the field initializer is the default.
 * {@link #apply(Map)} overrides defaults from a request's parameter map.
 */
public abstract class ArgsBase {

  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.FIELD)
  public @interface Doc {
    String help();
  }

  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.FIELD)
  public @interface Optional {}

  /**
   * Assigns every entry of {@code params} to the field of the same name.
   *
   * @return names that do not match any parameter; they are left untouched
   * @throws InvalidParameterException if a value cannot be assigned to its field
   */
  public List<String> apply(Map<String, ?> params) {
    List<String> ignored = new ArrayList<>();
    if (params == null) {
      return ignored;
    }
    Map<String, Field> fields = parameterFields();
    for (Map.Entry<String, ?> entry : params.entrySet()) {
      Field field = fields.get(entry.getKey());
      if (field == null) {
        ignored.add(entry.getKey());
        continue;
      }
      assign(field, entry.getValue());
    }
    validate();
    return ignored;
  }

  /** Parameter names mapped to their help text, in declaration order. */
  public Map<String, String> describe() {
    Map<String, String> help = new LinkedHashMap<>();
    for (Field field : parameterFields().values()) {
      help.put(field.getName(), field.getAnnotation(Doc.class).help());
    }
    return help;
  }

  /** Checks ranges; called after parameters were applied. */
  public void validate() {}

  protected static void check(boolean condition, String format, Object... args) {
    if (!condition) {
      throw new InvalidParameterException(String.format(format, args));
    }
  }

  private Map<String, Field> parameterFields() {
    Map<String, Field> fields = new LinkedHashMap<>();
    for (Field field : getClass().getFields()) {
      if (!Modifier.isStatic(field.getModifiers()) && field.isAnnotationPresent(Doc.class)) {
        fields.put(field.getName(), field);
      }
    }
    return fields;
  }

  private void assign(Field field, Object value) {
    Class<?> type = field.getType();
    try {
      if (type == boolean.class) {
        if (!(value instanceof Boolean)) {
          throw mismatch(field, value);
        }
        field.setBoolean(this, (Boolean) value);
        return;
      }
      if (!(value instanceof Number)) {
        throw mismatch(field, value);
      }
      double number = ((Number) value).doubleValue();
      if (type == double.class) {
        check(Double.isFinite(number), "Parameter '%s' must be finite, got %s",
            field.getName(), value);
        field.setDouble(this, number);
      } else if (type == int.class) {
        check(number == Math.rint(number) && Math.abs(number) <= Integer.MAX_VALUE,
            "Parameter '%s' expects an integer, got %s", field.getName(), value);
        field.setInt(this, (int) number);
      } else {
        throw mismatch(field, value);
      }
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Parameter field is not accessible: " + field, e);
    }
  }

  private static InvalidParameterException mismatch(Field field, Object value) {
    return new InvalidParameterException(String.format(
        "Parameter '%s' expects %s, got %s", field.getName(), field.getType().getSimpleName(),
        value == null ? "null" : value.getClass().getSimpleName()));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
    String sep = "";
    for (Field field : parameterFields().values()) {
      try {
        sb.append(sep).append(field.getName()).append('=').append(field.get(this));
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Parameter field is not accessible: " + field, e);
      }
      sep = ", ";
    }
    return sb.append('}').toString();
  }
}
