/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.hgc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.hgc.common.exceptions.HGCRuntimeError;
import exm.hgc.common.lang.Types.Type;

/**
 * Immutable runtime value of an IR type.
 */
public class Value {
  private static final Value TOKEN_VALUE = new Value(Types.TOKEN, 0, null);

  private final Type type;
  /** Payload of a bits value, masked to its width */
  private final long bits;
  /** Elements of a tuple value */
  private final List<Value> elements;

  private Value(Type type, long bits, List<Value> elements) {
    this.type = type;
    this.bits = bits;
    this.elements = elements;
  }

  public static Value bits(int width, long val) {
    return new Value(Types.bits(width), val & mask(width), null);
  }

  public static Value bool(boolean val) {
    return bits(1, val ? 1 : 0);
  }

  public static Value token() {
    return TOKEN_VALUE;
  }

  public static Value tuple(List<Value> elems) {
    List<Type> types = new ArrayList<Type>(elems.size());
    for (Value v: elems) {
      types.add(v.type());
    }
    return new Value(Types.tuple(types), 0,
            Collections.unmodifiableList(new ArrayList<Value>(elems)));
  }

  /**
   * @return the all-zeros value of the type, as produced by a
   *         receive whose predicate is false
   */
  public static Value zero(Type type) {
    switch (type.kind()) {
      case BITS:
        return bits(type.bitCount(), 0);
      case TOKEN:
        return token();
      case TUPLE:
        List<Value> elems = new ArrayList<Value>();
        for (Type t: type.elements()) {
          elems.add(zero(t));
        }
        return tuple(elems);
      default:
        throw new HGCRuntimeError("Unknown type kind " + type.kind());
    }
  }

  public static long mask(int width) {
    return width >= 64 ? -1L : (1L << width) - 1;
  }

  public Type type() {
    return type;
  }

  public long asLong() {
    checkBits();
    return bits;
  }

  public boolean isTrue() {
    checkBits();
    return bits != 0;
  }

  public List<Value> elements() {
    if (!type.isTuple()) {
      throw new HGCRuntimeError("Not a tuple value: " + this);
    }
    return elements;
  }

  public Value element(int i) {
    return elements().get(i);
  }

  private void checkBits() {
    if (!type.isBits()) {
      throw new HGCRuntimeError("Not a bits value: " + this);
    }
  }

  /**
   * @return value as written in IR text, without the type
   */
  public String text() {
    switch (type.kind()) {
      case BITS:
        return Long.toUnsignedString(bits);
      case TOKEN:
        return "token";
      case TUPLE:
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
          if (i > 0) {
            sb.append(", ");
          }
          sb.append(elements.get(i).text());
        }
        sb.append(")");
        return sb.toString();
      default:
        throw new HGCRuntimeError("Unknown type kind " + type.kind());
    }
  }

  @Override
  public String toString() {
    if (type.isBits()) {
      return type + ":" + text();
    }
    return text();
  }

  @Override
  public int hashCode() {
    int result = type.hashCode();
    result = 31 * result + Long.hashCode(bits);
    result = 31 * result + (elements == null ? 0 : elements.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Value))
      return false;
    Value other = (Value) obj;
    if (!type.equals(other.type) || bits != other.bits)
      return false;
    if (elements == null)
      return other.elements == null;
    return elements.equals(other.elements);
  }
}
