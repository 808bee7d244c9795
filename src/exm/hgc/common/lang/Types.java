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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.hgc.common.exceptions.HGCRuntimeError;

/**
 * Types of IR values: fixed-width bit vectors, tokens and tuples.
 */
public class Types {

  /** Widest bit vector supported */
  public static final int MAX_BITS = 64;

  public static enum TypeKind {
    BITS,
    TOKEN,
    TUPLE,
  }

  public static abstract class Type {
    public abstract TypeKind kind();

    public boolean isBits() {
      return kind() == TypeKind.BITS;
    }

    public boolean isToken() {
      return kind() == TypeKind.TOKEN;
    }

    public boolean isTuple() {
      return kind() == TypeKind.TUPLE;
    }

    /**
     * @return true if a value of this type carries a token anywhere inside
     */
    public abstract boolean containsToken();

    public int bitCount() {
      throw new HGCRuntimeError("Not a bits type: " + this);
    }

    public List<Type> elements() {
      throw new HGCRuntimeError("Not a tuple type: " + this);
    }

    @Override
    public abstract String toString();
  }

  public static class BitsType extends Type {
    private final int width;

    private BitsType(int width) {
      this.width = width;
    }

    @Override
    public TypeKind kind() {
      return TypeKind.BITS;
    }

    @Override
    public boolean containsToken() {
      return false;
    }

    @Override
    public int bitCount() {
      return width;
    }

    @Override
    public String toString() {
      return "bits[" + width + "]";
    }

    @Override
    public int hashCode() {
      return 31 * width + 7;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof BitsType)) {
        return false;
      }
      return ((BitsType)obj).width == width;
    }
  }

  public static class TokenType extends Type {
    private TokenType() {
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TOKEN;
    }

    @Override
    public boolean containsToken() {
      return true;
    }

    @Override
    public String toString() {
      return "token";
    }

    @Override
    public int hashCode() {
      return 17;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof TokenType;
    }
  }

  public static class TupleType extends Type {
    private final List<Type> elems;

    private TupleType(List<Type> elems) {
      this.elems = Collections.unmodifiableList(new ArrayList<Type>(elems));
    }

    @Override
    public TypeKind kind() {
      return TypeKind.TUPLE;
    }

    @Override
    public boolean containsToken() {
      for (Type t: elems) {
        if (t.containsToken()) {
          return true;
        }
      }
      return false;
    }

    @Override
    public List<Type> elements() {
      return elems;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(");
      boolean first = true;
      for (Type t: elems) {
        if (!first) {
          sb.append(", ");
        }
        sb.append(t.toString());
        first = false;
      }
      sb.append(")");
      return sb.toString();
    }

    @Override
    public int hashCode() {
      return elems.hashCode() * 13 + 3;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof TupleType)) {
        return false;
      }
      return ((TupleType)obj).elems.equals(elems);
    }
  }

  public static final TokenType TOKEN = new TokenType();

  /** Type of predicates and comparison results */
  public static final BitsType BOOL = new BitsType(1);

  public static BitsType bits(int width) {
    if (width < 1 || width > MAX_BITS) {
      throw new HGCRuntimeError("Unsupported bit width: " + width);
    }
    if (width == 1) {
      return BOOL;
    }
    return new BitsType(width);
  }

  public static TupleType tuple(List<Type> elems) {
    return new TupleType(elems);
  }

  public static TupleType tuple(Type ...elems) {
    return new TupleType(Arrays.asList(elems));
  }

  /**
   * @return the type of a receive result carrying the given payload
   */
  public static TupleType receiveResult(Type payload) {
    return tuple(TOKEN, payload);
  }
}
