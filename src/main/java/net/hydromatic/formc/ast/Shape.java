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
package net.hydromatic.formc.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;

/**
 * Value shape of an expression: the extent of each tensor axis.
 *
 * <p>A scalar has rank 0 and shape "()"; a 2-vector has shape "(2)"; a 3 by
 * 3 matrix has shape "(3, 3)".
 */
public final class Shape {
  public static final Shape SCALAR = new Shape(ImmutableList.of());

  public final ImmutableList<Integer> dims;

  private Shape(ImmutableList<Integer> dims) {
    this.dims = dims;
  }

  public static Shape of(int... dims) {
    if (dims.length == 0) {
      return SCALAR;
    }
    for (int dim : dims) {
      checkArgument(dim > 0, "invalid extent %s", dim);
    }
    return new Shape(ImmutableList.copyOf(Ints.asList(dims)));
  }

  public static Shape of(List<Integer> dims) {
    return of(Ints.toArray(dims));
  }

  public int rank() {
    return dims.size();
  }

  public boolean isScalar() {
    return dims.isEmpty();
  }

  public int dim(int axis) {
    return dims.get(axis);
  }

  public int first() {
    return dims.get(0);
  }

  public int last() {
    return dims.get(dims.size() - 1);
  }

  /** Returns the number of scalar components. */
  public int size() {
    int n = 1;
    for (int dim : dims) {
      n *= dim;
    }
    return n;
  }

  /** Returns this shape with an extra trailing axis. */
  public Shape append(int dim) {
    return of(
        ImmutableList.<Integer>builder().addAll(dims).add(dim).build());
  }

  /** Returns the shape whose axes are those of this shape then another. */
  public Shape concat(Shape shape) {
    return of(
        ImmutableList.<Integer>builder().addAll(dims).addAll(shape.dims)
            .build());
  }

  public Shape dropFirst() {
    return of(dims.subList(1, dims.size()));
  }

  public Shape dropLast() {
    return of(dims.subList(0, dims.size() - 1));
  }

  /** Returns the shape with axes reversed; used for transpose. */
  public Shape reverse() {
    return of(dims.reverse());
  }

  /**
   * Returns every multi-index of this shape in row-major order (the last
   * axis varying fastest). A scalar has one empty multi-index.
   */
  public List<int[]> indices() {
    final List<int[]> list = new ArrayList<>();
    final int[] index = new int[dims.size()];
    for (int k = 0, n = size(); k < n; k++) {
      list.add(index.clone());
      for (int axis = dims.size() - 1; axis >= 0; axis--) {
        if (++index[axis] < dims.get(axis)) {
          break;
        }
        index[axis] = 0;
      }
    }
    return list;
  }

  @Override
  public int hashCode() {
    return dims.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Shape && dims.equals(((Shape) o).dims);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("(");
    for (int i = 0; i < dims.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(dims.get(i));
    }
    return b.append(')').toString();
  }
}

// End Shape.java
