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
package net.hydromatic.axiom.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns the concatenation of two lists. */
  public static <E> ImmutableList<E> concat(List<? extends E> list0,
      List<? extends E> list1) {
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }

  /** Returns a copy of a list with the element at {@code i} replaced. */
  public static <E> ImmutableList<E> set(List<? extends E> list, int i, E e) {
    final ImmutableList.Builder<E> b =
        ImmutableList.builderWithExpectedSize(list.size());
    for (int j = 0; j < list.size(); j++) {
      b.add(j == i ? e : list.get(j));
    }
    return b.build();
  }

  /** Returns a copy of a list with the element at {@code i} removed. */
  public static <E> ImmutableList<E> remove(List<? extends E> list, int i) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    for (int j = 0; j < list.size(); j++) {
      if (j != i) {
        b.add(list.get(j));
      }
    }
    return b.build();
  }

  /** Returns whether every element of a collection matches a predicate. */
  public static <E> boolean allMatch(Iterable<? extends E> iterable,
      Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether any element of a collection matches a predicate. */
  public static <E> boolean anyMatch(Iterable<? extends E> iterable,
      Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }
}

// End Static.java
