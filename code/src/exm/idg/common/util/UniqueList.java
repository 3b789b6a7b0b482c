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
package exm.idg.common.util;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Set that remembers insertion order and can be used as a FIFO work list.
 * Iteration order is insertion order, which keeps all graph walks
 * deterministic.
 *
 * Equality is set equality, ignoring order.
 * @param <T>
 */
public class UniqueList<T> extends AbstractSet<T> {

  private final LinkedHashSet<T> data;

  public UniqueList() {
    this.data = new LinkedHashSet<T>();
  }

  public UniqueList(Iterable<? extends T> init) {
    this();
    pushBack(init);
  }

  public static <T1> UniqueList<T1> create() {
    return new UniqueList<T1>();
  }

  @SafeVarargs
  public static <T1> UniqueList<T1> of(T1 ...vals) {
    return new UniqueList<T1>(Arrays.asList(vals));
  }

  /**
   * Append if not present
   * @param val
   * @return true if added
   */
  public boolean pushBack(T val) {
    return data.add(val);
  }

  /**
   * Append all values not already present, in iteration order
   * @param vals
   * @return true if anything was added
   */
  public boolean pushBack(Iterable<? extends T> vals) {
    boolean changed = false;
    for (T val: vals) {
      changed = data.add(val) || changed;
    }
    return changed;
  }

  public T front() {
    if (data.isEmpty()) {
      throw new NoSuchElementException();
    }
    return data.iterator().next();
  }

  /**
   * Remove and return first element in insertion order
   */
  public T popFront() {
    Iterator<T> it = data.iterator();
    T first = it.next();
    it.remove();
    return first;
  }

  public boolean has(Object val) {
    return data.contains(val);
  }

  /**
   * @return new list with elements of this that are also in other,
   *          in the order of this
   */
  public UniqueList<T> intersect(Collection<?> other) {
    UniqueList<T> res = new UniqueList<T>();
    for (T val: data) {
      if (other.contains(val)) {
        res.pushBack(val);
      }
    }
    return res;
  }

  /**
   * @return new list with elements of this not in other
   */
  public UniqueList<T> subtract(Collection<?> other) {
    UniqueList<T> res = new UniqueList<T>();
    for (T val: data) {
      if (!other.contains(val)) {
        res.pushBack(val);
      }
    }
    return res;
  }

  /**
   * @return new list with elements of this followed by new elements of other
   */
  public UniqueList<T> computeUnion(Iterable<? extends T> other) {
    UniqueList<T> res = new UniqueList<T>(this);
    res.pushBack(other);
    return res;
  }

  public List<T> toList() {
    return new ArrayList<T>(data);
  }

  @Override
  public boolean add(T e) {
    return pushBack(e);
  }

  @Override
  public boolean contains(Object o) {
    return data.contains(o);
  }

  @Override
  public boolean remove(Object o) {
    return data.remove(o);
  }

  @Override
  public void clear() {
    data.clear();
  }

  @Override
  public Iterator<T> iterator() {
    return data.iterator();
  }

  @Override
  public int size() {
    return data.size();
  }
}
