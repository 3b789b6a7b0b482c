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

import com.google.common.base.Objects;

/**
 * Represent a pair of data.  Supports equality and hash comparison.
 *
 * Graph lookups return a pair of (result, found) so that callers have to
 * check the flag before using the result.
 * @param <T1>
 * @param <T2>
 */
public class Pair<T1, T2> {
  public final T1 val1;
  public final T2 val2;

  public Pair(T1 first, T2 second) {
    this.val1 = first;
    this.val2 = second;
  }

  public static <T1, T2> Pair<T1, T2> create(T1 f, T2 s) {
    return new Pair<T1, T2>(f, s);
  }

  /**
   * Result of a successful lookup
   */
  public static <T> Pair<T, Boolean> found(T val) {
    assert(val != null);
    return new Pair<T, Boolean>(val, Boolean.TRUE);
  }

  /**
   * Result of an unsuccessful lookup
   */
  public static <T> Pair<T, Boolean> notFound() {
    return new Pair<T, Boolean>(null, Boolean.FALSE);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(val1, val2);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || !(obj instanceof Pair)) {
      return false;
    }
    Pair<?, ?> other = (Pair<?, ?>) obj;
    return Objects.equal(val1, other.val1) && Objects.equal(val2, other.val2);
  }

  @Override
  public String toString() {
    return "(" + val1 + ", " + val2 + ")";
  }
}
