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
package exm.idg.graph;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.idg.common.exceptions.IDGRuntimeError;

/**
 * An equivalence class in a {@link DisjointSets} registry.
 *
 * Membership never changes after construction: a union creates a new set,
 * so holders of the old object can tell that it is stale.  Equality is
 * identity, which for live sets of one registry is the same as equality of
 * members.
 * @param <T>
 */
public class DisjointSet<T> implements Iterable<T> {
  private final List<T> members;
  private final ImmutableSet<T> memberSet;

  protected DisjointSet(Collection<? extends T> members) {
    if (members.isEmpty()) {
      throw new IDGRuntimeError("Disjoint sets must be non-empty");
    }
    this.memberSet = ImmutableSet.copyOf(members);
    this.members = ImmutableList.copyOf(memberSet);
  }

  public List<T> members() {
    return members;
  }

  /**
   * @return first member in insertion order
   */
  public T front() {
    return members.get(0);
  }

  public boolean has(T member) {
    return memberSet.contains(member);
  }

  public int size() {
    return members.size();
  }

  @Override
  public Iterator<T> iterator() {
    return members.iterator();
  }

  @Override
  public String toString() {
    return members.toString();
  }
}
