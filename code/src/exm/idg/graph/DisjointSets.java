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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exm.idg.common.util.UniqueList;

/**
 * Union-find registry partitioning entities into {@link DisjointSet}s.
 *
 * Sets are immutable: a union replaces both sets with a new one and
 * re-points every member.  Live sets are kept in creation order so that
 * iteration over the registry is deterministic.
 *
 * @param <T> entity type, compared by identity
 * @param <S> set type
 */
public class DisjointSets<T, S extends DisjointSet<T>> {

  /**
   * Create sets of the right subtype
   */
  public static interface SetFactory<T, S> {
    public S make(Collection<T> members);
  }

  private final SetFactory<T, S> factory;

  /** Entity to the live set containing it */
  private final Map<T, S> disjointSetMap;

  /** Live sets in creation order */
  private final UniqueList<S> disjointSets;

  public DisjointSets(SetFactory<T, S> factory) {
    this.factory = factory;
    this.disjointSetMap = new HashMap<T, S>();
    this.disjointSets = new UniqueList<S>();
  }

  /**
   * Copy with the same partition but new set objects
   */
  public DisjointSets(DisjointSets<T, S> other) {
    this(other.factory);
    for (S set: other.disjointSets) {
      S copy = factory.make(set.members());
      disjointSets.pushBack(copy);
      for (T member: copy) {
        disjointSetMap.put(member, copy);
      }
    }
  }

  public static <T1, S1 extends DisjointSet<T1>> DisjointSets<T1, S1>
                                          create(SetFactory<T1, S1> factory) {
    return new DisjointSets<T1, S1>(factory);
  }

  /**
   * @param entity
   * @return set containing entity, or null if never seen
   */
  public S find(T entity) {
    return disjointSetMap.get(entity);
  }

  /**
   * Register entity in a singleton set if not already present
   * @return set containing entity
   */
  public S initializeSet(T entity) {
    S set = disjointSetMap.get(entity);
    if (set != null) {
      return set;
    }
    set = factory.make(Collections.singletonList(entity));
    disjointSetMap.put(entity, set);
    disjointSets.pushBack(set);
    return set;
  }

  /**
   * Union the sets containing a and b, registering either if needed.
   * @return the set containing both afterwards
   */
  public S mapEntries(T a, T b) {
    S setA = initializeSet(a);
    S setB = initializeSet(b);
    if (setA == setB) {
      return setA;
    }

    List<T> members = new ArrayList<T>(setA.size() + setB.size());
    members.addAll(setA.members());
    members.addAll(setB.members());
    S merged = factory.make(members);

    disjointSets.remove(setA);
    disjointSets.remove(setB);
    disjointSets.pushBack(merged);
    for (T member: members) {
      disjointSetMap.put(member, merged);
    }
    return merged;
  }

  /**
   * @return true if both are registered and in the same set
   */
  public boolean strictAreMapped(T a, T b) {
    S setA = find(a);
    return setA != null && setA == find(b);
  }

  /**
   * @return true if a and b are the same entity or in the same set
   */
  public boolean permissiveAreMapped(T a, T b) {
    return a == b || strictAreMapped(a, b);
  }

  /**
   * @return live sets in creation order
   */
  public List<S> disjointSets() {
    return disjointSets.toList();
  }

  public Map<T, S> disjointSetMap() {
    return Collections.unmodifiableMap(disjointSetMap);
  }

  public int size() {
    return disjointSets.size();
  }

  @Override
  public String toString() {
    return disjointSets.toString();
  }
}
