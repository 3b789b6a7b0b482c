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

import exm.idg.common.lang.IterDomain;

/**
 * Group of iteration domains that are equivalent under one mode
 */
public class IdGroup extends DisjointSet<IterDomain> {

  public static final DisjointSets.SetFactory<IterDomain, IdGroup> FACTORY =
      new DisjointSets.SetFactory<IterDomain, IdGroup>() {
        @Override
        public IdGroup make(Collection<IterDomain> members) {
          return new IdGroup(members);
        }
      };

  private IdGroup(Collection<IterDomain> members) {
    super(members);
  }

  @Override
  public String toString() {
    return "idg" + members();
  }
}
