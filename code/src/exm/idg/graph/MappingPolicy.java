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

import exm.idg.common.lang.IterDomain;

/**
 * Per-mode rules for building an {@link IdGraph}.  One graph type is
 * shared by all modes; what differs is how the graph is seeded, which
 * extra dimensions are mapped after seeding, and which mappings are
 * refused during propagation.
 */
public interface MappingPolicy {

  public IdMappingMode mode();

  /**
   * Create the graph this mode starts from.  May read graphs of modes
   * built earlier.
   */
  public IdGraph initialGraph(IterDomainGraphs graphs);

  /**
   * Apply the mappings specific to this mode
   */
  public void buildMappings(IdGraph graph, IterDomainGraphs graphs);

  /**
   * Checked before every union, including those found by propagation.
   * A refused union is skipped, not an error.
   */
  public boolean allowMap(IdGraph graph, IterDomain a, IterDomain b);
}
