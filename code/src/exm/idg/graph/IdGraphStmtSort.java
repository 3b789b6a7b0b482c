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
import java.util.List;

/**
 * Groups of a graph in topological order
 */
public class IdGraphStmtSort extends IdGraphVisitor {
  private final List<IdGroup> sortedIds = new ArrayList<IdGroup>();
  private final List<ExprGroup> sortedExprs = new ArrayList<ExprGroup>();

  public IdGraphStmtSort(IdGraph graph) {
    this(graph, null);
  }

  public IdGraphStmtSort(IdGraph graph, Collection<IdGroup> subSelection) {
    super(graph, subSelection);
    traverse();
  }

  @Override
  protected void handle(IdGroup group) {
    sortedIds.add(group);
  }

  @Override
  protected void handle(ExprGroup group) {
    sortedExprs.add(group);
  }

  public List<IdGroup> ids() {
    return Collections.unmodifiableList(sortedIds);
  }

  public List<ExprGroup> exprs() {
    return Collections.unmodifiableList(sortedExprs);
  }
}
