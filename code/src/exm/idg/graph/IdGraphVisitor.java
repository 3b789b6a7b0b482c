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
import java.util.List;

import exm.idg.common.exceptions.MalformedGraphError;
import exm.idg.common.util.UniqueList;

/**
 * Visit the groups of an {@link IdGraph} in topological order: every id
 * group after all of its definitions and every transformation group after
 * all of its input groups.  Among groups ready at the same time, the
 * order in which they were discovered is kept.
 *
 * Transformation groups whose outputs overlap their inputs are skipped.
 * If a sub-selection of id groups is given, only transformation groups
 * with all inputs and outputs in the selection are followed.
 */
public abstract class IdGraphVisitor {

  private final IdGraph graph;

  /** Null if the whole graph is visited */
  private final UniqueList<IdGroup> subSelection;

  protected IdGraphVisitor(IdGraph graph) {
    this(graph, null);
  }

  protected IdGraphVisitor(IdGraph graph, Collection<IdGroup> subSelection) {
    this.graph = graph;
    this.subSelection = subSelection == null ? null
                          : new UniqueList<IdGroup>(subSelection);
  }

  public IdGraph graph() {
    return graph;
  }

  protected abstract void handle(IdGroup group);

  protected abstract void handle(ExprGroup group);

  /**
   * @throws MalformedGraphError if groups are left that can never be
   *          visited
   */
  public void traverse() {
    UniqueList<IdGroup> allIds;
    if (subSelection == null) {
      allIds = new UniqueList<IdGroup>(graph.disjointIdSets().disjointSets());
    } else {
      allIds = subSelection;
    }

    UniqueList<ExprGroup> allExprs = new UniqueList<ExprGroup>();
    for (IdGroup id: allIds) {
      for (ExprGroup expr: graph.uniqueDefinitions(id)) {
        if (eligible(expr, allIds)) {
          allExprs.pushBack(expr);
        }
      }
      for (ExprGroup expr: graph.uniqueUses(id)) {
        if (eligible(expr, allIds)) {
          allExprs.pushBack(expr);
        }
      }
    }

    UniqueList<IdGroup> visitedIds = new UniqueList<IdGroup>();
    UniqueList<ExprGroup> visitedExprs = new UniqueList<ExprGroup>();

    // Terminating inputs, including isolated groups
    UniqueList<IdGroup> toVisitIds = new UniqueList<IdGroup>();
    for (IdGroup id: allIds) {
      if (graph.uniqueDefinitions(id).intersect(allExprs).isEmpty()) {
        toVisitIds.pushBack(id);
      }
    }
    UniqueList<ExprGroup> toVisitExprs = new UniqueList<ExprGroup>();

    while (!toVisitIds.isEmpty() || !toVisitExprs.isEmpty()) {
      boolean progress = false;

      UniqueList<ExprGroup> stillWaitingExprs = new UniqueList<ExprGroup>();
      while (!toVisitExprs.isEmpty()) {
        ExprGroup expr = toVisitExprs.popFront();
        if (visitedExprs.contains(expr)) {
          continue;
        }
        List<IdGroup> inputs = graph.inputGroups(expr);
        if (visitedIds.containsAll(inputs)) {
          handle(expr);
          visitedExprs.pushBack(expr);
          progress = true;
          for (IdGroup output: graph.outputGroups(expr)) {
            if (!visitedIds.contains(output)) {
              toVisitIds.pushBack(output);
            }
          }
        } else {
          stillWaitingExprs.pushBack(expr);
        }
      }
      toVisitExprs = stillWaitingExprs;

      UniqueList<IdGroup> stillWaitingIds = new UniqueList<IdGroup>();
      while (!toVisitIds.isEmpty()) {
        IdGroup id = toVisitIds.popFront();
        if (visitedIds.contains(id)) {
          continue;
        }
        UniqueList<ExprGroup> defs =
                graph.uniqueDefinitions(id).intersect(allExprs);
        if (visitedExprs.containsAll(defs)) {
          handle(id);
          visitedIds.pushBack(id);
          progress = true;
          for (ExprGroup use: graph.uniqueUses(id)) {
            if (allExprs.contains(use) && !visitedExprs.contains(use)) {
              toVisitExprs.pushBack(use);
            }
          }
        } else {
          stillWaitingIds.pushBack(id);
        }
      }
      toVisitIds = stillWaitingIds;

      if (!progress) {
        throw new MalformedGraphError("Topological sort of " +
            graph.mode() + " graph is stuck, waiting ids: " + toVisitIds +
            " waiting exprs: " + toVisitExprs);
      }
    }

    if (visitedIds.size() != allIds.size()) {
      List<IdGroup> unvisited = new ArrayList<IdGroup>(
                                          allIds.subtract(visitedIds));
      throw new MalformedGraphError("Groups never became ready in " +
          graph.mode() + " graph, likely a cycle: " + unvisited);
    }
  }

  private boolean eligible(ExprGroup expr, UniqueList<IdGroup> allIds) {
    if (graph.isSelfLoop(expr)) {
      return false;
    }
    if (subSelection != null) {
      return allIds.containsAll(graph.inputGroups(expr)) &&
             allIds.containsAll(graph.outputGroups(expr));
    }
    return true;
  }
}
