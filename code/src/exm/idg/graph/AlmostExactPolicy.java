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
import java.util.List;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.util.Pair;
import exm.idg.ir.tree.Exprs.Expr;

/**
 * As EXACT, but transformations that do not change iteration, like a
 * split by one, map their input to the corresponding output.
 */
public class AlmostExactPolicy implements MappingPolicy {

  @Override
  public IdMappingMode mode() {
    return IdMappingMode.ALMOST_EXACT;
  }

  @Override
  public IdGraph initialGraph(IterDomainGraphs graphs) {
    return new IdGraph(graphs.idGraph(IdMappingMode.EXACT), this);
  }

  @Override
  public void buildMappings(IdGraph graph, IterDomainGraphs graphs) {
    // Mapping changes groups, so collect first
    List<Expr> exprs = new ArrayList<Expr>();
    for (ExprGroup group: graph.disjointExprSets().disjointSets()) {
      exprs.addAll(group.members());
    }
    for (Expr expr: exprs) {
      for (Pair<IterDomain, IterDomain> p: IdGraph.isTrivialExpr(expr)) {
        graph.mapIds(p.val1, p.val2);
      }
    }
  }

  @Override
  public boolean allowMap(IdGraph graph, IterDomain a, IterDomain b) {
    return true;
  }
}
