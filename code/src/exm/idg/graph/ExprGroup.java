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

import exm.idg.ir.tree.Exprs.Expr;

/**
 * Group of transformations that are equivalent under one mode.  Only
 * created by initialization or as a consequence of mapping their inputs
 * or outputs.
 */
public class ExprGroup extends DisjointSet<Expr> {

  public static final DisjointSets.SetFactory<Expr, ExprGroup> FACTORY =
      new DisjointSets.SetFactory<Expr, ExprGroup>() {
        @Override
        public ExprGroup make(Collection<Expr> members) {
          return new ExprGroup(members);
        }
      };

  private ExprGroup(Collection<Expr> members) {
    super(members);
  }

  @Override
  public String toString() {
    return "exprg" + members();
  }
}
