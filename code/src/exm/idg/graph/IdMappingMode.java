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

/**
 * Notions of equivalence between iteration domains
 */
public enum IdMappingMode {
  /** Index expressions are identical */
  EXACT,
  /** As EXACT, ignoring transformations that do not change iteration */
  ALMOST_EXACT,
  /** As ALMOST_EXACT, with broadcasts mapped to what they resolve to */
  PERMISSIVE,
  /** Share a loop in generated code */
  LOOP,
  ;
}
