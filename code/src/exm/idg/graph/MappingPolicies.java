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

import exm.idg.common.exceptions.IDGRuntimeError;

/**
 * Default policy for each mode
 */
public class MappingPolicies {

  public static MappingPolicy forMode(IdMappingMode mode) {
    switch (mode) {
      case EXACT:
        return new ExactPolicy();
      case ALMOST_EXACT:
        return new AlmostExactPolicy();
      case PERMISSIVE:
        return new PermissivePolicy();
      case LOOP:
        return new LoopPolicy();
      default:
        throw new IDGRuntimeError("Unknown mapping mode " + mode);
    }
  }
}
