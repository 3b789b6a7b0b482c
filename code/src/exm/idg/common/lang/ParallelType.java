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
package exm.idg.common.lang;

import exm.idg.common.exceptions.IDGRuntimeError;

/**
 * Parallelization annotation of a loop
 */
public enum ParallelType {
  BIDx, BIDy, BIDz, // Bound to block index
  TIDx, TIDy, TIDz, // Bound to thread index
  VECTORIZE,
  UNROLL,
  UNSWITCH,
  SERIAL,
  ;

  /**
   * @return true if the loop is bound to a block or thread index.  At
   *         most one such binding may apply to a loop.
   */
  public boolean isThread() {
    switch (this) {
    case BIDx:
    case BIDy:
    case BIDz:
    case TIDx:
    case TIDy:
    case TIDz:
      return true;
    case VECTORIZE:
    case UNROLL:
    case UNSWITCH:
    case SERIAL:
      return false;
    default:
      throw new IDGRuntimeError("Unknown parallel type " + this);
    }
  }

  public boolean isBlockDim() {
    return this == BIDx || this == BIDy || this == BIDz;
  }

  public boolean isThreadDim() {
    return this == TIDx || this == TIDy || this == TIDz;
  }
}
