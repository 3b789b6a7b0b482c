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
import exm.idg.common.lang.TensorView;

/**
 * Record of two distinct dimensions of one tensor found equivalent
 */
public class SelfMappingInfo {
  private final TensorView tensor;
  private final IterDomain first;
  private final IterDomain second;
  private final String domainName;
  private final IdMappingMode mode;

  public SelfMappingInfo(TensorView tensor, IterDomain first,
        IterDomain second, String domainName, IdMappingMode mode) {
    this.tensor = tensor;
    this.first = first;
    this.second = second;
    this.domainName = domainName;
    this.mode = mode;
  }

  public TensorView tensor() {
    return tensor;
  }

  public IterDomain first() {
    return first;
  }

  public IterDomain second() {
    return second;
  }

  /**
   * @return Root, RFactor or Leaf
   */
  public String domainName() {
    return domainName;
  }

  public IdMappingMode mode() {
    return mode;
  }

  @Override
  public String toString() {
    return tensor.name() + " " + domainName + ": " + first + " ~ " + second
           + " (" + mode + ")";
  }
}
