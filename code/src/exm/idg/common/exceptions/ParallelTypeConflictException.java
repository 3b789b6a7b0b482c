package exm.idg.common.exceptions;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.ParallelType;

/**
 * Two dimensions sharing a loop are bound to different
 * parallel types.
 */
public class ParallelTypeConflictException extends UserException {

  private static final long serialVersionUID = 1L;

  public final IterDomain first;
  public final IterDomain second;

  public ParallelTypeConflictException(IterDomain first, ParallelType ptype1,
                            IterDomain second, ParallelType ptype2) {
    super("Conflicting parallel types in loop group: " + first + " is " +
          ptype1 + " but " + second + " is " + ptype2);
    this.first = first;
    this.second = second;
  }
}
