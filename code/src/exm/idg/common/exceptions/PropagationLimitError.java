package exm.idg.common.exceptions;

/**
 * Propagation of a mapping did not reach a fixed point within the
 * configured number of steps.
 */
public class PropagationLimitError extends IDGRuntimeError {

  private static final long serialVersionUID = 1L;

  public final long steps;

  public PropagationLimitError(long steps, String msg) {
    super(msg);
    this.steps = steps;
  }
}
