package exm.idg.common.exceptions;

/**
 * The operation graph is not a DAG, or refers to dimensions that were
 * never registered.  Detected while traversing the graph.
 */
public class MalformedGraphError extends IDGRuntimeError {

  private static final long serialVersionUID = 1L;

  public MalformedGraphError(String msg) {
    super(msg);
  }
}
