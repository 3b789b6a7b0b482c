package exm.idg.common.exceptions;

/**
 * This represents an internal error in graph construction or queries.
 * These always indicate a bug in the graph code or in the caller.
 * */
public class IDGRuntimeError extends RuntimeException
{
  public IDGRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
