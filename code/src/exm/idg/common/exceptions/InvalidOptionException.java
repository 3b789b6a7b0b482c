package exm.idg.common.exceptions;

/**
 * A configuration setting has a missing or malformed value
 */
public class InvalidOptionException extends UserException {

  private static final long serialVersionUID = 1L;

  public InvalidOptionException(String message) {
    super(message);
  }
}
