package exm.splc.common.exceptions;

/**
 * A configuration property had a missing or malformed value
 */
public class InvalidOptionException extends UserException {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
