package exm.hgc.common.exceptions;

/**
 * Malformed IR text
 */
public class InvalidSyntaxException extends UserException {

  public InvalidSyntaxException(String file, int line, int col,
                                String message) {
    super(file, line, col, message);
  }

  private static final long serialVersionUID = 1L;
}
