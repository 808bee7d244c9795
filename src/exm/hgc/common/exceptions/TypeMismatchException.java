package exm.hgc.common.exceptions;

public class TypeMismatchException
extends UserException
{
  public TypeMismatchException(String file, int line, int col,
                               String message)
  {
    super(file, line, col, message);
  }

  public TypeMismatchException(String message)
  {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
