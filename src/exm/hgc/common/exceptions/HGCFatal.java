package exm.hgc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class HGCFatal extends RuntimeException {
  private static final long serialVersionUID = 1L;
  public final int exitCode;

  public HGCFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

}
