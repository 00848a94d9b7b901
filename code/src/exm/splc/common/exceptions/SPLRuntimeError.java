package exm.splc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug, e.g. a pass receiving a tree
 * that an earlier pass should have rejected.
 * */
public class SPLRuntimeError extends RuntimeException
{
  public SPLRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
