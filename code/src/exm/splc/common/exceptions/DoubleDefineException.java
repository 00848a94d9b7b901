package exm.splc.common.exceptions;

import exm.splc.frontend.symbols.SymbolEntry;

/**
 * Raised when a name is declared twice in one scope.
 */
public class DoubleDefineException
extends UserException
{
  private final SymbolEntry existing;
  private final SymbolEntry rejected;

  public DoubleDefineException(SymbolEntry existing, SymbolEntry rejected)
  {
    super(rejected.getDeclId().getNodeId(),
          "Duplicate declaration of '" + rejected.getName() + "' in "
          + rejected.getScope().getDisplayName() + " scope (previous @ "
          + existing.getDeclId() + ", current @ " + rejected.getDeclId() + ")");
    this.existing = existing;
    this.rejected = rejected;
  }

  /**
   * @return the entry already present in the scope
   */
  public SymbolEntry getExisting() {
    return existing;
  }

  /**
   * @return the entry that could not be declared
   */
  public SymbolEntry getRejected() {
    return rejected;
  }

  private static final long serialVersionUID = 1L;
}
