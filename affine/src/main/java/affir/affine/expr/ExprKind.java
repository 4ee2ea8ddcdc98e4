package affir.affine.expr;

/** Discriminant of an {@link AffineExpr}. Binary nodes carry their own {@link BinaryOpKind}. */
public enum ExprKind {
  CONSTANT,
  DIM_ID,
  SYMBOL_ID,
  BINARY;

  public boolean isLeaf() {
    return this != BINARY;
  }
}
