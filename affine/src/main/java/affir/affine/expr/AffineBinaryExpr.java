package affir.affine.expr;

/**
 * Affine binary operation expression: add, mul, floordiv, ceildiv or mod. Subtraction is
 * represented through a multiply by -1 and add.
 *
 * <p>Always built in simplified form by {@link AffineSimplifier}; e.g. the operands are never
 * both constants, and the RHS of mul/floordiv/ceildiv/mod is symbolic or constant.
 */
public final class AffineBinaryExpr implements AffineExpr {
  private final AffineContext context;
  private final int id;
  private final BinaryOpKind opKind;
  private final AffineExpr lhs;
  private final AffineExpr rhs;

  AffineBinaryExpr(
      AffineContext context, int id, BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
    this.context = context;
    this.id = id;
    this.opKind = opKind;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.BINARY;
  }

  @Override
  public AffineContext context() {
    return context;
  }

  @Override
  public int id() {
    return id;
  }

  public BinaryOpKind opKind() {
    return opKind;
  }

  public boolean isOpKind(BinaryOpKind kind) {
    return opKind == kind;
  }

  public AffineExpr lhs() {
    return lhs;
  }

  public AffineExpr rhs() {
    return rhs;
  }

  @Override
  public String toString() {
    return AffineExprPrinter.render(this);
  }
}
