package affir.affine.expr;

/** A floordiv, ceildiv or mod by the constant 0. */
public class AffineDivisionByZeroException extends AffineExprException {
  private final AffineExpr dividend;

  public AffineDivisionByZeroException(BinaryOpKind opKind, AffineExpr dividend) {
    super(opKind, "division by zero: " + dividend + " " + opKind.text() + " 0");
    this.dividend = dividend;
  }

  public AffineExpr dividend() {
    return dividend;
  }
}
