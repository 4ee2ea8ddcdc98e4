package affir.affine.expr;

/**
 * A construction request that does not describe an affine expression: a product of two
 * dimension-dependent operands, a dimension-dependent divisor, or operands from another context.
 */
public class InvalidAffineExprException extends AffineExprException {
  public InvalidAffineExprException(BinaryOpKind opKind, String message) {
    super(opKind, message);
  }
}
