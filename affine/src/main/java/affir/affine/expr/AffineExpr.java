package affir.affine.expr;

/**
 * A one-dimensional affine expression over dimension identifiers, symbol identifiers and integer
 * constants.
 *
 * <p>Instances are immutable and hash-consed by their owning {@link AffineContext}: two
 * expressions of the same context are structurally equal iff they are the same object, so
 * expressions are compared with {@code ==}.
 */
public sealed interface AffineExpr
    permits AffineConstantExpr, AffineDimExpr, AffineSymbolExpr, AffineBinaryExpr {

  ExprKind kind();

  AffineContext context();

  /** Stable index of this expression in the arena of its context. */
  int id();

  default boolean isConstant(long value) {
    return this instanceof AffineConstantExpr c && c.value() == value;
  }

  /**
   * Returns true if this expression is made out of only symbols and constants, i.e., it does not
   * involve dimensional identifiers.
   */
  default boolean isSymbolicOrConstant() {
    return AffineExprSupport.isSymbolicOrConstant(this);
  }

  /**
   * Returns true if this is a pure affine expression, i.e., multiplication, floordiv, ceildiv,
   * and mod is only allowed w.r.t constants.
   */
  default boolean isPureAffine() {
    return AffineExprSupport.isPureAffine(this);
  }

  /** Returns the greatest known integral divisor of this affine expression. */
  default long largestKnownDivisor() {
    return AffineExprSupport.largestKnownDivisor(this);
  }

  /** Returns true if the affine expression is a multiple of {@code factor}. */
  default boolean isMultipleOf(long factor) {
    return AffineExprSupport.isMultipleOf(this, factor);
  }

  default AffineExprRef ref() {
    return AffineExprRef.of(this);
  }
}
