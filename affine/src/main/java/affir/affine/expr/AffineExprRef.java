package affir.affine.expr;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lightweight, immutable handle over a canonical {@link AffineExpr} with arithmetic-style
 * construction operators. Every operator goes through the simplifier of the owning context and
 * returns a handle to the resulting canonical expression.
 *
 * <p>Two handles are equal iff they refer to the same expression instance.
 */
public final class AffineExprRef {
  private final AffineExpr expr;

  private AffineExprRef(AffineExpr expr) {
    this.expr = expr;
  }

  public static AffineExprRef of(AffineExpr expr) {
    return new AffineExprRef(checkNotNull(expr));
  }

  public AffineExpr expr() {
    return expr;
  }

  public AffineContext context() {
    return expr.context();
  }

  public ExprKind kind() {
    return expr.kind();
  }

  public AffineExprRef plus(AffineExprRef other) {
    return of(context().add(expr, other.expr));
  }

  public AffineExprRef plus(long value) {
    return of(context().add(expr, value));
  }

  public AffineExprRef minus(AffineExprRef other) {
    return plus(other.negate());
  }

  public AffineExprRef minus(long value) {
    return plus(-value);
  }

  public AffineExprRef negate() {
    return times(-1);
  }

  public AffineExprRef times(AffineExprRef other) {
    return of(context().mul(expr, other.expr));
  }

  public AffineExprRef times(long value) {
    return of(context().mul(expr, value));
  }

  public AffineExprRef floorDiv(AffineExprRef other) {
    return of(context().floorDiv(expr, other.expr));
  }

  public AffineExprRef floorDiv(long value) {
    return of(context().floorDiv(expr, value));
  }

  public AffineExprRef ceilDiv(AffineExprRef other) {
    return of(context().ceilDiv(expr, other.expr));
  }

  public AffineExprRef ceilDiv(long value) {
    return of(context().ceilDiv(expr, value));
  }

  public AffineExprRef mod(AffineExprRef other) {
    return of(context().mod(expr, other.expr));
  }

  public AffineExprRef mod(long value) {
    return of(context().mod(expr, value));
  }

  public boolean isSymbolicOrConstant() {
    return expr.isSymbolicOrConstant();
  }

  public boolean isPureAffine() {
    return expr.isPureAffine();
  }

  public long largestKnownDivisor() {
    return expr.largestKnownDivisor();
  }

  public boolean isMultipleOf(long factor) {
    return expr.isMultipleOf(factor);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof AffineExprRef)) return false;
    return expr == ((AffineExprRef) obj).expr;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(expr);
  }

  @Override
  public String toString() {
    return expr.toString();
  }
}
