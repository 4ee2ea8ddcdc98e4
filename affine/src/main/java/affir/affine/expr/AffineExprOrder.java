package affir.affine.expr;

import java.util.Comparator;

/**
 * Total order over canonical expressions, used to place the operands of commutative operators.
 *
 * <p>Nested binary expressions sort first, then dimensions, then symbols, then constants; ties
 * are broken by operator, position or value, and recursively by operands. An operand that
 * sorts lower is placed on the left, so constants always end up on the right.
 */
public final class AffineExprOrder implements Comparator<AffineExpr> {
  public static final AffineExprOrder INSTANCE = new AffineExprOrder();

  private AffineExprOrder() {}

  @Override
  public int compare(AffineExpr x, AffineExpr y) {
    if (x == y) return 0;

    final int rankCmp = Integer.compare(rank(x.kind()), rank(y.kind()));
    if (rankCmp != 0) return rankCmp;

    if (x instanceof AffineBinaryExpr bx && y instanceof AffineBinaryExpr by) {
      final int opCmp = bx.opKind().compareTo(by.opKind());
      if (opCmp != 0) return opCmp;
      final int lhsCmp = compare(bx.lhs(), by.lhs());
      if (lhsCmp != 0) return lhsCmp;
      return compare(bx.rhs(), by.rhs());
    }
    if (x instanceof AffineDimExpr dx && y instanceof AffineDimExpr dy) {
      return Integer.compare(dx.position(), dy.position());
    }
    if (x instanceof AffineSymbolExpr sx && y instanceof AffineSymbolExpr sy) {
      return Integer.compare(sx.position(), sy.position());
    }
    return Long.compare(((AffineConstantExpr) x).value(), ((AffineConstantExpr) y).value());
  }

  private static int rank(ExprKind kind) {
    return switch (kind) {
      case BINARY -> 0;
      case DIM_ID -> 1;
      case SYMBOL_ID -> 2;
      case CONSTANT -> 3;
    };
  }
}
