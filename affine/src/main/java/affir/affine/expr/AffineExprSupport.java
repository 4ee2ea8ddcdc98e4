package affir.affine.expr;

import com.google.common.math.LongMath;

import java.util.List;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/** Read-only structural queries and rewriting helpers over affine expressions. */
public abstract class AffineExprSupport {
  // |Long.MIN_VALUE| is not representable; 2^62 still divides it.
  private static final long MIN_VALUE_DIVISOR = 1L << 62;

  private AffineExprSupport() {}

  public static boolean isSymbolicOrConstant(AffineExpr expr) {
    return switch (expr.kind()) {
      case CONSTANT, SYMBOL_ID -> true;
      case DIM_ID -> false;
      case BINARY -> {
        final AffineBinaryExpr binary = (AffineBinaryExpr) expr;
        yield isSymbolicOrConstant(binary.lhs()) && isSymbolicOrConstant(binary.rhs());
      }
    };
  }

  /**
   * Stricter than what the simplifier accepts: a symbolic factor or divisor is constructible, but
   * only a literal constant one keeps the expression pure.
   */
  public static boolean isPureAffine(AffineExpr expr) {
    if (!(expr instanceof AffineBinaryExpr binary)) return true;

    final AffineExpr lhs = binary.lhs(), rhs = binary.rhs();
    return switch (binary.opKind()) {
      case ADD -> isPureAffine(lhs) && isPureAffine(rhs);
      case MUL -> isPureAffine(lhs)
          && isPureAffine(rhs)
          && (lhs instanceof AffineConstantExpr || rhs instanceof AffineConstantExpr);
      case FLOOR_DIV, CEIL_DIV, MOD -> isPureAffine(lhs) && rhs instanceof AffineConstantExpr;
    };
  }

  /**
   * Greatest positive integer dividing the expression for every valuation of its identifiers.
   * The constant 0 yields 0, the identity of gcd: every factor divides it.
   */
  public static long largestKnownDivisor(AffineExpr expr) {
    return switch (expr.kind()) {
      case CONSTANT -> absDivisor(((AffineConstantExpr) expr).value());
      case DIM_ID, SYMBOL_ID -> 1;
      case BINARY -> binaryDivisor((AffineBinaryExpr) expr);
    };
  }

  private static long binaryDivisor(AffineBinaryExpr binary) {
    final long lhsDivisor = largestKnownDivisor(binary.lhs());
    switch (binary.opKind()) {
      case ADD:
        return LongMath.gcd(lhsDivisor, largestKnownDivisor(binary.rhs()));

      case MUL:
        try {
          return LongMath.checkedMultiply(lhsDivisor, largestKnownDivisor(binary.rhs()));
        } catch (ArithmeticException overflow) {
          return 1;
        }

      case FLOOR_DIV:
      case CEIL_DIV:
        if (binary.rhs() instanceof AffineConstantExpr divisor) {
          final long d = absDivisor(divisor.value());
          return lhsDivisor % d == 0 ? Math.max(lhsDivisor / d, 1) : 1;
        }
        return 1;

      default:
        return 1;
    }
  }

  private static long absDivisor(long value) {
    return value == Long.MIN_VALUE ? MIN_VALUE_DIVISOR : Math.abs(value);
  }

  public static boolean isMultipleOf(AffineExpr expr, long factor) {
    final long divisor = largestKnownDivisor(expr);
    if (factor == 0) return divisor == 0;
    return divisor % factor == 0;
  }

  /** Visits every sub-expression in post-order. Shared sub-expressions are visited per use. */
  public static void walk(AffineExpr expr, Consumer<AffineExpr> visitor) {
    if (expr instanceof AffineBinaryExpr binary) {
      walk(binary.lhs(), visitor);
      walk(binary.rhs(), visitor);
    }
    visitor.accept(expr);
  }

  public static boolean isFunctionOfDim(AffineExpr expr, int position) {
    return switch (expr.kind()) {
      case DIM_ID -> ((AffineDimExpr) expr).position() == position;
      case CONSTANT, SYMBOL_ID -> false;
      case BINARY -> {
        final AffineBinaryExpr binary = (AffineBinaryExpr) expr;
        yield isFunctionOfDim(binary.lhs(), position) || isFunctionOfDim(binary.rhs(), position);
      }
    };
  }

  public static boolean isFunctionOfSymbol(AffineExpr expr, int position) {
    return switch (expr.kind()) {
      case SYMBOL_ID -> ((AffineSymbolExpr) expr).position() == position;
      case CONSTANT, DIM_ID -> false;
      case BINARY -> {
        final AffineBinaryExpr binary = (AffineBinaryExpr) expr;
        yield isFunctionOfSymbol(binary.lhs(), position)
            || isFunctionOfSymbol(binary.rhs(), position);
      }
    };
  }

  /** Largest dimension position referenced by the expression, or -1 if there is none. */
  public static int maxDimPosition(AffineExpr expr) {
    final int[] max = {-1};
    walk(expr, e -> {
      if (e instanceof AffineDimExpr dim) max[0] = Math.max(max[0], dim.position());
    });
    return max[0];
  }

  /** Largest symbol position referenced by the expression, or -1 if there is none. */
  public static int maxSymbolPosition(AffineExpr expr) {
    final int[] max = {-1};
    walk(expr, e -> {
      if (e instanceof AffineSymbolExpr sym) max[0] = Math.max(max[0], sym.position());
    });
    return max[0];
  }

  /**
   * Substitutes dimension {@code i} by {@code dims.get(i)} and symbol {@code j} by {@code
   * symbols.get(j)}, rebuilding the expression through the simplifier. Positions beyond the
   * given lists are kept. May throw {@link AffineExprException} if the substitution makes the
   * expression non-affine.
   */
  public static AffineExpr replaceDimsAndSymbols(
      AffineExpr expr, List<AffineExpr> dims, List<AffineExpr> symbols) {
    checkNotNull(dims);
    checkNotNull(symbols);
    return switch (expr.kind()) {
      case CONSTANT -> expr;
      case DIM_ID -> {
        final int pos = ((AffineDimExpr) expr).position();
        yield pos < dims.size() ? dims.get(pos) : expr;
      }
      case SYMBOL_ID -> {
        final int pos = ((AffineSymbolExpr) expr).position();
        yield pos < symbols.size() ? symbols.get(pos) : expr;
      }
      case BINARY -> {
        final AffineBinaryExpr binary = (AffineBinaryExpr) expr;
        final AffineExpr lhs = replaceDimsAndSymbols(binary.lhs(), dims, symbols);
        final AffineExpr rhs = replaceDimsAndSymbols(binary.rhs(), dims, symbols);
        if (lhs == binary.lhs() && rhs == binary.rhs()) yield expr;
        yield expr.context().binary(binary.opKind(), lhs, rhs);
      }
    };
  }
}
