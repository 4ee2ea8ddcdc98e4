package affir.affine.expr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Canonicalization applied before a binary expression is interned.
 *
 * <p>Constants are folded, identities are dropped and commutative operands are put in the order
 * of {@link AffineExprOrder}, so that no two shapes of the same value ever reach the context.
 * Non-affine requests are rejected with an {@link AffineExprException}.
 */
public class AffineSimplifier {
  private static final Logger LOG = LoggerFactory.getLogger(AffineSimplifier.class);

  private static final AffineSimplifier simplifier = new AffineSimplifier();

  public static AffineSimplifier getInstance() {
    return simplifier;
  }

  private AffineSimplifier() {}

  public AffineExpr simplify(
      AffineContext ctx, BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
    checkNotNull(lhs);
    checkNotNull(rhs);
    checkOwner(ctx, opKind, lhs);
    checkOwner(ctx, opKind, rhs);

    return switch (opKind) {
      case ADD -> simplifyAdd(ctx, lhs, rhs);
      case MUL -> simplifyMul(ctx, lhs, rhs);
      case FLOOR_DIV, CEIL_DIV, MOD -> simplifyDivLike(ctx, opKind, lhs, rhs);
    };
  }

  private AffineExpr simplifyAdd(AffineContext ctx, AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof AffineConstantExpr l && rhs instanceof AffineConstantExpr r) {
      return ctx.constant(l.value() + r.value());
    }
    if (lhs.isConstant(0)) return rhs;
    if (rhs.isConstant(0)) return lhs;

    // Constants go to the right.
    if (AffineExprOrder.INSTANCE.compare(lhs, rhs) > 0) {
      final AffineExpr tmp = lhs;
      lhs = rhs;
      rhs = tmp;
    }

    // (e + c1) + c2 -> e + (c1 + c2)
    if (rhs instanceof AffineConstantExpr c2
        && lhs instanceof AffineBinaryExpr inner
        && inner.isOpKind(BinaryOpKind.ADD)
        && inner.rhs() instanceof AffineConstantExpr c1) {
      return simplifyAdd(ctx, inner.lhs(), ctx.constant(c1.value() + c2.value()));
    }

    return ctx.internBinary(BinaryOpKind.ADD, lhs, rhs);
  }

  private AffineExpr simplifyMul(AffineContext ctx, AffineExpr lhs, AffineExpr rhs) {
    if (lhs instanceof AffineConstantExpr l && rhs instanceof AffineConstantExpr r) {
      return ctx.constant(l.value() * r.value());
    }
    if (lhs.isConstant(0) || rhs.isConstant(0)) return ctx.zero();
    if (lhs.isConstant(1)) return rhs;
    if (rhs.isConstant(1)) return lhs;

    final boolean lhsSymbolic = lhs.isSymbolicOrConstant();
    final boolean rhsSymbolic = rhs.isSymbolicOrConstant();
    if (!lhsSymbolic && !rhsSymbolic) {
      LOG.debug("Rejecting non-affine product {} * {}", lhs, rhs);
      throw new InvalidAffineExprException(
          BinaryOpKind.MUL,
          "product of two dimension-dependent expressions is not affine: "
              + lhs
              + " * "
              + rhs);
    }

    // The symbolic factor goes to the right; between two symbolic factors, constants go right.
    final boolean swap =
        lhsSymbolic && rhsSymbolic
            ? AffineExprOrder.INSTANCE.compare(lhs, rhs) > 0
            : lhsSymbolic;
    if (swap) {
      final AffineExpr tmp = lhs;
      lhs = rhs;
      rhs = tmp;
    }

    // (e * c1) * c2 -> e * (c1 * c2)
    if (rhs instanceof AffineConstantExpr c2
        && lhs instanceof AffineBinaryExpr inner
        && inner.isOpKind(BinaryOpKind.MUL)
        && inner.rhs() instanceof AffineConstantExpr c1) {
      return simplifyMul(ctx, inner.lhs(), ctx.constant(c1.value() * c2.value()));
    }

    return ctx.internBinary(BinaryOpKind.MUL, lhs, rhs);
  }

  private AffineExpr simplifyDivLike(
      AffineContext ctx, BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
    if (!rhs.isSymbolicOrConstant()) {
      LOG.debug("Rejecting dimension-dependent divisor in {} {} {}", lhs, opKind.text(), rhs);
      throw new InvalidAffineExprException(
          opKind,
          "divisor of " + opKind.text() + " must be symbolic or constant: " + rhs);
    }
    if (rhs.isConstant(0)) {
      LOG.debug("Rejecting division by zero in {} {} 0", lhs, opKind.text());
      throw new AffineDivisionByZeroException(opKind, lhs);
    }

    if (lhs instanceof AffineConstantExpr l && rhs instanceof AffineConstantExpr r) {
      return ctx.constant(fold(opKind, l.value(), r.value()));
    }
    if (lhs.isConstant(0)) return ctx.zero();

    if (opKind == BinaryOpKind.MOD) {
      if (rhs.isConstant(1) || rhs.isConstant(-1)) return ctx.zero();
    } else if (rhs.isConstant(1)) {
      return lhs;
    }

    return ctx.internBinary(opKind, lhs, rhs);
  }

  static long fold(BinaryOpKind opKind, long lhs, long rhs) {
    return switch (opKind) {
      case ADD -> lhs + rhs;
      case MUL -> lhs * rhs;
      case FLOOR_DIV -> Math.floorDiv(lhs, rhs);
      case CEIL_DIV -> -Math.floorDiv(-lhs, rhs);
      case MOD -> Math.floorMod(lhs, rhs);
    };
  }

  private static void checkOwner(AffineContext ctx, BinaryOpKind opKind, AffineExpr operand) {
    if (!ctx.owns(operand)) {
      throw new InvalidAffineExprException(
          opKind, "operand " + operand + " belongs to a different affine context");
    }
  }
}
