package affir.affine.expr;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
class AffineSimplifierTest {
  private final AffineContext ctx = AffineContext.mk();

  @Test
  void testFoldConstants() {
    assertSame(ctx.constant(7), ctx.add(ctx.constant(3), ctx.constant(4)));
    assertSame(ctx.constant(12), ctx.mul(ctx.constant(3), ctx.constant(4)));
    assertSame(ctx.constant(3), ctx.floorDiv(ctx.constant(7), 2));
    assertSame(ctx.constant(4), ctx.ceilDiv(ctx.constant(7), 2));
    assertSame(ctx.constant(1), ctx.mod(ctx.constant(7), 2));
    assertSame(ctx.constant(-4), ctx.floorDiv(ctx.constant(-7), 2));
    assertSame(ctx.constant(-3), ctx.ceilDiv(ctx.constant(-7), 2));
    assertSame(ctx.constant(1), ctx.mod(ctx.constant(-7), 2));
    assertSame(ctx.constant(0), ctx.mod(ctx.constant(8), 4));
  }

  @Test
  void testAddWrapsAround() {
    assertSame(ctx.constant(Long.MIN_VALUE), ctx.add(ctx.constant(Long.MAX_VALUE), 1));
  }

  @Test
  void testIdentities() {
    final AffineExpr d0 = ctx.dim(0);
    assertSame(d0, ctx.add(d0, 0));
    assertSame(d0, ctx.add(ctx.zero(), d0));
    assertSame(d0, ctx.mul(d0, 1));
    assertSame(d0, ctx.mul(ctx.one(), d0));
    assertSame(ctx.zero(), ctx.mul(d0, 0));
    assertSame(ctx.zero(), ctx.mul(ctx.zero(), ctx.symbol(0)));
    assertSame(d0, ctx.floorDiv(d0, 1));
    assertSame(d0, ctx.ceilDiv(d0, 1));
    assertSame(ctx.zero(), ctx.mod(d0, 1));
    assertSame(ctx.zero(), ctx.floorDiv(ctx.zero(), ctx.symbol(0)));
    assertSame(ctx.zero(), ctx.ceilDiv(ctx.zero(), 3));
    assertSame(ctx.zero(), ctx.mod(ctx.zero(), 3));
  }

  @Test
  void testCommutedOperandsShareInstance() {
    final AffineExpr d0 = ctx.dim(0), d1 = ctx.dim(1), s0 = ctx.symbol(0);
    assertSame(ctx.add(d0, s0), ctx.add(s0, d0));
    assertSame(ctx.add(d1, d0), ctx.add(d0, d1));
    assertSame(ctx.add(ctx.constant(3), d0), ctx.add(d0, 3));
    assertSame(ctx.mul(d0, s0), ctx.mul(s0, d0));
    assertSame(ctx.mul(ctx.constant(3), d0), ctx.mul(d0, 3));
    assertSame(ctx.mul(ctx.symbol(1), s0), ctx.mul(s0, ctx.symbol(1)));
  }

  @Test
  void testOperandOrder() {
    final AffineExpr d0 = ctx.dim(0), s0 = ctx.symbol(0);
    assertEquals("(d0 + 3)", ctx.add(ctx.constant(3), d0).toString());
    assertEquals("(d0 + s0)", ctx.add(s0, d0).toString());
    assertEquals("(s0 + 5)", ctx.add(ctx.constant(5), s0).toString());
    assertEquals("((d1 + 2) + d0)", ctx.add(d0, ctx.add(ctx.dim(1), 2)).toString());
    assertEquals("(d0 * s0)", ctx.mul(s0, d0).toString());
    assertEquals("(s0 * 3)", ctx.mul(ctx.constant(3), s0).toString());
    assertEquals("((d0 + 1) * s0)", ctx.mul(s0, ctx.add(d0, 1)).toString());
  }

  @Test
  void testInterning() {
    final AffineExpr first = ctx.add(ctx.dim(0), 3);
    final int size = ctx.size();
    final AffineExpr second = ctx.add(ctx.dim(0), ctx.constant(3));
    assertSame(first, second);
    assertEquals(size, ctx.size());
  }

  @Test
  void testIdempotence() {
    final AffineExpr sum = ctx.add(ctx.mul(ctx.dim(0), 4), ctx.symbol(2));
    final AffineBinaryExpr binary = (AffineBinaryExpr) sum;
    assertSame(sum, ctx.add(binary.lhs(), binary.rhs()));
    assertSame(sum, ctx.add(binary.rhs(), binary.lhs()));

    final AffineBinaryExpr div = (AffineBinaryExpr) ctx.floorDiv(sum, ctx.symbol(0));
    assertSame(div, ctx.binary(div.opKind(), div.lhs(), div.rhs()));
  }

  @Test
  void testReassociateConstants() {
    final AffineExpr d0 = ctx.dim(0);
    assertSame(ctx.add(d0, 7), ctx.add(ctx.add(d0, 3), 4));
    assertSame(ctx.add(d0, 7), ctx.add(ctx.constant(4), ctx.add(ctx.constant(3), d0)));
    assertSame(d0, ctx.add(ctx.add(d0, 3), -3));
    assertSame(ctx.mul(d0, 6), ctx.mul(ctx.mul(d0, 3), 2));
    assertSame(ctx.mul(d0, -2), ctx.mul(ctx.mul(d0, 2), -1));
    assertSame(d0, ctx.mul(ctx.mul(d0, -1), -1));
  }

  @Test
  void testSymbolicFactorAndDivisorAreConstructible() {
    final AffineExpr d0 = ctx.dim(0), s0 = ctx.symbol(0);
    assertEquals(BinaryOpKind.MUL, ((AffineBinaryExpr) ctx.mul(d0, s0)).opKind());
    assertEquals(BinaryOpKind.FLOOR_DIV, ((AffineBinaryExpr) ctx.floorDiv(d0, s0)).opKind());
    assertEquals(BinaryOpKind.CEIL_DIV, ((AffineBinaryExpr) ctx.ceilDiv(d0, s0)).opKind());
    assertEquals(BinaryOpKind.MOD, ((AffineBinaryExpr) ctx.mod(d0, ctx.add(s0, 1))).opKind());
  }

  @Test
  void testRejectNonAffineProduct() {
    final AffineExpr d0 = ctx.dim(0), d1 = ctx.dim(1);
    final InvalidAffineExprException e =
        assertThrows(InvalidAffineExprException.class, () -> ctx.mul(d0, d1));
    assertEquals(BinaryOpKind.MUL, e.opKind());
    assertThrows(
        InvalidAffineExprException.class, () -> ctx.mul(ctx.add(d0, ctx.symbol(0)), d1));
    assertThrows(InvalidAffineExprException.class, () -> ctx.mul(d0, d0));
  }

  @Test
  void testRejectDimensionalDivisor() {
    final AffineExpr d0 = ctx.dim(0), s0 = ctx.symbol(0);
    assertThrows(InvalidAffineExprException.class, () -> ctx.floorDiv(s0, d0));
    assertThrows(InvalidAffineExprException.class, () -> ctx.ceilDiv(ctx.constant(4), d0));
    assertThrows(InvalidAffineExprException.class, () -> ctx.mod(d0, ctx.add(s0, d0)));
  }

  @Test
  void testRejectDivisionByZero() {
    final AffineExpr d0 = ctx.dim(0);
    final AffineDivisionByZeroException e =
        assertThrows(AffineDivisionByZeroException.class, () -> ctx.mod(d0, ctx.constant(0)));
    assertEquals(BinaryOpKind.MOD, e.opKind());
    assertSame(d0, e.dividend());
    assertThrows(AffineDivisionByZeroException.class, () -> ctx.floorDiv(d0, 0));
    assertThrows(AffineDivisionByZeroException.class, () -> ctx.ceilDiv(ctx.constant(5), 0));
  }

  @Test
  void testRejectForeignOperand() {
    final AffineContext other = AffineContext.mk();
    assertThrows(InvalidAffineExprException.class, () -> ctx.add(ctx.dim(0), other.dim(0)));
  }

  @Test
  void testNoConstantPairSurvives() {
    final AffineExpr c2 = ctx.constant(2), c3 = ctx.constant(3), s0 = ctx.symbol(0);
    ctx.add(ctx.mul(c2, c3), ctx.add(c3, s0));
    ctx.mod(ctx.floorDiv(ctx.add(c2, c3), c2), ctx.ceilDiv(c3, c2));
    ctx.mul(ctx.add(ctx.dim(0), c2), ctx.mul(c3, c2));

    for (AffineExpr expr : ctx.snapshot()) {
      if (expr instanceof AffineBinaryExpr binary) {
        final boolean bothConstant =
            binary.lhs() instanceof AffineConstantExpr
                && binary.rhs() instanceof AffineConstantExpr;
        assertFalse(bothConstant, expr.toString());
        assertFalse(binary.lhs().isConstant(0) || binary.rhs().isConstant(0), expr.toString());
      }
    }
  }
}
