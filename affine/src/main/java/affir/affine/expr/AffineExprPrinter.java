package affir.affine.expr;

/**
 * Renders affine expressions in the affine-map syntax: {@code d0}, {@code s1}, {@code 42},
 * {@code (d0 + 3)}, {@code (d0 floordiv 2)}.
 *
 * <p>Binary expressions are always parenthesized, so the text is unambiguous and a parser can
 * rebuild the structurally equal (hence identical) expression from it.
 */
public final class AffineExprPrinter {
  private AffineExprPrinter() {}

  public static String render(AffineExpr expr) {
    final StringBuilder builder = new StringBuilder();
    print(expr, builder);
    return builder.toString();
  }

  public static void print(AffineExpr expr, StringBuilder builder) {
    switch (expr.kind()) {
      case CONSTANT -> builder.append(((AffineConstantExpr) expr).value());
      case DIM_ID -> builder.append('d').append(((AffineDimExpr) expr).position());
      case SYMBOL_ID -> builder.append('s').append(((AffineSymbolExpr) expr).position());
      case BINARY -> {
        final AffineBinaryExpr binary = (AffineBinaryExpr) expr;
        builder.append('(');
        print(binary.lhs(), builder);
        builder.append(' ').append(binary.opKind().text()).append(' ');
        print(binary.rhs(), builder);
        builder.append(')');
      }
    }
  }
}
