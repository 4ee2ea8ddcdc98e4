package affir.affine.expr;

/**
 * A dimensional identifier appearing in an affine expression.
 *
 * <p>Owned by its {@link AffineContext} and alive as long as the context is.
 */
public final class AffineDimExpr implements AffineExpr {
  private final AffineContext context;
  private final int id;
  // Position of this identifier in the argument list.
  private final int position;

  AffineDimExpr(AffineContext context, int id, int position) {
    this.context = context;
    this.id = id;
    this.position = position;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.DIM_ID;
  }

  @Override
  public AffineContext context() {
    return context;
  }

  @Override
  public int id() {
    return id;
  }

  public int position() {
    return position;
  }

  @Override
  public String toString() {
    return AffineExprPrinter.render(this);
  }
}
