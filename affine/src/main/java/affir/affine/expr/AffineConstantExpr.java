package affir.affine.expr;

/** An integer constant appearing in an affine expression. */
public final class AffineConstantExpr implements AffineExpr {
  private final AffineContext context;
  private final int id;
  private final long value;

  AffineConstantExpr(AffineContext context, int id, long value) {
    this.context = context;
    this.id = id;
    this.value = value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CONSTANT;
  }

  @Override
  public AffineContext context() {
    return context;
  }

  @Override
  public int id() {
    return id;
  }

  public long value() {
    return value;
  }

  @Override
  public String toString() {
    return AffineExprPrinter.render(this);
  }
}
