package affir.affine.expr;

public enum BinaryOpKind {
  ADD("+"),
  // RHS of mul is always a constant or a symbolic expression.
  MUL("*"),
  // RHS of mod is always a constant or a symbolic expression.
  MOD("mod"),
  // RHS of floordiv is always a constant or a symbolic expression.
  FLOOR_DIV("floordiv"),
  // RHS of ceildiv is always a constant or a symbolic expression.
  CEIL_DIV("ceildiv");

  private final String text;

  BinaryOpKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean isCommutative() {
    return this == ADD || this == MUL;
  }

  public boolean isDivLike() {
    return this == MOD || this == FLOOR_DIV || this == CEIL_DIV;
  }
}
