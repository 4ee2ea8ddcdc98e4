package affir.affine.expr;

/** Raised when an affine expression cannot be constructed. Not recoverable by retrying. */
public class AffineExprException extends RuntimeException {
  private final BinaryOpKind opKind;

  public AffineExprException(BinaryOpKind opKind, String message) {
    super(message);
    this.opKind = opKind;
  }

  /** The operator whose construction was rejected. */
  public BinaryOpKind opKind() {
    return opKind;
  }
}
