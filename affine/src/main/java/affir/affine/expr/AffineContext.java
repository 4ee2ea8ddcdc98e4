package affir.affine.expr;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Owner and interning store of affine expressions.
 *
 * <p>Every expression is created through a context and lives as long as the context does. The
 * context maps a structural key to the single instance of that shape, so identity equals
 * structural equality among the expressions of one context. Interning is serialized; expressions
 * themselves are immutable and may be shared across threads freely.
 */
public final class AffineContext {
  private static final Logger LOG = LoggerFactory.getLogger(AffineContext.class);

  public static final String INITIAL_CAPACITY_PROPERTY = "affir.context.initial_capacity";
  private static final int DEFAULT_INITIAL_CAPACITY = 64;

  /**
   * Structural key of an expression. Binary operands are keyed by their arena index, which is
   * sufficient because operands are already unique.
   */
  private record InternKey(ExprKind kind, BinaryOpKind opKind, long payload, int lhs, int rhs) {
    static InternKey leaf(ExprKind kind, long payload) {
      return new InternKey(kind, null, payload, -1, -1);
    }

    static InternKey binary(BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
      return new InternKey(ExprKind.BINARY, opKind, 0, lhs.id(), rhs.id());
    }
  }

  private final Map<InternKey, AffineExpr> uniques;
  private final List<AffineExpr> arena;

  private AffineContext(int initialCapacity) {
    this.uniques = new HashMap<>(initialCapacity);
    this.arena = new ArrayList<>(initialCapacity);
  }

  public static AffineContext mk() {
    return mk(Integer.getInteger(INITIAL_CAPACITY_PROPERTY, DEFAULT_INITIAL_CAPACITY));
  }

  public static AffineContext mk(int initialCapacity) {
    checkArgument(initialCapacity >= 0, "negative initial capacity: %s", initialCapacity);
    LOG.debug("Creating affine context with initial capacity {}", initialCapacity);
    return new AffineContext(initialCapacity);
  }

  public AffineExpr constant(long value) {
    return intern(
        InternKey.leaf(ExprKind.CONSTANT, value), id -> new AffineConstantExpr(this, id, value));
  }

  public AffineExpr zero() {
    return constant(0);
  }

  public AffineExpr one() {
    return constant(1);
  }

  public AffineExpr dim(int position) {
    checkArgument(position >= 0, "negative dimension position: %s", position);
    return intern(
        InternKey.leaf(ExprKind.DIM_ID, position), id -> new AffineDimExpr(this, id, position));
  }

  public AffineExpr symbol(int position) {
    checkArgument(position >= 0, "negative symbol position: %s", position);
    return intern(
        InternKey.leaf(ExprKind.SYMBOL_ID, position),
        id -> new AffineSymbolExpr(this, id, position));
  }

  public AffineExpr binary(BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
    checkNotNull(opKind);
    return AffineSimplifier.getInstance().simplify(this, opKind, lhs, rhs);
  }

  public AffineExpr add(AffineExpr lhs, AffineExpr rhs) {
    return binary(BinaryOpKind.ADD, lhs, rhs);
  }

  public AffineExpr add(AffineExpr lhs, long rhs) {
    return add(lhs, constant(rhs));
  }

  public AffineExpr sub(AffineExpr lhs, AffineExpr rhs) {
    return add(lhs, negate(rhs));
  }

  public AffineExpr sub(AffineExpr lhs, long rhs) {
    return add(lhs, constant(-rhs));
  }

  public AffineExpr negate(AffineExpr expr) {
    return mul(expr, constant(-1));
  }

  public AffineExpr mul(AffineExpr lhs, AffineExpr rhs) {
    return binary(BinaryOpKind.MUL, lhs, rhs);
  }

  public AffineExpr mul(AffineExpr lhs, long rhs) {
    return mul(lhs, constant(rhs));
  }

  public AffineExpr floorDiv(AffineExpr lhs, AffineExpr rhs) {
    return binary(BinaryOpKind.FLOOR_DIV, lhs, rhs);
  }

  public AffineExpr floorDiv(AffineExpr lhs, long rhs) {
    return floorDiv(lhs, constant(rhs));
  }

  public AffineExpr ceilDiv(AffineExpr lhs, AffineExpr rhs) {
    return binary(BinaryOpKind.CEIL_DIV, lhs, rhs);
  }

  public AffineExpr ceilDiv(AffineExpr lhs, long rhs) {
    return ceilDiv(lhs, constant(rhs));
  }

  public AffineExpr mod(AffineExpr lhs, AffineExpr rhs) {
    return binary(BinaryOpKind.MOD, lhs, rhs);
  }

  public AffineExpr mod(AffineExpr lhs, long rhs) {
    return mod(lhs, constant(rhs));
  }

  public AffineExprRef constantRef(long value) {
    return AffineExprRef.of(constant(value));
  }

  public AffineExprRef dimRef(int position) {
    return AffineExprRef.of(dim(position));
  }

  public AffineExprRef symbolRef(int position) {
    return AffineExprRef.of(symbol(position));
  }

  public synchronized AffineExpr exprAt(int id) {
    checkElementIndex(id, arena.size());
    return arena.get(id);
  }

  public synchronized int size() {
    return arena.size();
  }

  /** All expressions owned by this context, in creation order. */
  public synchronized List<AffineExpr> snapshot() {
    return ImmutableList.copyOf(arena);
  }

  public boolean owns(AffineExpr expr) {
    return expr.context() == this;
  }

  /** Called only by the simplifier, with operands already in canonical form. */
  AffineExpr internBinary(BinaryOpKind opKind, AffineExpr lhs, AffineExpr rhs) {
    return intern(
        InternKey.binary(opKind, lhs, rhs),
        id -> new AffineBinaryExpr(this, id, opKind, lhs, rhs));
  }

  private synchronized AffineExpr intern(InternKey key, IntFunction<AffineExpr> factory) {
    final AffineExpr existing = uniques.get(key);
    if (existing != null) return existing;

    final int id = arena.size();
    final AffineExpr expr = factory.apply(id);
    arena.add(expr);
    uniques.put(key, expr);

    if (LOG.isTraceEnabled()) LOG.trace("Interned #{}: {}", id, expr);
    final int size = arena.size();
    if (size >= 1024 && (size & (size - 1)) == 0) {
      LOG.debug("Affine context grew to {} expressions", size);
    }
    return expr;
  }
}
