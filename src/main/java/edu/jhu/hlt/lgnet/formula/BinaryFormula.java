package edu.jhu.hlt.lgnet.formula;

/**
 * A formula built by one of the six {@link Connective}s. Operands are stored
 * in written order; use {@link #getA()} and {@link #getB()} to get them by the
 * role they play in unfolding.
 *
 * Constructing a formula whose operands have the wrong polarity throws an
 * {@link IllegalArgumentException}.
 */
public class BinaryFormula extends Formula {
  private final Connective connective;
  private final Formula left, right;
  private final int hash;

  public BinaryFormula(Connective connective, Formula left, Formula right) {
    if (connective == null || left == null || right == null)
      throw new IllegalArgumentException("connective=" + connective + " left=" + left + " right=" + right);
    this.connective = connective;
    this.left = left;
    this.right = right;
    Formula a = getA(), b = getB();
    if (a.getPolarity() != connective.getArgumentPolarity()
        || b.getPolarity() != connective.getResultOperandPolarity()) {
      throw new IllegalArgumentException("malformed formula " + this
          + ": " + connective + " wants a:" + connective.getArgumentPolarity()
          + " b:" + connective.getResultOperandPolarity()
          + " but got a:" + a.getPolarity() + " b:" + b.getPolarity());
    }
    this.hash = 31 * (31 * connective.hashCode() + left.hashCode()) + right.hashCode();
  }

  public Connective getConnective() {
    return connective;
  }

  public Formula getLeft() {
    return left;
  }

  public Formula getRight() {
    return right;
  }

  /** The argument operand, unfolded first. */
  public Formula getA() {
    return connective.isArgumentOnRight() ? right : left;
  }

  /** The result operand, unfolded second. */
  public Formula getB() {
    return connective.isArgumentOnRight() ? left : right;
  }

  @Override
  public Polarity getPolarity() {
    return connective.getResultPolarity();
  }

  @Override
  public boolean isAtomic() {
    return false;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof BinaryFormula) {
      BinaryFormula f = (BinaryFormula) other;
      return hash == f.hash
          && connective == f.connective
          && left.equals(f.left)
          && right.equals(f.right);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + left + connective.getSymbol() + right + ")";
  }
}
