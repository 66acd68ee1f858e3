package edu.jhu.hlt.lgnet.formula;

/**
 * The six binary connectives of Lambek-Grishin, in three dual pairs.
 *
 * Each connective fixes the polarity of the formula it builds and of its two
 * operands. Operands are named the way the unfolding rules name them: "a" is
 * the argument and "b" the result. For right-division b/a and right-difference
 * b⊘a the argument is written on the right, for everything else on the left.
 */
public enum Connective {
  TENSOR("⊗", Polarity.P, Polarity.P, Polarity.P, false),
  COTENSOR("⊕", Polarity.N, Polarity.N, Polarity.N, false),
  RIGHT_DIV("/", Polarity.N, Polarity.P, Polarity.N, true),
  LEFT_DIV("\\", Polarity.N, Polarity.P, Polarity.N, false),
  RIGHT_DIFF("⊘", Polarity.P, Polarity.N, Polarity.P, true),
  LEFT_DIFF("▷", Polarity.P, Polarity.N, Polarity.P, false);

  private final String symbol;
  private final Polarity result;
  private final Polarity a, b;
  private final boolean argumentOnRight;

  private Connective(String symbol, Polarity result, Polarity a, Polarity b, boolean argumentOnRight) {
    this.symbol = symbol;
    this.result = result;
    this.a = a;
    this.b = b;
    this.argumentOnRight = argumentOnRight;
  }

  public String getSymbol() {
    return symbol;
  }

  public Polarity getResultPolarity() {
    return result;
  }

  public Polarity getArgumentPolarity() {
    return a;
  }

  public Polarity getResultOperandPolarity() {
    return b;
  }

  /** True for b/a and b⊘a, where the written order is (b, a). */
  public boolean isArgumentOnRight() {
    return argumentOnRight;
  }

  /** The connective of the opposite pair member, e.g. TENSOR &lt;-&gt; COTENSOR. */
  public Connective dual() {
    switch (this) {
    case TENSOR: return COTENSOR;
    case COTENSOR: return TENSOR;
    case RIGHT_DIV: return RIGHT_DIFF;
    case RIGHT_DIFF: return RIGHT_DIV;
    case LEFT_DIV: return LEFT_DIFF;
    case LEFT_DIFF: return LEFT_DIV;
    default:
      throw new RuntimeException("unknown connective: " + this);
    }
  }
}
