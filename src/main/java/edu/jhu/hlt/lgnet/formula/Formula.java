package edu.jhu.hlt.lgnet.formula;

/**
 * A polarized Lambek-Grishin formula: either an {@link Atom} or a
 * {@link BinaryFormula}. Formulas are immutable values.
 */
public abstract class Formula {

  public abstract Polarity getPolarity();

  public abstract boolean isAtomic();

  public static Atom positive(String name) {
    return new Atom(name, Polarity.P);
  }

  public static Atom negative(String name) {
    return new Atom(name, Polarity.N);
  }

  /** a⊗b */
  public static BinaryFormula tensor(Formula a, Formula b) {
    return new BinaryFormula(Connective.TENSOR, a, b);
  }

  /** a⊕b */
  public static BinaryFormula cotensor(Formula a, Formula b) {
    return new BinaryFormula(Connective.COTENSOR, a, b);
  }

  /** b/a, arguments in written order */
  public static BinaryFormula rdiv(Formula b, Formula a) {
    return new BinaryFormula(Connective.RIGHT_DIV, b, a);
  }

  /** a\b */
  public static BinaryFormula ldiv(Formula a, Formula b) {
    return new BinaryFormula(Connective.LEFT_DIV, a, b);
  }

  /** b⊘a, arguments in written order */
  public static BinaryFormula rdiff(Formula b, Formula a) {
    return new BinaryFormula(Connective.RIGHT_DIFF, b, a);
  }

  /** a▷b */
  public static BinaryFormula ldiff(Formula a, Formula b) {
    return new BinaryFormula(Connective.LEFT_DIFF, a, b);
  }
}
