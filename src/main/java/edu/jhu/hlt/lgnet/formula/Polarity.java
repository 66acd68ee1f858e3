package edu.jhu.hlt.lgnet.formula;

/**
 * Input ("P", positive) or output ("N", negative) polarity of a formula.
 */
public enum Polarity {
  P, N;

  public boolean isPositive() {
    return this == P;
  }
}
