package edu.jhu.hlt.lgnet.lexicon;

import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * What the lexicon hands to the unfolder: a formula and the term the
 * formula's occurrence starts out with. Loading and looking up entries is
 * someone else's job.
 */
public interface LexicalEntry {

  Formula getFormula();

  Term getTerm();

  /**
   * Plain value implementation, e.g. for hand-built sentences in tests.
   */
  public static class Simple implements LexicalEntry {
    private final Formula formula;
    private final Term term;

    public Simple(Formula formula, Term term) {
      if (formula == null || term == null)
        throw new IllegalArgumentException("formula=" + formula + " term=" + term);
      this.formula = formula;
      this.term = term;
    }

    @Override
    public Formula getFormula() {
      return formula;
    }

    @Override
    public Term getTerm() {
      return term;
    }

    @Override
    public String toString() {
      return term + " : " + formula;
    }
  }
}
