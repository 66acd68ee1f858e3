package edu.jhu.hlt.lgnet.term;

import java.util.List;

/**
 * A term of the three-sorted Lambek-Grishin term calculus: see
 * {@link ValueTerm}, {@link ContextTerm} and {@link CommandTerm}.
 *
 * Terms are immutable and compared structurally. Names are never
 * alpha-renamed: every name in a composition graph is derived from a unique
 * node identifier, so substitution does not need to worry about capture.
 */
public abstract class Term {

  public static enum Sort {
    VALUE, CONTEXT, COMMAND
  }

  public abstract Sort getSort();

  /** Immediate subterms, left to right. */
  public abstract List<Term> getChildren();

  /**
   * True if this term has no mu/comu binders and is a value or a context.
   * Only node terms may annotate nodes of a composition graph.
   */
  public boolean isNodeTerm() {
    if (getSort() == Sort.COMMAND)
      return false;
    return !containsBinder();
  }

  public boolean containsBinder() {
    for (Term c : getChildren())
      if (c.containsBinder())
        return true;
    return false;
  }

  /**
   * Replace every occurrence of target (a {@link ValueTerm.Variable} or
   * {@link ContextTerm.Covariable}) in this term with replacement. Occurrences
   * are only replaced when replacement has the sort of target.
   */
  public abstract Term substitute(Term replacement, Term target);

  /** True if this term equals other or occurs somewhere inside of it. */
  public boolean isSubtermOf(Term other) {
    if (equals(other))
      return true;
    for (Term c : other.getChildren())
      if (isSubtermOf(c))
        return true;
    return false;
  }

  static void checkTarget(Term target) {
    if (!(target instanceof ValueTerm.Variable) && !(target instanceof ContextTerm.Covariable))
      throw new IllegalArgumentException("can only substitute for a (co)variable: " + target);
  }
}
