package edu.jhu.hlt.lgnet.unfold;

import edu.jhu.hlt.lgnet.formula.Connective;
import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.term.ContextTerm;
import edu.jhu.hlt.lgnet.term.Term;
import edu.jhu.hlt.lgnet.term.ValueTerm;

/**
 * Node terms derived from node identifiers. Because identifiers are unique
 * within a graph, so are the (co)variable names made from them.
 */
public class NodeTerms {

  /** A variable (positive formula) or covariable (negative formula) named by id. */
  public static Term name(Formula f, int id) {
    String name = String.valueOf(id);
    if (f.getPolarity().isPositive())
      return new ValueTerm.Variable(name);
    return new ContextTerm.Covariable(name);
  }

  /**
   * Combine the terms of the two subformulas with the term constructor that
   * matches the connective. a and b are the argument and result operand, as
   * in {@link edu.jhu.hlt.lgnet.formula.BinaryFormula#getA()}.
   */
  public static Term compose(Connective c, Term a, Term b) {
    switch (c) {
    case TENSOR:
      return new ValueTerm.Pair((ValueTerm) a, (ValueTerm) b);
    case COTENSOR:
      return new ContextTerm.CoPair((ContextTerm) a, (ContextTerm) b);
    case RIGHT_DIV:
      return new ContextTerm.RightDivision((ContextTerm) b, (ValueTerm) a);
    case LEFT_DIV:
      return new ContextTerm.LeftDivision((ValueTerm) a, (ContextTerm) b);
    case RIGHT_DIFF:
      return new ValueTerm.RightDifference((ValueTerm) b, (ContextTerm) a);
    case LEFT_DIFF:
      return new ValueTerm.LeftDifference((ContextTerm) a, (ValueTerm) b);
    default:
      throw new RuntimeException("unknown connective: " + c);
    }
  }
}
