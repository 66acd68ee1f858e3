package edu.jhu.hlt.lgnet.term;

import static org.junit.Assert.*;

import org.junit.Test;

import edu.jhu.hlt.lgnet.term.ContextTerm.CoPair;
import edu.jhu.hlt.lgnet.term.ContextTerm.Covariable;
import edu.jhu.hlt.lgnet.term.ContextTerm.LeftDivision;
import edu.jhu.hlt.lgnet.term.ValueTerm.Mu;
import edu.jhu.hlt.lgnet.term.ValueTerm.Pair;
import edu.jhu.hlt.lgnet.term.ValueTerm.Variable;

public class TermTests {

  private Variable x = new Variable("x");
  private Variable y = new Variable("y");
  private Covariable alpha = new Covariable("alpha");

  @Test
  public void substituteVariable() {
    Pair p = new Pair(x, x);
    Pair expected = new Pair(y, y);
    assertEquals(expected, p.substitute(y, x));
    // untouched when target does not occur
    assertEquals(p, p.substitute(y, new Variable("z")));
  }

  @Test
  public void substituteRespectsSort() {
    // a context can't replace a variable, even if the names match
    Variable a = new Variable("alpha");
    LeftDivision ld = new LeftDivision(a, alpha);
    assertEquals(ld, ld.substitute(new Covariable("beta"), a));
    assertEquals(new LeftDivision(a, new Covariable("beta")), ld.substitute(new Covariable("beta"), alpha));
  }

  @Test(expected = IllegalArgumentException.class)
  public void substituteForComplexTerm() {
    x.substitute(y, new Pair(x, y));
  }

  @Test
  public void subterms() {
    Pair p = new Pair(x, new Pair(y, x));
    assertTrue(x.isSubtermOf(p));
    assertTrue(new Pair(y, x).isSubtermOf(p));
    assertTrue(p.isSubtermOf(p));
    assertFalse(new Variable("z").isSubtermOf(p));
    assertFalse(p.isSubtermOf(x));
  }

  @Test
  public void nodeTerms() {
    assertTrue(x.isNodeTerm());
    assertTrue(new CoPair(alpha, alpha).isNodeTerm());
    CommandTerm c = new CommandTerm.Right(x, "alpha");
    assertFalse(c.isNodeTerm());
    Mu mu = new Mu("x", c);
    assertTrue(mu.containsBinder());
    assertFalse(mu.isNodeTerm());
    assertFalse(new Pair(mu, y).isNodeTerm());
  }

  @Test(expected = IllegalArgumentException.class)
  public void commandWithBinder() {
    new CommandTerm.Right(new Mu("x", new CommandTerm.Right(x, "alpha")), "beta");
  }

  @Test
  public void commandSubstitutionKeepsBinderFree() {
    CommandTerm c = new CommandTerm.Right(x, "alpha");
    Mu mu = new Mu("z", new CommandTerm.Right(y, "beta"));
    // would put a binder inside the command, so nothing changes
    assertEquals(c, c.substitute(mu, x));
    assertEquals(new CommandTerm.Right(y, "alpha"), c.substitute(y, x));
  }

  @Test
  public void sorts() {
    assertEquals(Term.Sort.VALUE, x.getSort());
    assertEquals(Term.Sort.CONTEXT, alpha.getSort());
    assertEquals(Term.Sort.COMMAND, new CommandTerm.Left("x", alpha).getSort());
  }
}
