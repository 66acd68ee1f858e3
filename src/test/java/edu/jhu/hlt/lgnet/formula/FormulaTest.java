package edu.jhu.hlt.lgnet.formula;

import static org.junit.Assert.*;

import org.junit.Test;

public class FormulaTest {

  private Atom np = Formula.positive("np");
  private Atom s = Formula.negative("s");

  @Test
  public void polarities() {
    assertEquals(Polarity.P, Formula.tensor(np, np).getPolarity());
    assertEquals(Polarity.N, Formula.cotensor(s, s).getPolarity());
    assertEquals(Polarity.N, Formula.rdiv(s, np).getPolarity());
    assertEquals(Polarity.N, Formula.ldiv(np, s).getPolarity());
    assertEquals(Polarity.P, Formula.rdiff(np, s).getPolarity());
    assertEquals(Polarity.P, Formula.ldiff(s, np).getPolarity());
  }

  @Test
  public void argumentAndResult() {
    BinaryFormula f = Formula.rdiv(s, np);
    assertEquals(s, f.getLeft());
    assertEquals(np, f.getA());
    assertEquals(s, f.getB());

    BinaryFormula g = Formula.ldiv(np, s);
    assertEquals(np, g.getA());
    assertEquals(s, g.getB());
  }

  @Test(expected = IllegalArgumentException.class)
  public void tensorOfNegative() {
    Formula.tensor(s, np);
  }

  @Test(expected = IllegalArgumentException.class)
  public void divisionWithNegativeArgument() {
    Formula.rdiv(s, s);
  }

  @Test
  public void valueEquality() {
    assertEquals(Formula.ldiv(np, s), Formula.ldiv(Formula.positive("np"), Formula.negative("s")));
    assertEquals(Formula.ldiv(np, s).hashCode(), Formula.ldiv(np, s).hashCode());
    assertNotEquals(Formula.positive("n"), Formula.negative("n"));
    assertNotEquals(Formula.rdiff(np, s), Formula.ldiff(s, np));
  }

  @Test
  public void dualsAreInvolutive() {
    for (Connective c : Connective.values()) {
      assertEquals(c, c.dual().dual());
      assertNotEquals(c.getResultPolarity(), c.dual().getResultPolarity());
    }
  }

  @Test
  public void writtenOrder() {
    assertEquals("(s/np)", Formula.rdiv(s, np).toString());
    assertEquals("(np⊗np)", Formula.tensor(np, np).toString());
  }
}
