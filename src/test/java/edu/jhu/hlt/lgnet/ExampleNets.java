package edu.jhu.hlt.lgnet;

import java.util.Arrays;

import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Tentacle;
import edu.jhu.hlt.lgnet.lexicon.LexicalEntry;
import edu.jhu.hlt.lgnet.term.ContextTerm;
import edu.jhu.hlt.lgnet.term.Term;
import edu.jhu.hlt.lgnet.term.ValueTerm;
import edu.jhu.hlt.lgnet.unfold.Unfolder;

/**
 * Small sequents, unfolded and with their atoms linked by hand.
 */
public class ExampleNets {

  public static final Formula NP = Formula.positive("np");
  public static final Formula S = Formula.negative("s");

  public static LexicalEntry entry(Formula f, Term t) {
    return new LexicalEntry.Simple(f, t);
  }

  public static ValueTerm var(String name) {
    return new ValueTerm.Variable(name);
  }

  public static ContextTerm covar(String name) {
    return new ContextTerm.Covariable(name);
  }

  /**
   * s/np |- s/np
   * hypothesis 0-5: [1*, 2] fusion [4], conclusion 6-11: [10] fission [7*, 8]
   */
  public static CompositionGraph sOverNp() {
    return slashIdentity(Formula.rdiv(S, NP));
  }

  /**
   * np\s |- np\s
   * hypothesis 0-5: [2, 1*] fusion [4], conclusion 6-11: [10] fission [8, 7*]
   */
  public static CompositionGraph npUnderS() {
    return slashIdentity(Formula.ldiv(NP, S));
  }

  /**
   * np⊘s |- np⊘s
   * hypothesis 0-5: [1*, 2] fission [4], conclusion 6-11: [10] fusion [7*, 8]
   */
  public static CompositionGraph npMinusS() {
    return slashIdentity(Formula.rdiff(NP, S));
  }

  /**
   * s▷np |- s▷np
   * hypothesis 0-5: [2, 1*] fission [4], conclusion 6-11: [10] fusion [8, 7*]
   */
  public static CompositionGraph sFromNp() {
    return slashIdentity(Formula.ldiff(S, NP));
  }

  /**
   * f |- f for a division or difference of two atoms. The argument leaves are
   * 3 and 9, the result leaves 5 and 11.
   */
  private static CompositionGraph slashIdentity(Formula f) {
    CompositionGraph g = Unfolder.unfold(
        Arrays.asList(entry(f, term(f, "f"))),
        Arrays.asList(entry(f, term(f, "g"))));
    g.addAxiomLink(9, 3);   // argument
    g.addAxiomLink(5, 11);  // result
    return g;
  }

  private static Term term(Formula f, String name) {
    return f.getPolarity().isPositive() ? var(name) : covar(name);
  }

  /**
   * np⊗np |- np⊗np
   * hypothesis 0-5: [1*] fission [2, 4], conclusion 6-11: [8, 10] fusion [7*]
   */
  public static CompositionGraph npTimesNp() {
    Formula f = Formula.tensor(NP, NP);
    CompositionGraph g = Unfolder.unfold(
        Arrays.asList(entry(f, var("p"))),
        Arrays.asList(entry(f, var("q"))));
    g.addAxiomLink(3, 9);
    g.addAxiomLink(5, 11);
    return g;
  }

  /**
   * np, np\s |- s
   * np 0-1, np\s 2-7 with [4, 3*] fusion [6], s 8-9
   */
  public static CompositionGraph johnSleeps() {
    CompositionGraph g = Unfolder.unfold(
        Arrays.asList(
            entry(NP, var("john")),
            entry(Formula.ldiv(NP, S), covar("sleeps"))),
        Arrays.asList(entry(S, covar("alpha"))));
    g.addAxiomLink(1, 5);   // np
    g.addAxiomLink(7, 9);   // s
    return g;
  }

  /**
   * s⊕s |- s⊕s
   * hypothesis 0-5: [1*] fusion [2, 4], conclusion 6-11: [8, 10] fission [7*]
   */
  public static CompositionGraph sPlusS() {
    Formula f = Formula.cotensor(S, S);
    CompositionGraph g = Unfolder.unfold(
        Arrays.asList(entry(f, covar("k"))),
        Arrays.asList(entry(f, covar("l"))));
    g.addAxiomLink(3, 9);
    g.addAxiomLink(5, 11);
    return g;
  }

  /**
   * Two neutral tensor links sharing node 10, a redex for g1 only:
   * [11] fusion [13, 10] and [10, 12] fusion [14]
   */
  public static CompositionGraph associativityRedex() {
    CompositionGraph g = new CompositionGraph();
    for (int i = 10; i <= 14; i++)
      g.addNode(i, NP, var("v" + i));
    g.addLink(Link.fusion(
        Arrays.asList(Tentacle.active(11)),
        Arrays.asList(Tentacle.active(13), Tentacle.active(10))));
    g.addLink(Link.fusion(
        Arrays.asList(Tentacle.active(10), Tentacle.active(12)),
        Arrays.asList(Tentacle.active(14))));
    return g;
  }
}
