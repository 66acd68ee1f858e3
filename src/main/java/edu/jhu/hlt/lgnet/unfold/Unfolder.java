package edu.jhu.hlt.lgnet.unfold;

import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.lgnet.formula.Atom;
import edu.jhu.hlt.lgnet.formula.BinaryFormula;
import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.lexicon.LexicalEntry;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * Maximally unfolds formulas into one {@link CompositionGraph}.
 *
 * Every formula occurrence becomes two nodes joined by an axiom link: the
 * original occurrence (which keeps the term it was given) and its twin (which
 * gets a term derived from its identifier). A complex twin is then connected by
 * an operator link to the unfoldings of its immediate subformulas, see
 * {@link UnfoldRule}. This repeats until only atoms are left.
 *
 * One instance owns one identifier counter, threaded left to right through
 * self (two ids), then subformula a, then subformula b, and across all
 * hypotheses before all conclusions. Each step allocates exactly two ids.
 *
 * See Moortgat and Moot (2012), pp. 6-7 and p. 23-24.
 */
public class Unfolder {
  public static final Logger LOG = Logger.getLogger(Unfolder.class);

  private CompositionGraph graph;
  private int idCounter;
  private int numSteps;

  public Unfolder() {
    this.graph = new CompositionGraph();
    this.idCounter = 0;
    this.numSteps = 0;
  }

  /**
   * Unfold all hypotheses, then all conclusions, into a single graph.
   *
   * @throws IllegalArgumentException on a formula this unfolder does not know
   */
  public static CompositionGraph unfold(List<? extends LexicalEntry> hypotheses, List<? extends LexicalEntry> conclusions) {
    Unfolder u = new Unfolder();
    for (LexicalEntry e : hypotheses)
      u.unfoldHypothesis(e.getFormula(), e.getTerm());
    for (LexicalEntry e : conclusions)
      u.unfoldConclusion(e.getFormula(), e.getTerm());
    if (LOG.isDebugEnabled()) {
      LOG.debug("unfolded " + hypotheses.size() + " hypotheses and " + conclusions.size()
          + " conclusions into " + u.graph.size() + " nodes, " + u.graph.linkCount() + " links");
    }
    return u.getGraph();
  }

  /** @return the identifier of the occurrence which kept defaultTerm */
  public int unfoldHypothesis(Formula f, Term defaultTerm) {
    return unfold(f, defaultTerm, UnfoldMode.HYPOTHESIS);
  }

  /** @return the identifier of the occurrence which kept defaultTerm */
  public int unfoldConclusion(Formula f, Term defaultTerm) {
    return unfold(f, defaultTerm, UnfoldMode.CONCLUSION);
  }

  private int unfold(Formula f, Term defaultTerm, UnfoldMode mode) {
    int firstId = idCounter++;
    int mainId = idCounter++;
    numSteps++;
    graph.addNode(firstId, f, defaultTerm);

    Term mainTerm;
    Link operator = null;
    if (f instanceof Atom) {
      mainTerm = NodeTerms.name(f, mainId);
    } else if (f instanceof BinaryFormula) {
      BinaryFormula bf = (BinaryFormula) f;
      UnfoldRule rule = UnfoldRule.lookup(bf.getConnective(), mode);
      Formula a = bf.getA();
      Formula b = bf.getB();
      int aId = unfold(a, NodeTerms.name(a, idCounter), rule.getAMode());
      int bId = unfold(b, NodeTerms.name(b, idCounter), rule.getBMode());
      mainTerm = NodeTerms.compose(bf.getConnective(), NodeTerms.name(a, aId), NodeTerms.name(b, bId));
      operator = rule.makeLink(mainId, aId, bId);
    } else {
      throw new IllegalArgumentException("don't know how to unfold " + f
          + " (" + f.getClass().getName() + ")");
    }

    graph.addNode(mainId, f, mainTerm);
    if (mode == UnfoldMode.HYPOTHESIS)
      graph.addLink(Link.axiom(firstId, mainId));
    else
      graph.addLink(Link.axiom(mainId, firstId));
    if (operator != null)
      graph.addLink(operator);
    return firstId;
  }

  public CompositionGraph getGraph() {
    return graph;
  }

  /** The next identifier that would be allocated. */
  public int getIdCounter() {
    return idCounter;
  }

  /** Number of formula occurrences unfolded, each of which took two ids. */
  public int getNumSteps() {
    return numSteps;
  }
}
