package edu.jhu.hlt.lgnet.graph;

import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * A node of a {@link CompositionGraph}: a formula occurrence annotated with a
 * node term, plus the (at most one) link it is a premise of and the (at most
 * one) link it is a succedent of.
 *
 * A node with neither link is an unconnected endpoint, a node with one is on
 * the boundary of the net (a hypothesis or conclusion), and internal nodes
 * have both. After axiom links are eliminated formula and term are only
 * provenance.
 */
public class Node {
  private final int id;
  private final Formula formula;
  private final Term term;
  private Link premiseLink;     // link which lists this node as a premise, may be null
  private Link succedentLink;   // link which lists this node as a succedent, may be null

  public Node(int id, Formula formula, Term term) {
    if (id < 0)
      throw new IllegalArgumentException("id=" + id);
    if (formula == null)
      throw new IllegalArgumentException("node " + id + " has no formula");
    if (term == null || !term.isNodeTerm())
      throw new IllegalArgumentException("node " + id + " needs a binder-free value or context term: " + term);
    this.id = id;
    this.formula = formula;
    this.term = term;
  }

  public Node copy() {
    Node n = new Node(id, formula, term);
    n.premiseLink = premiseLink;
    n.succedentLink = succedentLink;
    return n;
  }

  public int getId() {
    return id;
  }

  public Formula getFormula() {
    return formula;
  }

  public Term getTerm() {
    return term;
  }

  /** May return null */
  public Link getPremiseLink() {
    return premiseLink;
  }

  /** May return null */
  public Link getSuccedentLink() {
    return succedentLink;
  }

  void setPremiseLink(Link premiseLink) {
    this.premiseLink = premiseLink;
  }

  void setSuccedentLink(Link succedentLink) {
    this.succedentLink = succedentLink;
  }

  public boolean isUnlinked() {
    return premiseLink == null && succedentLink == null;
  }

  @Override
  public int hashCode() {
    int h = id;
    h = 31 * h + formula.hashCode();
    h = 31 * h + term.hashCode();
    h = 31 * h + (premiseLink == null ? 0 : premiseLink.hashCode());
    return 31 * h + (succedentLink == null ? 0 : succedentLink.hashCode());
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Node) {
      Node n = (Node) other;
      return id == n.id
          && formula.equals(n.formula)
          && term.equals(n.term)
          && (premiseLink == null ? n.premiseLink == null : premiseLink.equals(n.premiseLink))
          && (succedentLink == null ? n.succedentLink == null : succedentLink.equals(n.succedentLink));
    }
    return false;
  }

  @Override
  public String toString() {
    return "(Node " + id + " " + formula + " " + term
        + " premise=" + premiseLink + " succedent=" + succedentLink + ")";
  }
}
