package edu.jhu.hlt.lgnet.graph;

import java.util.List;
import java.util.function.IntUnaryOperator;

import com.google.common.collect.ImmutableList;

/**
 * A link in a composition graph (or in a rewrite pattern): a list of premise
 * tentacles, a {@link LinkShape} and a list of succedent tentacles.
 *
 * Operator links have three tentacles, two of them grouped on one side and the
 * third isolated on the other, with at most one marked main. Axiom links have
 * one active premise and one active succedent and say that the two nodes are
 * occurrences of the same formula.
 *
 * Links are immutable values. The graph does not store them on their own,
 * every node holds the links it is an endpoint of, so two links with equal
 * tentacles are the same link.
 */
public final class Link {
  private final ImmutableList<Tentacle> premises;
  private final LinkShape shape;
  private final ImmutableList<Tentacle> succedents;
  private final int hash;

  public Link(List<Tentacle> premises, LinkShape shape, List<Tentacle> succedents) {
    if (shape == null)
      throw new IllegalArgumentException("no shape");
    this.premises = ImmutableList.copyOf(premises);
    this.shape = shape;
    this.succedents = ImmutableList.copyOf(succedents);
    int np = this.premises.size(), ns = this.succedents.size();
    if (shape == LinkShape.AXIOM) {
      if (np != 1 || ns != 1)
        throw new IllegalArgumentException("axiom links connect exactly two nodes: " + this);
      if (this.premises.get(0).isMain() || this.succedents.get(0).isMain())
        throw new IllegalArgumentException("axiom links have no main tentacle: " + this);
    } else {
      if (!((np == 1 && ns == 2) || (np == 2 && ns == 1)))
        throw new IllegalArgumentException("operator links have a group of two and one isolated tentacle: " + this);
      int mains = 0;
      for (Tentacle t : getTentacles())
        if (t.isMain())
          mains++;
      if (mains > 1)
        throw new IllegalArgumentException("more than one main tentacle: " + this);
    }
    this.hash = 31 * (31 * this.premises.hashCode() + shape.hashCode()) + this.succedents.hashCode();
  }

  public static Link axiom(int premise, int succedent) {
    return new Link(ImmutableList.of(Tentacle.active(premise)), LinkShape.AXIOM,
        ImmutableList.of(Tentacle.active(succedent)));
  }

  public static Link fusion(List<Tentacle> premises, List<Tentacle> succedents) {
    return new Link(premises, LinkShape.FUSION, succedents);
  }

  public static Link fission(List<Tentacle> premises, List<Tentacle> succedents) {
    return new Link(premises, LinkShape.FISSION, succedents);
  }

  public List<Tentacle> getPremises() {
    return premises;
  }

  public List<Tentacle> getSuccedents() {
    return succedents;
  }

  public LinkShape getShape() {
    return shape;
  }

  public boolean isAxiom() {
    return shape == LinkShape.AXIOM;
  }

  /** Premises followed by succedents. */
  public List<Tentacle> getTentacles() {
    return ImmutableList.<Tentacle>builder().addAll(premises).addAll(succedents).build();
  }

  /** May return null (axiom links and neutral tensor links). */
  public Tentacle getMain() {
    for (Tentacle t : premises)
      if (t.isMain())
        return t;
    for (Tentacle t : succedents)
      if (t.isMain())
        return t;
    return null;
  }

  public boolean hasPremise(int id) {
    for (Tentacle t : premises)
      if (t.getId() == id)
        return true;
    return false;
  }

  public boolean hasSuccedent(int id) {
    for (Tentacle t : succedents)
      if (t.getId() == id)
        return true;
    return false;
  }

  /**
   * True if the two grouped tentacles are premises (two sources grouped into
   * one result), false if they are succedents. Undefined for axiom links.
   */
  public boolean isTensorGroup() {
    checkOperator();
    return premises.size() == 2;
  }

  public List<Tentacle> getGroupedTentacles() {
    return isTensorGroup() ? premises : succedents;
  }

  public Tentacle getIsolatedTentacle() {
    return isTensorGroup() ? succedents.get(0) : premises.get(0);
  }

  private void checkOperator() {
    if (isAxiom())
      throw new IllegalStateException("axiom links have no grouping: " + this);
  }

  /** Applies f to every tentacle identifier, keeping kinds and shape. */
  public Link mapIds(IntUnaryOperator f) {
    ImmutableList.Builder<Tentacle> p = ImmutableList.builder();
    for (Tentacle t : premises)
      p.add(t.withId(f.applyAsInt(t.getId())));
    ImmutableList.Builder<Tentacle> s = ImmutableList.builder();
    for (Tentacle t : succedents)
      s.add(t.withId(f.applyAsInt(t.getId())));
    return new Link(p.build(), shape, s.build());
  }

  public Link rename(int from, int to) {
    return mapIds(i -> i == from ? to : i);
  }

  /** This link with every main marker removed. */
  public Link neutral() {
    if (getMain() == null)
      return this;
    ImmutableList.Builder<Tentacle> p = ImmutableList.builder();
    for (Tentacle t : premises)
      p.add(t.neutral());
    ImmutableList.Builder<Tentacle> s = ImmutableList.builder();
    for (Tentacle t : succedents)
      s.add(t.neutral());
    return new Link(p.build(), shape, s.build());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Link) {
      Link l = (Link) other;
      return hash == l.hash
          && shape == l.shape
          && premises.equals(l.premises)
          && succedents.equals(l.succedents);
    }
    return false;
  }

  @Override
  public String toString() {
    return premises + " " + shape.getSymbol() + " " + succedents;
  }
}
