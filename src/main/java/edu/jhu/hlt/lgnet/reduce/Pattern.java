package edu.jhu.hlt.lgnet.reduce;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * A rewrite rule over composition graphs. Tentacle identifiers in a pattern are
 * abstract numbers, bound to graph identifiers by {@link Unification}.
 */
public class Pattern {

  public static enum Kind {
    /** Removes a redex, the right-hand side is empty. */
    CONTRACTION,
    /** Restructures two links into two others (a structural postulate). */
    INTERACTION,
  }

  private final String name;
  private final Kind kind;
  private final ImmutableList<Link> lhs;
  private final ImmutableList<Link> rhs;

  public Pattern(String name, Kind kind, List<Link> lhs, List<Link> rhs) {
    if (lhs.isEmpty())
      throw new IllegalArgumentException(name + ": empty left-hand side");
    if (kind == Kind.CONTRACTION && !rhs.isEmpty())
      throw new IllegalArgumentException(name + ": contractions have an empty right-hand side");
    Set<Integer> lhsIds = new HashSet<>();
    for (Link l : lhs)
      for (Tentacle t : l.getTentacles())
        lhsIds.add(t.getId());
    for (Link l : rhs)
      for (Tentacle t : l.getTentacles())
        if (!lhsIds.contains(t.getId()))
          throw new IllegalArgumentException(name + ": " + t.getId() + " does not appear on the left-hand side");
    this.name = name;
    this.kind = kind;
    this.lhs = ImmutableList.copyOf(lhs);
    this.rhs = ImmutableList.copyOf(rhs);
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public List<Link> getLhs() {
    return lhs;
  }

  public List<Link> getRhs() {
    return rhs;
  }

  @Override
  public String toString() {
    return name + ": " + lhs + " => " + rhs;
  }
}
