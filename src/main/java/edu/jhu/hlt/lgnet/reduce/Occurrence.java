package edu.jhu.hlt.lgnet.reduce;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.lgnet.graph.Link;

/**
 * One match of a {@link Pattern}'s left-hand side in a graph: the final
 * unification and the graph links matched by each pattern link, in pattern
 * order.
 */
public class Occurrence {
  private final Pattern pattern;
  private final Unification unification;
  private final ImmutableList<Link> matched;

  public Occurrence(Pattern pattern, Unification unification, List<Link> matched) {
    if (matched.size() != pattern.getLhs().size())
      throw new IllegalArgumentException("matched " + matched.size() + " links for " + pattern);
    this.pattern = pattern;
    this.unification = unification;
    this.matched = ImmutableList.copyOf(matched);
  }

  public Pattern getPattern() {
    return pattern;
  }

  public Unification getUnification() {
    return unification;
  }

  public List<Link> getMatchedLinks() {
    return matched;
  }

  /** The graph identifier a pattern identifier was bound to. */
  public int resolve(int patternId) {
    Integer id = unification.lookup(patternId);
    if (id == null)
      throw new IllegalStateException(patternId + " is not bound in " + this);
    return id;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * pattern.getName().hashCode() + unification.hashCode()) + matched.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Occurrence) {
      Occurrence o = (Occurrence) other;
      return pattern.getName().equals(o.pattern.getName())
          && unification.equals(o.unification)
          && matched.equals(o.matched);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(Occurrence " + pattern.getName() + " " + unification.getBinding() + " " + matched + ")";
  }
}
