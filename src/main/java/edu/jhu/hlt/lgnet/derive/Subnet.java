package edu.jhu.hlt.lgnet.derive;

import java.util.List;
import java.util.SortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * A connected component of a composition graph.
 */
public class Subnet {
  private final ImmutableSortedSet<Integer> nodeIds;
  private final ImmutableList<Link> links;
  private final Term term;

  public Subnet(SortedSet<Integer> nodeIds, List<Link> links, Term term) {
    if (nodeIds.isEmpty())
      throw new IllegalArgumentException("empty subnet");
    this.nodeIds = ImmutableSortedSet.copyOfSorted(nodeIds);
    this.links = ImmutableList.copyOf(links);
    this.term = term;
  }

  public SortedSet<Integer> getNodeIds() {
    return nodeIds;
  }

  public List<Link> getLinks() {
    return links;
  }

  /** The term of the node with the smallest identifier. */
  public Term getTerm() {
    return term;
  }

  public int getLowestId() {
    return nodeIds.first();
  }

  @Override
  public String toString() {
    return "(Subnet " + nodeIds + " " + links + " term=" + term + ")";
  }
}
