package edu.jhu.hlt.lgnet.reduce;

import java.util.ArrayList;
import java.util.List;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Node;

/**
 * Removes the axiom-link scaffolding left behind by unfolding. Both operations
 * modify the graph in place.
 */
public class AxiomElimination {

  /**
   * Strips every axiom link from every node, then drops the nodes that have no
   * link left. Idempotent.
   */
  public static void reduce(CompositionGraph graph) {
    for (Link l : graph.getLinks())
      if (l.isAxiom())
        graph.removeLink(l);
    List<Integer> unlinked = new ArrayList<>();
    for (Node n : graph.getNodes())
      if (n.isUnlinked())
        unlinked.add(n.getId());
    for (int id : unlinked)
      graph.removeNode(id);
  }

  /**
   * Merges the two endpoints of every axiom link that connects two different
   * nodes, so that operator links which were only separated by axiom links
   * come to share a node. Axiom links from a node to itself are kept.
   *
   * @return the number of axiom links collapsed
   */
  public static int collapse(CompositionGraph graph) {
    int collapsed = 0;
    Link ax;
    while ((ax = nextCollapsible(graph)) != null) {
      int premiseEnd = ax.getPremises().get(0).getId();
      int succedentEnd = ax.getSuccedents().get(0).getId();
      graph.removeLink(ax);
      graph.identify(premiseEnd, succedentEnd);
      collapsed++;
    }
    return collapsed;
  }

  private static Link nextCollapsible(CompositionGraph graph) {
    for (Link l : graph.getLinks())
      if (l.isAxiom() && l.getPremises().get(0).getId() != l.getSuccedents().get(0).getId())
        return l;
    return null;
  }
}
