package edu.jhu.hlt.lgnet.reduce;

import java.util.LinkedHashSet;
import java.util.Set;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.LinkShape;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * Applies an {@link Occurrence} to the graph it was found in. The graph is
 * modified in place, so an occurrence must not be applied twice or to a graph
 * that has been rewritten since it was found.
 */
public class Rewriter {

  public static void apply(CompositionGraph graph, Occurrence occ) {
    switch (occ.getPattern().getKind()) {
    case CONTRACTION:
      contract(graph, occ);
      break;
    case INTERACTION:
      interact(graph, occ);
      break;
    default:
      throw new RuntimeException("unknown pattern kind: " + occ.getPattern().getKind());
    }
  }

  /**
   * Removes the matched links and the nodes between them, then joins the node
   * above the redex with the node below it.
   */
  public static void contract(CompositionGraph graph, Occurrence occ) {
    Pattern p = occ.getPattern();
    Unification u = occ.getUnification();
    for (Link l : occ.getMatchedLinks())
      graph.removeLink(l);

    // Boundary ids are seen once, on the premise side (upper) or succedent side (lower)
    Integer upper = null, lower = null;
    Set<Integer> boundary = new LinkedHashSet<>();
    for (Link l : p.getLhs()) {
      for (Tentacle t : l.getPremises())
        if (u.isSeenOnce(t.getId()) && upper == null)
          upper = occ.resolve(t.getId());
      for (Tentacle t : l.getSuccedents())
        if (u.isSeenOnce(t.getId()) && lower == null)
          lower = occ.resolve(t.getId());
    }
    if (upper == null || lower == null)
      throw new IllegalArgumentException(p.getName() + " has no upper and lower boundary: " + p);
    for (int patternId : u.getSeenOnce())
      boundary.add(occ.resolve(patternId));

    for (int patternId : u.getBinding().keySet()) {
      if (u.isSeenOnce(patternId))
        continue;
      int id = occ.resolve(patternId);
      if (!boundary.contains(id) && graph.hasNode(id))
        graph.removeNode(id);
    }
    graph.identify(upper, lower);
  }

  /** Replaces the matched links with the right-hand side, instantiated through the binding. */
  public static void interact(CompositionGraph graph, Occurrence occ) {
    for (Link l : occ.getMatchedLinks())
      graph.removeLink(l);
    for (Link l : occ.getPattern().getRhs())
      graph.addLink(l.mapIds(occ::resolve));
  }

  /**
   * Drops the main marker from every fusion link. In an abstract proof
   * structure only cotensor links keep their main tentacle.
   */
  public static void neutralizeFusions(CompositionGraph graph) {
    for (Link l : graph.getLinks())
      if (l.getShape() == LinkShape.FUSION && l.getMain() != null)
        graph.replaceLink(l, l.neutral());
  }
}
