package edu.jhu.hlt.lgnet.derive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Node;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * Splits a graph into its connected components, two nodes being connected if
 * some link of any shape has tentacles to both.
 *
 * These are plain components. Tensor subnets, which stop at cotensor links
 * and binder boundaries, are for a {@link TermDerivation} to carve out of
 * them.
 */
public class SubnetExtractor {

  /** Components ordered by their lowest node identifier. */
  public static List<Subnet> extract(CompositionGraph graph) {
    List<Subnet> subnets = new ArrayList<>();
    Set<Integer> visited = new HashSet<>();
    for (Node start : graph.getNodes()) {
      if (visited.contains(start.getId()))
        continue;
      TreeSet<Integer> ids = new TreeSet<>();
      Set<Link> links = new LinkedHashSet<>();
      Deque<Integer> agenda = new ArrayDeque<>();
      agenda.push(start.getId());
      visited.add(start.getId());
      while (!agenda.isEmpty()) {
        Node n = graph.getNode(agenda.pop());
        ids.add(n.getId());
        for (Link l : new Link[] {n.getSuccedentLink(), n.getPremiseLink()}) {
          if (l == null || !links.add(l))
            continue;
          for (Tentacle t : l.getTentacles())
            if (visited.add(t.getId()))
              agenda.push(t.getId());
        }
      }
      subnets.add(new Subnet(ids, new ArrayList<>(links), start.getTerm()));
    }
    return subnets;
  }
}
