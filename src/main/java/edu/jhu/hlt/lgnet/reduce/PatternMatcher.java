package edu.jhu.hlt.lgnet.reduce;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.log4j.Logger;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Node;

/**
 * Finds occurrences of a pattern's left-hand side in a graph.
 *
 * Depth-first search: the first pattern link is tried against the succedent
 * link of every node (ascending identifier), and every further pattern link
 * only against links adjacent to nodes that are bound but not yet closed off
 * (pattern identifiers seen once). Each complete match is handed to a visitor,
 * which returns false to stop the search.
 */
public class PatternMatcher {
  public static final Logger LOG = Logger.getLogger(PatternMatcher.class);

  /**
   * Calls visitor on every distinct occurrence of pattern in graph until it
   * returns false.
   *
   * @return false if the visitor stopped the search early
   */
  public static boolean match(Pattern pattern, CompositionGraph graph, Predicate<Occurrence> visitor) {
    Set<Occurrence> seen = new HashSet<>();
    Link first = pattern.getLhs().get(0);
    Set<Link> tried = new HashSet<>();
    for (Node n : graph.getNodes()) {
      Link l = n.getSuccedentLink();
      if (l == null || !tried.add(l))
        continue;
      Unification u = Unification.EMPTY.unify(first, l);
      if (u == null)
        continue;
      List<Link> matched = new ArrayList<>();
      matched.add(l);
      if (!extend(pattern, graph, u, matched, seen, visitor))
        return false;
    }
    return true;
  }

  private static boolean extend(Pattern pattern, CompositionGraph graph, Unification u,
      List<Link> matched, Set<Occurrence> seen, Predicate<Occurrence> visitor) {
    int i = matched.size();
    if (i == pattern.getLhs().size()) {
      Occurrence o = new Occurrence(pattern, u, matched);
      if (!seen.add(o))
        return true;
      if (LOG.isTraceEnabled())
        LOG.trace("found " + o);
      return visitor.test(o);
    }
    Link next = pattern.getLhs().get(i);
    for (Link candidate : candidates(graph, u)) {
      if (matched.contains(candidate))
        continue;
      Unification u2 = u.unify(next, candidate);
      if (u2 == null)
        continue;
      matched.add(candidate);
      boolean keepGoing = extend(pattern, graph, u2, matched, seen, visitor);
      matched.remove(matched.size() - 1);
      if (!keepGoing)
        return false;
    }
    return true;
  }

  /** Succedent links of the open nodes, then their premise links. */
  private static Set<Link> candidates(CompositionGraph graph, Unification u) {
    List<Node> open = new ArrayList<>();
    for (int patternId : u.getSeenOnce()) {
      int id = u.lookup(patternId);
      if (graph.hasNode(id))
        open.add(graph.getNode(id));
    }
    Set<Link> c = new LinkedHashSet<>();
    for (Node n : open)
      if (n.getSuccedentLink() != null)
        c.add(n.getSuccedentLink());
    for (Node n : open)
      if (n.getPremiseLink() != null)
        c.add(n.getPremiseLink());
    return c;
  }

  public static List<Occurrence> findAll(Pattern pattern, CompositionGraph graph) {
    List<Occurrence> all = new ArrayList<>();
    match(pattern, graph, o -> {
      all.add(o);
      return true;
    });
    return all;
  }

  /** May return null. */
  public static Occurrence findFirst(Pattern pattern, CompositionGraph graph) {
    Occurrence[] first = new Occurrence[1];
    match(pattern, graph, o -> {
      first[0] = o;
      return false;
    });
    return first[0];
  }

  /** The first occurrence of the first pattern (in list order) that has one. May return null. */
  public static Occurrence findFirst(List<Pattern> patterns, CompositionGraph graph) {
    for (Pattern p : patterns) {
      Occurrence o = findFirst(p, graph);
      if (o != null)
        return o;
    }
    return null;
  }
}
