package edu.jhu.hlt.lgnet.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * A composition graph: a map from node identifier to {@link Node}. Links are
 * only reachable through the nodes which are their endpoints, and all edges
 * are identifier lookups.
 *
 * Built insert-only by the unfolder, then mutated by the reduction engine one
 * rewrite at a time. Use {@link #duplicate()} to get an independent snapshot
 * before rewriting a graph that someone else holds on to.
 *
 * Nodes are kept sorted by identifier so that every traversal (and therefore
 * every search over occurrences) is deterministic.
 */
public class CompositionGraph {

  private TreeMap<Integer, Node> nodes;

  public CompositionGraph() {
    this.nodes = new TreeMap<>();
  }

  public CompositionGraph duplicate() {
    CompositionGraph g = new CompositionGraph();
    for (Node n : nodes.values())
      g.nodes.put(n.getId(), n.copy());
    return g;
  }

  public Node addNode(int id, Formula formula, Term term) {
    if (nodes.containsKey(id))
      throw new IllegalStateException("identifier " + id + " is already in use");
    Node n = new Node(id, formula, term);
    nodes.put(id, n);
    return n;
  }

  public boolean hasNode(int id) {
    return nodes.containsKey(id);
  }

  /**
   * Tentacles only ever point at nodes of the same graph, so a missing node is
   * a broken invariant rather than a user error.
   */
  public Node getNode(int id) {
    Node n = nodes.get(id);
    if (n == null)
      throw new IllegalStateException("no node with identifier " + id);
    return n;
  }

  /** Removes a node, detaching it from any links it still had. */
  public Node removeNode(int id) {
    Node n = getNode(id);
    if (n.getPremiseLink() != null)
      removeLink(n.getPremiseLink());
    if (n.getSuccedentLink() != null)
      removeLink(n.getSuccedentLink());
    return nodes.remove(id);
  }

  /** In identifier order. */
  public Collection<Node> getNodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public Set<Integer> getIds() {
    return Collections.unmodifiableSet(nodes.keySet());
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /**
   * Attach a link to its endpoints: every premise tentacle's node gets it as
   * its premise link and every succedent tentacle's node as its succedent link.
   */
  public void addLink(Link link) {
    for (Tentacle t : link.getPremises()) {
      Node n = getNode(t.getId());
      if (n.getPremiseLink() != null && !n.getPremiseLink().equals(link))
        throw new IllegalStateException("node " + n.getId() + " is already a premise of " + n.getPremiseLink() + ", can't add " + link);
      n.setPremiseLink(link);
    }
    for (Tentacle t : link.getSuccedents()) {
      Node n = getNode(t.getId());
      if (n.getSuccedentLink() != null && !n.getSuccedentLink().equals(link))
        throw new IllegalStateException("node " + n.getId() + " is already a succedent of " + n.getSuccedentLink() + ", can't add " + link);
      n.setSuccedentLink(link);
    }
  }

  /** Detach a link from every endpoint that still references it. */
  public void removeLink(Link link) {
    for (Tentacle t : link.getTentacles()) {
      Node n = nodes.get(t.getId());
      if (n == null)
        continue;
      if (link.equals(n.getPremiseLink()))
        n.setPremiseLink(null);
      if (link.equals(n.getSuccedentLink()))
        n.setSuccedentLink(null);
    }
  }

  /** Every node referencing oldLink references newLink instead. */
  public void replaceLink(Link oldLink, Link newLink) {
    Set<Integer> ids = new LinkedHashSet<>();
    for (Tentacle t : oldLink.getTentacles())
      ids.add(t.getId());
    for (Tentacle t : newLink.getTentacles())
      ids.add(t.getId());
    for (int id : ids) {
      Node n = nodes.get(id);
      if (n == null)
        continue;
      if (oldLink.equals(n.getPremiseLink()))
        n.setPremiseLink(newLink);
      if (oldLink.equals(n.getSuccedentLink()))
        n.setSuccedentLink(newLink);
    }
  }

  /**
   * Connect two atomic leaves with a new axiom link. This is the hook for an
   * (external) atom-linking search: premiseEnd must not yet be a premise of
   * anything, succedentEnd must not yet be a succedent of anything, and both
   * must be occurrences of the same atom.
   */
  public Link addAxiomLink(int premiseEnd, int succedentEnd) {
    Node p = getNode(premiseEnd);
    Node s = getNode(succedentEnd);
    if (p.getPremiseLink() != null)
      throw new IllegalArgumentException("node " + premiseEnd + " already is a premise of " + p.getPremiseLink());
    if (s.getSuccedentLink() != null)
      throw new IllegalArgumentException("node " + succedentEnd + " already is a succedent of " + s.getSuccedentLink());
    if (!p.getFormula().isAtomic() || !p.getFormula().equals(s.getFormula()))
      throw new IllegalArgumentException("can only link occurrences of the same atom: "
          + p.getFormula() + " and " + s.getFormula());
    Link ax = Link.axiom(premiseEnd, succedentEnd);
    addLink(ax);
    return ax;
  }

  /**
   * Merge two nodes into one. The first node must have no premise link and the
   * second no succedent link; the merged node takes the succedent link of the
   * first and the premise link of the second. The smaller identifier survives
   * (with its formula and term) and tentacles pointing at the other one are
   * renamed.
   *
   * @return the identifier of the merged node
   */
  public int identify(int premiseFreeId, int succedentFreeId) {
    if (premiseFreeId == succedentFreeId)
      return premiseFreeId;
    Node pf = getNode(premiseFreeId);
    Node sf = getNode(succedentFreeId);
    if (pf.getPremiseLink() != null)
      throw new IllegalStateException("can't identify, node " + premiseFreeId + " still is a premise of " + pf.getPremiseLink());
    if (sf.getSuccedentLink() != null)
      throw new IllegalStateException("can't identify, node " + succedentFreeId + " still is a succedent of " + sf.getSuccedentLink());

    Link below = sf.getPremiseLink();
    Link above = pf.getSuccedentLink();
    int kept = Math.min(premiseFreeId, succedentFreeId);
    int dropped = Math.max(premiseFreeId, succedentFreeId);

    nodes.remove(dropped);
    Node k = nodes.get(kept);
    k.setPremiseLink(below);
    k.setSuccedentLink(above);

    if (below != null)
      replaceLink(below, below.rename(dropped, kept));
    if (above != null && !above.equals(below))
      replaceLink(above, above.rename(dropped, kept));
    return kept;
  }

  /** Distinct links, in order of the first node (by identifier) that holds them. */
  public List<Link> getLinks() {
    Set<Link> links = new LinkedHashSet<>();
    for (Node n : nodes.values()) {
      if (n.getSuccedentLink() != null)
        links.add(n.getSuccedentLink());
      if (n.getPremiseLink() != null)
        links.add(n.getPremiseLink());
    }
    return new ArrayList<>(links);
  }

  public int linkCount() {
    return getLinks().size();
  }

  public int countLinks(LinkShape shape) {
    int c = 0;
    for (Link l : getLinks())
      if (l.getShape() == shape)
        c++;
    return c;
  }

  /**
   * Checks that every node's links list it on the right side and that every
   * tentacle of every link points at a node which holds the link.
   *
   * @throws IllegalStateException if not
   */
  public void checkConsistency() {
    for (Node n : nodes.values()) {
      Link p = n.getPremiseLink();
      if (p != null && !p.hasPremise(n.getId()))
        throw new IllegalStateException("node " + n.getId() + " has premise link " + p + " which does not list it as a premise");
      Link s = n.getSuccedentLink();
      if (s != null && !s.hasSuccedent(n.getId()))
        throw new IllegalStateException("node " + n.getId() + " has succedent link " + s + " which does not list it as a succedent");
    }
    for (Link l : getLinks()) {
      for (Tentacle t : l.getPremises())
        if (!l.equals(getNode(t.getId()).getPremiseLink()))
          throw new IllegalStateException("node " + t.getId() + " is not attached to " + l + " as a premise");
      for (Tentacle t : l.getSuccedents())
        if (!l.equals(getNode(t.getId()).getSuccedentLink()))
          throw new IllegalStateException("node " + t.getId() + " is not attached to " + l + " as a succedent");
    }
  }

  /**
   * A canonical rendering of the structure (identifiers and links, no
   * formulas or terms). Two graphs with the same signature are the same net.
   */
  public String signature() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Integer, Node> e : nodes.entrySet()) {
      Node n = e.getValue();
      sb.append(e.getKey());
      sb.append(" p=");
      sb.append(n.getPremiseLink());
      sb.append(" s=");
      sb.append(n.getSuccedentLink());
      sb.append('\n');
    }
    return sb.toString();
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof CompositionGraph)
      return nodes.equals(((CompositionGraph) other).nodes);
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(CompositionGraph");
    for (Node n : nodes.values()) {
      sb.append("\n  ");
      sb.append(n);
    }
    sb.append(')');
    return sb.toString();
  }
}
