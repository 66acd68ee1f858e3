package edu.jhu.hlt.lgnet.reduce;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * A partial binding from pattern identifiers to graph identifiers, plus the
 * set of pattern identifiers that have been bound exactly once so far.
 *
 * Immutable: every unify method returns a new unification, or null if the two
 * sides are incompatible. Binding is one-directional, two pattern identifiers
 * may be bound to the same graph identifier but not the other way around, so
 * [x, y] unifies with [z, z] while [z, z] does not unify with [x, y].
 */
public final class Unification {

  public static final Unification EMPTY =
      new Unification(ImmutableMap.<Integer, Integer>of(), ImmutableSet.<Integer>of());

  // pattern id -> graph id, in the order they were bound
  private final ImmutableMap<Integer, Integer> binding;
  private final ImmutableSet<Integer> seenOnce;

  private Unification(ImmutableMap<Integer, Integer> binding, ImmutableSet<Integer> seenOnce) {
    this.binding = binding;
    this.seenOnce = seenOnce;
  }

  /** May return null. */
  public Unification unify(int patternId, int graphId) {
    Integer bound = binding.get(patternId);
    if (bound == null) {
      ImmutableMap<Integer, Integer> b = ImmutableMap.<Integer, Integer>builder()
          .putAll(binding).put(patternId, graphId).build();
      ImmutableSet<Integer> s = ImmutableSet.<Integer>builder()
          .addAll(seenOnce).add(patternId).build();
      return new Unification(b, s);
    }
    if (bound != graphId)
      return null;
    if (!seenOnce.contains(patternId))
      return this;
    ImmutableSet.Builder<Integer> s = ImmutableSet.builder();
    for (int i : seenOnce)
      if (i != patternId)
        s.add(i);
    return new Unification(binding, s.build());
  }

  /** May return null. */
  public Unification unify(Tentacle pattern, Tentacle graph) {
    if (pattern.getKind() != graph.getKind())
      return null;
    return unify(pattern.getId(), graph.getId());
  }

  /** May return null. */
  public Unification unify(List<Tentacle> pattern, List<Tentacle> graph) {
    if (pattern.size() != graph.size())
      return null;
    Unification u = this;
    for (int i = 0; i < pattern.size() && u != null; i++)
      u = u.unify(pattern.get(i), graph.get(i));
    return u;
  }

  /** Succedents first, then premises. May return null. */
  public Unification unify(Link pattern, Link graph) {
    if (pattern.getShape() != graph.getShape())
      return null;
    Unification u = unify(pattern.getSuccedents(), graph.getSuccedents());
    if (u == null)
      return null;
    return u.unify(pattern.getPremises(), graph.getPremises());
  }

  public Map<Integer, Integer> getBinding() {
    return binding;
  }

  /** May return null. */
  public Integer lookup(int patternId) {
    return binding.get(patternId);
  }

  /** Pattern identifiers bound exactly once, in the order they were bound. */
  public Set<Integer> getSeenOnce() {
    return seenOnce;
  }

  public boolean isSeenOnce(int patternId) {
    return seenOnce.contains(patternId);
  }

  @Override
  public int hashCode() {
    return 31 * binding.hashCode() + seenOnce.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Unification) {
      Unification u = (Unification) other;
      return binding.equals(u.binding) && seenOnce.equals(u.seenOnce);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(Unification " + binding + " seenOnce=" + seenOnce + ")";
  }
}
