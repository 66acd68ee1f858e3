package edu.jhu.hlt.lgnet.reduce;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.util.ExperimentProperties;

/**
 * Rewrites a composition graph to a fixpoint: contractions first, then
 * interactions that lead to a graph not seen before. The input graph is not
 * modified.
 */
public class Reducer {
  public static final Logger LOG = Logger.getLogger(Reducer.class);

  public static final String MAX_STEPS = "reduce.maxSteps";
  public static final String INTERACTIONS = "reduce.interactions";
  public static final String COLLAPSE_AXIOMS = "reduce.collapseAxioms";

  private static final HashFunction HASH = Hashing.murmur3_128();

  private int maxSteps;
  private boolean useInteractions;
  private boolean collapseAxioms;

  public Reducer() {
    this(new ExperimentProperties());
  }

  public Reducer(ExperimentProperties config) {
    this.maxSteps = config.getInt(MAX_STEPS, 10000);
    this.useInteractions = config.getBoolean(INTERACTIONS, true);
    this.collapseAxioms = config.getBoolean(COLLAPSE_AXIOMS, true);
    if (maxSteps < 0)
      throw new IllegalArgumentException(MAX_STEPS + " must be non-negative: " + maxSteps);
  }

  public ReductionResult reduce(CompositionGraph input) {
    CompositionGraph g = input.duplicate();
    if (collapseAxioms) {
      int c = AxiomElimination.collapse(g);
      Rewriter.neutralizeFusions(g);
      if (LOG.isDebugEnabled())
        LOG.debug("collapsed " + c + " axiom links, " + g.size() + " nodes left");
    }

    List<String> applied = new ArrayList<>();
    int contractions = 0, interactions = 0;
    boolean limit = false;
    Set<HashCode> seen = new HashSet<>();
    seen.add(hash(g));
    while (true) {
      if (contractions + interactions >= maxSteps) {
        LOG.warn("stopping after " + maxSteps + " rewrites, graph not at a fixpoint yet");
        limit = true;
        break;
      }

      Occurrence c = PatternMatcher.findFirst(Patterns.CONTRACTIONS, g);
      if (c != null) {
        if (LOG.isDebugEnabled())
          LOG.debug("contracting " + c);
        Rewriter.apply(g, c);
        seen.add(hash(g));
        applied.add(c.getPattern().getName());
        contractions++;
        continue;
      }

      if (!useInteractions)
        break;
      CompositionGraph next = nextInteraction(g, seen, applied);
      if (next == null)
        break;
      g = next;
      interactions++;
    }

    AxiomElimination.reduce(g);
    ReductionResult r = new ReductionResult(g, applied, contractions, interactions, limit);
    LOG.info("reduced: " + r);
    return r;
  }

  /** May return null if every interaction leads to a graph already seen. */
  private CompositionGraph nextInteraction(CompositionGraph g, Set<HashCode> seen, List<String> applied) {
    for (Pattern p : Patterns.INTERACTIONS) {
      for (Occurrence o : PatternMatcher.findAll(p, g)) {
        CompositionGraph candidate = g.duplicate();
        Rewriter.apply(candidate, o);
        if (seen.add(hash(candidate))) {
          if (LOG.isDebugEnabled())
            LOG.debug("interaction " + o);
          applied.add(p.getName());
          return candidate;
        }
      }
    }
    return null;
  }

  private static HashCode hash(CompositionGraph g) {
    return HASH.hashString(g.signature(), StandardCharsets.UTF_8);
  }

  public int getMaxSteps() {
    return maxSteps;
  }

  public boolean usesInteractions() {
    return useInteractions;
  }

  public boolean collapsesAxioms() {
    return collapseAxioms;
  }
}
