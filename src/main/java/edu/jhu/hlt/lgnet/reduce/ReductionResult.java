package edu.jhu.hlt.lgnet.reduce;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.LinkShape;

/**
 * What {@link Reducer#reduce(CompositionGraph)} ended with.
 */
public class ReductionResult {
  private final CompositionGraph graph;
  private final ImmutableList<String> applied;
  private final int contractions;
  private final int interactions;
  private final boolean stepLimitReached;

  public ReductionResult(CompositionGraph graph, List<String> applied,
      int contractions, int interactions, boolean stepLimitReached) {
    this.graph = graph;
    this.applied = ImmutableList.copyOf(applied);
    this.contractions = contractions;
    this.interactions = interactions;
    this.stepLimitReached = stepLimitReached;
  }

  public CompositionGraph getGraph() {
    return graph;
  }

  /** Names of the patterns applied, in order. */
  public List<String> getApplied() {
    return applied;
  }

  public int getNumContractions() {
    return contractions;
  }

  public int getNumInteractions() {
    return interactions;
  }

  public int getNumSteps() {
    return contractions + interactions;
  }

  /**
   * True if no cotensor (fission) link is left, i.e. the structure reduced to
   * a tensor tree.
   */
  public boolean isConvertible() {
    return graph.countLinks(LinkShape.FISSION) == 0;
  }

  public boolean isStepLimitReached() {
    return stepLimitReached;
  }

  @Override
  public String toString() {
    return "(ReductionResult convertible=" + isConvertible()
        + " contractions=" + contractions
        + " interactions=" + interactions
        + " stepLimitReached=" + stepLimitReached
        + " nodes=" + graph.size()
        + " links=" + graph.linkCount() + ")";
  }
}
