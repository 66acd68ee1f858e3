package edu.jhu.hlt.lgnet.derive;

import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.term.Term;

/**
 * Reads a term off a reduced (convertible) composition graph. Implementations
 * decide how the terms of the graph's {@link Subnet}s are combined.
 */
public interface TermDerivation {

  /** May return null if no term can be derived from this graph. */
  Term derive(CompositionGraph reduced);
}
