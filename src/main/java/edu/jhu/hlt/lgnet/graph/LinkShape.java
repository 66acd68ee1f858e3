package edu.jhu.hlt.lgnet.graph;

/**
 * Shape symbol of a {@link Link}: fusion ○ and fission ● for operator links,
 * | for axiom links.
 */
public enum LinkShape {
  FUSION("○"), FISSION("●"), AXIOM("|");

  private final String symbol;

  private LinkShape(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
