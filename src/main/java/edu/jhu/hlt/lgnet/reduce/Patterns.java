package edu.jhu.hlt.lgnet.reduce;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.LinkShape;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * The rewrite catalogue for LG proof nets: one contraction per connective and
 * side, and the four Grishin interaction postulates.
 *
 * See Moortgat and Moot (2012), pp. 9-11 (contractions) and p. 15
 * (interactions).
 */
public class Patterns {

  // Contractions

  public static final Pattern RDIV_R = contraction("rdivR",
      link(LinkShape.FUSION, a(1), a(2)).to(a(3)),
      link(LinkShape.FISSION, a(3)).to(m(4), a(2)));

  public static final Pattern PROD_L = contraction("prodL",
      link(LinkShape.FISSION, m(1)).to(a(2), a(3)),
      link(LinkShape.FUSION, a(2), a(3)).to(a(4)));

  public static final Pattern LDIV_R = contraction("ldivR",
      link(LinkShape.FUSION, a(2), a(1)).to(a(3)),
      link(LinkShape.FISSION, a(3)).to(a(2), m(4)));

  public static final Pattern RDIF_L = contraction("rdifL",
      link(LinkShape.FISSION, m(1), a(2)).to(a(3)),
      link(LinkShape.FUSION, a(3)).to(a(4), a(2)));

  public static final Pattern CPRD_R = contraction("cprdR",
      link(LinkShape.FUSION, a(1)).to(a(2), a(3)),
      link(LinkShape.FISSION, a(2), a(3)).to(m(4)));

  public static final Pattern LDIF_L = contraction("ldifL",
      link(LinkShape.FISSION, a(2), m(1)).to(a(3)),
      link(LinkShape.FUSION, a(3)).to(a(2), a(4)));

  // Interactions, all with the same right-hand side

  private static final ImmutableList<Link> INTERACTION_RHS = ImmutableList.of(
      link(LinkShape.FUSION, a(1), a(2)).to(a(0)),
      link(LinkShape.FUSION, a(0)).to(a(3), a(4)));

  public static final Pattern G1 = interaction("g1",
      link(LinkShape.FUSION, a(1)).to(a(3), a(0)),
      link(LinkShape.FUSION, a(0), a(2)).to(a(4)));

  public static final Pattern G3 = interaction("g3",
      link(LinkShape.FUSION, a(1), a(0)).to(a(3)),
      link(LinkShape.FUSION, a(2)).to(a(0), a(4)));

  public static final Pattern G2 = interaction("g2",
      link(LinkShape.FUSION, a(1)).to(a(0), a(4)),
      link(LinkShape.FUSION, a(0), a(2)).to(a(3)));

  public static final Pattern G4 = interaction("g4",
      link(LinkShape.FUSION, a(2)).to(a(3), a(0)),
      link(LinkShape.FUSION, a(1), a(0)).to(a(4)));

  /** In the order the reducer tries them. */
  public static final List<Pattern> CONTRACTIONS =
      ImmutableList.of(RDIV_R, PROD_L, LDIV_R, RDIF_L, CPRD_R, LDIF_L);

  /** Associativity (g1, g3) before commutativity (g2, g4). */
  public static final List<Pattern> INTERACTIONS =
      ImmutableList.of(G1, G3, G2, G4);

  public static List<Pattern> all() {
    return ImmutableList.<Pattern>builder().addAll(CONTRACTIONS).addAll(INTERACTIONS).build();
  }

  /** May return null. */
  public static Pattern byName(String name) {
    for (Pattern p : all())
      if (p.getName().equals(name))
        return p;
    return null;
  }

  private static Pattern contraction(String name, Link first, Link second) {
    return new Pattern(name, Pattern.Kind.CONTRACTION, ImmutableList.of(first, second), ImmutableList.<Link>of());
  }

  private static Pattern interaction(String name, Link first, Link second) {
    return new Pattern(name, Pattern.Kind.INTERACTION, ImmutableList.of(first, second), INTERACTION_RHS);
  }

  private static Tentacle m(int id) {
    return Tentacle.main(id);
  }

  private static Tentacle a(int id) {
    return Tentacle.active(id);
  }

  private static LinkBuilder link(LinkShape shape, Tentacle... premises) {
    return new LinkBuilder(shape, premises);
  }

  private static class LinkBuilder {
    private final LinkShape shape;
    private final Tentacle[] premises;

    LinkBuilder(LinkShape shape, Tentacle[] premises) {
      this.shape = shape;
      this.premises = premises;
    }

    Link to(Tentacle... succedents) {
      return new Link(ImmutableList.copyOf(premises), shape, ImmutableList.copyOf(succedents));
    }
  }
}
