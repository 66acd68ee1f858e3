package edu.jhu.hlt.lgnet.unfold;

import static edu.jhu.hlt.lgnet.unfold.UnfoldMode.CONCLUSION;
import static edu.jhu.hlt.lgnet.unfold.UnfoldMode.HYPOTHESIS;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.jhu.hlt.lgnet.formula.Connective;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.LinkShape;
import edu.jhu.hlt.lgnet.graph.Tentacle;

/**
 * The operator link introduced when unfolding a complex formula, one entry per
 * (connective, mode). An entry says in which mode each immediate subformula is
 * unfolded next, and where the main formula and the two subformulas sit on the
 * new link.
 *
 * See Moortgat and Moot (2012), the term-annotated links on p. 24.
 */
public enum UnfoldRule {
  // Hypothesis (left) rules
  L_RDIV(Connective.RIGHT_DIV, HYPOTHESIS, CONCLUSION, HYPOTHESIS,
      new Slot[] {Slot.MAIN, Slot.A}, LinkShape.FUSION, new Slot[] {Slot.B}),
  L_TENSOR(Connective.TENSOR, HYPOTHESIS, HYPOTHESIS, HYPOTHESIS,
      new Slot[] {Slot.MAIN}, LinkShape.FISSION, new Slot[] {Slot.A, Slot.B}),
  L_LDIV(Connective.LEFT_DIV, HYPOTHESIS, CONCLUSION, HYPOTHESIS,
      new Slot[] {Slot.A, Slot.MAIN}, LinkShape.FUSION, new Slot[] {Slot.B}),
  L_RDIFF(Connective.RIGHT_DIFF, HYPOTHESIS, CONCLUSION, HYPOTHESIS,
      new Slot[] {Slot.MAIN, Slot.A}, LinkShape.FISSION, new Slot[] {Slot.B}),
  // Both subformulas are succedents of this link, so both continue as hypotheses.
  L_COTENSOR(Connective.COTENSOR, HYPOTHESIS, HYPOTHESIS, HYPOTHESIS,
      new Slot[] {Slot.MAIN}, LinkShape.FUSION, new Slot[] {Slot.A, Slot.B}),
  L_LDIFF(Connective.LEFT_DIFF, HYPOTHESIS, CONCLUSION, HYPOTHESIS,
      new Slot[] {Slot.A, Slot.MAIN}, LinkShape.FISSION, new Slot[] {Slot.B}),

  // Conclusion (right) rules
  R_RDIV(Connective.RIGHT_DIV, CONCLUSION, HYPOTHESIS, CONCLUSION,
      new Slot[] {Slot.B}, LinkShape.FISSION, new Slot[] {Slot.MAIN, Slot.A}),
  R_TENSOR(Connective.TENSOR, CONCLUSION, CONCLUSION, CONCLUSION,
      new Slot[] {Slot.A, Slot.B}, LinkShape.FUSION, new Slot[] {Slot.MAIN}),
  R_LDIV(Connective.LEFT_DIV, CONCLUSION, HYPOTHESIS, CONCLUSION,
      new Slot[] {Slot.B}, LinkShape.FISSION, new Slot[] {Slot.A, Slot.MAIN}),
  R_RDIFF(Connective.RIGHT_DIFF, CONCLUSION, HYPOTHESIS, CONCLUSION,
      new Slot[] {Slot.B}, LinkShape.FUSION, new Slot[] {Slot.MAIN, Slot.A}),
  R_COTENSOR(Connective.COTENSOR, CONCLUSION, CONCLUSION, CONCLUSION,
      new Slot[] {Slot.A, Slot.B}, LinkShape.FISSION, new Slot[] {Slot.MAIN}),
  R_LDIFF(Connective.LEFT_DIFF, CONCLUSION, HYPOTHESIS, CONCLUSION,
      new Slot[] {Slot.B}, LinkShape.FUSION, new Slot[] {Slot.A, Slot.MAIN});

  /** Which formula a tentacle of the new link points at. */
  public static enum Slot {
    MAIN, A, B
  }

  private final Connective connective;
  private final UnfoldMode mode;
  private final UnfoldMode aMode, bMode;
  private final Slot[] premises;
  private final LinkShape shape;
  private final Slot[] succedents;

  private UnfoldRule(Connective connective, UnfoldMode mode, UnfoldMode aMode, UnfoldMode bMode,
      Slot[] premises, LinkShape shape, Slot[] succedents) {
    this.connective = connective;
    this.mode = mode;
    this.aMode = aMode;
    this.bMode = bMode;
    this.premises = premises;
    this.shape = shape;
    this.succedents = succedents;
  }

  public static UnfoldRule lookup(Connective c, UnfoldMode mode) {
    for (UnfoldRule r : values())
      if (r.connective == c && r.mode == mode)
        return r;
    throw new RuntimeException("no unfolding rule for " + c + " in mode " + mode);
  }

  public Connective getConnective() {
    return connective;
  }

  public UnfoldMode getMode() {
    return mode;
  }

  public UnfoldMode getAMode() {
    return aMode;
  }

  public UnfoldMode getBMode() {
    return bMode;
  }

  public LinkShape getShape() {
    return shape;
  }

  /** The operator link for a main node and the first nodes of its two subformulas. */
  public Link makeLink(int mainId, int aId, int bId) {
    return new Link(
        tentacles(premises, mainId, aId, bId),
        shape,
        tentacles(succedents, mainId, aId, bId));
  }

  private static List<Tentacle> tentacles(Slot[] slots, int mainId, int aId, int bId) {
    ImmutableList.Builder<Tentacle> b = ImmutableList.builder();
    for (Slot s : slots) {
      switch (s) {
      case MAIN:
        b.add(Tentacle.main(mainId));
        break;
      case A:
        b.add(Tentacle.active(aId));
        break;
      case B:
        b.add(Tentacle.active(bId));
        break;
      default:
        throw new RuntimeException("unknown slot: " + s);
      }
    }
    return b.build();
  }
}
