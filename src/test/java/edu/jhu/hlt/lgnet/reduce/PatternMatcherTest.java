package edu.jhu.hlt.lgnet.reduce;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.lgnet.ExampleNets;
import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Tentacle;

public class PatternMatcherTest {

  static CompositionGraph collapsed(CompositionGraph g) {
    AxiomElimination.collapse(g);
    Rewriter.neutralizeFusions(g);
    return g;
  }

  @Test
  public void rightDivisionRedex() {
    CompositionGraph g = collapsed(ExampleNets.sOverNp());
    List<Occurrence> all = PatternMatcher.findAll(Patterns.RDIV_R, g);
    assertEquals(1, all.size());
    Occurrence o = all.get(0);
    assertEquals(0, o.resolve(1));
    assertEquals(2, o.resolve(2));
    assertEquals(4, o.resolve(3));
    assertEquals(6, o.resolve(4));
    assertEquals(Link.fusion(
        Arrays.asList(Tentacle.active(0), Tentacle.active(2)),
        Arrays.asList(Tentacle.active(4))), o.getMatchedLinks().get(0));
    assertEquals(Link.fission(
        Arrays.asList(Tentacle.active(4)),
        Arrays.asList(Tentacle.main(6), Tentacle.active(2))), o.getMatchedLinks().get(1));

    for (Pattern p : Patterns.all())
      if (p != Patterns.RDIV_R)
        assertTrue(p.getName(), PatternMatcher.findAll(p, g).isEmpty());
  }

  @Test
  public void mainMarkersBlockContraction() {
    CompositionGraph g = ExampleNets.sOverNp();
    AxiomElimination.collapse(g);
    assertNull(PatternMatcher.findFirst(Patterns.RDIV_R, g));
  }

  @Test
  public void productRedex() {
    CompositionGraph g = collapsed(ExampleNets.npTimesNp());
    Occurrence o = PatternMatcher.findFirst(Patterns.CONTRACTIONS, g);
    assertNotNull(o);
    assertSame(Patterns.PROD_L, o.getPattern());
  }

  @Test
  public void onlyG1MatchesAssociativityRedex() {
    CompositionGraph g = ExampleNets.associativityRedex();
    assertEquals(1, PatternMatcher.findAll(Patterns.G1, g).size());
    assertNull(PatternMatcher.findFirst(Patterns.G2, g));
    assertNull(PatternMatcher.findFirst(Patterns.G3, g));
    assertNull(PatternMatcher.findFirst(Patterns.G4, g));
    assertNull(PatternMatcher.findFirst(Patterns.CONTRACTIONS, g));
  }

  @Test
  public void visitorCanStop() {
    CompositionGraph g = ExampleNets.associativityRedex();
    int[] calls = new int[1];
    boolean finished = PatternMatcher.match(Patterns.G1, g, o -> {
      calls[0]++;
      return false;
    });
    assertFalse(finished);
    assertEquals(1, calls[0]);
    assertTrue(PatternMatcher.match(Patterns.G1, g, o -> true));
  }

  @Test
  public void nothingInEmptyGraph() {
    assertTrue(PatternMatcher.findAll(Patterns.G1, new CompositionGraph()).isEmpty());
  }
}
