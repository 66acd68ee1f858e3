package edu.jhu.hlt.lgnet.derive;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.lgnet.ExampleNets;
import edu.jhu.hlt.lgnet.formula.Formula;
import edu.jhu.hlt.lgnet.graph.CompositionGraph;
import edu.jhu.hlt.lgnet.reduce.Reducer;
import edu.jhu.hlt.lgnet.term.ValueTerm;
import edu.jhu.hlt.lgnet.unfold.Unfolder;

public class SubnetExtractorTest {

  @Test
  public void components() {
    Unfolder u = new Unfolder();
    u.unfoldHypothesis(Formula.tensor(ExampleNets.NP, ExampleNets.NP), new ValueTerm.Variable("p"));
    u.unfoldHypothesis(ExampleNets.NP, new ValueTerm.Variable("x"));
    List<Subnet> subnets = SubnetExtractor.extract(u.getGraph());
    assertEquals(2, subnets.size());

    Subnet first = subnets.get(0);
    assertEquals(Arrays.asList(0, 1, 2, 3, 4, 5), Arrays.asList(first.getNodeIds().toArray(new Integer[0])));
    assertEquals(4, first.getLinks().size());
    assertEquals(new ValueTerm.Variable("p"), first.getTerm());

    Subnet second = subnets.get(1);
    assertEquals(6, second.getLowestId());
    assertEquals(2, second.getNodeIds().size());
    assertEquals(1, second.getLinks().size());
    assertEquals(new ValueTerm.Variable("x"), second.getTerm());
  }

  @Test
  public void reducedTensorTree() {
    CompositionGraph g = new Reducer().reduce(ExampleNets.johnSleeps()).getGraph();
    List<Subnet> subnets = SubnetExtractor.extract(g);
    assertEquals(1, subnets.size());
    assertEquals(3, subnets.get(0).getNodeIds().size());
    assertEquals(new ValueTerm.Variable("john"), subnets.get(0).getTerm());
  }

  @Test
  public void emptyGraph() {
    assertTrue(SubnetExtractor.extract(new CompositionGraph()).isEmpty());
  }
}
