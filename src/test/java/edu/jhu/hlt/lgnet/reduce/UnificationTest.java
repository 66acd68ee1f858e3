package edu.jhu.hlt.lgnet.reduce;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.lgnet.graph.Link;
import edu.jhu.hlt.lgnet.graph.Tentacle;

public class UnificationTest {

  private static List<Tentacle> active(int... ids) {
    Tentacle[] t = new Tentacle[ids.length];
    for (int i = 0; i < ids.length; i++)
      t[i] = Tentacle.active(ids[i]);
    return Arrays.asList(t);
  }

  @Test
  public void distinctPatternIdsMayShareGraphId() {
    Unification u = Unification.EMPTY.unify(active(1, 2), active(5, 5));
    assertNotNull(u);
    assertEquals(Integer.valueOf(5), u.lookup(1));
    assertEquals(Integer.valueOf(5), u.lookup(2));
  }

  @Test
  public void repeatedPatternIdMustAgree() {
    assertNull(Unification.EMPTY.unify(active(1, 1), active(5, 6)));
  }

  @Test
  public void seenOnce() {
    Unification u = Unification.EMPTY.unify(1, 10);
    assertTrue(u.isSeenOnce(1));
    u = u.unify(2, 20);
    u = u.unify(1, 10);
    assertFalse(u.isSeenOnce(1));
    assertTrue(u.isSeenOnce(2));
    assertEquals(2, u.getBinding().size());
    // binding again keeps it closed
    assertEquals(u, u.unify(1, 10));
    assertNull(u.unify(2, 21));
  }

  @Test
  public void kindsMustMatch() {
    assertNull(Unification.EMPTY.unify(Tentacle.main(1), Tentacle.active(1)));
    assertNull(Unification.EMPTY.unify(Tentacle.active(1), Tentacle.main(1)));
    assertNotNull(Unification.EMPTY.unify(Tentacle.main(1), Tentacle.main(7)));
  }

  @Test
  public void lengthsMustMatch() {
    assertNull(Unification.EMPTY.unify(active(1, 2), active(5)));
  }

  @Test
  public void links() {
    Link pattern = Link.fusion(active(1, 2), active(3));
    Link graph = Link.fusion(active(7, 8), active(9));
    Unification u = Unification.EMPTY.unify(pattern, graph);
    assertNotNull(u);
    assertEquals(Integer.valueOf(9), u.lookup(3));
    // succedents are bound first
    assertEquals(Arrays.asList(3, 1, 2), new ArrayList<>(u.getSeenOnce()));

    assertNull(Unification.EMPTY.unify(pattern, Link.fission(active(7, 8), active(9))));
    assertNull(Unification.EMPTY.unify(pattern, Link.fusion(active(7), active(8, 9))));
  }

  @Test
  public void unificationIsImmutable() {
    Unification u = Unification.EMPTY.unify(1, 2);
    u.unify(3, 4);
    assertEquals(1, u.getBinding().size());
    assertTrue(Unification.EMPTY.getBinding().isEmpty());
  }
}
