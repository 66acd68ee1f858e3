package edu.jhu.hlt.lgnet.graph;

/**
 * One connection slot of a {@link Link}, pointing at a node identifier. The
 * main tentacle connects to the formula a link decomposes, active tentacles to
 * its immediate subformulas (axiom links only have active tentacles).
 *
 * In a rewrite pattern the identifier is an abstract number rather than a
 * node identifier, see {@link edu.jhu.hlt.lgnet.reduce.Unification}.
 */
public final class Tentacle {

  public static enum Kind {
    MAIN, ACTIVE
  }

  private final Kind kind;
  private final int id;

  public Tentacle(Kind kind, int id) {
    if (kind == null)
      throw new IllegalArgumentException();
    if (id < 0)
      throw new IllegalArgumentException("id=" + id);
    this.kind = kind;
    this.id = id;
  }

  public static Tentacle main(int id) {
    return new Tentacle(Kind.MAIN, id);
  }

  public static Tentacle active(int id) {
    return new Tentacle(Kind.ACTIVE, id);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isMain() {
    return kind == Kind.MAIN;
  }

  public int getId() {
    return id;
  }

  public Tentacle withId(int newId) {
    if (newId == id)
      return this;
    return new Tentacle(kind, newId);
  }

  /** The same tentacle without the main marker. */
  public Tentacle neutral() {
    if (kind == Kind.ACTIVE)
      return this;
    return new Tentacle(Kind.ACTIVE, id);
  }

  @Override
  public int hashCode() {
    return 2 * id + (kind == Kind.MAIN ? 1 : 0);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Tentacle) {
      Tentacle t = (Tentacle) other;
      return id == t.id && kind == t.kind;
    }
    return false;
  }

  @Override
  public String toString() {
    return kind == Kind.MAIN ? id + "*" : String.valueOf(id);
  }
}
