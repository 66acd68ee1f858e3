package edu.jhu.hlt.lgnet.formula;

/**
 * An atomic formula like np or s. Polarity is part of the atom, so np with
 * polarity P and np with polarity N are different formulas.
 */
public class Atom extends Formula {
  private final String name;
  private final Polarity polarity;

  public Atom(String name, Polarity polarity) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("atom needs a name");
    if (polarity == null)
      throw new IllegalArgumentException("atom needs a polarity: " + name);
    this.name = name;
    this.polarity = polarity;
  }

  public String getName() {
    return name;
  }

  @Override
  public Polarity getPolarity() {
    return polarity;
  }

  @Override
  public boolean isAtomic() {
    return true;
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + polarity.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Atom) {
      Atom a = (Atom) other;
      return polarity == a.polarity && name.equals(a.name);
    }
    return false;
  }

  @Override
  public String toString() {
    return name;
  }
}
