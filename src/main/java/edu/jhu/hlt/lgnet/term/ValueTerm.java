package edu.jhu.hlt.lgnet.term;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Value terms: variables, tensor pairs, the two difference forms, and the mu
 * binder which turns a command into a value.
 */
public abstract class ValueTerm extends Term {

  @Override
  public Sort getSort() {
    return Sort.VALUE;
  }

  @Override
  public abstract ValueTerm substitute(Term replacement, Term target);

  public static class Variable extends ValueTerm {
    private final String name;

    public Variable(String name) {
      if (name == null)
        throw new IllegalArgumentException();
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public List<Term> getChildren() {
      return Collections.emptyList();
    }

    @Override
    public ValueTerm substitute(Term replacement, Term target) {
      checkTarget(target);
      if (replacement.getSort() == Sort.VALUE && equals(target))
        return (ValueTerm) replacement;
      return this;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Variable && name.equals(((Variable) other).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** v ⊗ w */
  public static class Pair extends ValueTerm {
    private final ValueTerm left, right;

    public Pair(ValueTerm left, ValueTerm right) {
      this.left = left;
      this.right = right;
    }

    public ValueTerm getLeft() {
      return left;
    }

    public ValueTerm getRight() {
      return right;
    }

    @Override
    public List<Term> getChildren() {
      return Arrays.<Term>asList(left, right);
    }

    @Override
    public ValueTerm substitute(Term replacement, Term target) {
      return new Pair(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 1 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Pair) {
        Pair p = (Pair) other;
        return left.equals(p.left) && right.equals(p.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " ⊗ " + right + ")";
    }
  }

  /** e ▷ v */
  public static class LeftDifference extends ValueTerm {
    private final ContextTerm left;
    private final ValueTerm right;

    public LeftDifference(ContextTerm left, ValueTerm right) {
      this.left = left;
      this.right = right;
    }

    public ContextTerm getLeft() {
      return left;
    }

    public ValueTerm getRight() {
      return right;
    }

    @Override
    public List<Term> getChildren() {
      return Arrays.<Term>asList(left, right);
    }

    @Override
    public ValueTerm substitute(Term replacement, Term target) {
      return new LeftDifference(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 2 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof LeftDifference) {
        LeftDifference d = (LeftDifference) other;
        return left.equals(d.left) && right.equals(d.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " ▷ " + right + ")";
    }
  }

  /** v ⊘ e */
  public static class RightDifference extends ValueTerm {
    private final ValueTerm left;
    private final ContextTerm right;

    public RightDifference(ValueTerm left, ContextTerm right) {
      this.left = left;
      this.right = right;
    }

    public ValueTerm getLeft() {
      return left;
    }

    public ContextTerm getRight() {
      return right;
    }

    @Override
    public List<Term> getChildren() {
      return Arrays.<Term>asList(left, right);
    }

    @Override
    public ValueTerm substitute(Term replacement, Term target) {
      return new RightDifference(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 3 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof RightDifference) {
        RightDifference d = (RightDifference) other;
        return left.equals(d.left) && right.equals(d.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " ⊘ " + right + ")";
    }
  }

  /** μx.c, binds a variable over a command */
  public static class Mu extends ValueTerm {
    private final String name;
    private final CommandTerm body;

    public Mu(String name, CommandTerm body) {
      this.name = name;
      this.body = body;
    }

    public String getName() {
      return name;
    }

    public CommandTerm getBody() {
      return body;
    }

    @Override
    public boolean containsBinder() {
      return true;
    }

    @Override
    public List<Term> getChildren() {
      return Collections.<Term>singletonList(body);
    }

    @Override
    public ValueTerm substitute(Term replacement, Term target) {
      return new Mu(name, body.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 4 + name.hashCode()) + body.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Mu) {
        Mu m = (Mu) other;
        return name.equals(m.name) && body.equals(m.body);
      }
      return false;
    }

    @Override
    public String toString() {
      return "μ" + name + "." + body;
    }
  }
}
