package edu.jhu.hlt.lgnet.term;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Context terms: covariables, the two division forms, cotensor pairs, and the
 * comu binder which turns a command into a context.
 */
public abstract class ContextTerm extends Term {

  @Override
  public Sort getSort() {
    return Sort.CONTEXT;
  }

  @Override
  public abstract ContextTerm substitute(Term replacement, Term target);

  public static class Covariable extends ContextTerm {
    private final String name;

    public Covariable(String name) {
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
    public ContextTerm substitute(Term replacement, Term target) {
      checkTarget(target);
      if (replacement.getSort() == Sort.CONTEXT && equals(target))
        return (ContextTerm) replacement;
      return this;
    }

    @Override
    public int hashCode() {
      return ~name.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Covariable && name.equals(((Covariable) other).name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** v \ e */
  public static class LeftDivision extends ContextTerm {
    private final ValueTerm left;
    private final ContextTerm right;

    public LeftDivision(ValueTerm left, ContextTerm right) {
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
    public ContextTerm substitute(Term replacement, Term target) {
      return new LeftDivision(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 5 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof LeftDivision) {
        LeftDivision d = (LeftDivision) other;
        return left.equals(d.left) && right.equals(d.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " \\ " + right + ")";
    }
  }

  /** e / v */
  public static class RightDivision extends ContextTerm {
    private final ContextTerm left;
    private final ValueTerm right;

    public RightDivision(ContextTerm left, ValueTerm right) {
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
    public ContextTerm substitute(Term replacement, Term target) {
      return new RightDivision(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 6 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof RightDivision) {
        RightDivision d = (RightDivision) other;
        return left.equals(d.left) && right.equals(d.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " / " + right + ")";
    }
  }

  /** e ⊕ f */
  public static class CoPair extends ContextTerm {
    private final ContextTerm left, right;

    public CoPair(ContextTerm left, ContextTerm right) {
      this.left = left;
      this.right = right;
    }

    public ContextTerm getLeft() {
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
    public ContextTerm substitute(Term replacement, Term target) {
      return new CoPair(left.substitute(replacement, target), right.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 7 + left.hashCode()) + right.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof CoPair) {
        CoPair p = (CoPair) other;
        return left.equals(p.left) && right.equals(p.right);
      }
      return false;
    }

    @Override
    public String toString() {
      return "(" + left + " ⊕ " + right + ")";
    }
  }

  /** μ̃α.c, binds a covariable over a command */
  public static class Comu extends ContextTerm {
    private final String name;
    private final CommandTerm body;

    public Comu(String name, CommandTerm body) {
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
    public ContextTerm substitute(Term replacement, Term target) {
      return new Comu(name, body.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      return 31 * (31 * 8 + name.hashCode()) + body.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Comu) {
        Comu m = (Comu) other;
        return name.equals(m.name) && body.equals(m.body);
      }
      return false;
    }

    @Override
    public String toString() {
      return "μ̃" + name + "." + body;
    }
  }
}
