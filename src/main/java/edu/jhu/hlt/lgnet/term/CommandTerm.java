package edu.jhu.hlt.lgnet.term;

import java.util.Collections;
import java.util.List;

/**
 * Command terms. A command is either a cut over three names scoping another
 * command, or a binder-free value/context closed off against a name.
 */
public abstract class CommandTerm extends Term {

  @Override
  public Sort getSort() {
    return Sort.COMMAND;
  }

  @Override
  public abstract CommandTerm substitute(Term replacement, Term target);

  /** (first second) / third, then body */
  public static class Cut extends CommandTerm {
    private final String first, second, third;
    private final CommandTerm body;

    public Cut(String first, String second, String third, CommandTerm body) {
      this.first = first;
      this.second = second;
      this.third = third;
      this.body = body;
    }

    public String getFirst() {
      return first;
    }

    public String getSecond() {
      return second;
    }

    public String getThird() {
      return third;
    }

    public CommandTerm getBody() {
      return body;
    }

    @Override
    public List<Term> getChildren() {
      return Collections.<Term>singletonList(body);
    }

    @Override
    public CommandTerm substitute(Term replacement, Term target) {
      return new Cut(first, second, third, body.substitute(replacement, target));
    }

    @Override
    public int hashCode() {
      int h = first.hashCode();
      h = 31 * h + second.hashCode();
      h = 31 * h + third.hashCode();
      return 31 * h + body.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Cut) {
        Cut c = (Cut) other;
        return first.equals(c.first) && second.equals(c.second)
            && third.equals(c.third) && body.equals(c.body);
      }
      return false;
    }

    @Override
    public String toString() {
      return "cut(" + first + " " + second + ")/" + third + "." + body;
    }
  }

  /** v ⌈ α: a binder-free value against a coname */
  public static class Right extends CommandTerm {
    private final ValueTerm value;
    private final String coname;

    public Right(ValueTerm value, String coname) {
      if (!value.isNodeTerm())
        throw new IllegalArgumentException("command needs a binder-free value: " + value);
      this.value = value;
      this.coname = coname;
    }

    public ValueTerm getValue() {
      return value;
    }

    public String getConame() {
      return coname;
    }

    @Override
    public List<Term> getChildren() {
      return Collections.<Term>singletonList(value);
    }

    @Override
    public CommandTerm substitute(Term replacement, Term target) {
      ValueTerm v = value.substitute(replacement, target);
      if (!v.isNodeTerm())
        return this;
      return new Right(v, coname);
    }

    @Override
    public int hashCode() {
      return 31 * value.hashCode() + coname.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Right) {
        Right r = (Right) other;
        return coname.equals(r.coname) && value.equals(r.value);
      }
      return false;
    }

    @Override
    public String toString() {
      return value + " ⌈ " + coname;
    }
  }

  /** x ⌉ e: a name against a binder-free context */
  public static class Left extends CommandTerm {
    private final String name;
    private final ContextTerm context;

    public Left(String name, ContextTerm context) {
      if (!context.isNodeTerm())
        throw new IllegalArgumentException("command needs a binder-free context: " + context);
      this.name = name;
      this.context = context;
    }

    public String getName() {
      return name;
    }

    public ContextTerm getContext() {
      return context;
    }

    @Override
    public List<Term> getChildren() {
      return Collections.<Term>singletonList(context);
    }

    @Override
    public CommandTerm substitute(Term replacement, Term target) {
      ContextTerm e = context.substitute(replacement, target);
      if (!e.isNodeTerm())
        return this;
      return new Left(name, e);
    }

    @Override
    public int hashCode() {
      return ~(31 * name.hashCode() + context.hashCode());
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Left) {
        Left l = (Left) other;
        return name.equals(l.name) && context.equals(l.context);
      }
      return false;
    }

    @Override
    public String toString() {
      return name + " ⌉ " + context;
    }
  }
}
