package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.Set;

// The sorts; Prop : Type and Type : Type.
public final class TermSort extends Term {
  public enum Kind { Prop, Type }
  public final Kind _kind;
  TermSort( Kind kind ) { super(kind==Kind.Type ? null : Term.TYPE, 0x50 + kind.ordinal()); _kind = kind; }

  @Override public boolean occurs( Id v ) { return false; }
  @Override void free_vars( Set<Id> acc, Ary<Id> bound ) { }
  @Override Term subst0( Id v, Term t ) { return this; }
  @Override boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs ) { return _kind==((TermSort)t)._kind; }
  @Override boolean atomic() { return true; }
  @Override public SB str( SB sb ) { return sb.p(_kind.name()); }
}
