package com.cliffc.proof.step;

import com.cliffc.proof.term.Term;

// A name prefix and the term to bind under it; input of letin and cut
public final class Binding {
  public final String _prefix;
  public final Term _t;
  public Binding( String prefix, Term t ) { _prefix = prefix; _t = t; }
}
