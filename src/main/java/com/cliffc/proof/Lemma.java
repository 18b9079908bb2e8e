package com.cliffc.proof;

import com.cliffc.proof.term.Term;

// A lemma some theory plugin produced, and now has to prove
public final class Lemma {
  public final String _plugin;  // Plugin owning the lemma
  public final String _name;
  public final Term _goal;
  public final Object _info;    // Plugin private data
  public Lemma( String plugin, String name, Term goal, Object info ) {
    _plugin = plugin; _name = name; _goal = goal; _info = info;
  }
  @Override public String toString() { return _plugin+"/"+_name+" : "+_goal; }
}
