package com.cliffc.proof.env;

import com.cliffc.proof.term.Id;

// Binding a name already bound in the environment
public class NameConflict extends RuntimeException {
  public final Id _new, _old;
  public NameConflict( Id nnew, Id old ) {
    super("Following ids conflict: "+nnew+" <> "+old);
    _new = nnew;
    _old = old;
  }
}
