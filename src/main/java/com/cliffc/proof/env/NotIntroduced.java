package com.cliffc.proof.env;

import com.cliffc.proof.term.Term;

// Lookup (direct or coerced) found no identifier for a term
public class NotIntroduced extends RuntimeException {
  public final Term _term;
  public NotIntroduced( Term term ) {
    super("Following formula is used in a context where it is not declared: "+term);
    _term = term;
  }
}
