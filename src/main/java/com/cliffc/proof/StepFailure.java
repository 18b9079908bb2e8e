package com.cliffc.proof;

// A step does not apply to this sequent; try something else
public class StepFailure extends RuntimeException {
  public final Sequent _seq;
  public StepFailure( String msg, Sequent seq ) { super(msg); _seq = seq; }
}
