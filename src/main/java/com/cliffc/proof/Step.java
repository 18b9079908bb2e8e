package com.cliffc.proof;

import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.term.Term;

/** One kind of reasoning step.
 *
 *  A step is immutable and reusable; many nodes share the same Step.  Each use
 *  takes an input 'I' and records a private state 'S' in the node it closes.
 *  {@link #compute} turns a goal into new goals, {@link #elaborate} later
 *  rebuilds this step's term from the terms of those goals, and {@link
 *  #render} prints it.
 *
 * @param <I> input supplied by the caller
 * @param <S> per-node state
 */
public abstract class Step<I,S> {
  public static final Prelude[] NO_PRELUDE = new Prelude[0];

  public final String _name;
  protected Step( String name ) { _name = name; }

  // State and new goals of one application
  public static final class Computed<S> {
    public final S _state;
    public final Sequent[] _goals;
    Computed( S state, Sequent[] goals ) { _state = state; _goals = goals; }
  }
  protected static <S> Computed<S> computed( S state, Sequent... goals ) { return new Computed<>(state,goals); }

  /** Apply to the sequent.  Must not mutate it; returns fresh sequents, one
   *  per new branch.
   *  @throws StepFailure if the step does not apply here */
  public abstract Computed<S> compute( Sequent seq, I input );

  /** @param args elaborated terms of the branches, in the order compute returned them
   *  @return this step's term */
  public abstract Term elaborate( S state, Term[] args );

  /** @return auxiliary declarations this use needs */
  public Prelude[] prelude( S state ) { return NO_PRELUDE; }

  public final Render<S> render( Lang lang ) { return lang==Lang.Coq ? coq() : dot(); }
  protected abstract Render<S> coq();
  protected Render<S> dot() { return new Render<>(Pretty.AllBranchesEquivalent,(sb,s) -> sb.p("N/A")); }

  @Override public String toString() { return _name; }
}
