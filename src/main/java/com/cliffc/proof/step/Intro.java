package com.cliffc.proof.step;

import com.cliffc.proof.*;
import com.cliffc.proof.env.Env;
import com.cliffc.proof.print.Coq;
import com.cliffc.proof.print.Dot;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.term.TermBind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Introduce the head universal quantifier of the goal.  A variable used in
 *  the body keeps its own name; a mere hypothesis gets a fresh 'prefix<N>'.
 *  Elaborates to a lambda. */
public final class Intro extends Step<String,Id> {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final Intro STEP = new Intro();
  private Intro() { super("intro"); }

  @Override public Computed<Id> compute( Sequent seq, String prefix ) {
    Term g = seq._goal.reduce();
    if( !(g instanceof TermBind b) || b._kind!=TermBind.Kind.Forall ) {
      LOGGER.warn("Expected a universal quantification, but got: {}",g);
      throw new StepFailure("Can't introduce formula",seq);
    }
    if( b.dependent() ) {
      LOGGER.debug("Declaring {} : {}",b._v,b._v._ty);
      Env e = seq._env.add(b._v);
      return computed(b._v,new Sequent(e,b._body));
    }
    Env.Intro in = seq._env.intro(prefix,b._v._ty);
    LOGGER.debug("Introduced {} : {}",in._id,b._v._ty);
    return computed(in._id,new Sequent(in._env,b._body));
  }

  @Override public Term elaborate( Id id, Term[] args ) {
    if( args.length!=1 ) throw PF.fatal("intro has one branch, got "+args.length);
    return Term.lambda(id,args[0]);
  }

  @Override protected Render<Id> coq() {
    return new Render<>(Pretty.LastBranchIsContinuation,(sb,id) -> Coq.id(sb.p("intro "),id).p('.'));
  }
  @Override protected Render<Id> dot() {
    return new Render<>(Pretty.AllBranchesEquivalent,(sb,id) -> Dot.term(Dot.id(sb,id).p(": "),id._ty));
  }

  public static Pos intro( Pos pos, String prefix ) {
    return Proof.apply_step(pos,STEP,prefix).branch(0);
  }
}
