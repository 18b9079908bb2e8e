package com.cliffc.proof.step;

import com.cliffc.proof.*;
import com.cliffc.proof.env.Env;
import com.cliffc.proof.print.Coq;
import com.cliffc.proof.print.Dot;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Cut on formula 't': first prove 't' in the current environment, then the
 *  goal with a fresh hypothesis of 't'.  Elaborates to a let binding of the
 *  first branch's term around the second's. */
public final class Cut extends Step<Binding,Id> {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final Cut STEP = new Cut();
  private Cut() { super("cut"); }

  @Override public Computed<Id> compute( Sequent seq, Binding b ) {
    Env e = seq._env;
    Env.Intro in = e.intro(b._prefix,b._t);
    LOGGER.debug("cut {} : {}",in._id,b._t);
    return computed(in._id,new Sequent(e,b._t),new Sequent(in._env,seq._goal));
  }

  @Override public Term elaborate( Id id, Term[] args ) {
    if( args.length!=2 ) throw PF.fatal("cut has two branches, got "+args.length);
    return Term.letin(id,args[0],args[1]);
  }

  @Override protected Render<Id> coq() {
    return new Render<>(Pretty.LastBranchIsContinuation,
                        (sb,id) -> Coq.term(Coq.id(sb.p("assert ("),id).p(": "),id._ty).p(")."));
  }
  @Override protected Render<Id> dot() {
    return new Render<>(Pretty.AllBranchesEquivalent,(sb,id) -> Dot.term(Dot.id(sb,id).p(" = "),id._ty));
  }

  /** @return the position proving 't', then the continuation */
  public static Pos[] cut( Pos pos, String prefix, Term t ) {
    return Proof.apply_step(pos,STEP,new Binding(prefix,t))._branches;
  }
}
