package com.cliffc.proof.step;

import com.cliffc.proof.*;
import com.cliffc.proof.env.Env;
import com.cliffc.proof.print.Coq;
import com.cliffc.proof.print.Dot;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Name an existing term: a fresh identifier of its type, same goal
public final class LetIn extends Step<Binding,LetIn.Bound> {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final LetIn STEP = new LetIn();
  private LetIn() { super("letin"); }

  public static final class Bound {
    public final Id _id;
    public final Term _t;
    Bound( Id id, Term t ) { _id = id; _t = t; }
  }

  @Override public Computed<Bound> compute( Sequent seq, Binding b ) {
    Env.Intro in = seq._env.intro(b._prefix,b._t.ty());
    LOGGER.debug("let_binding {} = {}",in._id,b._t);
    return computed(new Bound(in._id,b._t),new Sequent(in._env,seq._goal));
  }

  @Override public Term elaborate( Bound b, Term[] args ) {
    if( args.length!=1 ) throw PF.fatal("letin has one branch, got "+args.length);
    return Term.letin(b._id,b._t,args[0]);
  }

  @Override protected Render<Bound> coq() {
    return new Render<>(Pretty.LastBranchIsContinuation,
                        (sb,b) -> Coq.id(Coq.term(sb.p("pose proof ("),b._t).p(") as "),b._id).p('.'));
  }
  @Override protected Render<Bound> dot() {
    return new Render<>(Pretty.AllBranchesEquivalent,(sb,b) -> Dot.term(Dot.id(sb,b._id).p(" = "),b._t));
  }

  public static Pos letin( Pos pos, String prefix, Term t ) {
    return Proof.apply_step(pos,STEP,new Binding(prefix,t)).branch(0);
  }
}
