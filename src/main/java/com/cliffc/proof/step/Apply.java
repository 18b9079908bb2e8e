package com.cliffc.proof.step;

import com.cliffc.proof.*;
import com.cliffc.proof.env.Env;
import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.print.Coq;
import com.cliffc.proof.print.Dot;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Apply 'f : A0 -> ... -> An-1 -> G' to prove goal 'G'; one new goal per
 *  argument, in the same environment.  With n==0 'f' proves the goal exactly.
 *
 *  The return type must match the goal syntactically, and every free variable
 *  of 'f' must be bound in the environment.
 */
public final class Apply extends Step<Apply.Args,Apply.Args> {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final Apply STEP = new Apply();
  private Apply() { super("apply"); }

  public static final class Args {
    public final Term _f;
    public final int _n;
    public final Prelude[] _preludes;
    public Args( Term f, int n, Prelude... preludes ) { _f = f; _n = n; _preludes = preludes; }
  }

  @Override public Computed<Args> compute( Sequent seq, Args a ) {
    Term f = a._f;
    LOGGER.debug("applying {}",f);
    if( a._n < 0 )
      throw new StepFailure("Negative number of arguments "+a._n+" while applying: "+f,seq);
    Arrows.Split split = Arrows.match_n_arrows(a._n,f.ty());
    if( split==null ) {
      LOGGER.warn("Expected a non-dependent product type but got: {} while applying: {}",f.ty(),f);
      throw new StepFailure("Expected "+a._n+" non-dependent arguments but got: "+f.ty()+" while applying: "+f,seq);
    }
    // The application must prove the current goal
    if( !split._ret.equals(seq._goal) )
      throw new StepFailure("Wrong result type during application, expected "+seq._goal+" but got "+split._ret,seq);
    // The applied term must be closed in the current environment
    Env e = seq._env;
    List<Id> unbound = new ArrayList<>();
    for( Id id : f.free_vars() )
      if( !e.exists(id) )
        unbound.add(id);
    if( !unbound.isEmpty() ) {
      Collections.sort(unbound);
      SB sb = new SB().p("The variables [");
      for( Id id : unbound ) sb.p(id).p("; ");
      throw new StepFailure(sb.unchar(2).p("] are free in ").p(f).toString(),seq);
    }
    Sequent[] goals = new Sequent[a._n];
    for( int i=0; i<goals.length; i++ )
      goals[i] = new Sequent(e,split._args.at(i));
    LOGGER.debug("Goals left: {}",split._args);
    return computed(a,goals);
  }

  @Override public Term elaborate( Args a, Term[] args ) { return Term.app(a._f,args); }

  @Override public Prelude[] prelude( Args a ) { return a._preludes; }

  @Override protected Render<Args> coq() {
    return new Render<>(Pretty.AllBranchesEquivalent,
                        (sb,a) -> Coq.term(sb.p(a._n==0 ? "exact " : "apply "),a._f).p('.'));
  }
  @Override protected Render<Args> dot() {
    return new Render<>(Pretty.AllBranchesEquivalent,(sb,a) -> Dot.term(sb,a._f));
  }

  // Tactics
  public static Pos[] apply( Pos pos, Term f, int n, Prelude... preludes ) {
    return Proof.apply_step(pos,STEP,new Args(f,n,preludes))._branches;
  }
  public static void exact( Pos pos, Term f, Prelude... preludes ) { apply(pos,f,0,preludes); }
  // Apply with as many arguments as the type of 'f' has arrows
  public static Pos[] apply_all( Pos pos, Term f, Prelude... preludes ) {
    Ary<Term> args = Arrows.match_arrows(f.ty())._args;
    return apply(pos,f,args._len,preludes);
  }
}
