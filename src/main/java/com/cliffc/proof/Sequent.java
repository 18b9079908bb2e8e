package com.cliffc.proof;

import com.cliffc.proof.env.Env;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;

// Prove '_goal' under the bindings of '_env'
public final class Sequent {
  public final Env _env;
  public final Term _goal;
  public Sequent( Env env, Term goal ) { _env = env; _goal = goal; }

  public SB str( SB sb ) {
    sb.p("sequent:").ii(1).nl().p("env:").ii(1);
    for( Id id : _env.bindings() )
      id.str(sb.nl());
    sb.di(1).nl().p("goal: ").p(_goal);
    return sb.di(1);
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
