package com.cliffc.proof.print;

import com.cliffc.proof.*;
import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.prelude.PreludeGraph;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;
import org.jetbrains.annotations.Nullable;

import java.util.function.UnaryOperator;

/** Entry points for printing proofs, finished or not, in any {@link Lang}. */
public abstract class Printer {

  // Preludes for a proof script, or for a standalone proof term
  public enum Mode { Proof, Term }

  public static SB prelude( SB sb, Lang lang, Mode mode, Prelude p ) {
    if( lang==Lang.Dot ) return sb;
    if( p instanceof Prelude.Require r )
      return sb.p("(* Prelude: Module import *)").nl().p("Require Import ").p(r._unit).p('.').nl();
    Prelude.Alias a = (Prelude.Alias)p;
    sb.p("(* Prelude: Alias *)").nl();
    if( mode==Mode.Proof )
      return Coq.term(Coq.id(sb.p("pose ( "),a._id).p(" := "),a._term).p(" ).").nl();
    return Coq.term(Coq.term(Coq.id(sb.p("Definition "),a._id).p(" : "),a._id._ty).p(" := "),a._term).p('.').nl();
  }

  /** Print every prelude the given ones need, dependencies first, once each */
  public static SB preludes( SB sb, PreludeGraph g, Lang lang, Mode mode, Iterable<Prelude> l ) {
    g.emit(l,p -> prelude(sb,lang,mode,p));
    return sb;
  }

  /** Preludes, then the proof.  Dot shows open nodes; Coq needs a finished proof. */
  public static SB print( SB sb, Registry reg, Lang lang, Proof p ) {
    preludes(sb,reg._preludes,lang,Mode.Proof,p.preludes());
    return lang==Lang.Dot ? Dot.proof(sb,p) : Coq.proof(sb,p);
  }
  public static String print( Registry reg, Lang lang, Proof p ) { return print(new SB(),reg,lang,p).toString(); }

  /** Elaborate, optionally post-process, and print the proof term.  The
   *  post-processing must keep the term's type. */
  public static SB print_term( SB sb, Lang lang, Proof p, @Nullable UnaryOperator<Term> process ) {
    Term t = Elaborate.elaborate(p);
    Term t2 = process==null ? t : process.apply(t);
    if( !t.ty().equals(t2.ty()) )
      throw PF.fatal("Post-processing changed the proof type from "+t.ty()+" to "+t2.ty());
    return lang==Lang.Dot ? Dot.proof_term(sb,p._root,t2) : Coq.proof_term(sb,t2);
  }
  public static String print_term( Lang lang, Proof p ) { return print_term(new SB(),lang,p,null).toString(); }

  public static SB print_term_preludes( SB sb, Registry reg, Lang lang, Proof p ) {
    return preludes(sb,reg._preludes,lang,Mode.Term,p.preludes());
  }
}
