package com.cliffc.proof.print;

import com.cliffc.proof.*;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;

/** Coq output: terms, and proof scripts.
 *
 *  Scripts print each closed node's tactic, then its branches.  Peer branches
 *  get a bullet keyed on depth ('-', '+', then '--', '++', ...).  For a step
 *  whose last branch is the rest of the proof, the side branches are boxed in
 *  braces and the last one follows at the same depth, walked in a loop so
 *  long chains of cuts or intros do not recurse.
 */
public abstract class Coq {
  // Bullet glyphs, cycled by depth and repeated once per full cycle
  public static char[] BULLETS = {'-','+'};

  public static SB id( SB sb, Id id ) { return sb.p(id._name); }
  public static SB term( SB sb, Term t ) { return t.str(sb); }

  static SB bullet( SB sb, int depth ) {
    int n = BULLETS.length;
    return sb.rep(BULLETS[depth % n],depth/n+1);
  }

  public static SB proof( SB sb, Proof p ) {
    sb.p("(* PROOF START *)").nl();
    node(sb,p.root(),0);
    return sb.nl().p("(* PROOF END *)").nl();
  }

  static void node( SB sb, Node n, int depth ) {
    while( true ) {
      if( !(n.extract() instanceof Node.Closed<?> c) ) throw new OpenProof(n);
      c.print(Lang.Coq,sb);
      int len = c.nbranches();
      if( len==0 ) return;
      if( len==1 ) { sb.nl(); n = c.branch(0); continue; }
      if( c.pretty(Lang.Coq)==Pretty.AllBranchesEquivalent ) {
        for( int i=0; i<len; i++ ) {
          bullet(sb.nl(),depth).s().ii(1);
          node(sb,c.branch(i),depth+1);
          sb.di(1);
        }
        return;
      }
      // Side conditions boxed, then the continuation at this same depth
      for( int i=0; i<len-1; i++ ) {
        sb.nl().p("{ ").ii(1);
        node(sb,c.branch(i),depth);
        sb.di(1).p(" }");
      }
      sb.nl();
      n = c.branch(len-1);
    }
  }

  public static SB proof_term( SB sb, Term t ) {
    sb.p("(* PROOF START *)").nl();
    return term(sb,t).nl().p("(* PROOF END *)").nl();
  }
}
