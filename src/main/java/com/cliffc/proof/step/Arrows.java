package com.cliffc.proof.step;

import com.cliffc.proof.term.Term;
import com.cliffc.proof.term.TermBind;
import com.cliffc.proof.util.Ary;
import org.jetbrains.annotations.Nullable;

// Matching non-dependent products, A0 -> A1 -> ... -> R
public abstract class Arrows {

  // Argument types and the remaining return type
  public static final class Split {
    public final Ary<Term> _args;
    public final Term _ret;
    Split( Ary<Term> args, Term ret ) { _args = args; _ret = ret; }
  }

  /** @return the product if 'ty' head-reduces to a non-dependent one, or null */
  public static @Nullable TermBind match_arrow( Term ty ) {
    Term t = ty.reduce();
    return t instanceof TermBind b && b._kind==TermBind.Kind.Forall && !b.dependent() ? b : null;
  }

  /** Peel off as many leading arrows as possible */
  public static Split match_arrows( Term ty ) {
    Ary<Term> args = new Ary<>();
    TermBind b;
    while( (b = match_arrow(ty))!=null ) {
      args.push(b._v._ty);
      ty = b._body;
    }
    return new Split(args,ty);
  }

  /** Peel off exactly 'n' leading arrows
   *  @return null if there are fewer than 'n' */
  public static @Nullable Split match_n_arrows( int n, Term ty ) {
    Ary<Term> args = new Ary<>();
    for( int i=0; i<n; i++ ) {
      TermBind b = match_arrow(ty);
      if( b==null ) return null;
      args.push(b._v._ty);
      ty = b._body;
    }
    return new Split(args,ty);
  }
}
