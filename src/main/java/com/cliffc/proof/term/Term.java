package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Terms of a small typed calculus; proofs are terms and goals are types.

 Immutable.  Every term carries its type, computed and checked at
 construction.  Equality is structural up to renaming of bound variables, and
 the hash is computed bottom-up so it agrees with that equality.

 BNF of the printed forms:
    t = Prop | Type             | // Sorts; Prop : Type : Type
        x                       | // Use of an identifier
        t0 t1 ... tn            | // Application
        forall (x : T), t       | // Dependent product
        T0 -> T1                | // Non-dependent product
        fun (x : T) => t        | // Lambda
        let x := t0 in t1       | // Let binding
 */
public abstract class Term {
  public static final TermSort TYPE = new TermSort(TermSort.Kind.Type);
  public static final TermSort PROP = new TermSort(TermSort.Kind.Prop);

  final Term _ty;               // Null only for TYPE, which is its own type
  final int _hash;              // Alpha-invariant hash

  Term( Term ty, int hash ) { _ty = ty; _hash = hash==0 ? 0xcafebabe : hash; }

  /** @return the type of this term */
  public Term ty() { return _ty==null ? this : _ty; }

  // ---------------------------------------------------------------------
  // Constructors
  public static TermVar var( Id id ) { return id.term(); }
  public static Term app( Term f, Term... args ) {
    for( Term arg : args ) f = new TermApp(f,arg);
    return f;
  }
  public static Term apply( Term f, List<Term> args ) { return app(f,args.toArray(new Term[0])); }
  public static TermBind forall( Id v, Term body ) { return new TermBind(TermBind.Kind.Forall,v,body); }
  public static TermBind lambda( Id v, Term body ) { return new TermBind(TermBind.Kind.Lambda,v,body); }
  public static TermLet  letin ( Id v, Term e, Term body ) { return new TermLet(v,e,body); }
  // Non-dependent product, with an anonymous bound variable
  public static TermBind arrow( Term arg, Term ret ) {
    Id v = Id.var("_",arg);
    for( int i=0; ret.occurs(v); i++ ) v = Id.var("_"+i,arg);
    return forall(v,ret);
  }
  public static Term arrows( Term ret, Term... args ) {
    for( int i=args.length-1; i>=0; i-- ) ret = arrow(args[i],ret);
    return ret;
  }

  // ---------------------------------------------------------------------
  // Structure

  /** @return true if 'v' occurs free in this term */
  public abstract boolean occurs( Id v );

  /** @return the set of free plain variables; constants are not included */
  public final Set<Id> free_vars() { HashSet<Id> s = new HashSet<>(); free_vars(s, new Ary<>()); return s; }
  abstract void free_vars( Set<Id> acc, Ary<Id> bound );

  /** Capture-avoiding substitution of 't' for free occurrences of 'v'. */
  public final Term subst( Id v, Term t ) {
    return occurs(v) ? subst0(v,t) : this;
  }
  abstract Term subst0( Id v, Term t );

  /** Head reduction: beta and zeta redexes at the head are contracted until
   *  the head is a sort, a variable, a binder or a stuck application. */
  public Term reduce() {
    Term t = this;
    while( true ) {
      if( t instanceof TermLet let ) { t = let._body.subst(let._v,let._e); continue; }
      if( t instanceof TermApp app ) {
        Term f = app._fun.reduce();
        if( f instanceof TermBind b && b._kind==TermBind.Kind.Lambda ) {
          t = b._body.subst(b._v,app._arg);
          continue;
        }
      }
      return t;
    }
  }

  // Binder variable, renamed if it would capture something free in 't'.  The
  // new name also avoids everything free in 'body'.
  static Id fresh( Id v, Term t, Term body ) {
    Set<Id> fvs = new HashSet<>();
    t.free_vars(fvs,new Ary<>());
    if( !clash(fvs,v._name) ) return v;
    body.free_vars(fvs,new Ary<>());
    String name = v._name;
    while( clash(fvs,name) ) name += "'";
    return v.rename(name);
  }
  private static boolean clash( Set<Id> fvs, String name ) {
    for( Id id : fvs ) if( id._name.equals(name) ) return true;
    return false;
  }

  // ---------------------------------------------------------------------
  // Equality, up to renaming of bound variables.  'lhs' and 'rhs' are the
  // binders passed on the way down, innermost last.
  abstract boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs );

  @Override public final boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Term t) || _hash!=t._hash || getClass()!=t.getClass() ) return false;
    return eq(t,new Ary<>(),new Ary<>());
  }
  @Override public final int hashCode() { return _hash; }

  static int mix( int a, int b ) { return a*0x9E3779B1 + (b ^ (b>>>16)); }

  // ---------------------------------------------------------------------
  // Printing
  public abstract SB str( SB sb );
  // Atoms print without parens when used as an argument
  boolean atomic() { return false; }
  SB str_arg( SB sb ) { return atomic() ? str(sb) : str(sb.p('(')).p(')'); }
  @Override public final String toString() { return str(new SB()).toString(); }
}
