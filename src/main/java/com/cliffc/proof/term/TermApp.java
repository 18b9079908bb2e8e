package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.Set;

// Application of a function to one argument
public final class TermApp extends Term {
  public final Term _fun, _arg;
  TermApp( Term fun, Term arg ) {
    super(type(fun,arg), mix(mix(0x41,fun.hashCode()),arg.hashCode()));
    _fun = fun; _arg = arg;
  }

  // The function's type must expose a product whose domain is exactly the
  // argument's type.
  private static Term type( Term fun, Term arg ) {
    Term fty = fun.ty().reduce();
    if( !(fty instanceof TermBind b) || b._kind!=TermBind.Kind.Forall )
      throw new IllegalArgumentException("Not a function: "+fun+" : "+fun.ty());
    if( !arg.ty().equals(b._v._ty) )
      throw new IllegalArgumentException("Type mismatch: '"+arg+"' has type "+arg.ty()+", but an expression of type "+b._v._ty+" was expected");
    return b._body.subst(b._v,arg);
  }

  /** @return the head of the application spine */
  public Term head() { Term t = this; while( t instanceof TermApp app ) t = app._fun; return t; }
  /** @return the arguments of the application spine, in order */
  public Ary<Term> args() {
    Ary<Term> args = new Ary<>();
    for( Term t = this; t instanceof TermApp app; t = app._fun ) args.push(app._arg);
    for( int i=0, j=args._len-1; i<j; i++, j-- ) {
      Term x = args.at(i);
      args.set(i,args.at(j));
      args.set(j,x);
    }
    return args;
  }

  @Override public boolean occurs( Id v ) { return _fun.occurs(v) || _arg.occurs(v); }
  @Override void free_vars( Set<Id> acc, Ary<Id> bound ) { _fun.free_vars(acc,bound); _arg.free_vars(acc,bound); }
  @Override Term subst0( Id v, Term t ) { return new TermApp(_fun.subst(v,t),_arg.subst(v,t)); }
  @Override boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs ) {
    TermApp app = (TermApp)t;
    return _fun.eq(app._fun,lhs,rhs) && _arg.eq(app._arg,lhs,rhs);
  }

  @Override public SB str( SB sb ) {
    head().str_arg(sb);
    for( Term arg : args() ) arg.str_arg(sb.s());
    return sb;
  }
}
