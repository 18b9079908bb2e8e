package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.Set;

// let v := e in body
public final class TermLet extends Term {
  public final Id _v;
  public final Term _e, _body;

  TermLet( Id v, Term e, Term body ) {
    super(type(v,e,body), mix(mix(mix(0x4C,v._ty.hashCode()),e.hashCode()),body.hashCode()));
    _v = v; _e = e; _body = body;
  }
  private static Term type( Id v, Term e, Term body ) {
    if( !e.ty().equals(v._ty) )
      throw new IllegalArgumentException("Type mismatch: let-bound '"+v+"' has type "+v._ty+" but is bound to "+e+" : "+e.ty());
    return body.ty().subst(v,e);
  }

  @Override public boolean occurs( Id v ) {
    return _v._ty.occurs(v) || _e.occurs(v) || (!_v.equals(v) && _body.occurs(v));
  }
  @Override void free_vars( Set<Id> acc, Ary<Id> bound ) {
    _v._ty.free_vars(acc,bound);
    _e.free_vars(acc,bound);
    bound.push(_v);
    _body.free_vars(acc,bound);
    bound.pop();
  }
  @Override Term subst0( Id v, Term t ) {
    Id nv = _v.retype(_v._ty.subst(v,t));
    Term e = _e.subst(v,t);
    if( _v.equals(v) )
      return new TermLet(nv,e,nv==_v ? _body : _body.subst(_v,nv.term()));
    nv = fresh(nv,t,_body);
    Term body = nv==_v ? _body : _body.subst(_v,nv.term());
    return new TermLet(nv,e,body.subst(v,t));
  }
  @Override boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs ) {
    TermLet let = (TermLet)t;
    if( !_v._ty.eq(let._v._ty,lhs,rhs) || !_e.eq(let._e,lhs,rhs) ) return false;
    lhs.push(_v);  rhs.push(let._v);
    boolean eq = _body.eq(let._body,lhs,rhs);
    lhs.pop();     rhs.pop();
    return eq;
  }

  @Override public SB str( SB sb ) {
    return _body.str(_e.str(sb.p("let ").p(_v._name).p(" := ")).p(" in "));
  }
}
