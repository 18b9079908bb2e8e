package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.Set;

// Binders: dependent products and lambdas
public final class TermBind extends Term {
  public enum Kind { Forall, Lambda }
  public final Kind _kind;
  public final Id _v;
  public final Term _body;

  TermBind( Kind kind, Id v, Term body ) {
    super(type(kind,v,body), mix(mix(0x42+kind.ordinal(),v._ty.hashCode()),body.hashCode()));
    _kind = kind; _v = v; _body = body;
  }
  private static Term type( Kind kind, Id v, Term body ) {
    return kind==Kind.Forall ? body.ty() : new TermBind(Kind.Forall,v,body.ty());
  }

  /** @return true if the bound variable is used in the body; false for simple arrows */
  public boolean dependent() { return _body.occurs(_v); }

  @Override public boolean occurs( Id v ) {
    return _v._ty.occurs(v) || (!_v.equals(v) && _body.occurs(v));
  }
  @Override void free_vars( Set<Id> acc, Ary<Id> bound ) {
    _v._ty.free_vars(acc,bound);
    bound.push(_v);
    _body.free_vars(acc,bound);
    bound.pop();
  }
  @Override Term subst0( Id v, Term t ) {
    Id nv = _v.retype(_v._ty.subst(v,t));
    if( _v.equals(v) )          // Shadowed; only the binder type sees the substitution
      return nv==_v ? this : new TermBind(_kind,nv,_body.subst(_v,nv.term()));
    nv = fresh(nv,t,_body);
    Term body = nv==_v ? _body : _body.subst(_v,nv.term());
    return new TermBind(_kind,nv,body.subst(v,t));
  }
  @Override boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs ) {
    TermBind b = (TermBind)t;
    if( _kind!=b._kind || !_v._ty.eq(b._v._ty,lhs,rhs) ) return false;
    lhs.push(_v);  rhs.push(b._v);
    boolean eq = _body.eq(b._body,lhs,rhs);
    lhs.pop();     rhs.pop();
    return eq;
  }

  @Override public SB str( SB sb ) {
    if( _kind==Kind.Lambda )
      return _body.str(sb.p("fun (").p(_v._name).p(" : ").p(_v._ty).p(") => "));
    if( !dependent() ) {
      if( _v._ty instanceof TermBind || _v._ty instanceof TermLet ) _v._ty.str(sb.p('(')).p(')');
      else _v._ty.str(sb);
      return _body.str(sb.p(" -> "));
    }
    return _body.str(sb.p("forall (").p(_v._name).p(" : ").p(_v._ty).p("), "));
  }
}
