package com.cliffc.proof.term;

import com.cliffc.proof.util.Ary;
import com.cliffc.proof.util.SB;

import java.util.Set;

// Use of an identifier
public final class TermVar extends Term {
  public final Id _id;
  // The hash only sees the type, so renaming a bound variable keeps it
  TermVar( Id id ) { super(id._ty, mix(0x71,id._ty.hashCode())); _id = id; }

  @Override public boolean occurs( Id v ) { return _id.equals(v); }
  @Override void free_vars( Set<Id> acc, Ary<Id> bound ) {
    if( _id._var && bound.find(_id)==-1 ) acc.add(_id);
  }
  @Override Term subst0( Id v, Term t ) { return _id.equals(v) ? t : this; }

  @Override boolean eq( Term t, Ary<Id> lhs, Ary<Id> rhs ) {
    Id id = ((TermVar)t)._id;
    int l = depth(lhs,_id), r = depth(rhs,id);
    if( l!=r ) return false;
    return l!=-1 || _id.equals(id);
  }
  // Distance from the innermost binder, or -1 if free
  private static int depth( Ary<Id> bound, Id id ) {
    for( int i=bound._len-1; i>=0; i-- )
      if( bound.at(i).equals(id) )
        return bound._len-1-i;
    return -1;
  }

  @Override boolean atomic() { return true; }
  @Override public SB str( SB sb ) { return sb.p(_id._name); }
}
