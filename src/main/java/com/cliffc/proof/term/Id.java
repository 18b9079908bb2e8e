package com.cliffc.proof.term;

import com.cliffc.proof.util.SB;

/** A typed name.
 *
 *  Either a plain variable (bound by a quantifier, a lambda, a let, or minted
 *  fresh by an environment) or a declared constant (a global symbol such as an
 *  axiom or a type constructor).  Constants are never free variables of a
 *  term.
 */
public final class Id implements Comparable<Id> {
  public final String _name;
  public final Term _ty;
  public final boolean _var;    // Plain variable vs declared constant
  private TermVar _term;        // Lazily built use-site term

  private Id( String name, Term ty, boolean var ) {
    assert name!=null && ty!=null;
    _name = name; _ty = ty; _var = var;
  }
  public static Id var( String name, Term ty ) { return new Id(name,ty,true ); }
  public static Id cst( String name, Term ty ) { return new Id(name,ty,false); }

  public boolean is_var() { return _var; }

  // Same flavor and name, different type
  Id retype( Term ty ) { return ty==_ty ? this : new Id(_name,ty,_var); }
  Id rename( String name ) { return new Id(name,_ty,_var); }

  /** @return the term standing for a use of this identifier */
  public TermVar term() {
    if( _term==null ) _term = new TermVar(this);
    return _term;
  }

  public SB str( SB sb ) { return sb.p(_name).p(" : ").p(_ty); }

  @Override public String toString() { return _name; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Id id && _var==id._var && _name.equals(id._name) && _ty.equals(id._ty);
  }
  @Override public int hashCode() { return _name.hashCode()*31 + _ty.hashCode(); }
  @Override public int compareTo( Id id ) { return _name.compareTo(id._name); }
}
