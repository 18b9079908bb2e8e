package com.cliffc.proof.prelude;

import com.cliffc.proof.PF;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;

/** Auxiliary declaration some proof steps need emitted before their output:
 *  an import of an external unit, or a named alias for a term.
 *
 *  Entries are made through a {@link PreludeGraph}, which records their
 *  dependencies.
 */
public abstract class Prelude {
  Prelude() { }

  // Import of an external unit
  public static final class Require extends Prelude {
    public final String _unit;
    Require( String unit ) { _unit = unit; }
    @Override public SB str( SB sb ) { return sb.p("require: ").p(_unit); }
    @Override public boolean equals( Object o ) { return o instanceof Require r && _unit.equals(r._unit); }
    @Override public int hashCode() { return _unit.hashCode()*2; }
  }

  // Named alias bound to a term; the name has the term's type
  public static final class Alias extends Prelude {
    public final Id _id;
    public final Term _term;
    Alias( Id id, Term term ) {
      if( !id._ty.equals(term.ty()) )
        throw PF.fatal("Alias "+id+" : "+id._ty+" bound to a term of type "+term.ty());
      _id = id; _term = term;
    }
    @Override public SB str( SB sb ) { return sb.p("alias: ").p(_id).p(" -> ").p(_term); }
    @Override public boolean equals( Object o ) {
      if( !(o instanceof Alias a) || !_id.equals(a._id) ) return false;
      // Same alias name must always stand for the same term
      if( !_term.equals(a._term) ) throw PF.fatal("Alias "+_id+" bound to both "+_term+" and "+a._term);
      return true;
    }
    @Override public int hashCode() { return _id.hashCode()*2+1; }
  }

  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }
}
