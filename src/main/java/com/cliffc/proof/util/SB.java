package com.cliffc.proof.util;

import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing.
 *  Every printer in the engine writes into one of these. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( Term t ) { return t.str(this); }
  public SB p( Id id ) { _sb.append(id._name); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally call the Object
  // version with a Term and lose the pretty printer.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  public SB s() { _sb.append(' '); return this; }
  // Repeat a char n times
  public SB rep( char c, int n ) { for( int i=0; i<n; i++ ) _sb.append(c); return this; }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  // Remove the last n chars
  public SB unchar( int n ) { _sb.setLength(_sb.length()-n); return this; }

  // Newline, then indent to the current level
  public SB nl( ) { p('\n'); for( int i=0; i<_indent; i++ ) p("  "); return this; }

  @Override public String toString() { return _sb.toString(); }
}
