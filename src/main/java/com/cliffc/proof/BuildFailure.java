package com.cliffc.proof;

import com.cliffc.proof.util.SB;

/** Applying a step failed.  Carries the position of the offending open node;
 *  the message includes its sequent, bindings and goal, for the user. */
public class BuildFailure extends RuntimeException {
  public final String _msg;
  public final Pos _pos;

  BuildFailure( String msg, Pos pos, Throwable cause ) {
    super(context(msg,pos),cause);
    _msg = msg;
    _pos = pos;
  }

  private static String context( String msg, Pos pos ) {
    Node n = pos.get();
    SB sb = new SB().p("In context:").ii(1).nl().p(n._uid).p(": ");
    if( n._proof instanceof Node.Open open ) open._seq.str(sb);
    return sb.di(1).nl().p(msg).toString();
  }
}
