package com.cliffc.proof;

import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.SB;

/** A proof tree node.
 *
 *  Starts Open on a sequent and is closed at most once, in place, by a step;
 *  closing never reopens.  A node knows its own position, and caches its
 *  elaborated term.
 */
public final class Node {
  private static int CNT=1;
  public final int _uid;        // Unique, increasing; display only
  final Pos _pos;               // Where this node lives
  State _proof;                 // Open or Closed
  Term _term;                   // Elaborated term, set at most once

  public abstract static class State { State() { } }

  public static final class Open extends State {
    public final Sequent _seq;
    Open( Sequent seq ) { _seq = seq; }
  }

  public static final class Closed<S> extends State {
    public final Step<?,S> _step;
    public final S _state;
    final Node[] _branches;
    Closed( Step<?,S> step, S state, Node[] branches ) { _step = step; _state = state; _branches = branches; }

    Term elaborate( Term[] args ) { return _step.elaborate(_state,args); }
    public Prelude[] prelude() { return _step.prelude(_state); }
    public Pretty pretty( Lang lang ) { return _step.render(lang)._pretty; }
    public SB print( Lang lang, SB sb ) { return _step.render(lang)._pp.print(sb,_state); }
    public int nbranches() { return _branches.length; }
    public Node branch( int i ) { return _branches[i]; }
  }

  Node( Pos pos, State proof ) { this(CNT++,pos,proof); }
  private Node( int uid, Pos pos, State proof ) { _uid = uid; _pos = pos; _proof = proof; }

  // Fills fresh containers before the real nodes exist
  static final Node PLACEHOLDER = new Node(0,new Pos(new Node[0],-1),null);

  // The single Open -> Closed transition
  <S> void close( Step<?,S> step, S state, Node[] branches ) {
    if( !(_proof instanceof Open) )
      throw PF.fatal("Trying to apply reasoning step to an already closed proof");
    _proof = new Closed<>(step,state,branches);
  }

  public Pos pos() { return _pos; }
  public boolean is_open() { return _proof instanceof Open; }

  /** @return the raw state, without its state type */
  public State extract() { return _proof; }

  /** @return the sequent of an open node */
  public Sequent sequent() {
    if( _proof instanceof Open open ) return open._seq;
    throw PF.fatal("No sequent on closed node "+_uid);
  }

  /** @return the children of a closed node */
  public Node[] branches() {
    if( _proof instanceof Closed<?> c ) return c._branches.clone();
    throw new OpenProof(this);
  }

  @Override public String toString() {
    return _proof instanceof Closed<?> c ? _uid+":"+c._step._name : _uid+":open";
  }
}
