package com.cliffc.proof;

/** A stable handle on one slot of a node container.  Valid for the life of
 *  the proof: containers are never resized, and nodes are closed in place. */
public final class Pos {
  final Node[] _nodes;
  final int _idx;
  Pos( Node[] nodes, int idx ) { _nodes = nodes; _idx = idx; }

  public Node get() { return _nodes[_idx]; }

  @Override public boolean equals( Object o ) {
    return o instanceof Pos p && _nodes==p._nodes && _idx==p._idx;
  }
  @Override public int hashCode() { return System.identityHashCode(_nodes)*31+_idx; }
  @Override public String toString() { return _idx<0 ? "#-" : "#"+get()._uid; }
}
