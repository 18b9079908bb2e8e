package com.cliffc.proof;

// A closed node was expected, but the proof is not finished there
public class OpenProof extends RuntimeException {
  public final Node _node;
  public OpenProof( Node node ) { super("Open proof at node "+node._uid); _node = node; }
}
