package com.cliffc.proof;

/** A computation manipulating proof positions.  Most take a {@link Pos} and
 *  return nothing when they close the branch, a single Pos when they do not
 *  branch, and several when they do. */
@FunctionalInterface
public interface Tactic<A,B> {
  B run( A a );
}
