package com.cliffc.proof;

/** How a step wants its branches laid out in a script.  A case split would be
 *  {@link #AllBranchesEquivalent}, while a cut is {@link #LastBranchIsContinuation}:
 *  the earlier branches are side conditions and the last one is the rest of
 *  the proof. */
public enum Pretty {
  AllBranchesEquivalent,
  LastBranchIsContinuation,
}
