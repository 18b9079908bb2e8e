package com.cliffc.proof;

// Proof languages supported by the printers
public enum Lang {
  Dot,                          // Graphviz graph of the proof tree
  Coq,                          // Coq proof script, or Coq term
}
