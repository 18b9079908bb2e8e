package com.cliffc.proof;

import com.cliffc.proof.util.SB;

// How a step prints in one language: branch layout, and a printer for its state
public final class Render<S> {
  public interface Printer<S> { SB print( SB sb, S state ); }

  public final Pretty _pretty;
  public final Printer<S> _pp;
  public Render( Pretty pretty, Printer<S> pp ) { _pretty = pretty; _pp = pp; }
}
