package com.cliffc.proof;

import com.cliffc.proof.env.Coercions;
import com.cliffc.proof.env.Env;
import com.cliffc.proof.prelude.PreludeGraph;

/** Process-wide, append-only registries: lookup coercions and the prelude
 *  dependency graph.  Made once at startup and handed to whatever needs
 *  them; fill them before building proofs that rely on them. */
public final class Registry {
  public final Coercions _coercions = new Coercions();
  public final PreludeGraph _preludes = new PreludeGraph();

  /** @return an empty environment looking up through these coercions */
  public Env env() { return Env.empty(_coercions); }
}
