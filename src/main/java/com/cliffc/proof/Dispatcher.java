package com.cliffc.proof;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;

/** Hook for theory plugins to hand back proofs.
 *
 *  A plugin that produced a lemma is asked for a tactic proving it; callers
 *  run that tactic on the position where the lemma is needed.  This is the
 *  only way decision procedures plug steps into a proof tree.
 */
public final class Dispatcher {
  private static final Logger LOGGER = LogManager.getLogger();

  public interface Plugin {
    String name();
    /** @return a tactic closing a position whose goal is the lemma, or null if unknown */
    @Nullable Tactic<Pos,Void> lemma( Lemma lemma );
  }

  private final HashMap<String,Plugin> _plugins = new HashMap<>();

  public Dispatcher register( Plugin p ) {
    if( _plugins.putIfAbsent(p.name(),p)!=null )
      throw new IllegalArgumentException("Plugin '"+p.name()+"' already registered");
    return this;
  }

  public Tactic<Pos,Void> lemma( Lemma lemma ) {
    Plugin p = _plugins.get(lemma._plugin);
    if( p==null ) throw new IllegalArgumentException("No plugin '"+lemma._plugin+"' for lemma "+lemma._name);
    Tactic<Pos,Void> tac = p.lemma(lemma);
    if( tac==null ) throw new IllegalArgumentException("Plugin '"+lemma._plugin+"' cannot prove lemma "+lemma._name);
    LOGGER.debug("Plugin {} proves {}",lemma._plugin,lemma);
    return tac;
  }
}
