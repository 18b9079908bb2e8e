package com.cliffc.proof.prelude;

import com.cliffc.proof.PF;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/** Dependency graph of prelude entries.
 *
 *  Vertices are entries, an edge runs from a prerequisite to the entry needing
 *  it.  Append-only: entries and edges are added when entries are made, and
 *  never removed.  Emission walks the whole graph in a stable topological
 *  order (ties broken by insertion order) and visits every transitive
 *  prerequisite of the requested entries exactly once.
 */
public final class PreludeGraph {
  private static final Logger LOGGER = LogManager.getLogger();

  private final Ary<Prelude> _vs = new Ary<>();                 // Vertices, in insertion order
  private final HashMap<Prelude,Integer> _idx = new HashMap<>(); // Vertex to insertion index
  private final ArrayList<BitSet> _succs = new ArrayList<>();   // Direct edges, by index
  private BitSet[] _closure;    // Reflexive-transitive closure; null when stale

  public Prelude.Require require( String unit, Prelude... deps ) { return mk(new Prelude.Require(unit),deps); }
  public Prelude.Alias alias( Id id, Term t, Prelude... deps ) { return mk(new Prelude.Alias(id,t),deps); }

  private <P extends Prelude> P mk( P p, Prelude[] deps ) {
    int x = vertex(p);
    for( Prelude dep : deps ) {
      LOGGER.debug("{} ---> {}",dep,p);
      _succs.get(vertex(dep)).set(x);
    }
    _closure = null;
    return p;
  }

  // Add if missing; return the index
  private int vertex( Prelude p ) {
    Integer x = _idx.get(p);
    if( x!=null ) return x;
    _idx.put(p,_vs._len);
    _vs.push(p);
    _succs.add(new BitSet());
    return _vs._len-1;
  }

  public int len() { return _vs._len; }
  public boolean has( Prelude p ) { return _idx.containsKey(p); }

  /** Visit, in dependency order, every entry the given ones transitively
   *  depend on, themselves included.  Each entry is visited at most once no
   *  matter how often it is requested. */
  public void emit( Iterable<? extends Prelude> entries, Consumer<Prelude> visit ) {
    BitSet want = new BitSet();
    for( Prelude p : entries ) {
      Integer x = _idx.get(p);
      if( x==null ) throw PF.fatal("Prelude not registered: "+p);
      want.set(x);
    }
    if( want.isEmpty() ) return;
    BitSet[] reach = closure();
    for( int v : topo() )
      if( reach[v].intersects(want) )
        visit.accept(_vs.at(v));
  }

  // Reflexive-transitive closure, recomputed only after registrations
  private BitSet[] closure() {
    if( _closure!=null ) return _closure;
    int n = _vs._len;
    BitSet[] reach = new BitSet[n];
    for( int v=0; v<n; v++ ) {
      BitSet r = reach[v] = new BitSet(n);
      r.set(v);
      Ary<Integer> work = new Ary<>();
      work.push(v);
      while( !work.isEmpty() ) {
        BitSet succs = _succs.get(work.pop());
        for( int s = succs.nextSetBit(0); s>=0; s = succs.nextSetBit(s+1) )
          if( !r.get(s) ) { r.set(s); work.push(s); }
      }
    }
    return (_closure = reach);
  }

  // Kahn's algorithm, always releasing the earliest inserted ready vertex
  private int[] topo() {
    int n = _vs._len;
    int[] preds = new int[n];
    for( BitSet succs : _succs )
      for( int s = succs.nextSetBit(0); s>=0; s = succs.nextSetBit(s+1) )
        preds[s]++;
    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for( int v=0; v<n; v++ ) if( preds[v]==0 ) ready.add(v);
    int[] order = new int[n];
    int k=0;
    while( !ready.isEmpty() ) {
      int v = order[k++] = ready.poll();
      BitSet succs = _succs.get(v);
      for( int s = succs.nextSetBit(0); s>=0; s = succs.nextSetBit(s+1) )
        if( --preds[s]==0 ) ready.add(s);
    }
    if( k!=n ) throw PF.fatal("Cycle in prelude dependencies");
    return order;
  }
}
