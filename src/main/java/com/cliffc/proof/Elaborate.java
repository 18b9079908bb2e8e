package com.cliffc.proof;

import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Elaborate a closed proof tree into a single term.
 *
 *  Post-order walk with an explicit stack, so long proof chains do not grow
 *  the Java stack.  Each node caches its term; a node reachable twice is
 *  elaborated once, and elaborating again is all cache hits.
 */
public abstract class Elaborate {
  private static final Logger LOGGER = LogManager.getLogger();

  // A closed node waiting on its branches
  private static final class Frame {
    final Node _n;
    final Node.Closed<?> _c;
    final Term[] _args;
    int _i;                     // Next branch to elaborate
    Frame( Node n, Node.Closed<?> c ) { _n = n; _c = c; _args = new Term[c._branches.length]; }
  }

  /** @return the term of the whole proof; its type is the root goal
   *  @throws OpenProof if any node is still open */
  public static Term elaborate( Proof proof ) {
    long t0 = System.nanoTime();
    Term t = node(proof.root());
    // Equal up to head reduction
    if( !t.ty().reduce().equals(proof._root._goal.reduce()) )
      throw PF.fatal("Elaborated a term of type "+t.ty()+" for goal "+proof._root._goal);
    LOGGER.debug("Elaborated proof in {} usec",(System.nanoTime()-t0)/1000);
    return t;
  }

  /** @return the term of the subtree rooted at 'root' */
  public static Term node( Node root ) {
    if( root._term!=null ) return root._term;
    Ary<Frame> stk = new Ary<>();
    stk.push(frame(root));
    while( true ) {
      Frame f = stk.last();
      if( f._i < f._args.length ) {
        Node kid = f._c._branches[f._i];
        if( kid._term!=null ) f._args[f._i++] = kid._term;
        else stk.push(frame(kid));
        continue;
      }
      Term t = f._n._term = f._c.elaborate(f._args);
      stk.pop();
      if( stk.isEmpty() ) return t;
      Frame par = stk.last();
      par._args[par._i++] = t;
    }
  }

  private static Frame frame( Node n ) {
    if( n._proof instanceof Node.Closed<?> c ) return new Frame(n,c);
    throw new OpenProof(n);
  }
}
