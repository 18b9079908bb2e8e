package com.cliffc.proof;

import com.cliffc.proof.env.NameConflict;
import com.cliffc.proof.env.NotIntroduced;
import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/** A proof under construction.
 *
 *  The root sequent, plus a container of exactly one node, so the root is
 *  addressed by a {@link Pos} like any other goal.  The tree only grows
 *  through {@link #apply_step}; open positions may be closed in any order.
 *
 *  Not thread safe: one owner drives the construction.
 */
public final class Proof {
  private static final Logger LOGGER = LogManager.getLogger();

  public final Sequent _root;
  final Node[] _nodes;

  private Proof( Sequent root, Node[] nodes ) { _root = root; _nodes = nodes; }

  public static Proof make( Sequent seq ) { return new Proof(seq,mk_branches(new Sequent[]{seq})); }

  public Node root() {
    if( _nodes.length!=1 ) throw PF.fatal("Proof with "+_nodes.length+" roots");
    return _nodes[0];
  }
  public Pos root_pos() { return root()._pos; }

  // The container is allocated at its final size before any node holding a
  // position into it is made.
  static Node[] mk_branches( Sequent[] goals ) {
    Node[] res = new Node[goals.length];
    Arrays.fill(res,Node.PLACEHOLDER);
    for( int i=0; i<res.length; i++ )
      res[i] = new Node(new Pos(res,i),new Node.Open(goals[i]));
    return res;
  }

  // The state of the closed node, and the positions of its new branches
  public static final class Applied<S> {
    public final S _state;
    public final Pos[] _branches;
    Applied( S state, Pos[] branches ) { _state = state; _branches = branches; }
    public Pos branch( int i ) { return _branches[i]; }
  }

  /** Close the open node at 'pos' with 'step'.
   *  @throws BuildFailure if the step does not apply there */
  public static <I,S> Applied<S> apply_step( Pos pos, Step<I,S> step, I input ) {
    Node node = pos.get();
    if( !(node._proof instanceof Node.Open open) )
      throw PF.fatal("Trying to apply reasoning step to an already closed proof");
    LOGGER.debug("Applying {} at node {}",step._name,node._uid);
    Step.Computed<S> res;
    try {
      res = step.compute(open._seq,input);
    } catch( StepFailure e ) {
      LOGGER.warn("Step {} failed at node {}: {}",step._name,node._uid,e.getMessage());
      throw new BuildFailure(e.getMessage(),pos,e);
    } catch( NotIntroduced e ) {
      LOGGER.warn("Step {} failed at node {}: {}",step._name,node._uid,e.getMessage());
      throw new BuildFailure("Formula was not introduced: "+e._term,pos,e);
    } catch( NameConflict e ) {
      LOGGER.warn("Step {} failed at node {}: {}",step._name,node._uid,e.getMessage());
      throw new BuildFailure("Following ids conflict: "+e._new+" <> "+e._old,pos,e);
    }
    Node[] branches = mk_branches(res._goals);
    node.close(step,res._state,branches);
    Pos[] ps = new Pos[branches.length];
    for( int i=0; i<ps.length; i++ ) ps[i] = branches[i]._pos;
    return new Applied<>(res._state,ps);
  }

  /** @return every prelude entry used by a closed node, duplicates included */
  public Ary<Prelude> preludes() {
    Ary<Prelude> acc = new Ary<>();
    Ary<Node> work = new Ary<>();
    work.push(root());
    while( !work.isEmpty() ) {
      if( work.pop()._proof instanceof Node.Closed<?> c ) {
        acc.addAll(c.prelude());
        for( int i=c._branches.length-1; i>=0; i-- ) work.push(c._branches[i]);
      }
    }
    return acc;
  }

  /** @return positions of the open nodes, left to right */
  public Ary<Pos> open_positions() {
    Ary<Pos> acc = new Ary<>();
    Ary<Node> work = new Ary<>();
    work.push(root());
    while( !work.isEmpty() ) {
      Node n = work.pop();
      if( n._proof instanceof Node.Closed<?> c ) {
        for( int i=c._branches.length-1; i>=0; i-- ) work.push(c._branches[i]);
      } else acc.push(n._pos);
    }
    return acc;
  }

  public boolean is_closed() { return open_positions().isEmpty(); }
}
