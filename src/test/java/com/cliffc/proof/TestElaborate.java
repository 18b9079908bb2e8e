package com.cliffc.proof;

import com.cliffc.proof.step.Apply;
import com.cliffc.proof.step.Cut;
import com.cliffc.proof.step.LetIn;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.term.TermLet;
import org.junit.Test;

import static com.cliffc.proof.Sig.*;
import static com.cliffc.proof.term.Term.*;
import static org.junit.Assert.*;

public class TestElaborate {
  // Proves its goal with a fixed term, and counts elaborations
  private static final class Counting extends Step<Term,Term> {
    int _cnt;
    Counting() { super("counting"); }
    @Override public Computed<Term> compute( Sequent seq, Term t ) {
      if( !t.ty().equals(seq._goal) ) throw new StepFailure("bad type",seq);
      return computed(t);
    }
    @Override public Term elaborate( Term t, Term[] args ) { _cnt++; return t; }
    @Override protected Render<Term> coq() { return new Render<>(Pretty.AllBranchesEquivalent,(sb,t) -> sb.p("exact ").p(t).p('.')); }
  }

  @Test public void testCached() {
    Counting c = new Counting();
    Proof pf = proof(R);
    Pos[] ps = Apply.apply(pf.root_pos(),f,2);
    Proof.apply_step(ps[0],c,p);
    Proof.apply_step(ps[1],c,q);
    Term t0 = Elaborate.elaborate(pf);
    assertEquals(2,c._cnt);
    Term t1 = Elaborate.elaborate(pf);
    assertSame(t0,t1);
    assertEquals(2,c._cnt);
    // Subtrees were cached on the way
    assertSame(p,Elaborate.node(ps[0].get()));
    assertEquals(2,c._cnt);
  }

  @Test public void testSubtree() {
    Counting c = new Counting();
    Proof pf = proof(R);
    Pos[] ps = Apply.apply(pf.root_pos(),f,2);
    Proof.apply_step(ps[0],c,p);
    // The finished part elaborates while a sibling is still open
    assertEquals(p,Elaborate.node(ps[0].get()));
    try {
      Elaborate.elaborate(pf);
      fail();
    } catch( OpenProof op ) {
      assertSame(ps[1].get(),op._node);
    }
    Proof.apply_step(ps[1],c,q);
    assertEquals(app(f,p,q),Elaborate.elaborate(pf));
    assertEquals(2,c._cnt);
  }

  @Test(expected=OpenProof.class)
  public void testOpenRoot() { Elaborate.elaborate(proof(P)); }

  @Test public void testType() {
    Proof pf = proof(Q);
    Pos[] ps = Cut.cut(pf.root_pos(),"H",P);
    Apply.exact(ps[0],p);
    Apply.apply_all(ps[1],g);
    Apply.exact(pf.open_positions().at(0),p);
    Term t = Elaborate.elaborate(pf);
    assertEquals(pf._root._goal,t.ty());
  }

  @Test public void testLongChain() {
    // Deep enough to overflow a recursive walk
    int n = 2000;
    Proof pf = proof(Q);
    Pos pos = pf.root_pos();
    for( int i=0; i<n; i++ )
      pos = LetIn.letin(pos,"L",p);
    assertEquals("L"+(n-1),pos.get().sequent()._env.get(P)._name);
    Apply.apply(pos,g,1);
    Apply.exact(pf.open_positions().at(0),p);
    Term t = Elaborate.elaborate(pf);
    assertEquals(Q,t.ty());
    int depth = 0;
    while( t instanceof TermLet let ) { depth++; t = let._body; }
    assertEquals(n,depth);
    assertEquals(app(g,p),t);
  }
}
