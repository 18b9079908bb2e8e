package com.cliffc.proof;

import com.cliffc.proof.env.Env;
import com.cliffc.proof.env.NameConflict;
import com.cliffc.proof.env.NotIntroduced;
import com.cliffc.proof.prelude.Prelude;
import com.cliffc.proof.step.Apply;
import com.cliffc.proof.step.Cut;
import com.cliffc.proof.step.Intro;
import com.cliffc.proof.term.Id;
import com.cliffc.proof.term.Term;
import com.cliffc.proof.util.Ary;
import org.junit.Test;

import static com.cliffc.proof.Sig.*;
import static com.cliffc.proof.term.Term.*;
import static org.junit.Assert.*;

public class TestProof {
  @Test public void testMake() {
    Proof pf = proof(P);
    Node root = pf.root();
    assertTrue(root.is_open());
    assertSame(root,pf.root_pos().get());
    assertEquals(P,root.sequent()._goal);
    assertSame(pf._root,root.sequent());
    assertEquals(1,pf.open_positions().len());
    assertFalse(pf.is_closed());
  }

  @Test public void testGrow() {
    Proof pf = proof(arrow(P,R));
    Pos h = Intro.intro(pf.root_pos(),"H");
    Node root = pf.root();
    assertFalse(root.is_open());
    assertEquals(1,root.branches().length);
    assertSame(h.get(),root.branches()[0]);
    assertTrue(h.get()._uid > root._uid);
    // The new sequent knows the hypothesis
    Sequent seq = h.get().sequent();
    assertEquals(R,seq._goal);
    assertEquals("H0",seq._env.get(P)._name);
    Pos[] ps = Apply.apply(h,f,2);
    assertEquals(2,ps.length);
    assertEquals(P,ps[0].get().sequent()._goal);
    assertEquals(Q,ps[1].get().sequent()._goal);
    assertSame(seq._env,ps[0].get().sequent()._env);
    assertEquals(2,pf.open_positions().len());
    assertEquals(ps[0],pf.open_positions().at(0));
    assertEquals(ps[1],pf.open_positions().at(1));
  }

  @Test public void testAnyOrder() {
    Proof pf = proof(R);
    Pos[] ps = Apply.apply(pf.root_pos(),f,2);
    Apply.exact(ps[1],q);
    assertFalse(pf.is_closed());
    assertEquals(ps[0],pf.open_positions().at(0));
    Apply.exact(ps[0],p);
    assertTrue(pf.is_closed());
    assertEquals(app(f,p,q),Elaborate.elaborate(pf));
  }

  @Test(expected=AssertionError.class)
  public void testCloseTwice() {
    Proof pf = proof(P);
    Apply.exact(pf.root_pos(),p);
    Apply.exact(pf.root_pos(),p);
  }

  @Test public void testStepFailure() {
    Proof pf = proof(P);
    Pos pos = pf.root_pos();
    try {
      Intro.intro(pos,"H");
      fail();
    } catch( BuildFailure bf ) {
      assertEquals(pos,bf._pos);
      assertEquals("Can't introduce formula",bf._msg);
      assertTrue(bf.getCause() instanceof StepFailure);
      assertTrue(bf.getMessage().startsWith("In context:"));
      assertTrue(bf.getMessage().contains("goal: P"));
      assertTrue(bf.getMessage().endsWith("Can't introduce formula"));
    }
    // Failure leaves the node open
    assertTrue(pos.get().is_open());
    Apply.exact(pos,p);
    assertTrue(pf.is_closed());
  }

  @Test public void testNameConflict() {
    // 'x' is already taken, so the dependent intro cannot bind it
    Env e = new Registry().env().add(Id.var("x",P));
    Proof pf = proof(e,forall(X,pr(X.term())));
    try {
      Intro.intro(pf.root_pos(),"H");
      fail();
    } catch( BuildFailure bf ) {
      assertTrue(bf.getCause() instanceof NameConflict);
      assertEquals("Following ids conflict: x <> x",bf._msg);
      assertTrue(bf.getMessage().contains("x : P"));
    }
  }

  @Test public void testNotIntroduced() {
    Proof pf = proof(R);
    Pos pos = pf.root_pos();
    Step<Void,Void> lookup = new Step<>("lookup") {
      @Override public Computed<Void> compute( Sequent seq, Void v ) { seq._env.find(seq._goal); return computed(null); }
      @Override public Term elaborate( Void v, Term[] args ) { throw new UnsupportedOperationException(); }
      @Override protected Render<Void> coq() { return new Render<>(Pretty.AllBranchesEquivalent,(sb,v) -> sb); }
    };
    try {
      Proof.apply_step(pos,lookup,null);
      fail();
    } catch( BuildFailure bf ) {
      assertTrue(bf.getCause() instanceof NotIntroduced);
      assertEquals("Formula was not introduced: R",bf._msg);
    }
  }

  @Test public void testBranchesOfOpen() {
    Proof pf = proof(P);
    try {
      pf.root().branches();
      fail();
    } catch( OpenProof op ) {
      assertSame(pf.root(),op._node);
    }
  }

  @Test(expected=AssertionError.class)
  public void testSequentOfClosed() {
    Proof pf = proof(P);
    Apply.exact(pf.root_pos(),p);
    pf.root().sequent();
  }

  @Test public void testBranchesCopy() {
    Proof pf = proof(R);
    Apply.apply(pf.root_pos(),f,2);
    Node[] kids = pf.root().branches();
    kids[0] = null;
    assertNotNull(pf.root().branches()[0]);
  }

  @Test public void testPreludes() {
    Registry reg = new Registry();
    Prelude a = reg._preludes.require("A");
    Prelude b = reg._preludes.require("B",a);
    Proof pf = proof(reg.env(),Q);
    Pos[] ps = Cut.cut(pf.root_pos(),"H",P);
    Apply.exact(ps[0],p,b);
    Apply.apply(ps[1],g,1,a,b);
    Ary<Prelude> pre = pf.preludes();
    assertEquals(3,pre.len());
    assertEquals(b,pre.at(0));
    assertEquals(a,pre.at(1));
    assertEquals(b,pre.at(2));
  }

  @Test public void testUids() {
    Proof pf = proof(R);
    Pos[] ps = Apply.apply(pf.root_pos(),f,2);
    assertTrue(ps[0].get()._uid < ps[1].get()._uid);
    assertNotEquals(ps[0],ps[1]);
    assertEquals("#"+ps[1].get()._uid,ps[1].toString());
  }
}
