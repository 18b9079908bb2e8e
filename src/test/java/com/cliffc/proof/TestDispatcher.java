package com.cliffc.proof;

import com.cliffc.proof.step.Apply;
import com.cliffc.proof.term.Term;
import org.junit.Test;

import static com.cliffc.proof.Sig.*;
import static org.junit.Assert.*;

public class TestDispatcher {
  // Knows one lemma per proposition, proved by the axiom kept in '_info'
  private static final class Axioms implements Dispatcher.Plugin {
    @Override public String name() { return "axioms"; }
    @Override public Tactic<Pos,Void> lemma( Lemma lemma ) {
      if( !(lemma._info instanceof Term t) ) return null;
      return pos -> { Apply.exact(pos,t); return null; };
    }
  }

  @Test public void testLemma() {
    Dispatcher d = new Dispatcher().register(new Axioms());
    Proof pf = proof(R);
    Pos[] ps = Apply.apply(pf.root_pos(),f,2);
    d.lemma(new Lemma("axioms","p",P,p)).run(ps[0]);
    d.lemma(new Lemma("axioms","q",Q,q)).run(ps[1]);
    assertTrue(pf.is_closed());
    assertEquals("f p q",Elaborate.elaborate(pf).toString());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testDuplicate() { new Dispatcher().register(new Axioms()).register(new Axioms()); }

  @Test(expected=IllegalArgumentException.class)
  public void testUnknownPlugin() { new Dispatcher().lemma(new Lemma("arith","l",P,p)); }

  @Test(expected=IllegalArgumentException.class)
  public void testUnknownLemma() { new Dispatcher().register(new Axioms()).lemma(new Lemma("axioms","l",P,"nope")); }

  @Test public void testLemmaStr() {
    assertEquals("axioms/p : P",new Lemma("axioms","p",P,p).toString());
  }
}
