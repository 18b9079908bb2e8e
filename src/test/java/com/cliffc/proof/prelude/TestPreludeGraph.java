package com.cliffc.proof.prelude;

import com.cliffc.proof.term.Id;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.cliffc.proof.Sig.*;
import static org.junit.Assert.*;

public class TestPreludeGraph {
  private static List<Prelude> emit( PreludeGraph g, Prelude... ps ) {
    ArrayList<Prelude> res = new ArrayList<>();
    g.emit(List.of(ps),res::add);
    return res;
  }

  @Test public void testDiamondOnce() {
    PreludeGraph g = new PreludeGraph();
    Prelude a = g.require("A");
    Prelude b = g.require("B",a);
    Prelude c = g.require("C",a);
    assertEquals(List.of(a,b,c),emit(g,c,b,c));
  }

  @Test public void testTransitiveOnly() {
    PreludeGraph g = new PreludeGraph();
    Prelude a = g.require("A");
    Prelude b = g.require("B",a);
    Prelude d = g.require("D");
    Prelude c = g.require("C",b);
    assertEquals(List.of(a,b,c),emit(g,c));
    assertEquals(List.of(d),emit(g,d));
    assertEquals(4,g.len());
  }

  @Test public void testStableOrder() {
    PreludeGraph g = new PreludeGraph();
    Prelude x = g.require("X");
    Prelude y = g.require("Y");
    Prelude z = g.require("Z",y);
    // Unrelated entries come out in insertion order
    assertEquals(List.of(x,y,z),emit(g,z,x));
    // A late prerequisite still comes first
    Prelude w = g.require("W");
    Prelude v = g.require("V",w,x);
    assertEquals(List.of(x,w,v),emit(g,v));
  }

  @Test public void testRegisterTwice() {
    PreludeGraph g = new PreludeGraph();
    Prelude a = g.require("A");
    Prelude b = g.require("B");
    // Same entry again, now with a dependency
    Prelude a2 = g.require("A",b);
    assertEquals(a,a2);
    assertEquals(2,g.len());
    assertEquals(List.of(b,a),emit(g,a));
  }

  @Test public void testAlias() {
    PreludeGraph g = new PreludeGraph();
    Prelude req = g.require("Classical");
    Id ap = Id.cst("ap",P);
    Prelude.Alias al = g.alias(ap,p,req);
    assertTrue(g.has(al));
    assertEquals("alias: ap -> p",al.toString());
    assertEquals("require: Classical",req.toString());
    assertEquals(List.of(req,al),emit(g,al,al));
  }

  @Test public void testEmpty() {
    PreludeGraph g = new PreludeGraph();
    g.require("A");
    assertTrue(emit(g).isEmpty());
  }

  @Test(expected=AssertionError.class)
  public void testAliasBadType() { new PreludeGraph().alias(Id.cst("aq",Q),p); }

  @Test(expected=AssertionError.class)
  public void testAliasRebound() {
    PreludeGraph g = new PreludeGraph();
    Id ap = Id.cst("ap",P);
    g.alias(ap,p);
    g.alias(ap,Id.cst("p2",P).term());
  }

  @Test(expected=AssertionError.class)
  public void testUnregistered() {
    Prelude a = new PreludeGraph().require("A");
    emit(new PreludeGraph(),a);
  }

  @Test(expected=AssertionError.class)
  public void testCycle() {
    PreludeGraph g = new PreludeGraph();
    Prelude a = g.require("A");
    Prelude b = g.require("B",a);
    g.require("A",b);
    emit(g,a);
  }
}
