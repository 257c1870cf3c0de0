package com.cliffc.sdfc.dep;

import com.cliffc.sdfc.ast.*;
import org.junit.Test;

import static com.cliffc.sdfc.AstBuilder.*;
import static org.junit.Assert.*;

public class TestUsage {

  @Test public void testReads() {
    Usage u = Usage.of(def(tp("a","b"),tuple(plus(v("x"),v("y")),v("x"))));
    assertEquals("[a, b]",u._defs.toString());
    assertEquals("[x, y]",u._reads.toString());
    assertEquals("[x, y]",u._left_reads.toString());
    assertFalse(u._delay);
    assertTrue(u._ck.is_base());
  }

  // Merge selectors, sampling variables and clocks are all read
  @Test public void testMerge() {
    Usage u = Usage.of(def("y",merge("c",when(v("x"),"true","c"),when(c(0),"false","c"))));
    assertEquals("[c, x]",u._reads.toString());
    assertEquals("[c, x]",u._left_reads.toString());
    // A merge runs on its first branch's clock
    assertEquals(on("true","c"),u._ck);
  }

  @Test public void testDelay() {
    Usage u = Usage.of(def("y",fby(0,v("x"))));
    assertTrue(u._delay);
    assertEquals("[x]",u._reads.toString());
    assertTrue(u._left_reads.isEmpty());
    // A sampled delay still needs its clock now
    Usage s = Usage.of(def("y",at(on("true","c"),fby(0,v("x",on("true","c"))))));
    assertEquals("[c, x]",s._reads.toString());
    assertEquals("[c]",s._left_reads.toString());
  }

  @Test public void testLast() {
    Usage u = Usage.of(def("x",plus(last("x"),c(1))));
    assertEquals("[x]",u._reads.toString());
    assertTrue(u._left_reads.isEmpty());
    assertFalse(u._delay);
  }

  @Test public void testResetAndLinear() {
    Usage u = Usage.of(def("y",every("f","r",lin("a"),v("b"))));
    assertEquals("[r, a, b]",u._reads.toString());
    assertEquals("[a]",u._lin_reads.toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testControlRejected() {
    Usage.of(new Eq.Reset(eqs(def("y",v("x"))),v("r")));
  }
}
