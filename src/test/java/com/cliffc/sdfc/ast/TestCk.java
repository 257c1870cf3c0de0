package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import org.junit.Test;

import java.util.ArrayList;

import static org.junit.Assert.*;

public class TestCk {

  @Test public void testPath() {
    Ck ck = Ck.BASE.on("true","c").on("A","s");
    assertEquals("base on true(c) on A(s)",ck.toString());
    assertEquals(2,ck.depth());
    Ary<Ck> path = ck.path();
    assertEquals(2,path._len);
    assertEquals("c",path.at(0)._var);
    assertEquals("s",path.at(1)._var);
    assertEquals("c",ck.outermost()._var);
    assertNull(Ck.BASE.outermost());
    assertTrue(Ck.BASE.path().isEmpty());
    assertEquals("[s, c]",ck.vars(new ArrayList<>()).toString());
  }

  @Test public void testJoinable() {
    Ck a  = Ck.BASE.on("true","c");
    Ck a2 = Ck.BASE.on("true","c").on("false","d");
    Ck b  = Ck.BASE.on("false","c");
    Ck z  = Ck.BASE.on("true","z");
    // The base clock joins everything
    assertTrue(Ck.joinable(Ck.BASE,a));
    assertTrue(Ck.joinable(b,Ck.BASE));
    // Same outermost test
    assertTrue(Ck.joinable(a,a2));
    // Same variable, different tag
    assertFalse(Ck.joinable(a,b));
    // Different variable
    assertFalse(Ck.joinable(a,z));
  }

  @Test public void testEquals() {
    assertEquals(Ck.BASE.on("true","c"),Ck.BASE.on("true","c"));
    assertEquals(Ck.BASE.on("true","c").hashCode(),Ck.BASE.on("true","c").hashCode());
    assertNotEquals(Ck.BASE.on("true","c"),Ck.BASE.on("true","d"));
    assertNotEquals(Ck.BASE,Ck.BASE.on("true","c"));
  }

  @Test public void testPrint() {
    Exp e = new Merge("c",new Ary<>(new String[]{"true","false"}),
                      new Ary<>(new Exp[]{new When(new Var("x"),"true","c"),new When(new Const("0"),"false","c")}));
    assertEquals("merge c (true -> x when true(c)) (false -> 0 when false(c))",e.toString());
    assertEquals("(a, b) = 0 fby (+(x, 1))",
                 new Eq.Def(new Pat.TuplePat(new Pat.VarPat("a"),new Pat.VarPat("b")),
                            new Fby(new Const("0"),new Call("+",new Var("x"),new Const("1")))).toString());
    assertEquals("t.lus:3:7: oops",new Loc("t.lus",3,7).errLocMsg("oops"));
    assertEquals("oops",Loc.NONE.errLocMsg("oops"));
  }
}
