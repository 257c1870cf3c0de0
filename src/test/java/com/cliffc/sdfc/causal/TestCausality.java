package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.CompileError;
import com.cliffc.sdfc.ErrMsg;
import com.cliffc.sdfc.Reporter;
import com.cliffc.sdfc.ast.*;
import com.cliffc.sdfc.util.Ary;
import org.junit.Test;

import java.util.HashSet;

import static com.cliffc.sdfc.AstBuilder.*;
import static org.junit.Assert.*;

public class TestCausality {

  private static final Loc NODE = new Loc("t.lus",1,1);

  private static NodeDec body( Eq... eqs ) {
    return new NodeDec("n",decs("i","c","r"),decs("x","y"),decs(),new Ary<>(eqs),null).loc(NODE);
  }

  private static void ok( NodeDec n ) {
    Reporter.Collect errs = new Reporter.Collect();
    Causality.node(n,errs);
    assertFalse(errs.has_errors());
  }

  // Expect a cycle; returns the reported error
  private static ErrMsg bad( NodeDec n ) {
    Reporter.Collect errs = new Reporter.Collect();
    try {
      Causality.node(n,errs);
      fail("expected a causality error");
    } catch( CompileError e ) {
      assertEquals(1,errs._errs._len);
      assertSame(errs._errs.at(0),e._err);
      assertEquals(ErrMsg.Level.Causality,e._err._lvl);
      return e._err;
    }
    return null;
  }

  @Test public void testSelfLoop() {
    Loc loc = new Loc("t.lus",3,5);
    ErrMsg err = bad(body(def(loc,"x",plus(v("x"),c(1)))));
    assertEquals(1,err._what._len);
    assertEquals("x",err._what.at(0));
    assertEquals(Causal.CYCLE+"\n(^x) < x",err._msg);
    assertEquals(loc,err._loc);
    assertTrue(err.toString().startsWith("t.lus:3:5: Causality error"));
  }

  @Test public void testDelayCuts() {
    ok(body(def("x",fby(1,plus(v("x"),c(1))))));
    ok(body(def("x",pre(v("y"))),def("y",plus(v("x"),v("i")))));
  }

  @Test public void testTwoCycle() {
    Loc ly = new Loc("t.lus",4,3);
    ErrMsg err = bad(body(def("x",plus(v("y"),v("i"))),def(ly,"y",call("f",v("x")))));
    assertTrue(err._what.find(s -> s.equals("x")) != -1);
    assertTrue(err._what.find(s -> s.equals("y")) != -1);
    // x has no location, so the first located definer on the cycle is blamed
    assertEquals(ly,err._loc);
  }

  @Test public void testLongChain() {
    int n = 20000;
    Ary<Eq> eqs = new Ary<>(Eq.class);
    for( int i=n; i>0; i-- ) eqs.add(def("x"+i,v("x"+(i-1))));
    ok(new NodeDec("n",decs("x0"),decs(),decs(),eqs,null));
    eqs.add(def("x0",v("x"+n)));
    ErrMsg err = bad(new NodeDec("n",decs(),decs(),decs(),eqs,null));
    assertEquals(n+1,err._what._len);
  }

  @Test public void testNodeLocFallback() {
    ErrMsg err = bad(body(def("x",v("y")),def("y",v("x"))));
    assertEquals(NODE,err._loc);
  }

  @Test public void testLastNeverCycles() {
    ok(body(def("x",plus(last("x"),c(1)))));
    ok(body(def("x",last("y")),def("y",last("x"))));
  }

  // Definitions in exclusive branches would cycle if both ran
  @Test public void testSwitch() {
    Eq sw = new Eq.Switch(v("c"),new Ary<>(new Eq.Switch.Handler[]{
          new Eq.Switch.Handler("true" ,block(names(),def("x",v("y")))),
          new Eq.Switch.Handler("false",block(names(),def("y",v("x"))))}));
    ok(body(sw));
    // The same pair in one branch is a cycle
    Eq sw2 = new Eq.Switch(v("c"),new Ary<>(new Eq.Switch.Handler[]{
          new Eq.Switch.Handler("true" ,block(names(),def("x",v("y")),def("y",v("x")))),
          new Eq.Switch.Handler("false",block(names(),def("y",v("i")),def("x",v("i"))))}));
    bad(body(sw2));
  }

  @Test public void testSwitchCondition() {
    // The condition comes before every branch
    Eq sw = new Eq.Switch(v("x"),new Ary<>(new Eq.Switch.Handler[]{
          new Eq.Switch.Handler("true" ,block(names(),def("x",v("i")))),
          new Eq.Switch.Handler("false",block(names(),def("x",c(0))))}));
    bad(body(sw));
  }

  @Test public void testAutomaton() {
    Eq.State s1 = new Eq.State("S1",block(names(),def("x",v("y"))),
                                new Ary<>(new Eq.Escape[]{new Eq.Escape(v("c"),true,"S2")}),
                                new Ary<>(Eq.Escape.class));
    Eq.State s2 = new Eq.State("S2",block(names(),def("y",v("x"))),
                                new Ary<>(Eq.Escape.class),
                                new Ary<>(new Eq.Escape[]{new Eq.Escape(v("c"),false,"S1")}));
    ok(body(new Eq.Automaton(new Ary<>(new Eq.State[]{s1,s2}))));
    // A weak transition reads what the state body writes; a strong one may not
    Eq.State s3 = new Eq.State("S3",block(names(),def("x",v("i"))),
                                new Ary<>(new Eq.Escape[]{new Eq.Escape(v("x"),true,"S3")}),
                                new Ary<>(Eq.Escape.class));
    ok(body(new Eq.Automaton(new Ary<>(new Eq.State[]{s3}))));
    Eq.State s4 = new Eq.State("S4",block(names(),def("x",v("i"))),
                                new Ary<>(Eq.Escape.class),
                                new Ary<>(new Eq.Escape[]{new Eq.Escape(v("x"),true,"S4")}));
    bad(body(new Eq.Automaton(new Ary<>(new Eq.State[]{s4}))));
  }

  @Test public void testPresent() {
    Eq p = new Eq.Present(new Ary<>(new Eq.Present.Handler[]{
          new Eq.Present.Handler(v("c"),block(names(),def("x",v("y"))))}),
      block(names(),def("y",v("x"))));
    ok(body(p));
  }

  @Test public void testReset() {
    bad(body(new Eq.Reset(eqs(def("x",v("y")),def("y",v("x"))),v("r"))));
    ok(body(new Eq.Reset(eqs(def("x",v("i")),def("y",v("x"))),v("r"))));
    // The reset condition is read before the body runs
    bad(body(new Eq.Reset(eqs(def("x",v("i"))),v("x"))));
  }

  // Block locals are hidden from the enclosing constraint
  @Test public void testBlockLocals() {
    Eq sw = new Eq.Switch(v("c"),new Ary<>(new Eq.Switch.Handler[]{
          new Eq.Switch.Handler("true" ,block(names("t"),def("t",v("i")),def("x",v("t")))),
          new Eq.Switch.Handler("false",block(names("t"),def("t",c(0)),def("x",v("t"))))}));
    ok(body(sw,def("y",v("x"))));
  }

  // A linear value consumed once in each of two exclusive branches is two
  // independent single uses.
  @Test public void testLinearAcrossBranches() {
    Eq sw = new Eq.Switch(v("c"),new Ary<>(new Eq.Switch.Handler[]{
          new Eq.Switch.Handler("true" ,block(names(),def("x",call("f",lin("i"))))),
          new Eq.Switch.Handler("false",block(names(),def("x",call("g",lin("i")))))}));
    ok(body(sw));
  }

  // Plain reads of a value come before its linear consumer
  @Test public void testLinearAfterReads() {
    ok(body(def("x",call("f",v("i"))),def("y",call("g",lin("i")))));
    // The consumer may not feed a reader of the same value
    bad(body(def("x",call("f",v("i"),v("y"))),def("y",call("g",lin("i")))));
  }

  @Test public void testContract() {
    // The contract is checked on its own
    Contract c = new Contract(v("i"),v("ok"),decs(),decs("ok","a"),
                              eqs(def("a",v("ok")),def("ok",v("a"))));
    NodeDec n = new NodeDec("n",decs("i"),decs("x"),decs(),eqs(def("x",v("i"))),c).loc(NODE);
    bad(n);
    Contract good = new Contract(v("i"),v("ok"),decs(),decs("ok"),eqs(def("ok",call("not",v("x")))));
    ok(new NodeDec("n",decs("i"),decs("x"),decs(),eqs(def("x",v("i"))),good));
    // Assumptions are read before the contract equations run
    Contract early = new Contract(v("ok"),v("ok"),decs(),decs("ok"),eqs(def("ok",call("not",v("i")))));
    bad(new NodeDec("n",decs("i"),decs("x"),decs(),eqs(def("x",v("i"))),early));
  }

  @Test public void testRender() {
    assertEquals("(^a || ^b) < x",render(Constraint.cseq(Constraint.cand(Constraint.read("a"),Constraint.read("b")),Constraint.write("x"))));
    assertEquals("^a < ^b < x",render(Constraint.cseq(Constraint.read("a"),Constraint.cseq(Constraint.read("b"),Constraint.write("x")))));
    assertEquals("*a || last b",render(Constraint.cand(Constraint.linread("a"),Constraint.lastread("b"))));
    assertEquals("(^a, ^b)",render(Constraint.ctuple(new Ary<>(new Constraint[]{Constraint.read("a"),Constraint.read("b")}))));
    // Nested parallel composition falls back from a tuple
    assertEquals("^a || ^b || ^c",render(Constraint.ctuple(new Ary<>(new Constraint[]{
            Constraint.cand(Constraint.read("a"),Constraint.read("b")),Constraint.read("c")}))));
  }
  private static String render( Constraint c ) {
    Ary<Ac> alts = Constraint.norm(c).alternatives();
    assertEquals(1,alts._len);
    return alts.at(0).render();
  }

  @Test public void testNormDistributes() {
    // (^a # ^b) < x  ==  (^a < x) # (^b < x)
    Constraint c = Constraint.cseq(Constraint.cor(Constraint.read("a"),Constraint.read("b")),Constraint.write("x"));
    Ary<Ac> alts = Constraint.norm(c).alternatives();
    assertEquals(2,alts._len);
    assertEquals("^a < x",alts.at(0).render());
    assertEquals("^b < x",alts.at(1).render());
    // Delays and projections
    assertSame(Constraint.EMPTY,Constraint.pre(Constraint.cand(Constraint.read("a"),Constraint.linread("b"))));
    assertEquals("x",render(Constraint.pre(Constraint.cseq(Constraint.read("a"),Constraint.write("x")))));
    HashSet<String> hide = new HashSet<>();
    hide.add("t");
    assertEquals("^a < x",render(Constraint.clear(hide,Constraint.cseq(Constraint.read("a"),Constraint.cseq(Constraint.write("t"),Constraint.write("x"))))));
  }
}
