package com.cliffc.sdfc;

import com.cliffc.sdfc.ast.*;
import com.cliffc.sdfc.causal.Causal;
import com.cliffc.sdfc.sched.Refine;
import com.cliffc.sdfc.util.Ary;
import org.junit.Test;

import java.util.Properties;

import static com.cliffc.sdfc.AstBuilder.*;
import static org.junit.Assert.*;

public class TestCompile {

  // x = 1 fby (x + 1)
  private static NodeDec counter() {
    return node("counter",names(),names("x"),names(),def("x",new Fby(c(1),plus(v("x"),c(1)))));
  }
  private static NodeDec loop( String name ) {
    return node(name,names(),names("x"),names(),def(new Loc(name+".ept",3,5),"x",plus(v("x"),c(1))));
  }
  private static NodeDec control() {
    return new NodeDec("ctl",decs("x","r"),decs("y"),decs(),eqs(new Eq.Reset(eqs(def("y",v("x"))),v("r"))),null);
  }
  private static Program prog( NodeDec... ns ) { return new Program(new Ary<>(ns)); }

  @Test public void testPipeline() {
    NodeDec n = Compile.node(counter());
    assertEquals("x = _v2\n"+
                 "_v1 = +(x, 1)\n"+
                 "_v2 = 1 fby _v1\n",str(n._eqs));
    assertEquals(2,n._locals._len);
    // Compiling the output again changes nothing
    assertEquals(str(n._eqs),str(Compile.node(n)._eqs));
  }

  @Test public void testCycle() {
    Reporter.Collect errs = new Reporter.Collect();
    try {
      Compile.node(loop("n"),Options.DEFAULT,errs);
      fail();
    } catch( CompileError e ) {
      assertSame(errs._errs.at(0),e._err);
      assertTrue(e._err._msg.startsWith(Causal.CYCLE));
      assertEquals(3,e._err._loc._line);
      assertEquals("Causality: [x]",e._err.brief());
    }
  }

  @Test public void testProgram() {
    CompileResult r = Compile.program(prog(counter(),loop("a"),loop("b")));
    assertFalse(r.is_ok());
    assertNull(r._prog);
    assertEquals(2,r._errs._len);
    assertEquals("a.ept",r._errs.at(0)._loc._src);
    assertEquals("b.ept",r._errs.at(1)._loc._src);

    r = Compile.program(prog(counter(),loop("a"),loop("b")),Options.DEFAULT.with_stop_on_first_error(true));
    assertEquals(1,r._errs._len);

    r = Compile.program(prog(counter(),node("id",names("i"),names("o"),names(),def("o",v("i")))));
    assertTrue(r.is_ok());
    assertEquals(2,r._prog._nodes._len);
    assertEquals("o = i\n",str(r._prog.node("id")._eqs));
  }

  // Control constructs must be lowered before this pipeline; a leftover one
  // is a defect and is not collected with the diagnostics
  @Test public void testInternal() {
    Reporter.Collect errs = new Reporter.Collect();
    try {
      Compile.node(control(),Options.DEFAULT,errs);
      fail();
    } catch( IllegalArgumentException e ) {
      assertFalse(errs.has_errors());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInternalProgram() {
    Compile.program(prog(loop("a"),control()));
  }

  @Test public void testContract() {
    Contract c = new Contract(v("i"),v("ok"),decs(),decs("ok","a","b"),
                              eqs(def("ok",call("and",v("a"),v("b"))),
                                  def("b",pre(v("i"))),
                                  def("a",call("f",v("i")))));
    NodeDec n = Compile.node(new NodeDec("n",decs("i"),decs("y"),decs(),eqs(def("y",v("i"))),c));
    assertEquals("a,ok,b",order(n._contract._eqs));
    assertEquals("y",order(n._eqs));
  }

  @Test public void testOptions() {
    Properties props = new Properties();
    assertSame(Refine.CLOCK_CLUSTER,Options.from(props)._refine);
    props.setProperty("sdfc.schedule","topological");
    props.setProperty("sdfc.mem_alloc","true");
    Options opts = Options.from(props);
    assertSame(Refine.TOPOLOGICAL,opts._refine);
    assertTrue(opts._mem_alloc);
    assertFalse(opts._stop_on_first_error);
    assertEquals("mem_alloc=true schedule=topological stop_on_first_error=false",opts.toString());
  }

  @Test public void testScheduleOption() {
    Ck ca = on("true","c"), cb = on("true","d");
    NodeDec n = node("n",names("c","d","x","z"),names("p","q","r"),names(),
                     def("p",v("x",ca)),def("q",at(cb,call("f",v("p")))),def("r",v("z",ca)));
    assertEquals("p,r,q",order(Compile.node(n)._eqs));
    Options topo = Options.DEFAULT.with_refine(Refine.TOPOLOGICAL);
    assertEquals("p,q,r",order(Compile.node(n,topo,Reporter.NONE)._eqs));
  }

  @Test public void testSystemOptions() {
    String old = System.getProperty("sdfc.schedule");
    System.setProperty("sdfc.schedule","topological");
    try {
      assertSame(Refine.TOPOLOGICAL,Options.fromSystem()._refine);
    } finally {
      if( old == null ) System.clearProperty("sdfc.schedule");
      else System.setProperty("sdfc.schedule",old);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadOption() {
    Properties props = new Properties();
    props.setProperty("sdfc.schedule","fastest");
    Options.from(props);
  }
}
