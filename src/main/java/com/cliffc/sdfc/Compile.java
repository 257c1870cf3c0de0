package com.cliffc.sdfc;

import com.cliffc.sdfc.ast.NodeDec;
import com.cliffc.sdfc.ast.Program;
import com.cliffc.sdfc.causal.Causality;
import com.cliffc.sdfc.norm.Normalize;
import com.cliffc.sdfc.sched.Scheduler;
import com.cliffc.sdfc.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

/** Middle-end driver: normalize, check causality, then schedule.  Nodes are
 *  independent; nothing is shared between calls.
 */
public abstract class Compile {
  private static final Logger LOG = LogManager.getLogger();

  private Compile() { }

  public static @NotNull NodeDec node( @NotNull NodeDec n ) { return node(n,Options.DEFAULT,Reporter.NONE); }

  /** Compile one node.
   *  @throws CompileError on a causality cycle, after reporting it */
  public static @NotNull NodeDec node( @NotNull NodeDec n, @NotNull Options opts, @NotNull Reporter reporter ) {
    NodeDec norm = Normalize.node(n,opts);
    Causality.node(norm,reporter);
    return Scheduler.node(norm,opts._refine);
  }

  public static @NotNull CompileResult program( @NotNull Program p ) { return program(p,Options.DEFAULT); }

  /** Compile every node.  A failing node fails the program; the other nodes
   *  are still checked unless {@code stop_on_first_error} is set.
   *  @throws IllegalArgumentException if a control structure is not lowered
   *  @throws IllegalStateException on a cyclic scheduling graph */
  public static @NotNull CompileResult program( @NotNull Program p, @NotNull Options opts ) {
    Reporter.Collect errs = new Reporter.Collect();
    Ary<NodeDec> nodes = new Ary<>(NodeDec.class);
    for( NodeDec n : p._nodes ) {
      try {
        nodes.add(node(n,opts,errs));
      } catch( CompileError e ) {
        LOG.debug("node {} rejected",n._name);
        if( opts._stop_on_first_error ) break;
      }
    }
    if( errs.has_errors() ) return CompileResult.failed(errs.sorted());
    LOG.debug("compiled {} nodes",nodes._len);
    return CompileResult.ok(new Program(nodes));
  }
}
