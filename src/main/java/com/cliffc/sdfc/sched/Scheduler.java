package com.cliffc.sdfc.sched;

import com.cliffc.sdfc.ast.Contract;
import com.cliffc.sdfc.ast.Eq;
import com.cliffc.sdfc.ast.NodeDec;
import com.cliffc.sdfc.dep.DepGraph;
import com.cliffc.sdfc.dep.GNode;
import com.cliffc.sdfc.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

// Orders the equations of a normalized, causal node for sequential code.
public class Scheduler {
  private static final Logger LOG = LogManager.getLogger();

  // Contract equations are ordered apart from the body
  public static @NotNull NodeDec node( @NotNull NodeDec n, @NotNull Refine refine ) {
    Contract c = n._contract;
    if( c != null ) c = c.with_body(c._locals,schedule(c._eqs,refine));
    Ary<Eq> eqs = schedule(n._eqs,refine);
    LOG.debug("schedule of {} ({}): {}",n._name,refine,eqs);
    return n.with_body(n._locals,eqs,c);
  }

  /** @throws IllegalArgumentException on a control structure
   *  @throws IllegalStateException on a cyclic scheduling graph */
  public static @NotNull Ary<Eq> schedule( @NotNull Ary<Eq> eqs, @NotNull Refine refine ) {
    DepGraph g = DepGraph.scheduling(eqs);
    Ary<GNode> order = refine.refine(g.topological());
    return order.map(n -> n._eq,Eq.class);
  }
}
