package com.cliffc.sdfc.sched;

import com.cliffc.sdfc.dep.GNode;
import com.cliffc.sdfc.util.Ary;

/** Reorders a topological order of a scheduling graph into another one.
 *  Implementations must keep every edge forward.
 */
public interface Refine {
  Ary<GNode> refine( Ary<GNode> topo );

  // Cluster equations whose clocks can share control structure
  Refine CLOCK_CLUSTER = new ClockCluster();

  // Keep the plain topological order
  Refine TOPOLOGICAL = new Refine() {
      @Override public Ary<GNode> refine( Ary<GNode> topo ) { return topo; }
      @Override public String toString() { return "topological"; }
    };
}
