package com.cliffc.sdfc.dep;

import com.cliffc.sdfc.ast.Eq;
import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;
import com.cliffc.sdfc.util.VBitSet;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Set;

/** Equation dependency graph, one {@link GNode} per definition.
 *  <p>
 *  The scheduling view has an edge from the definer of {@code x} to every
 *  equation left-reading {@code x}, except when the definer is a delay.  It is
 *  acyclic for causal bodies.  The full view has an edge to every reader and
 *  no cut; it may be cyclic.
 */
public class DepGraph {
  public final Ary<GNode> _nodes = new Ary<>(GNode.class);
  private final HashMap<String,GNode> _defs = new HashMap<>();
  private int _nedges;

  private DepGraph( Ary<Eq> eqs, boolean full ) {
    for( Eq eq : eqs ) {
      Usage u = Usage.of(eq);
      GNode n = new GNode(_nodes._len,(Eq.Def)eq,u);
      _nodes.add(n);
      for( String x : n._usage._defs ) _defs.put(x,n);
    }
    for( GNode n : _nodes ) {
      Set<String> reads = full ? n._usage._reads : n._usage._left_reads;
      for( String x : reads ) {
        GNode d = _defs.get(x);
        if( d != null && (full || !d._usage._delay) && d.add_succ(n) )
          _nedges++;
      }
    }
  }

  public static @NotNull DepGraph scheduling( @NotNull Ary<Eq> eqs ) { return new DepGraph(eqs,false); }
  public static @NotNull DepGraph full( @NotNull Ary<Eq> eqs ) { return new DepGraph(eqs,true); }

  // Definer of x, or null for inputs and unknown names
  public GNode def( String x ) { return _defs.get(x); }
  public int nedges() { return _nedges; }

  /** Stable topological order: each node after its predecessors, otherwise
   *  in input order.
   *  @throws IllegalStateException on a cycle */
  public Ary<GNode> topological() {
    Ary<GNode> order = new Ary<>(GNode.class);
    VBitSet done = new VBitSet(), onstack = new VBitSet();
    Ary<GNode> stack = new Ary<>(GNode.class);
    int[] next = new int[_nodes._len]; // Next predecessor to visit
    for( GNode root : _nodes ) {
      if( done.test(root._idx) ) continue;
      onstack.set(root._idx);
      stack.add(root);
      while( !stack.isEmpty() ) {
        GNode n = stack.last();
        if( next[n._idx] < n._preds._len ) {
          GNode p = n._preds.at(next[n._idx]++);
          if( done.test(p._idx) ) continue;
          if( onstack.tset(p._idx) )
            throw new IllegalStateException("cyclic dependency graph at "+p);
          stack.add(p);
        } else {
          stack.pop();
          onstack.clear(n._idx);
          done.set(n._idx);
          order.add(n);
        }
      }
    }
    return order;
  }

  @Override public String toString() {
    SB sb = new SB();
    for( GNode n : _nodes ) {
      sb.p('#').p(n._idx).p(" ->");
      for( GNode s : n._succs ) sb.p(" #").p(s._idx);
      sb.nl();
    }
    return sb.toString();
  }
}
