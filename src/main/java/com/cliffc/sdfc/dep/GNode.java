package com.cliffc.sdfc.dep;

import com.cliffc.sdfc.ast.Ck;
import com.cliffc.sdfc.ast.Eq;
import com.cliffc.sdfc.util.Ary;

// One equation in a dependency graph.  Edges run from a definition to its
// readers: _succs must come later in a schedule, _preds earlier.
public class GNode {
  public final int _idx;          // Position in the input equation list
  public final Eq.Def _eq;
  public final Usage _usage;
  public final Ary<GNode> _succs = new Ary<>(GNode.class);
  public final Ary<GNode> _preds = new Ary<>(GNode.class);

  GNode( int idx, Eq.Def eq, Usage usage ) { _idx=idx; _eq=eq; _usage=usage; }

  public Ck ck() { return _usage._ck; }

  // Add edge this -> n, once
  boolean add_succ( GNode n ) {
    if( _succs.find(n) != -1 ) return false;
    _succs.add(n);
    n._preds.add(this);
    return true;
  }

  // Direct edge in either direction
  public boolean linked( GNode n ) {
    return _succs.find(n) != -1 || _preds.find(n) != -1;
  }

  @Override public String toString() { return "#"+_idx+" "+_eq; }
}
