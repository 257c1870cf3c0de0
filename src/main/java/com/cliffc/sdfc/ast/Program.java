package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;
import org.jetbrains.annotations.Nullable;

public class Program {
  public final Ary<NodeDec> _nodes;
  public Program( Ary<NodeDec> nodes ) { _nodes=nodes; }

  public @Nullable NodeDec node( String name ) {
    int idx = _nodes.find(n -> n._name.equals(name));
    return idx == -1 ? null : _nodes.at(idx);
  }
  @Override public String toString() {
    SB sb = new SB();
    for( NodeDec n : _nodes ) n.str(sb).nl();
    return sb.toString();
  }
}
