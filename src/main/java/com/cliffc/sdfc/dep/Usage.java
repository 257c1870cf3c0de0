package com.cliffc.sdfc.dep;

import com.cliffc.sdfc.ast.Ck;
import com.cliffc.sdfc.ast.Eq;
import com.cliffc.sdfc.util.SB;

import java.util.LinkedHashSet;

// What one definition defines and reads.  Derived on demand, never stored
// in the AST.
public final class Usage {
  public final LinkedHashSet<String> _defs;
  public final LinkedHashSet<String> _reads;      // Every variable used
  public final LinkedHashSet<String> _left_reads; // Used before the definition runs
  public final LinkedHashSet<String> _lin_reads;  // Consumed by a linear use
  public final boolean _delay;                    // Right-hand side is a delay
  public final Ck _ck;

  private Usage( Eq.Def def ) {
    _defs       = def._pat.vars(new LinkedHashSet<>());
    _reads      = Vars.reads(def._rhs,new LinkedHashSet<>());
    _left_reads = Vars.left_reads(def._rhs,new LinkedHashSet<>());
    _lin_reads  = Vars.linear_reads(def._rhs,new LinkedHashSet<>());
    _delay      = Vars.is_delay(def._rhs);
    _ck         = Vars.clock(def._rhs);
  }

  public static Usage of( Eq eq ) {
    if( !(eq instanceof Eq.Def def) )
      throw new IllegalArgumentException("usage of a control structure: "+eq);
    return new Usage(def);
  }

  @Override public String toString() {
    SB sb = new SB().p(_defs,"def {",",","}").p(_reads," reads {",",","}").p(_left_reads," left {",",","}");
    if( _delay ) sb.p(" delay");
    return _ck.str(sb.p(" on ")).toString();
  }
}
