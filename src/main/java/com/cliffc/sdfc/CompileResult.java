package com.cliffc.sdfc;

import com.cliffc.sdfc.ast.Program;
import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Either the compiled program, or the errors found
public final class CompileResult {
  public final Program _prog;       // Null on failure
  public final Ary<ErrMsg> _errs;   // Sorted by level, then discovery order

  private CompileResult( Program prog, Ary<ErrMsg> errs ) { _prog=prog; _errs=errs; }

  static CompileResult ok( Program prog ) { return new CompileResult(prog,new Ary<>(ErrMsg.class)); }
  static CompileResult failed( Ary<ErrMsg> errs ) { return new CompileResult(null,errs); }

  public boolean is_ok() { return _prog != null; }

  @Override public String toString() {
    if( is_ok() ) return _prog.toString();
    SB sb = new SB();
    for( ErrMsg err : _errs ) sb.p(err.toString()).nl();
    return sb.toString();
  }
}
