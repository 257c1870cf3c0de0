package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Body of a control-construct branch: local declarations and equations
public class Block {
  public final Ary<VarDec> _locals;
  public final Ary<Eq> _eqs;
  public Loc _loc = Loc.NONE;
  public Block( Ary<VarDec> locals, Ary<Eq> eqs ) { _locals=locals; _eqs=eqs; }
  public Block loc( Loc loc ) { _loc=loc; return this; }

  public SB str( SB sb ) {
    if( !_locals.isEmpty() ) VarDec.str(sb.ip("var "),_locals).nl();
    return Eq.str(sb,_eqs);
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
