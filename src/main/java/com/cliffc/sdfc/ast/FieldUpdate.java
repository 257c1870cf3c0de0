package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Functional record update: a copy of rec with field _fld replaced by val
public class FieldUpdate extends Exp {
  public final String _fld;
  public FieldUpdate( String fld, Exp rec, Exp val ) { super(rec,val); _fld=fld; }
  public Exp rec() { return kid(0); }
  public Exp val() { return kid(1); }
  @Override public Exp copy( Ary<Exp> kids ) { return new FieldUpdate(_fld,kids.at(0),kids.at(1)).attrs(this); }
  @Override public SB str( SB sb ) {
    pp(sb.p("{ "),rec()).p(" with .").p(_fld).p(" = ");
    return val().str(sb).p(" }");
  }
}
