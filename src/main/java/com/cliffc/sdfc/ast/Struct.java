package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Record construction; field names parallel the kids
public class Struct extends Exp {
  public final Ary<String> _flds;
  public Struct( Ary<String> flds, Ary<Exp> vals ) {
    super(vals);
    assert flds._len==vals._len;
    _flds=flds;
  }
  @Override public Exp copy( Ary<Exp> kids ) { return new Struct(_flds,kids).attrs(this); }
  @Override public SB str( SB sb ) {
    sb.p("{ ");
    for( int i=0; i<_kids._len; i++ ) {
      if( i>0 ) sb.p("; ");
      kid(i).str(sb.p(_flds.at(i)).p(" = "));
    }
    return sb.p(" }");
  }
}
