package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Array literal
public class ArrayExp extends Exp {
  public ArrayExp( Exp... es ) { super(es); }
  public ArrayExp( Ary<Exp> es ) { super(es); }
  @Override public Exp copy( Ary<Exp> kids ) { return new ArrayExp(kids).attrs(this); }
  @Override public SB str( SB sb ) { return plist(sb.p('['),_kids,0,_kids._len).p(']'); }
}
