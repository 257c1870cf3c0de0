package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

public class Tuple extends Exp {
  public Tuple( Exp... es ) { super(es); }
  public Tuple( Ary<Exp> es ) { super(es); }
  @Override public Exp copy( Ary<Exp> kids ) { return new Tuple(kids).attrs(this); }
  @Override public SB str( SB sb ) { return plist(sb.p('('),_kids,0,_kids._len).p(')'); }
}
