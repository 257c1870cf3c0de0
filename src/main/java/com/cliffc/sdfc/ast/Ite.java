package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Strict if/then/else: both branches are computed, one is selected
public class Ite extends Exp {
  public Ite( Exp c, Exp t, Exp f ) { super(c,t,f); }
  public Exp cond() { return kid(0); }
  public Exp thn () { return kid(1); }
  public Exp els () { return kid(2); }
  @Override public Exp copy( Ary<Exp> kids ) { return new Ite(kids.at(0),kids.at(1),kids.at(2)).attrs(this); }
  @Override public SB str( SB sb ) {
    cond().str(sb.p("if "));
    thn ().str(sb.p(" then "));
    return els().str(sb.p(" else "));
  }
}
