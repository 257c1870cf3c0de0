package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Unit delay.  {@code v fby e} is {@code v} in the first step, then the
 *  previous value of {@code e}; {@code pre e} has no initial value.
 */
public class Fby extends Exp {
  public final Const _init;     // Initial value; null for "pre"
  public Fby( Const init, Exp e ) { super(e); _init = init; }
  public Exp e() { return kid(0); }
  public boolean is_pre() { return _init==null; }
  @Override public Exp copy( Ary<Exp> kids ) { return new Fby(_init,kids.at(0)).attrs(this); }
  @Override public SB str( SB sb ) {
    if( is_pre() ) return pp(sb.p("pre "),e());
    return pp(_init.str(sb).p(" fby "),e());
  }
}
