package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Node contract: local equations bracketed by an assumption on the inputs and
 *  a guarantee enforced on the outputs, with the controllable variables left
 *  free for a controller synthesizer downstream.
 */
public class Contract {
  public final Exp _assume, _enforce;
  public final Ary<VarDec> _controllables;
  public final Ary<VarDec> _locals;
  public final Ary<Eq> _eqs;
  public Loc _loc = Loc.NONE;

  public Contract( Exp assume, Exp enforce, Ary<VarDec> controllables, Ary<VarDec> locals, Ary<Eq> eqs ) {
    _assume=assume; _enforce=enforce; _controllables=controllables; _locals=locals; _eqs=eqs;
  }
  public Contract loc( Loc loc ) { _loc=loc; return this; }

  // Same contract, new locals and equations
  public Contract with_body( Ary<VarDec> locals, Ary<Eq> eqs ) {
    return new Contract(_assume,_enforce,_controllables,locals,eqs).loc(_loc);
  }

  public SB str( SB sb ) {
    sb.ip("contract").nl().ii(1);
    if( !_locals.isEmpty() ) VarDec.str(sb.ip("var "),_locals).p(';').nl();
    Eq.str(sb,_eqs);
    _assume .str(sb.ip("assume ")).nl();
    _enforce.str(sb.ip("enforce ")).nl();
    if( !_controllables.isEmpty() ) VarDec.str(sb.ip("with "),_controllables).nl();
    return sb.di(1);
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
