package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Sampling: e is present only when variable _var carries tag _tag
public class When extends Exp {
  public final String _tag, _var;
  public When( Exp e, String tag, String var ) { super(e); _tag=tag; _var=var; }
  public Exp e() { return kid(0); }
  @Override public Exp copy( Ary<Exp> kids ) { return new When(kids.at(0),_tag,_var).attrs(this); }
  @Override public SB str( SB sb ) { return pp(sb,e()).p(" when ").p(_tag).p('(').p(_var).p(')'); }
}
