package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// A literal or a static constant name, kept as its source spelling
public class Const extends Exp {
  public final String _lit;
  public Const( String lit ) { super(); _lit = lit; }
  @Override public Exp copy( Ary<Exp> kids ) { return new Const(_lit).attrs(this); }
  @Override public boolean is_atom() { return true; }
  @Override public SB str( SB sb ) { return sb.p(_lit); }
}
