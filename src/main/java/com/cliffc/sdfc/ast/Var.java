package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

public class Var extends Exp {
  public final String _name;
  public Var( String name ) { super(); _name = name; }
  @Override public Exp copy( Ary<Exp> kids ) { return new Var(_name).attrs(this); }
  @Override public boolean is_atom() { return true; }
  @Override public SB str( SB sb ) { return sb.p(_name); }
}
