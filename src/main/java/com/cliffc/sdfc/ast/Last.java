package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Previous value of a state variable.  Unlike a delay, it names the
// variable's own memory, and is never part of a same-step dependency.
public class Last extends Exp {
  public final String _name;
  public Last( String name ) { super(); _name = name; }
  @Override public Exp copy( Ary<Exp> kids ) { return new Last(_name).attrs(this); }
  @Override public boolean is_atom() { return true; }
  @Override public SB str( SB sb ) { return sb.p("last ").p(_name); }
}
