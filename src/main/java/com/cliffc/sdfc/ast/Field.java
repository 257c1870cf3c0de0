package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

public class Field extends Exp {
  public final String _fld;
  public Field( Exp rec, String fld ) { super(rec); _fld=fld; }
  public Exp rec() { return kid(0); }
  @Override public Exp copy( Ary<Exp> kids ) { return new Field(kids.at(0),_fld).attrs(this); }
  @Override public SB str( SB sb ) { return pp(sb,rec()).p('.').p(_fld); }
}
