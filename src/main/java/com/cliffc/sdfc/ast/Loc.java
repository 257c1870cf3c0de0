package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.SB;

import java.util.Objects;

// Point in source code to blame.  Upstream parsing fills these in; passes
// only carry them along and print them in error messages.
public final class Loc {
  public static final Loc NONE = new Loc(null,0,0);

  public final String _src;     // Source file name, or null
  public final int _line, _col; // 1-based; 0 if unknown

  public Loc( String src, int line, int col ) { _src=src; _line=line; _col=col; }

  public boolean is_none() { return _src==null && _line==0; }

  // Error message prefixed with the file and line, in the usual
  // "file:line:col: msg" shape.
  public String errLocMsg( String msg ) {
    if( is_none() ) return msg;
    SB sb = new SB().p(_src==null ? "<unknown>" : _src).p(':').p(_line);
    if( _col > 0 ) sb.p(':').p(_col);
    return sb.p(": ").p(msg).toString();
  }

  @Override public String toString() { return errLocMsg(""); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Loc loc) ) return false;
    return _line==loc._line && _col==loc._col && Objects.equals(_src,loc._src);
  }
  @Override public int hashCode() { return Objects.hash(_src,_line,_col); }
}
