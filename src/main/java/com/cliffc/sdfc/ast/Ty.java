package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.SB;

import java.util.Arrays;
import java.util.Objects;

// Data types, as computed by typing upstream.  Only carried around here so
// that fresh local declarations get a type.
public final class Ty {
  public enum Kind { ID, PROD, ARRAY }

  public static final Ty INT  = id("int");
  public static final Ty BOOL = id("bool");
  public static final Ty REAL = id("float");

  public final Kind _kind;
  public final String _name;    // Type name for ID
  public final Ty[] _tys;       // Components for PROD; element type for ARRAY
  public final int _size;       // Array size

  private Ty( Kind kind, String name, Ty[] tys, int size ) { _kind=kind; _name=name; _tys=tys; _size=size; }

  public static Ty id( String name ) { return new Ty(Kind.ID,name,null,0); }
  public static Ty prod( Ty... tys ) { return new Ty(Kind.PROD,null,tys,0); }
  public static Ty array( Ty elem, int size ) { return new Ty(Kind.ARRAY,null,new Ty[]{elem},size); }

  public SB str( SB sb ) {
    return switch( _kind ) {
    case ID -> sb.p(_name);
    case ARRAY -> _tys[0].str(sb).p('^').p(_size);
    case PROD -> {
      sb.p('(');
      for( int i=0; i<_tys.length; i++ ) {
        if( i>0 ) sb.p(" * ");
        _tys[i].str(sb);
      }
      yield sb.p(')');
    }
    };
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ty ty) ) return false;
    return _kind==ty._kind && _size==ty._size && Objects.equals(_name,ty._name) && Arrays.equals(_tys,ty._tys);
  }
  @Override public int hashCode() { return Objects.hash(_kind,_name,_size,Arrays.hashCode(_tys)); }
}
