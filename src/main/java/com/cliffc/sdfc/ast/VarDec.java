package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

// Variable declaration: name, type and clock
public class VarDec {
  public final String _name;
  public final Ty _ty;
  public final Ck _ck;
  public final Linearity _lin;
  public VarDec( String name, Ty ty, Ck ck, Linearity lin ) { _name=name; _ty=ty; _ck=ck; _lin=lin; }
  public VarDec( String name, Ty ty ) { this(name,ty,Ck.BASE,Linearity.NOT_LINEAR); }

  public SB str( SB sb ) {
    sb.p(_name);
    if( _ty!=null ) _ty.str(sb.p(" : "));
    if( !_ck.is_base() ) _ck.str(sb.p(" :: "));
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }

  public static SB str( SB sb, Ary<VarDec> vds ) {
    for( int i=0; i<vds._len; i++ ) {
      if( i>0 ) sb.p("; ");
      vds.at(i).str(sb);
    }
    return sb;
  }
  public static boolean has( Ary<VarDec> vds, String name ) {
    return vds.find(vd -> vd._name.equals(name)) != -1;
  }
}
