package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Application of a primitive operator or of a node.  A node call may carry a
 *  reset condition: {@code f(args) every r} restarts f's memories when
 *  {@code r} is true.
 */
public class Call extends Exp {
  public enum Kind { OP, NODE }
  public final String _fun;
  public final Kind _kind;
  public final String _reset;   // Reset variable, or null
  public Call( String fun, Kind kind, String reset, Ary<Exp> args ) { super(args); _fun=fun; _kind=kind; _reset=reset; }
  public Call( String fun, Exp... args ) { this(fun,Kind.OP,null,new Ary<>(args)); }
  @Override public Exp copy( Ary<Exp> kids ) { return new Call(_fun,_kind,_reset,kids).attrs(this); }
  @Override public SB str( SB sb ) {
    plist(sb.p(_fun).p('('),_kids,0,_kids._len).p(')');
    return _reset==null ? sb : sb.p(" every ").p(_reset);
  }
}
