package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Array operators.  Static sizes and indices live in {@code _params}; the
 *  dynamic operands are kids, laid out per operator:
 *  <pre>
 *  REPEAT       e^n              kids [e]             params [n]
 *  SELECT       a[i][j]          kids [a]             params [i,j,...]
 *  SELECT_DYN   a.[i] default d  kids [a,d,i,...]
 *  UPDATE       [a with [i]=v]   kids [a,v]           params [i,...]
 *  SLICE        a[lo..hi]        kids [a]             params [lo,hi]
 *  CONCAT       a @ b            kids [a,b]
 *  MAP/FOLD/MAPFOLD              kids [args...]       params [n], _fun, _reset
 *  </pre>
 */
public class ArrayOp extends Exp {
  public enum Op {
    REPEAT, SELECT, SELECT_DYN, UPDATE, SLICE, CONCAT, MAP, FOLD, MAPFOLD
  }

  public final Op _op;
  public final int[] _params;
  public final String _fun;     // Iterated function, for iterators
  public final String _reset;   // Iterator reset variable, or null

  public ArrayOp( Op op, int[] params, String fun, String reset, Ary<Exp> kids ) {
    super(kids);
    _op=op; _params=params; _fun=fun; _reset=reset;
  }
  public ArrayOp( Op op, int[] params, Exp... kids ) { this(op,params,null,null,new Ary<>(kids)); }

  @Override public Exp copy( Ary<Exp> kids ) { return new ArrayOp(_op,_params,_fun,_reset,kids).attrs(this); }

  @Override public SB str( SB sb ) {
    switch( _op ) {
    case REPEAT -> pp(sb,kid(0)).p('^').p(_params[0]);
    case SELECT -> { pp(sb,kid(0)); for( int i : _params ) sb.p('[').p(i).p(']'); }
    case SELECT_DYN -> {
      pp(sb,kid(0)).p('.');
      for( int i=2; i<_kids._len; i++ ) kid(i).str(sb.p('[')).p(']');
      pp(sb.p(" default "),kid(1));
    }
    case UPDATE -> {
      pp(sb.p('['),kid(0)).p(" with ");
      for( int i : _params ) sb.p('[').p(i).p(']');
      kid(1).str(sb.p(" = ")).p(']');
    }
    case SLICE -> pp(sb,kid(0)).p('[').p(_params[0]).p("..").p(_params[1]).p(']');
    case CONCAT -> pp(pp(sb,kid(0)).p(" @ "),kid(1));
    default -> {
      sb.p(_op.name().toLowerCase()).p("<<").p(_params[0]).p(">> ").p(_fun).p('(');
      plist(sb,_kids,0,_kids._len).p(')');
      if( _reset!=null ) sb.p(" every ").p(_reset);
    }
    }
    return sb;
  }
}
