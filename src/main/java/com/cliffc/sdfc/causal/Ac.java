package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Alternative-free constraint, the unit of the cycle check.
 *  <pre>
 *  a ::= x | ^x | *x | last x | a < a | a || a | (a,...,a)
 *  </pre>
 */
public abstract class Ac {
  Ac() { }

  // Print with the given binding priority: 0 at top and under ||, 1 under <
  // and in tuples.
  abstract SB str( SB sb, int prio );
  public final String render() { return str(new SB(),0).toString(); }
  @Override public final String toString() { return render(); }

  static final class Seq extends Ac {
    final Ac _a0, _a1;
    Seq( Ac a0, Ac a1 ) { _a0=a0; _a1=a1; }
    @Override SB str( SB sb, int prio ) {
      if( prio > 1 ) sb.p('(');
      _a1.str(_a0.str(sb,1).p(" < "),1);
      return prio > 1 ? sb.p(')') : sb;
    }
  }
  static final class And extends Ac {
    final Ac _a0, _a1;
    And( Ac a0, Ac a1 ) { _a0=a0; _a1=a1; }
    @Override SB str( SB sb, int prio ) {
      if( prio > 0 ) sb.p('(');
      _a1.str(_a0.str(sb,0).p(" || "),0);
      return prio > 0 ? sb.p(')') : sb;
    }
  }
  static final class Tuple extends Ac {
    final Ary<Ac> _as;
    Tuple( Ary<Ac> as ) { _as=as; }
    @Override SB str( SB sb, int prio ) {
      sb.p('(');
      for( int i=0; i<_as._len; i++ ) _as.at(i).str(i==0 ? sb : sb.p(", "),1);
      return sb.p(')');
    }
  }
  static final class Leaf extends Ac {
    final Constraint.Access _acc;
    final String _x;
    Leaf( Constraint.Access acc, String x ) { _acc=acc; _x=x; }
    @Override SB str( SB sb, int prio ) { return _acc.str(sb,_x); }
  }
}
