package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.util.Ary;

// Normalized constraint: a choice among alternative-free constraints.
// Sequence and parallel composition distribute over the choice.
public abstract class Nc {
  public static final Nc EMPTY = new Nc() { };

  Nc() { }

  static final class Or extends Nc {
    final Nc _n0, _n1;
    Or( Nc n0, Nc n1 ) { _n0=n0; _n1=n1; }
  }
  static final class One extends Nc {
    final Ac _ac;
    One( Ac ac ) { _ac=ac; }
  }

  static Nc of( Ac ac ) { return new One(ac); }

  static Nc cor( Nc n0, Nc n1 ) {
    if( n0==EMPTY && n1==EMPTY ) return EMPTY;
    return new Or(n0,n1);
  }
  static Nc cseq( Nc n0, Nc n1 ) {
    if( n0==EMPTY ) return n1;
    if( n1==EMPTY ) return n0;
    if( n0 instanceof Or o ) return new Or(cseq(o._n0,n1),cseq(o._n1,n1));
    if( n1 instanceof Or o ) return new Or(cseq(n0,o._n0),cseq(n0,o._n1));
    return new One(new Ac.Seq(((One)n0)._ac,((One)n1)._ac));
  }
  static Nc cand( Nc n0, Nc n1 ) {
    if( n0==EMPTY ) return n1;
    if( n1==EMPTY ) return n0;
    if( n0 instanceof Or o ) return new Or(cand(o._n0,n1),cand(o._n1,n1));
    if( n1 instanceof Or o ) return new Or(cand(n0,o._n0),cand(n0,o._n1));
    return new One(new Ac.And(((One)n0)._ac,((One)n1)._ac));
  }

  // Every alternative, left to right; empty alternatives are dropped
  public Ary<Ac> alternatives() { return alternatives(new Ary<>(Ac.class)); }
  private Ary<Ac> alternatives( Ary<Ac> acc ) {
    if( this instanceof Or o ) { o._n0.alternatives(acc); o._n1.alternatives(acc); }
    else if( this instanceof One one ) acc.add(one._ac);
    return acc;
  }
}
