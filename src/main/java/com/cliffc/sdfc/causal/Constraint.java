package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

import java.util.Set;

/** Scheduling constraints.
 *  <pre>
 *  c ::= c # c | c || c | c < c | (c,...,c) | x | ^x | *x | last x | empty
 *  </pre>
 *  {@code #} is a choice between exclusive alternatives, {@code ||} parallel
 *  composition and {@code <} sequence.  {@code x} writes x, {@code ^x} reads
 *  it, {@code *x} is a linear read.  {@code x = x + 1} is rejected because
 *  {@code ^x < x} is not causal.
 *  <p>
 *  Build with the smart constructors, which drop {@link #EMPTY}.
 */
public abstract class Constraint {
  public static final Constraint EMPTY = new Constraint() {
      @Override SB str( SB sb ) { return sb.p("empty"); }
    };

  Constraint() { }

  abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  static final class Or extends Constraint {
    final Constraint _c0, _c1;
    Or( Constraint c0, Constraint c1 ) { _c0=c0; _c1=c1; }
    @Override SB str( SB sb ) { return _c1.str(_c0.str(sb.p('(')).p(" # ")).p(')'); }
  }
  static final class And extends Constraint {
    final Constraint _c0, _c1;
    And( Constraint c0, Constraint c1 ) { _c0=c0; _c1=c1; }
    @Override SB str( SB sb ) { return _c1.str(_c0.str(sb.p('(')).p(" || ")).p(')'); }
  }
  static final class Seq extends Constraint {
    final Constraint _c0, _c1;
    Seq( Constraint c0, Constraint c1 ) { _c0=c0; _c1=c1; }
    @Override SB str( SB sb ) { return _c1.str(_c0.str(sb.p('(')).p(" < ")).p(')'); }
  }
  static final class Tuple extends Constraint {
    final Ary<Constraint> _cs;
    Tuple( Ary<Constraint> cs ) { _cs=cs; }
    @Override SB str( SB sb ) {
      sb.p('(');
      for( int i=0; i<_cs._len; i++ ) _cs.at(i).str(i==0 ? sb : sb.p(", "));
      return sb.p(')');
    }
  }

  // Leaf access to a variable
  static final class Leaf extends Constraint {
    final Access _acc;
    final String _x;
    Leaf( Access acc, String x ) { _acc=acc; _x=x; }
    @Override SB str( SB sb ) { return _acc.str(sb,_x); }
  }

  // Kinds of variable access
  enum Access {
    WRITE(""), READ("^"), LINREAD("*"), LASTREAD("last ");
    final String _prefix;
    Access( String prefix ) { _prefix=prefix; }
    SB str( SB sb, String x ) { return sb.p(_prefix).p(x); }
  }

  public static Constraint write   ( String x ) { return new Leaf(Access.WRITE   ,x); }
  public static Constraint read    ( String x ) { return new Leaf(Access.READ    ,x); }
  public static Constraint linread ( String x ) { return new Leaf(Access.LINREAD ,x); }
  public static Constraint lastread( String x ) { return new Leaf(Access.LASTREAD,x); }

  public static Constraint cand( Constraint c0, Constraint c1 ) {
    if( c0==EMPTY ) return c1;
    if( c1==EMPTY ) return c0;
    return new And(c0,c1);
  }
  public static Constraint cor( Constraint c0, Constraint c1 ) {
    if( c0==EMPTY && c1==EMPTY ) return EMPTY;
    return new Or(c0,c1);
  }
  public static Constraint cseq( Constraint c0, Constraint c1 ) {
    if( c0==EMPTY ) return c1;
    if( c1==EMPTY ) return c0;
    return new Seq(c0,c1);
  }
  // Balanced, so long equation lists give shallow trees
  public static Constraint candlist( Ary<Constraint> cs ) { return candlist(cs,0,cs._len); }
  private static Constraint candlist( Ary<Constraint> cs, int lo, int hi ) {
    if( hi-lo == 0 ) return EMPTY;
    if( hi-lo == 1 ) return cs.at(lo);
    int mid = (lo+hi)>>>1;
    return cand(candlist(cs,lo,mid),candlist(cs,mid,hi));
  }
  public static Constraint corlist( Ary<Constraint> cs ) {
    if( cs.isEmpty() ) return EMPTY;
    Constraint c = cs.last();
    for( int i=cs._len-2; i>=0; i-- ) c = cor(cs.at(i),c);
    return c;
  }
  // Arguments evaluated in one step, without ordering among them.  Only
  // leaves and tuples can share a node; anything else is parallel.
  public static Constraint ctuple( Ary<Constraint> cs ) {
    boolean all_empty = true;
    for( Constraint c : cs ) {
      if( c instanceof Or || c instanceof And || c instanceof Seq ) return candlist(cs);
      if( c!=EMPTY ) all_empty = false;
    }
    return all_empty ? EMPTY : new Tuple(cs);
  }

  // Cut the current-step dependencies of a delayed expression
  public static Constraint pre( Constraint c ) {
    if( c instanceof Or  o ) return cor (pre(o._c0),pre(o._c1));
    if( c instanceof And a ) return cand(pre(a._c0),pre(a._c1));
    if( c instanceof Seq s ) return cseq(pre(s._c0),pre(s._c1));
    if( c instanceof Tuple t ) return ctuple(t._cs.map(Constraint::pre,Constraint.class));
    if( c instanceof Leaf l && (l._acc==Access.READ || l._acc==Access.LINREAD) ) return EMPTY;
    return c;
  }

  // Remove every access to the given names
  public static Constraint clear( Set<String> xs, Constraint c ) {
    if( c instanceof Or  o ) return cor (clear(xs,o._c0),clear(xs,o._c1));
    if( c instanceof And a ) return cand(clear(xs,a._c0),clear(xs,a._c1));
    if( c instanceof Seq s ) return cseq(clear(xs,s._c0),clear(xs,s._c1));
    if( c instanceof Tuple t ) return ctuple(t._cs.map(ci -> clear(xs,ci),Constraint.class));
    if( c instanceof Leaf l && xs.contains(l._x) ) return EMPTY;
    return c;
  }

  /** Distribute choices outwards: the result is a choice among
   *  alternatives free of {@code #}. */
  public static Nc norm( Constraint c ) {
    if( c instanceof Or  o ) return Nc.cor (norm(o._c0),norm(o._c1));
    if( c instanceof And a ) return Nc.cand(norm(a._c0),norm(a._c1));
    if( c instanceof Seq s ) return Nc.cseq(norm(s._c0),norm(s._c1));
    if( c instanceof Tuple t ) return Nc.of(new Ac.Tuple(ctuple_ac(t._cs)));
    if( c instanceof Leaf l ) return Nc.of(new Ac.Leaf(l._acc,l._x));
    return Nc.EMPTY;
  }
  private static Ary<Ac> ctuple_ac( Ary<Constraint> cs ) {
    Ary<Ac> acs = new Ary<>(Ac.class);
    for( Constraint c : cs ) {
      if( c instanceof Leaf l ) acs.add(new Ac.Leaf(l._acc,l._x));
      else if( c instanceof Tuple t ) acs.add(new Ac.Tuple(ctuple_ac(t._cs)));
      else if( c != EMPTY ) throw new IllegalStateException("unexpected constraint in tuple: "+c);
    }
    return acs;
  }
}
