package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Expressions of a node body.  Every expression carries the clock, type and
 *  linearity computed upstream, plus a source location.  Expressions are
 *  treated as immutable once built: passes rewrite by {@link #copy} with new
 *  kids, keeping the attributes.
 */
public abstract class Exp {
  public final Ary<Exp> _kids;  // Sub-expressions, in evaluation order
  public Ck _ck = Ck.BASE;
  public Ty _ty;
  public Linearity _lin = Linearity.NOT_LINEAR;
  public Loc _loc = Loc.NONE;

  Exp( Ary<Exp> kids ) { _kids = kids; }
  Exp( Exp... kids ) { this(new Ary<>(kids)); }

  public Exp kid( int i ) { return _kids.at(i); }

  // Fluent attribute setters, used while building
  public Exp ck ( Ck ck ) { _ck = ck; return this; }
  public Exp ty ( Ty ty ) { _ty = ty; return this; }
  public Exp lin( Linearity lin ) { _lin = lin; return this; }
  public Exp loc( Loc loc ) { _loc = loc; return this; }
  // Copy all attributes from another expression
  public Exp attrs( Exp e ) { _ck=e._ck; _ty=e._ty; _lin=e._lin; _loc=e._loc; return this; }

  // Same expression with new kids and the same attributes
  public abstract Exp copy( Ary<Exp> kids );

  // Variables, constants and last are leaves
  public boolean is_atom() { return false; }

  // Everybody has to have a pretty print
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  // Print a kid, parenthesized unless atomic
  static SB pp( SB sb, Exp e ) {
    if( e.is_atom() || e instanceof Tuple || e instanceof ArrayExp ) return e.str(sb);
    return e.str(sb.p('(')).p(')');
  }
  static SB plist( SB sb, Ary<Exp> es, int lo, int hi ) {
    for( int i=lo; i<hi; i++ ) {
      if( i>lo ) sb.p(", ");
      es.at(i).str(sb);
    }
    return sb;
  }
}
