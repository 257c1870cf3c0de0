package com.cliffc.sdfc.dep;

import com.cliffc.sdfc.ast.*;

import java.util.Collection;

/** Variables read by expressions.  A full read is any use of a variable in
 *  the step; a left-read is a use that must be computed before the reader in
 *  the same step.  A delay only needs its source's clock now, and {@code last
 *  x} reads the memory of {@code x}, never the current value.
 */
public abstract class Vars {
  private Vars() { }

  public static <C extends Collection<String>> C reads( Exp e, C acc ) { return reads(e,false,acc); }
  public static <C extends Collection<String>> C left_reads( Exp e, C acc ) { return reads(e,true,acc); }

  private static <C extends Collection<String>> C reads( Exp e, boolean left, C acc ) {
    e._ck.vars(acc);
    if( e instanceof Var v ) { acc.add(v._name); return acc; }
    if( e instanceof Last l ) { if( !left ) acc.add(l._name); return acc; }
    if( e instanceof Fby f && left ) return f.e()._ck.vars(acc);
    if( e instanceof Merge m ) acc.add(m._var);
    if( e instanceof When w ) acc.add(w._var);
    if( e instanceof Call c && c._reset != null ) acc.add(c._reset);
    if( e instanceof ArrayOp op && op._reset != null ) acc.add(op._reset);
    for( Exp kid : e._kids ) reads(kid,left,acc);
    return acc;
  }

  // Variables consumed by a linear use
  public static <C extends Collection<String>> C linear_reads( Exp e, C acc ) {
    if( e instanceof Var v && e._lin.is_linear() ) acc.add(v._name);
    for( Exp kid : e._kids ) linear_reads(kid,acc);
    return acc;
  }

  // The right-hand side is a delay
  public static boolean is_delay( Exp e ) { return e instanceof Fby; }

  // Clock of a right-hand side; a merge runs on the clock of its first branch
  public static Ck clock( Exp e ) {
    return e instanceof Merge m ? m.kid(0)._ck : e._ck;
  }
}
