package com.cliffc.sdfc;

import com.cliffc.sdfc.ast.*;
import com.cliffc.sdfc.util.Ary;

// Short-hand constructors for test programs.  Every variable is an int on
// the base clock unless a test says otherwise.
public abstract class AstBuilder {
  private AstBuilder() { }

  public static Var v( String x ) { return new Var(x); }
  public static Exp v( String x, Ck ck ) { return new Var(x).ck(ck); }
  public static Exp lin( String x ) { return new Var(x).lin(Linearity.LINEAR); }
  public static Const c( String lit ) { return new Const(lit); }
  public static Const c( int lit ) { return new Const(Integer.toString(lit)); }
  public static Last last( String x ) { return new Last(x); }
  public static Call call( String f, Exp... args ) { return new Call(f,args); }
  public static Call app( String f, Exp... args ) { return new Call(f,Call.Kind.NODE,null,new Ary<>(args)); }
  public static Call every( String f, String r, Exp... args ) { return new Call(f,Call.Kind.NODE,r,new Ary<>(args)); }
  public static Exp plus( Exp a, Exp b ) { return call("+",a,b); }
  public static Fby fby( int init, Exp e ) { return new Fby(c(init),e); }
  public static Fby pre( Exp e ) { return new Fby(null,e); }
  public static When when( Exp e, String tag, String x ) { return (When)new When(e,tag,x).ck(e._ck.on(tag,x)); }
  public static Ite ite( Exp c, Exp t, Exp f ) { return new Ite(c,t,f); }
  public static Tuple tuple( Exp... es ) { return new Tuple(es); }
  public static Merge merge( String x, Exp t, Exp f ) {
    return new Merge(x,new Ary<>(new String[]{"true","false"}),new Ary<>(new Exp[]{t,f}));
  }
  public static Ck on( String tag, String x ) { return Ck.BASE.on(tag,x); }
  public static Exp at( Ck ck, Exp e ) { return e.ck(ck); }

  public static Eq.Def def( String x, Exp e ) { return new Eq.Def(x,e); }
  public static Eq.Def def( Pat p, Exp e ) { return new Eq.Def(p,e); }
  public static Pat tp( String... xs ) {
    Ary<Pat> ps = new Ary<>(Pat.class);
    for( String x : xs ) ps.add(new Pat.VarPat(x));
    return new Pat.TuplePat(ps);
  }
  public static Eq.Def def( Loc loc, String x, Exp e ) { return (Eq.Def)new Eq.Def(x,e).loc(loc); }

  public static Ary<VarDec> decs( String... xs ) {
    Ary<VarDec> ds = new Ary<>(VarDec.class);
    for( String x : xs ) ds.add(new VarDec(x,Ty.INT));
    return ds;
  }
  public static Ary<Eq> eqs( Eq... eqs ) { return new Ary<>(eqs); }
  public static String[] names( String... xs ) { return xs; }

  public static Block block( String[] locals, Eq... eqs ) { return new Block(decs(locals),new Ary<>(eqs)); }

  public static NodeDec node( String name, String[] ins, String[] outs, String[] locals, Eq... eqs ) {
    return new NodeDec(name,decs(ins),decs(outs),decs(locals),new Ary<>(eqs),null);
  }

  // Defined variables of each equation, in order, comma separated
  public static String order( Ary<Eq> eqs ) {
    StringBuilder sb = new StringBuilder();
    for( Eq eq : eqs ) {
      if( sb.length() > 0 ) sb.append(',');
      sb.append(((Eq.Def)eq)._pat);
    }
    return sb.toString();
  }
  // Equations, one per line
  public static String str( Ary<Eq> eqs ) {
    StringBuilder sb = new StringBuilder();
    for( Eq eq : eqs ) sb.append(eq).append('\n');
    return sb.toString();
  }
}
