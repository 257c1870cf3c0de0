package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.Reporter;
import com.cliffc.sdfc.ast.*;
import com.cliffc.sdfc.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;

import static com.cliffc.sdfc.causal.Constraint.EMPTY;
import static com.cliffc.sdfc.causal.Constraint.cand;
import static com.cliffc.sdfc.causal.Constraint.candlist;
import static com.cliffc.sdfc.causal.Constraint.clear;
import static com.cliffc.sdfc.causal.Constraint.cor;
import static com.cliffc.sdfc.causal.Constraint.corlist;
import static com.cliffc.sdfc.causal.Constraint.cseq;
import static com.cliffc.sdfc.causal.Constraint.ctuple;
import static com.cliffc.sdfc.causal.Constraint.lastread;
import static com.cliffc.sdfc.causal.Constraint.linread;
import static com.cliffc.sdfc.causal.Constraint.pre;
import static com.cliffc.sdfc.causal.Constraint.read;
import static com.cliffc.sdfc.causal.Constraint.write;

/** Causality typing: each expression and equation gets a scheduling
 *  {@link Constraint}.  Blocks are checked where they stand and their locals
 *  are then projected away; a contract is checked apart from the body.
 */
public class Causality {
  private static final Logger LOG = LogManager.getLogger();

  private final Causal _causal;

  private Causality( Causal causal ) { _causal=causal; }

  /** Check a node and its contract.
   *  @throws com.cliffc.sdfc.CompileError on a causality cycle */
  public static void node( @NotNull NodeDec n, @NotNull Reporter reporter ) {
    LinkedHashMap<String,Loc> defs = new LinkedHashMap<>();
    if( n._contract != null ) def_sites(n._contract._eqs,defs);
    def_sites(n._eqs,defs);
    Causality c = new Causality(new Causal(reporter,defs));
    if( n._contract != null ) c.contract(n._contract,n._loc);
    c._causal.check(n._loc,c.eqs(n._eqs));
    LOG.debug("{} is causal",n._name);
  }

  // Source location of the first definition of each variable, nested blocks
  // included.
  private static void def_sites( Ary<Eq> eqs, LinkedHashMap<String,Loc> defs ) {
    for( Eq eq : eqs ) {
      if( eq instanceof Eq.Def def ) {
        for( String x : def._pat.vars(new ArrayList<String>()) ) defs.putIfAbsent(x,def._loc);
      } else if( eq instanceof Eq.Switch sw ) {
        for( Eq.Switch.Handler h : sw._handlers ) def_sites(h._block._eqs,defs);
      } else if( eq instanceof Eq.Present p ) {
        for( Eq.Present.Handler h : p._handlers ) def_sites(h._block._eqs,defs);
        def_sites(p._default._eqs,defs);
      } else if( eq instanceof Eq.Reset r ) {
        def_sites(r._eqs,defs);
      } else if( eq instanceof Eq.Automaton a ) {
        for( Eq.State s : a._states ) def_sites(s._block._eqs,defs);
      }
    }
  }

  private void contract( Contract c, Loc node_loc ) {
    Constraint t = cseq(exp(c._assume),cseq(eqs(c._eqs),exp(c._enforce)));
    _causal.check(c._loc.is_none() ? node_loc : c._loc,t);
  }

  Constraint eqs( Ary<Eq> eqs ) {
    Ary<Constraint> cs = new Ary<>(Constraint.class);
    for( Eq eq : eqs ) cs.add(eq(eq));
    return candlist(cs);
  }

  Constraint eq( Eq eq ) {
    if( eq instanceof Eq.Def def )
      return cseq(exp(def._rhs),pat(def._pat));
    if( eq instanceof Eq.Switch sw ) {
      Ary<Constraint> cs = new Ary<>(Constraint.class);
      for( Eq.Switch.Handler h : sw._handlers ) cs.add(block(h._block));
      return cseq(exp(sw._cond),corlist(cs));
    }
    if( eq instanceof Eq.Present p ) {
      Ary<Constraint> cs = new Ary<>(Constraint.class);
      cs.add(block(p._default));
      for( Eq.Present.Handler h : p._handlers ) cs.add(cseq(exp(h._cond),block(h._block)));
      return corlist(cs);
    }
    if( eq instanceof Eq.Reset r )
      return cseq(exp(r._cond),eqs(r._eqs));
    if( eq instanceof Eq.Automaton a ) {
      Ary<Constraint> cs = new Ary<>(Constraint.class);
      for( Eq.State s : a._states ) {
        Constraint tb = block(s._block);
        cs.add(cseq(escapes(s._unless),cseq(tb,escapes(s._until))));
      }
      return corlist(cs);
    }
    throw new IllegalArgumentException("unknown equation "+eq.getClass().getSimpleName());
  }

  private Constraint escapes( Ary<Eq.Escape> escs ) {
    Ary<Constraint> cs = new Ary<>(Constraint.class);
    for( Eq.Escape e : escs ) cs.add(exp(e._cond));
    return candlist(cs);
  }

  // Check the block where it stands, then hide its locals
  private Constraint block( Block b ) {
    Constraint t = eqs(b._eqs);
    _causal.check(b._loc,t);
    HashSet<String> locals = new HashSet<>();
    for( VarDec vd : b._locals ) locals.add(vd._name);
    return clear(locals,t);
  }

  private static Constraint pat( Pat p ) {
    if( p instanceof Pat.VarPat vp ) return write(vp._name);
    Ary<Constraint> cs = new Ary<>(Constraint.class);
    for( Pat pi : ((Pat.TuplePat)p)._pats ) cs.add(pat(pi));
    return candlist(cs);
  }

  Constraint exp( Exp e ) {
    if( e instanceof Const ) return EMPTY;
    if( e instanceof Var v ) return e._lin.is_linear() ? linread(v._name) : read(v._name);
    if( e instanceof Last l ) return lastread(l._name);
    if( e instanceof Tuple || e instanceof Struct || e instanceof ArrayExp ) return candlist(kids(e));
    if( e instanceof Field f ) return exp(f.rec());
    if( e instanceof Fby f ) return pre(exp(f.e()));
    if( e instanceof When w ) return cand(exp(w.e()),read(w._var));
    if( e instanceof Merge m ) return cseq(read(m._var),corlist(kids(m)));
    if( e instanceof Ite ite ) return cseq(exp(ite.cond()),cor(exp(ite.thn()),exp(ite.els())));
    if( e instanceof FieldUpdate fu ) return cseq(exp(fu.val()),exp(fu.rec()));
    if( e instanceof Call c ) return reset(c._reset,ctuple(kids(c)));
    if( e instanceof ArrayOp op ) {
      if( op._op == ArrayOp.Op.UPDATE ) return cseq(exp(op.kid(1)),exp(op.kid(0)));
      return reset(op._reset,ctuple(kids(op)));
    }
    throw new IllegalArgumentException("unknown expression "+e.getClass().getSimpleName());
  }

  private Ary<Constraint> kids( Exp e ) { return e._kids.map(this::exp,Constraint.class); }

  // A reset condition is read before the call starts
  private static Constraint reset( String r, Constraint c ) {
    return r == null ? c : cseq(read(r),c);
  }
}
