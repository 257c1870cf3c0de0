package com.cliffc.sdfc.norm;

import com.cliffc.sdfc.Options;
import com.cliffc.sdfc.ast.*;
import com.cliffc.sdfc.util.Ary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;

/** Normal form for node bodies.
 *  <pre>
 *  e   ::= op(e,...,e) | x | C | e when C(x) | x.f | ...
 *  act ::= e | merge x (C1 -> act) ... (Cn -> act) | (act,...,act)
 *  eq  ::= x = v fby e | pat = act | pat = f(e,...,e) every r
 *  </pre>
 *  Sub-expressions that do not fit their context are moved into fresh
 *  equations {@code _vN = e} with a fresh local {@code _vN}.  Sampling
 *  distributes over tuples, and a merge of tuples becomes a tuple of merges.
 *  {@code if c then a else b} becomes {@code merge c (true -> a when true(c))
 *  (false -> b when false(c))}.
 *  <p>
 *  The rewrite is driven by the {@link Kind} of the enclosing context.  The
 *  pass is idempotent.
 */
public class Normalize {
  private static final Logger LOG = LogManager.getLogger();

  // What the enclosing context accepts; see add() for the exact rules
  public enum Kind {
    VREF_COND,                // Value reference, unless conditionally computed
    VREF,                     // Variable, field or literal
    EXP,                      // Simple expression
    ACT,                      // Anything but a node application or a delay
    ANY,                      // Anything at all
  }

  private final Kind _merge_kind;
  private final HashSet<String> _names; // Every name in use in the node
  private int _cnt;                     // Fresh name counter

  // Current equation list context
  private Ary<VarDec> _decls;
  private Ary<Eq> _eqs;

  private Normalize( HashSet<String> names, boolean mem_alloc ) {
    _names = names;
    _merge_kind = mem_alloc ? Kind.VREF : Kind.ACT;
  }

  // Normalize a node body and its contract
  public static @NotNull NodeDec node( @NotNull NodeDec n, @NotNull Options opts ) {
    Normalize norm = new Normalize(n.names(),opts._mem_alloc);
    Contract c = n._contract;
    if( c != null ) {
      Ary<Eq> ceqs = norm.eqs(c._locals,c._eqs);
      c = c.with_body(norm._decls,ceqs);
    }
    Ary<Eq> eqs = norm.eqs(n._locals,n._eqs);
    LOG.debug("normalized {}: {} equations",n._name,eqs._len);
    return n.with_body(norm._decls,eqs,c);
  }

  // Normalize an equation list against its local declarations.  Leaves the
  // extended declarations in _decls.
  private Ary<Eq> eqs( Ary<VarDec> locals, Ary<Eq> eqs ) {
    _decls = locals.copy();
    _eqs = new Ary<>(Eq.class);
    for( Eq eq : eqs ) {
      if( !(eq instanceof Eq.Def def) )
        throw new IllegalArgumentException("control structure reached normalization: "+eq);
      distribute(def._pat,exp(Kind.ANY,def._rhs),def._loc);
    }
    return _eqs;
  }

  // Split tuple patterns matched against tuples; move a delay defining an
  // output into a fresh local.
  private void distribute( Pat pat, Exp e, Loc loc ) {
    if( pat instanceof Pat.TuplePat tp && e instanceof Tuple t && tp._pats._len==t._kids._len ) {
      for( int i=0; i<t._kids._len; i++ )
        distribute(tp._pats.at(i),t.kid(i),loc);
      return;
    }
    if( pat instanceof Pat.VarPat vp && e instanceof Fby && !VarDec.has(_decls,vp._name) )
      e = fresh(e);
    _eqs.add(new Eq.Def(pat,e).loc(loc));
  }

  // Normalize e for context kind
  Exp exp( Kind kind, Exp e ) {
    Exp r;
    if( e instanceof Var || e instanceof Last ) {
      r = e;
    } else if( e instanceof Const c ) {
      r = sample(c,c._ck);
    } else if( e instanceof Merge m ) {
      r = merge(m,m._var,m._tags,list(_merge_kind,m._kids,0,m._kids._len));
    } else if( e instanceof Ite ite ) {
      Exp c = exp(Kind.ANY,ite.cond());
      Exp t = exp(Kind.ACT,ite.thn());
      Exp f = exp(Kind.ACT,ite.els());
      String x = c instanceof Var v ? v._name : fresh(c)._name;
      r = merge(ite,x,new Ary<>(new String[]{"true","false"}),
                new Ary<>(new Exp[]{whenc(t,"true",x),whenc(f,"false",x)}));
    } else if( e instanceof Tuple || e instanceof ArrayExp ) {
      r = e.copy(list(kind,e._kids,0,e._kids._len));
    } else if( e instanceof When w ) {
      r = whenc(exp(kind,w.e()),w._tag,w._var);
    } else if( e instanceof Call ) {
      r = e.copy(list(Kind.VREF_COND,e._kids,0,e._kids._len));
    } else if( e instanceof Fby f ) {
      Exp src = exp(Kind.EXP,f.e());
      if( !is_constant(src) ) src = fresh(src);
      r = f.copy(new Ary<>(new Exp[]{src}));
    } else if( e instanceof Field || e instanceof Struct ) {
      r = e.copy(list(Kind.EXP,e._kids,0,e._kids._len));
    } else if( e instanceof FieldUpdate fu ) {
      r = fu.copy(new Ary<>(new Exp[]{exp(Kind.VREF,fu.rec()),exp(Kind.EXP,fu.val())}));
    } else if( e instanceof ArrayOp op ) {
      r = op.copy(array_op(op));
    } else {
      throw new IllegalArgumentException("unknown expression "+e.getClass().getSimpleName());
    }
    return add(kind,r);
  }

  private Ary<Exp> array_op( ArrayOp op ) {
    Ary<Exp> kids = op._kids;
    switch( op._op ) {
    case REPEAT: case SELECT: case SLICE: case CONCAT:
      return list(Kind.VREF,kids,0,kids._len);
    case SELECT_DYN:
      return list(Kind.VREF,kids,0,1)
        .addAll(list(Kind.EXP,kids,1,kids._len));
    case UPDATE:
      return list(Kind.VREF,kids,0,1)
        .addAll(list(Kind.EXP,kids,1,2));
    default:                  // Iterators
      return list(Kind.VREF_COND,kids,0,kids._len);
    }
  }

  // Normalize kids [lo,hi) in order, so fresh equations appear in order
  private Ary<Exp> list( Kind kind, Ary<Exp> es, int lo, int hi ) {
    Ary<Exp> rs = new Ary<>(Exp.class);
    for( int i=lo; i<hi; i++ )
      rs.add(exp(kind,es.at(i)));
    return rs;
  }

  // Materialize e into a fresh equation if it does not fit kind
  private Exp add( Kind kind, Exp e ) {
    boolean up = switch( kind ) {
    case VREF_COND -> !is_ref(e) && (e instanceof Fby || e._lin.is_linear());
    case VREF -> !is_ref(e) && !is_literal(e);
    case EXP -> e instanceof Merge || e instanceof Tuple || is_app(e) || e instanceof Fby ||
      (e instanceof ArrayOp op && op._op != ArrayOp.Op.SELECT);
    case ACT -> is_app(e) || e instanceof Fby;
    case ANY -> false;
    };
    return up ? fresh(e) : e;
  }

  // Node application; primitive operators stay inline
  private static boolean is_app( Exp e ) {
    return e instanceof Call c && (c._kind == Call.Kind.NODE || c._reset != null);
  }
  private static boolean is_ref( Exp e ) {
    return e instanceof Var || e instanceof Field || e instanceof Last;
  }
  // A constant, possibly sampled
  private static boolean is_literal( Exp e ) {
    while( e instanceof When w ) e = w.e();
    return e instanceof Const;
  }
  // Delay sources kept in place: constants and variables, possibly sampled
  private static boolean is_constant( Exp e ) {
    while( e instanceof When w ) e = w.e();
    return e instanceof Const || e instanceof Var;
  }

  // A constant on a sampled clock becomes the base-clock constant sampled
  // along the clock path.
  private static Exp sample( Const c, Ck ck ) {
    if( ck.is_base() ) return c.copy(c._kids).ck(Ck.BASE);
    return new When(sample(c,ck._par),ck._tag,ck._var).attrs(c).ck(ck);
  }

  // (e1,...,en) when C(x) = (e1 when C(x),...,en when C(x))
  private static Exp whenc( Exp e, String tag, String x ) {
    Ck ck = e._ck.on(tag,x);
    if( e instanceof Tuple t ) {
      Ary<Exp> es = new Ary<>(Exp.class);
      for( Exp ei : t._kids ) es.add(whenc(ei,tag,x));
      return t.copy(es).ck(ck);
    }
    return new When(e,tag,x).attrs(e).ck(ck);
  }

  // merge x (C1 -> (e11,...,e1n)) ... (Ck -> (ek1,...,ekn)) becomes
  // (merge x (C1 -> e11) ... (Ck -> ek1), ..., merge x (C1 -> e1n) ... (Ck -> ekn))
  // when every branch is a tuple of the same arity.
  private static Exp merge( Exp e, String x, Ary<String> tags, Ary<Exp> bs ) {
    int arity = tuple_arity(bs);
    if( arity <= 0 )
      return new Merge(x,tags,bs).attrs(bs.at(0)).ck(e._ck).loc(e._loc);
    Ary<Exp> parts = new Ary<>(Exp.class);
    for( int i=0; i<arity; i++ ) {
      Ary<Exp> bis = new Ary<>(Exp.class);
      for( Exp b : bs ) bis.add(b.kid(i));
      parts.add(merge(e,x,tags,bis));
    }
    return new Tuple(parts).attrs(e);
  }
  // Common arity of the branches if all are tuples, else -1
  private static int tuple_arity( Ary<Exp> bs ) {
    int arity = -1;
    for( Exp b : bs ) {
      if( !(b instanceof Tuple) ) return -1;
      if( arity == -1 ) arity = b._kids._len;
      else if( arity != b._kids._len ) return -1;
    }
    return arity;
  }

  // New equation _vN = e, before the current one
  private Var fresh( Exp e ) {
    String n;
    do n = "_v"+(++_cnt); while( _names.contains(n) );
    _names.add(n);
    _decls.add(new VarDec(n,e._ty,e._ck,e._lin));
    _eqs.add(new Eq.Def(n,e).loc(e._loc));
    LOG.debug("fresh {} = {}",n,e);
    return (Var)new Var(n).attrs(e);
  }
}
