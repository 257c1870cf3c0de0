package com.cliffc.sdfc.causal;

import com.cliffc.sdfc.CompileError;
import com.cliffc.sdfc.ErrMsg;
import com.cliffc.sdfc.Reporter;
import com.cliffc.sdfc.ast.Loc;
import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.VBitSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/** Causality check of a scheduling constraint.
 *  <p>
 *  The constraint is normalized into a choice of alternatives, and each
 *  alternative is checked on its own: it is causal if its dependence graph is
 *  acyclic.  The graph has one node per written variable and per linear read,
 *  one fresh node per read, and one node per tuple.  In {@code a < b} every
 *  top node of {@code b} depends on every bottom node of {@code a}.
 */
public class Causal {
  private static final Logger LOG = LogManager.getLogger();

  public static final String CYCLE = "Causality error: the following constraint is not causal.";

  private final Reporter _reporter;
  private final LinkedHashMap<String,Loc> _defs; // Definition sites, in source order

  public Causal( Reporter reporter, LinkedHashMap<String,Loc> defs ) { _reporter=reporter; _defs=defs; }

  /** Check every alternative of c.
   *  @param loc blamed when no definition site of a cycle variable is known
   *  @throws CompileError on the first non-causal alternative, after reporting it */
  public void check( Loc loc, Constraint c ) {
    Ary<Ac> alts = Constraint.norm(c).alternatives();
    LOG.debug("{} alternatives at {}",alts._len,loc);
    for( Ac ac : alts ) {
      Ary<String> vars = cycle(ac);
      if( vars == null ) continue;
      ErrMsg err = ErrMsg.causality(locate(vars,loc),vars,CYCLE+"\n"+ac.render());
      _reporter.report(err);
      throw new CompileError(err);
    }
  }

  // First definition site of a cycle variable, in source order
  private Loc locate( Ary<String> vars, Loc loc ) {
    HashSet<String> xs = new HashSet<>(Arrays.asList(vars.asAry()));
    for( Map.Entry<String,Loc> e : _defs.entrySet() )
      if( !e.getValue().is_none() && xs.contains(e.getKey()) )
        return e.getValue();
    return loc;
  }

  // Variables on a dependence cycle of ac, or null if acyclic
  static Ary<String> cycle( Ac ac ) {
    Graph g = new Graph();
    g.initialize(ac);
    g.make_graph(ac);
    Ary<MNode> cyc = g.cycle();
    if( cyc == null ) return null;
    LinkedHashSet<String> vars = new LinkedHashSet<>();
    for( MNode n : cyc ) vars.addAll(n._vars);
    return new Ary<>(String.class).addAll(vars);
  }

  // Micro-node; _deps must all come before this one
  static final class MNode {
    final int _idx;
    final Ary<MNode> _deps = new Ary<>(MNode.class);
    final LinkedHashSet<String> _vars = new LinkedHashSet<>();
    MNode( int idx ) { _idx=idx; }
    void depends( MNode n ) { if( _deps.find(n) == -1 ) _deps.add(n); }
  }

  private static final class Graph {
    final Ary<MNode> _nodes = new Ary<>(MNode.class);
    final HashMap<String,MNode> _n2g = new HashMap<>(); // Writer of x
    final HashMap<String,MNode> _lin = new HashMap<>(); // Linear reader of x

    MNode make() { MNode n = new MNode(_nodes._len); _nodes.add(n); return n; }

    // One node per written variable and per linear read; a tuple owns all
    // of its elements.
    void initialize( Ac ac ) {
      if( ac instanceof Ac.And a ) { initialize(a._a0); initialize(a._a1); }
      else if( ac instanceof Ac.Seq s ) { initialize(s._a0); initialize(s._a1); }
      else if( ac instanceof Ac.Tuple || ac instanceof Ac.Leaf l && l._acc!=Constraint.Access.READ && l._acc!=Constraint.Access.LASTREAD )
        associate(make(),ac);
    }
    private void associate( MNode g, Ac ac ) {
      if( ac instanceof Ac.Leaf l ) {
        switch( l._acc ) {
        case WRITE -> { _n2g.put(l._x,g); g._vars.add(l._x); }
        case LINREAD -> { _lin.put(l._x,g); g._vars.add(l._x); }
        default -> { }
        }
      } else if( ac instanceof Ac.Tuple t ) {
        for( Ac a : t._as ) associate(g,a);
      }
    }

    // n depends on the writer of x
    private void attach( MNode n, String x ) {
      n._vars.add(x);
      MNode w = _n2g.get(x);
      if( w != null ) n.depends(w);
    }
    // The linear reader of x depends on n
    private void attach_lin( MNode n, String x ) {
      MNode l = _lin.get(x);
      if( l != null ) l.depends(n);
    }

    private void add_dependence( MNode g, Ac ac ) {
      if( ac instanceof Ac.Leaf l ) {
        switch( l._acc ) {
        case READ -> { attach(g,l._x); attach_lin(g,l._x); }
        case LINREAD -> attach(_lin.get(l._x),l._x);
        default -> { }
        }
      } else if( ac instanceof Ac.Tuple t ) {
        for( Ac a : t._as ) add_dependence(g,a);
      }
    }

    private MNode node_for( Ac ac ) {
      if( ac instanceof Ac.Leaf l && l._acc==Constraint.Access.LINREAD ) return _lin.get(l._x);
      if( ac instanceof Ac.Leaf l && l._acc==Constraint.Access.WRITE   ) return _n2g.get(l._x);
      if( ac instanceof Ac.Tuple t && !t._as.isEmpty() ) return node_for(t._as.at(0));
      return make();
    }

    // Returns the top nodes in [0] and the bottom nodes in [1]
    Ary<MNode>[] make_graph( Ac ac ) {
      if( ac instanceof Ac.And a ) return compose(a._a0,a._a1,false);
      if( ac instanceof Ac.Seq s ) return compose(s._a0,s._a1,true );
      MNode g;
      if( ac instanceof Ac.Tuple t ) {
        g = node_for(t);
        for( Ac a : t._as ) add_dependence(g,a);
      } else {
        Ac.Leaf l = (Ac.Leaf)ac;
        g = switch( l._acc ) {
        case WRITE -> _n2g.get(l._x);
        case READ -> { MNode r = make(); attach(r,l._x); attach_lin(r,l._x); yield r; }
        case LINREAD -> { MNode r = _lin.get(l._x); attach(r,l._x); yield r; }
        case LASTREAD -> null;
        };
      }
      Ary<MNode> tb = new Ary<>(MNode.class);
      if( g != null ) tb.add(g);
      return pair(tb,tb.copy());
    }
    private Ary<MNode>[] compose( Ac a0, Ac a1, boolean seq ) {
      Ary<MNode>[] tb0 = make_graph(a0), tb1 = make_graph(a1);
      if( seq )
        for( MNode t : tb1[0] )
          for( MNode b : tb0[1] )
            t.depends(b);
      return pair(tb0[0].addAll(tb1[0]),tb0[1].addAll(tb1[1]));
    }
    @SuppressWarnings("unchecked")
    private static Ary<MNode>[] pair( Ary<MNode> top, Ary<MNode> bot ) { return new Ary[]{top,bot}; }

    // Three-colour depth-first search; returns the nodes on a cycle
    Ary<MNode> cycle() {
      VBitSet grey = new VBitSet(), black = new VBitSet();
      Ary<MNode> stack = new Ary<>(MNode.class); // The grey path
      int[] next = new int[_nodes._len];         // Next dependence to visit
      for( MNode root : _nodes ) {
        if( black.test(root._idx) ) continue;
        grey.set(root._idx);
        stack.add(root);
        while( !stack.isEmpty() ) {
          MNode n = stack.last();
          if( next[n._idx] < n._deps._len ) {
            MNode d = n._deps.at(next[n._idx]++);
            if( black.test(d._idx) ) continue;
            if( grey.tset(d._idx) ) {
              Ary<MNode> cyc = new Ary<>(MNode.class);
              for( int i=stack.find(d); i<stack._len; i++ ) cyc.add(stack.at(i));
              return cyc;
            }
            stack.add(d);
          } else {
            stack.pop();
            black.set(n._idx);
          }
        }
      }
      return null;
    }
  }
}
