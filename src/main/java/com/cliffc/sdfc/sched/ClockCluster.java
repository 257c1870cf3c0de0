package com.cliffc.sdfc.sched;

import com.cliffc.sdfc.ast.Ck;
import com.cliffc.sdfc.dep.GNode;
import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

import java.util.ArrayList;
import java.util.HashMap;

/** Two-way insertion refinement.  Walking the order from the back, each
 *  equation is inserted into the result before the first equation it could
 *  share a clock test with, provided no equation linked to it comes first;
 *  otherwise it goes to the head.  A pass runs once forwards and once on the
 *  reversed result, so equations move both up and down towards their
 *  clock-mates.
 *  <p>
 *  Passes repeat until the order stops changing, so the result is stable
 *  under refinement.  A pass depends only on the equations and their order,
 *  so if the passes revisit an order instead, the orders on that loop are
 *  candidates and the least one by printed equations is picked: the same pick
 *  is made starting from any of them.
 *  <p>
 *  Insertion never passes a linked equation, so every edge stays forward.
 */
public class ClockCluster implements Refine {
  ClockCluster() { }

  @Override public Ary<GNode> refine( Ary<GNode> topo ) {
    HashMap<Ary<GNode>,Integer> seen = new HashMap<>();
    ArrayList<Ary<GNode>> trail = new ArrayList<>();
    Ary<GNode> cur = topo;
    while( !seen.containsKey(cur) ) {
      seen.put(cur,trail.size());
      trail.add(cur);
      cur = pass(cur);
    }
    int start = seen.get(cur);
    Ary<GNode> best = trail.get(start);
    String bkey = key(best);
    for( int i=start+1; i<trail.size(); i++ ) {
      String k = key(trail.get(i));
      if( k.compareTo(bkey) < 0 ) { best = trail.get(i); bkey = k; }
    }
    return best;
  }

  static Ary<GNode> pass( Ary<GNode> ns ) {
    return recook(recook(ns).reverse()).reverse();
  }

  static Ary<GNode> recook( Ary<GNode> ns ) {
    Ary<GNode> rs = new Ary<>(GNode.class);
    for( int i=ns._len-1; i>=0; i-- )
      rs.insert(place(ns.at(i),rs),ns.at(i));
    return rs;
  }

  // Index of the first joinable equation ahead of any linked one, else 0
  static int place( GNode n, Ary<GNode> rs ) {
    for( int i=0; i<rs._len; i++ ) {
      GNode m = rs.at(i);
      if( n.linked(m) ) return 0;
      if( Ck.joinable(n.ck(),m.ck()) ) return i;
    }
    return 0;
  }

  // Printed equations, one per line
  private static String key( Ary<GNode> ns ) {
    SB sb = new SB();
    for( GNode n : ns ) sb.p(n._eq.toString()).nl();
    return sb.toString();
  }

  @Override public String toString() { return "cluster"; }
}
