package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

import java.util.Collection;
import java.util.Objects;

/** A clock: either the base clock, or a parent clock sampled by a condition
 *  {@code ck on tag(x)}.  The chain of conditions from the base outwards is
 *  the clock path; the "outermost" condition is the one nearest the base.
 */
public final class Ck {
  public static final Ck BASE = new Ck(null,null,null);

  public final Ck _par;         // Parent clock; null only for BASE
  public final String _tag;     // Condition tag, e.g. "true" or an enum constructor
  public final String _var;     // Controlling variable

  private Ck( Ck par, String tag, String var ) { _par=par; _tag=tag; _var=var; }

  public static Ck on( Ck par, String tag, String var ) {
    return new Ck(Objects.requireNonNull(par),Objects.requireNonNull(tag),Objects.requireNonNull(var));
  }
  public Ck on( String tag, String var ) { return on(this,tag,var); }

  public boolean is_base() { return _par==null; }

  // Number of sampling conditions
  public int depth() { return is_base() ? 0 : 1+_par.depth(); }

  // Root-first list of sampling conditions; each element is a one-step clock
  // whose _tag/_var hold the condition.
  public Ary<Ck> path() {
    Ary<Ck> path = new Ary<>(Ck.class);
    for( Ck ck = this; !ck.is_base(); ck = ck._par )
      path.insert(0,ck);
    return path;
  }

  // Condition nearest the base clock, or null for BASE
  public Ck outermost() {
    if( is_base() ) return null;
    Ck ck = this;
    while( !ck._par.is_base() ) ck = ck._par;
    return ck;
  }

  // Add every controlling variable along the path
  public <C extends Collection<String>> C vars( C acc ) {
    for( Ck ck = this; !ck.is_base(); ck = ck._par )
      acc.add(ck._var);
    return acc;
  }

  // Two clock paths may share control structure if either is empty, or their
  // outermost conditions test the same variable for the same tag.
  public static boolean joinable( Ck ck0, Ck ck1 ) {
    Ck o0 = ck0.outermost(), o1 = ck1.outermost();
    if( o0==null || o1==null ) return true;
    return o0._var.equals(o1._var) && o0._tag.equals(o1._tag);
  }

  public SB str( SB sb ) {
    if( is_base() ) return sb.p("base");
    return _par.str(sb).p(" on ").p(_tag).p('(').p(_var).p(')');
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ck ck) ) return false;
    return Objects.equals(_tag,ck._tag) && Objects.equals(_var,ck._var) && Objects.equals(_par,ck._par);
  }
  @Override public int hashCode() { return Objects.hash(_par,_tag,_var); }
}
