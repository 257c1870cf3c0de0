package com.cliffc.sdfc.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB p( boolean s) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally pass a String as an
  // Object and get the wrong overload.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p("  "); return this; }
  public SB i( ) { return i(0); }
  public SB ip(String s) { return i().p(s); }

  // Print a separated list, with open and close brackets
  public <E> SB p( Iterable<E> es, String open, String sep, String close ) {
    p(open);
    boolean first = true;
    for( E e : es ) {
      if( !first ) p(sep);
      first = false;
      pobj(e);
    }
    return p(close);
  }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }

  @Override public String toString() { return _sb.toString(); }
}
