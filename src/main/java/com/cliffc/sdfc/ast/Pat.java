package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

import java.util.Collection;

// Left-hand side of a definition: a variable or a tuple of patterns
public abstract class Pat {
  // Add every defined variable
  public abstract <C extends Collection<String>> C vars( C acc );
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  public static class VarPat extends Pat {
    public final String _name;
    public VarPat( String name ) { _name=name; }
    @Override public <C extends Collection<String>> C vars( C acc ) { acc.add(_name); return acc; }
    @Override public SB str( SB sb ) { return sb.p(_name); }
  }

  public static class TuplePat extends Pat {
    public final Ary<Pat> _pats;
    public TuplePat( Pat... pats ) { _pats = new Ary<>(pats); }
    public TuplePat( Ary<Pat> pats ) { _pats = pats; }
    @Override public <C extends Collection<String>> C vars( C acc ) {
      for( Pat p : _pats ) p.vars(acc);
      return acc;
    }
    @Override public SB str( SB sb ) {
      sb.p('(');
      for( int i=0; i<_pats._len; i++ ) {
        if( i>0 ) sb.p(", ");
        _pats.at(i).str(sb);
      }
      return sb.p(')');
    }
  }
}
