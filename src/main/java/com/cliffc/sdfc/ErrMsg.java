package com.cliffc.sdfc;

import com.cliffc.sdfc.ast.Loc;
import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

// Error messages
public class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    Causality,                // Instantaneous dependency cycles
  }

  public final Loc _loc;      // Point in code to blame
  public final String _msg;   // Printable error message, minus location
  public final Ary<String> _what; // Implicated variables, or expressions
  public final Level _lvl;    // Priority for printing
  public int _order;          // Message order as they are found.

  public ErrMsg( @Nullable Loc loc, String msg, Ary<String> what, Level lvl ) {
    _loc = loc==null ? Loc.NONE : loc;
    _msg=msg; _what=what; _lvl=lvl;
  }

  // Causality cycle through the named variables; msg carries the rendered
  // constraint.
  public static ErrMsg causality( Loc loc, Ary<String> vars, String msg ) {
    return new ErrMsg(loc,msg,vars,Level.Causality);
  }

  @Override public String toString() {
    return _loc.errLocMsg(_msg);
  }
  // Short single-line form, with the implicated names
  public String brief() {
    return new SB().p(_lvl.name()).p(_what,": [",", ","]").toString();
  }
  @Override public int compareTo( ErrMsg msg ) {
    int cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _order - msg._order;
  }
  @Override public boolean equals( Object obj ) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _msg.equals(err._msg) && _loc.equals(err._loc) && _what.equals(err._what);
  }
  @Override public int hashCode() {
    return Objects.hash(_loc,_msg,_lvl,_what);
  }
}
