package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Equations.  A {@link Def} defines variables from an expression; the other
 *  kinds are control constructs whose bodies are blocks of equations.  Control
 *  constructs are lowered into definitions upstream of normalization, but the
 *  causality checker accepts them directly.
 */
public abstract class Eq {
  public Loc _loc = Loc.NONE;

  public Eq loc( Loc loc ) { _loc = loc; return this; }

  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  // Print a list of equations, one per line at the current indent
  public static SB str( SB sb, Ary<? extends Eq> eqs ) {
    for( Eq eq : eqs ) eq.str(sb.i()).p(';').nl();
    return sb;
  }

  // pat = rhs
  public static class Def extends Eq {
    public final Pat _pat;
    public final Exp _rhs;
    public Def( Pat pat, Exp rhs ) { _pat=pat; _rhs=rhs; }
    public Def( String x, Exp rhs ) { this(new Pat.VarPat(x),rhs); }
    @Override public SB str( SB sb ) { return _rhs.str(_pat.str(sb).p(" = ")); }
  }

  // switch e { tag -> block }
  public static class Switch extends Eq {
    public final Exp _cond;
    public final Ary<Handler> _handlers;
    public Switch( Exp cond, Ary<Handler> handlers ) { _cond=cond; _handlers=handlers; }
    @Override public SB str( SB sb ) {
      _cond.str(sb.p("switch ")).p(" {").nl().ii(1);
      for( Handler h : _handlers ) h._block.str(sb.ip("| ").p(h._tag).p(" ->").nl().ii(1)).di(1);
      return sb.di(1).ip("}");
    }
    public static class Handler {
      public final String _tag;
      public final Block _block;
      public Handler( String tag, Block block ) { _tag=tag; _block=block; }
    }
  }

  // present { cond -> block } default block
  public static class Present extends Eq {
    public final Ary<Handler> _handlers;
    public final Block _default;
    public Present( Ary<Handler> handlers, Block dflt ) { _handlers=handlers; _default=dflt; }
    @Override public SB str( SB sb ) {
      sb.p("present {").nl().ii(1);
      for( Handler h : _handlers ) h._block.str(h._cond.str(sb.ip("| ")).p(" ->").nl().ii(1)).di(1);
      _default.str(sb.ip("default").nl().ii(1)).di(1);
      return sb.di(1).ip("}");
    }
    public static class Handler {
      public final Exp _cond;
      public final Block _block;
      public Handler( Exp cond, Block block ) { _cond=cond; _block=block; }
    }
  }

  // reset eqs every e
  public static class Reset extends Eq {
    public final Ary<Eq> _eqs;
    public final Exp _cond;
    public Reset( Ary<Eq> eqs, Exp cond ) { _eqs=eqs; _cond=cond; }
    @Override public SB str( SB sb ) {
      str(sb.p("reset").nl().ii(1),_eqs).di(1);
      return _cond.str(sb.ip("every "));
    }
  }

  // automaton { state S: block unless/until escapes }
  public static class Automaton extends Eq {
    public final Ary<State> _states;
    public Automaton( Ary<State> states ) { _states=states; }
    @Override public SB str( SB sb ) {
      sb.p("automaton {").nl().ii(1);
      for( State s : _states ) {
        sb.ip("state ").p(s._name).nl().ii(1);
        for( Escape e : s._unless ) e.str(sb.ip("unless "));
        s._block.str(sb);
        for( Escape e : s._until ) e.str(sb.ip("until "));
        sb.di(1);
      }
      return sb.di(1).ip("}");
    }
  }

  public static class State {
    public final String _name;
    public final Block _block;
    public final Ary<Escape> _until;   // Checked at the end of the step
    public final Ary<Escape> _unless;  // Checked at the start of the step
    public State( String name, Block block, Ary<Escape> until, Ary<Escape> unless ) {
      _name=name; _block=block; _until=until; _unless=unless;
    }
  }

  public static class Escape {
    public final Exp _cond;
    public final boolean _reset;  // "then" resets the target; "continue" does not
    public final String _next;
    public Escape( Exp cond, boolean reset, String next ) { _cond=cond; _reset=reset; _next=next; }
    SB str( SB sb ) { return _cond.str(sb).p(_reset ? " then " : " continue ").p(_next).nl(); }
  }
}
