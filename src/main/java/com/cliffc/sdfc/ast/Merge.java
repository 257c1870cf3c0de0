package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

/** Combines branches on complementary clocks: {@code merge x (tag -> e)+}
 *  takes the branch whose tag matches the current value of {@code x}.
 *  Kids are the branches; {@code _tags} runs in parallel with them.
 */
public class Merge extends Exp {
  public final String _var;
  public final Ary<String> _tags;
  public Merge( String var, Ary<String> tags, Ary<Exp> branches ) {
    super(branches);
    assert tags._len==branches._len;
    _var=var;
    _tags=tags;
  }
  public String tag( int i ) { return _tags.at(i); }
  @Override public Exp copy( Ary<Exp> kids ) { return new Merge(_var,_tags,kids).attrs(this); }
  @Override public SB str( SB sb ) {
    sb.p("merge ").p(_var);
    for( int i=0; i<_kids._len; i++ )
      kid(i).str(sb.p(" (").p(tag(i)).p(" -> ")).p(')');
    return sb;
  }
}
