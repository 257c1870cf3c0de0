package com.cliffc.sdfc.ast;

import com.cliffc.sdfc.util.Ary;
import com.cliffc.sdfc.util.SB;

import java.util.HashSet;

// A node: the unit of normalization, causality checking and scheduling
public class NodeDec {
  public final String _name;
  public final Ary<VarDec> _inputs, _outputs, _locals;
  public final Ary<Eq> _eqs;
  public final Contract _contract;  // Null if none
  public Loc _loc = Loc.NONE;

  public NodeDec( String name, Ary<VarDec> inputs, Ary<VarDec> outputs, Ary<VarDec> locals, Ary<Eq> eqs, Contract contract ) {
    _name=name; _inputs=inputs; _outputs=outputs; _locals=locals; _eqs=eqs; _contract=contract;
  }
  public NodeDec loc( Loc loc ) { _loc=loc; return this; }

  // Same node, new locals, equations and contract
  public NodeDec with_body( Ary<VarDec> locals, Ary<Eq> eqs, Contract contract ) {
    return new NodeDec(_name,_inputs,_outputs,locals,eqs,contract).loc(_loc);
  }

  // Every declared name, including contract locals and controllables
  public HashSet<String> names() {
    HashSet<String> names = new HashSet<>();
    for( VarDec vd : _inputs  ) names.add(vd._name);
    for( VarDec vd : _outputs ) names.add(vd._name);
    for( VarDec vd : _locals  ) names.add(vd._name);
    if( _contract!=null ) {
      for( VarDec vd : _contract._locals        ) names.add(vd._name);
      for( VarDec vd : _contract._controllables ) names.add(vd._name);
    }
    return names;
  }

  public SB str( SB sb ) {
    VarDec.str(sb.p("node ").p(_name).p('('),_inputs).p(") returns (");
    VarDec.str(sb,_outputs).p(')').nl();
    if( _contract!=null ) _contract.str(sb);
    if( !_locals.isEmpty() ) VarDec.str(sb.p("var "),_locals).p(';').nl();
    Eq.str(sb.p("let").nl().ii(1),_eqs).di(1);
    return sb.p("tel").nl();
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
