package com.cliffc.sdfc;

// Fatal diagnostic for one node: compilation of that node stops here.
public class CompileError extends RuntimeException {
  public final ErrMsg _err;
  public CompileError( ErrMsg err ) { super(err.toString()); _err=err; }
}
