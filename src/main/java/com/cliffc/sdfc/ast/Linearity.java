package com.cliffc.sdfc.ast;

// Linearity marker computed by typing: a LINEAR value is consumed at most once.
public enum Linearity {
  NOT_LINEAR,
  LINEAR;

  public boolean is_linear() { return this==LINEAR; }
}
