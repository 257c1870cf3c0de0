package com.cliffc.sdfc.util;

import java.util.BitSet;

// Visit marks for graph walks, indexed by node number
public class VBitSet extends BitSet {
  // Cannot override 'set' to return a value... :-P
  // Set the bit, and report if it was already set
  public boolean tset(int idx) { boolean b = get(idx); set(idx); return b; }
  public boolean test(int idx) { return get(idx); }
}
