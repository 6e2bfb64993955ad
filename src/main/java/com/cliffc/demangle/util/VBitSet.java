package com.cliffc.demangle.util;

import java.util.BitSet;

// Frozen-after-init membership tables, indexed by enum ordinal
public class VBitSet extends BitSet {
  public boolean test(int idx) { return get(idx); }
}
