package com.cliffc.demangle.node;

import org.jetbrains.annotations.Nullable;

// Differentiability of a function type, with its one-character mangled code
public enum MangledDifferentiabilityKind {
  NonDifferentiable(""),
  Forward("f"),
  Reverse("r"),
  Normal("d"),
  Linear("l");

  private final String _code;
  MangledDifferentiabilityKind( String code ) { _code = code; }
  public String code() { return _code; }

  // Null for anything but an exact code
  public static @Nullable MangledDifferentiabilityKind decode( String code ) {
    if( code==null ) return null;
    for( MangledDifferentiabilityKind k : values() )
      if( k._code.equals(code) ) return k;
    return null;
  }
}
