package com.cliffc.demangle.node;

// Whether a reference is made directly or through an indirection
public enum Directness {
  DIRECT("direct"), INDIRECT("indirect"), UNKNOWN("");
  private final String _text;
  Directness( String text ) { _text = text; }
  public String text() { return _text; }
}
