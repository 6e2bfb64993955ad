package com.cliffc.demangle.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  // Tab indent, d levels past the current indent
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p('\t'); return this; }
  public SB i( ) { return i(0); }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }
  // Drop the last character, e.g. a trailing newline or separator
  public SB unchar() { if( _sb.length() > 0 ) _sb.setLength(_sb.length()-1); return this; }

  @Override public String toString() { return _sb.toString(); }
}
