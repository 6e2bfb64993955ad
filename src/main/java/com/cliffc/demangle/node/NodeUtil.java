package com.cliffc.demangle.node;

import org.jetbrains.annotations.Nullable;

// Static helpers over possibly-absent Nodes
public abstract class NodeUtil {

  // Nil-safe nominal tests: an absent node is none of these
  public static boolean isAlias   ( @Nullable Node n ) { return n != null && n.isAlias   (); }
  public static boolean isClass   ( @Nullable Node n ) { return n != null && n.isClass   (); }
  public static boolean isEnum    ( @Nullable Node n ) { return n != null && n.isEnum    (); }
  public static boolean isProtocol( @Nullable Node n ) { return n != null && n.isProtocol(); }
  public static boolean isStruct  ( @Nullable Node n ) { return n != null && n.isStruct  (); }

  // Same Kinds, same payloads, same shape, all the way down.  Parent links
  // and node identity are ignored.
  public static boolean deepEquals( @Nullable Node a, @Nullable Node b ) {
    if( a==b ) return true;
    if( a==null || b==null ) return false;
    if( a._kind != b._kind || !a.payload().equals(b.payload()) ) return false;
    if( a.numChildren() != b.numChildren() ) return false;
    for( int i=0; i<a.numChildren(); i++ )
      if( !deepEquals(a.child(i),b.child(i)) )
        return false;
    return true;
  }
}
