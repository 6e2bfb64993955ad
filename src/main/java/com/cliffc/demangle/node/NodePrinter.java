package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;

// Diagnostic tree dump; not the production renderer.
//   kind=Structure
//   	kind=Module, text:"Core"
//   	kind=Identifier, text:"Point"
public abstract class NodePrinter {

  public static String dump( Node node ) { return _pp(node,new SB()).unchar().toString(); }

  // One line per node, children one tab deeper, left to right
  static SB _pp( Node node, SB sb ) {
    sb.i().p("kind=").p(node._kind.name());
    if( node.payload().hasValue() )
      node.payload().str(sb.p(", "));
    sb.nl().ii(1);
    for( int i=0; i<node.numChildren(); i++ )
      _pp(node.child(i),sb);
    return sb.di(1);
  }
}
