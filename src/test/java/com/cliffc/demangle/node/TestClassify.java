package com.cliffc.demangle.node;

import com.cliffc.demangle.ContractViolation;
import com.cliffc.demangle.DM;
import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestClassify {

  @After public void reset() { DM.STRICT = true; }

  static Node nominal( Kind kind, String module, String name ) {
    return new Node(kind, new Node(Kind.Module,module), new Node(Kind.Identifier,name));
  }
  static Node type( Node n ) { return new Node(Kind.Type,n); }
  static Node proto( String name ) { return type(nominal(Kind.Protocol,"Core",name)); }

  // ProtocolList -> TypeList -> Type(Protocol)*
  static Node protocolList( int n ) {
    Node types = new Node(Kind.TypeList);
    for( int i=0; i<n; i++ ) types.add(proto("P"+i));
    return new Node(Kind.ProtocolList,types);
  }

  @Test public void testSimpleAtoms() {
    assertTrue(nominal(Kind.Structure,"Core","Point").isSimpleType());
    assertTrue(new Node(Kind.Module,"Core").isSimpleType());
    assertTrue(new Node(Kind.Tuple).isSimpleType());
    assertTrue(new Node(Kind.Integer,42).isSimpleType());
    assertTrue(new Node(Kind.NegativeInteger,42).isSimpleType());
    assertTrue(new Node(Kind.SugaredOptional).isSimpleType());
    assertTrue(new Node(Kind.BoundGenericFunction).isSimpleType());
    assertFalse(new Node(Kind.FunctionType).isSimpleType());
    assertFalse(new Node(Kind.Identifier,"x").isSimpleType());
    assertFalse(new Node(Kind.ProtocolListWithClass).isSimpleType());
    assertFalse(new Node(Kind.PackExpansion).isSimpleType());
    assertFalse(new Node(Kind.UnknownIndex).isSimpleType());
  }

  @Test public void testSimpleThroughType() {
    assertTrue(type(nominal(Kind.Class,"Core","C")).isSimpleType());
    assertFalse(type(new Node(Kind.FunctionType)).isSimpleType());
  }

  @Test public void testSimpleProtocolList() {
    assertTrue(protocolList(0).isSimpleType());
    assertTrue(protocolList(1).isSimpleType());
    assertFalse(protocolList(2).isSimpleType());
  }

  @Test public void testSimpleProtocolListWithAnyObject() {
    assertTrue (new Node(Kind.ProtocolListWithAnyObject,protocolList(0)).isSimpleType());
    assertFalse(new Node(Kind.ProtocolListWithAnyObject,protocolList(1)).isSimpleType());
    assertFalse(new Node(Kind.ProtocolListWithAnyObject,protocolList(3)).isSimpleType());
  }

  @Test public void testMalformedProtocolListStrict() {
    try {
      new Node(Kind.ProtocolListWithAnyObject,new Node(Kind.ProtocolList)).isSimpleType();
      fail();
    } catch( ContractViolation cv ) {
      assertEquals(ContractViolation.Reason.Malformed, cv._reason);
    }
    try {
      new Node(Kind.ProtocolList).isSimpleType();
      fail();
    } catch( ContractViolation cv ) {
      assertEquals(ContractViolation.Reason.Malformed, cv._reason);
    }
  }

  @Test public void testMalformedProtocolListLenient() {
    DM.STRICT = false;
    assertFalse(new Node(Kind.ProtocolListWithAnyObject).isSimpleType());
    assertFalse(new Node(Kind.ProtocolListWithAnyObject,new Node(Kind.ProtocolList)).isSimpleType());
    assertFalse(new Node(Kind.ProtocolList).isSimpleType());
    assertFalse(new Node(Kind.Type).isSimpleType());
  }

  @Test public void testNeedSpaceBeforeType() {
    assertFalse(new Node(Kind.FunctionType).isNeedSpaceBeforeType());
    assertFalse(new Node(Kind.NoEscapeFunctionType).isNeedSpaceBeforeType());
    assertFalse(new Node(Kind.UncurriedFunctionType).isNeedSpaceBeforeType());
    assertFalse(type(new Node(Kind.DependentGenericType)).isNeedSpaceBeforeType());
    assertTrue(type(nominal(Kind.Structure,"Core","S")).isNeedSpaceBeforeType());
    assertTrue(new Node(Kind.ThinFunctionType).isNeedSpaceBeforeType());
  }

  @Test public void testExistential() {
    assertTrue(new Node(Kind.ExistentialMetatype).isExistentialType());
    assertTrue(protocolList(2).isExistentialType());
    assertTrue(new Node(Kind.ProtocolListWithClass).isExistentialType());
    assertTrue(new Node(Kind.ProtocolListWithAnyObject).isExistentialType());
    assertFalse(new Node(Kind.Metatype).isExistentialType());
    // No Type look-through
    assertFalse(type(protocolList(1)).isExistentialType());
  }

  @Test public void testNominalTests() {
    Node cls = nominal(Kind.Class,"Core","C");
    assertTrue(cls.isClassType());
    assertTrue(cls.isClass());
    assertTrue(type(cls).isClass());
    assertFalse(type(cls).isClassType());
    assertTrue(new Node(Kind.BoundGenericClass).isClass());

    assertTrue(type(nominal(Kind.Enum,"Core","E")).isEnum());
    assertTrue(new Node(Kind.BoundGenericEnum).isEnum());
    assertTrue(type(nominal(Kind.Structure,"Core","S")).isStruct());
    assertTrue(new Node(Kind.BoundGenericStructure).isStruct());
    assertTrue(type(nominal(Kind.TypeAlias,"Core","A")).isAlias());
    // Bound generic aliases are not aliases
    assertFalse(new Node(Kind.BoundGenericTypeAlias).isAlias());
    assertTrue(proto("P").isProtocol());
    assertTrue(new Node(Kind.ProtocolSymbolicReference,1).isProtocol());
    assertTrue(new Node(Kind.ObjectiveCProtocolSymbolicReference,1).isProtocol());
    assertFalse(new Node(Kind.BoundGenericProtocol).isProtocol());

    assertFalse(cls.isStruct());
    assertFalse(cls.isEnum());
    assertFalse(cls.isAlias());
    assertFalse(cls.isProtocol());
  }

  @Test public void testNilSafe() {
    assertFalse(NodeUtil.isAlias(null));
    assertFalse(NodeUtil.isClass(null));
    assertFalse(NodeUtil.isEnum(null));
    assertFalse(NodeUtil.isProtocol(null));
    assertFalse(NodeUtil.isStruct(null));
    assertTrue(NodeUtil.isStruct(type(nominal(Kind.Structure,"Core","S"))));
    assertTrue(NodeUtil.isEnum(new Node(Kind.BoundGenericEnum)));
  }

  @Test public void testConsumesGenericArgs() {
    for( Kind k : new Kind[]{Kind.Variable, Kind.Subscript, Kind.ImplicitClosure, Kind.ExplicitClosure,
                             Kind.DefaultArgumentInitializer, Kind.Initializer,
                             Kind.PropertyWrapperBackingInitializer, Kind.PropertyWrapperInitFromProjectedValue} )
      assertFalse(k.toString(), new Node(k).isConsumesGenericArgs());
    assertTrue(new Node(Kind.Function).isConsumesGenericArgs());
    assertTrue(new Node(Kind.Structure).isConsumesGenericArgs());
    assertTrue(new Node(Kind.Getter).isConsumesGenericArgs());
  }
}
