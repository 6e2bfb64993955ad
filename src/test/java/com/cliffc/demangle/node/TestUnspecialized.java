package com.cliffc.demangle.node;

import com.cliffc.demangle.ContractViolation;
import com.cliffc.demangle.DM;
import org.junit.After;
import org.junit.Test;

import static com.cliffc.demangle.node.TestClassify.nominal;
import static com.cliffc.demangle.node.TestClassify.type;
import static org.junit.Assert.*;

public class TestUnspecialized {

  @After public void reset() { DM.STRICT = true; }

  // Swift.Int
  static Node intType() { return type(nominal(Kind.Structure,DM.STDLIB_NAME,"Int")); }

  // kind<Type(nominal)><args...>
  static Node bound( Kind kind, Node nominal, Node... args ) {
    return new Node(kind, type(nominal), new Node(Kind.TypeList,args));
  }

  // Core.Point<Int>
  static Node boundPoint() { return bound(Kind.BoundGenericStructure,nominal(Kind.Structure,"Core","Point"),intType()); }

  static Node funcType() {
    return type(new Node(Kind.FunctionType,
                         new Node(Kind.ArgumentTuple,type(new Node(Kind.Tuple))),
                         new Node(Kind.ReturnType,intType())));
  }

  static void checkStripped( Node n ) {
    assertTrue(n.isSpecialized());
    Node u = n.unspecialized();
    assertFalse(u.isSpecialized());
    // Idempotent
    assertTrue(NodeUtil.deepEquals(u,u.unspecialized()));
    TestNode.checkInvariants(u);
  }

  @Test public void testBoundGenericStructure() {
    Node s = nominal(Kind.Structure,"Core","Point");
    Node b = bound(Kind.BoundGenericStructure,s,intType());
    assertTrue(b.isSpecialized());
    Node u = b.unspecialized();
    assertSame(s, u);           // Already a single layer; returned directly
    assertTrue(NodeUtil.deepEquals(nominal(Kind.Structure,"Core","Point"),u));
    assertFalse(u.isSpecialized());
    checkStripped(b);
  }

  @Test public void testAllBoundNominals() {
    Kind[][] pairs = {
      {Kind.BoundGenericClass           , Kind.Class           },
      {Kind.BoundGenericEnum            , Kind.Enum            },
      {Kind.BoundGenericOtherNominalType, Kind.OtherNominalType},
      {Kind.BoundGenericTypeAlias       , Kind.TypeAlias       },
    };
    for( Kind[] p : pairs ) {
      Node b = bound(p[0],nominal(p[1],"Core","X"),intType());
      Node u = b.unspecialized();
      assertEquals(p[1], u._kind);
      checkStripped(b);
    }
    // A bound generic protocol unwraps to its protocol
    Node bp = bound(Kind.BoundGenericProtocol,nominal(Kind.Protocol,"Core","P"),intType());
    assertEquals(Kind.Protocol, bp.unspecialized()._kind);
  }

  @Test public void testNestedNominal() {
    // Core.Outer<Int>.Inner
    Node inner = new Node(Kind.Structure, bound(Kind.BoundGenericStructure,nominal(Kind.Structure,"Core","Outer"),intType()),
                          new Node(Kind.Identifier,"Inner"));
    assertTrue(inner.isSpecialized());
    Node expect = new Node(Kind.Structure, nominal(Kind.Structure,"Core","Outer"), new Node(Kind.Identifier,"Inner"));
    assertTrue(NodeUtil.deepEquals(expect,inner.unspecialized()));
    checkStripped(inner);

    // Core.Outer<Int>.Inner<Int>: strip both layers
    Node both = bound(Kind.BoundGenericStructure,inner,intType());
    assertTrue(NodeUtil.deepEquals(expect,both.unspecialized()));
    checkStripped(both);
  }

  @Test public void testFunctionCopiesAllChildren() {
    // Core.Point<Int>.f : () -> Int
    Node f = new Node(Kind.Function, boundPoint(), new Node(Kind.Identifier,"f"), funcType());
    Node u = f.unspecialized();
    Node expect = new Node(Kind.Function, nominal(Kind.Structure,"Core","Point"), new Node(Kind.Identifier,"f"), funcType());
    assertTrue(NodeUtil.deepEquals(expect,u));
    assertNotSame(f.child(1), u.child(1));
    // Input tree untouched, back-links included
    assertTrue(NodeUtil.deepEquals(new Node(Kind.Function, boundPoint(), new Node(Kind.Identifier,"f"), funcType()),f));
    TestNode.checkInvariants(f);
    checkStripped(f);
  }

  @Test public void testAccessorsAndClosures() {
    Node var = new Node(Kind.Variable, boundPoint(), new Node(Kind.Identifier,"x"), intType());
    Node get = new Node(Kind.Getter, var);
    assertTrue(get.isSpecialized());
    Node u = get.unspecialized();
    assertEquals(Kind.Getter, u._kind);
    assertEquals(Kind.Variable, u.firstChild()._kind);
    assertEquals(Kind.Structure, u.firstChild().firstChild()._kind);
    checkStripped(get);

    Node clo = new Node(Kind.ExplicitClosure, get, intType(), new Node(Kind.Number,0));
    assertEquals(3, clo.unspecialized().numChildren());
    checkStripped(clo);
  }

  @Test public void testUnspecializedFunctionIsCopy() {
    Node f = new Node(Kind.Function, nominal(Kind.Structure,"Core","Point"), new Node(Kind.Identifier,"f"), funcType());
    assertFalse(f.isSpecialized());
    Node u = f.unspecialized();
    assertNotSame(f, u);
    assertTrue(NodeUtil.deepEquals(f,u));
  }

  @Test public void testBoundGenericFunction() {
    Node f = new Node(Kind.Function, new Node(Kind.Module,"Core"), new Node(Kind.Identifier,"id"), funcType());
    Node bf = new Node(Kind.BoundGenericFunction, f, new Node(Kind.TypeList,intType()));
    assertTrue(bf.isSpecialized());
    assertSame(f, bf.unspecialized());
    checkStripped(bf);

    // Constructor of a specialized type
    Node ctor = new Node(Kind.Constructor, boundPoint(), funcType());
    Node bc = new Node(Kind.BoundGenericFunction, ctor, new Node(Kind.TypeList,intType()));
    Node u = bc.unspecialized();
    assertEquals(Kind.Constructor, u._kind);
    assertEquals(Kind.Structure, u.firstChild()._kind);
    checkStripped(bc);
  }

  @Test public void testExtension() {
    Node sig = new Node(Kind.DependentGenericSignature, new Node(Kind.DependentGenericParamCount,1));
    Node ext = new Node(Kind.Extension, new Node(Kind.Module,"App"), boundPoint(), sig);
    assertTrue(ext.isSpecialized());
    Node u = ext.unspecialized();
    Node expect = new Node(Kind.Extension, new Node(Kind.Module,"App"), nominal(Kind.Structure,"Core","Point"),
                           new Node(Kind.DependentGenericSignature, new Node(Kind.DependentGenericParamCount,1)));
    assertTrue(NodeUtil.deepEquals(expect,u));
    checkStripped(ext);

    Node ext2 = new Node(Kind.Extension, new Node(Kind.Module,"App"), boundPoint());
    assertEquals(2, ext2.unspecialized().numChildren());
  }

  @Test public void testCanonicalExtensionUnchanged() {
    Node ext = new Node(Kind.Extension, new Node(Kind.Module,"App"), nominal(Kind.Structure,"Core","Point"));
    assertFalse(ext.isSpecialized());
    assertSame(ext, ext.unspecialized());
  }

  @Test public void testNotSpecializable() {
    for( Kind k : new Kind[]{Kind.Module, Kind.Identifier, Kind.Tuple, Kind.Type, Kind.Protocol} ) {
      try {
        new Node(k).unspecialized();
        fail(k.toString());
      } catch( ContractViolation cv ) {
        assertEquals(ContractViolation.Reason.NotSpecializable, cv._reason);
      }
    }
    // Same policy when lenient
    DM.STRICT = false;
    try {
      new Node(Kind.Identifier,"x").unspecialized();
      fail();
    } catch( ContractViolation cv ) {
      assertEquals(ContractViolation.Reason.NotSpecializable, cv._reason);
    }
  }

  @Test public void testMalformedBoundGeneric() {
    Node bad = new Node(Kind.BoundGenericStructure, nominal(Kind.Structure,"Core","Point"), new Node(Kind.TypeList));
    try {
      bad.unspecialized();
      fail();
    } catch( ContractViolation cv ) {
      assertEquals(ContractViolation.Reason.Malformed, cv._reason);
    }
    Node badf = new Node(Kind.BoundGenericFunction, new Node(Kind.Variable), new Node(Kind.TypeList));
    try {
      badf.unspecialized();
      fail();
    } catch( ContractViolation cv ) {
      assertEquals(ContractViolation.Reason.Malformed, cv._reason);
    }
  }

  @Test public void testNotSpecialized() {
    assertFalse(new Node(Kind.Module,"Core").isSpecialized());
    assertFalse(nominal(Kind.Structure,"Core","Point").isSpecialized());
    assertFalse(type(boundPoint()).isSpecialized()); // No Type look-through
    assertTrue(new Node(Kind.Protocol, boundPoint(), new Node(Kind.Identifier,"P")).isSpecialized());
  }
}
