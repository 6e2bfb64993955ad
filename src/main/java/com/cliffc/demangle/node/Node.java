package com.cliffc.demangle.node;

import com.cliffc.demangle.DM;
import com.cliffc.demangle.util.Ary;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static com.cliffc.demangle.ContractViolation.Reason.*;

// Demangle tree.  A Node is one grammar production: a Kind, a Payload and an
// ordered list of owned children.  Built bottom-up by a parser, then walked
// read-only by a renderer.
//
// Invariants, maintained by every structural mutation:
// - a leaf payload (text, index, tag) never has children;
// - otherwise the payload is the child-count marker for the current count;
// - every child's _par is the Node whose list holds it.
public class Node {
  public final Kind _kind;      // Never changes; see recast()
  private Payload _payload;
  private final Ary<Node> _kids = new Ary<>(Node.class);
  // Back-link to the owning Node, or null for a root.  Only used to count
  // ancestors; never an owner.
  private Node _par;

  public Node( @NotNull Kind kind ) { _kind = kind; _payload = Payload.NONE; }
  public Node( @NotNull Kind kind, @NotNull String text ) { _kind = kind; _payload = Payload.text(text); }
  public Node( @NotNull Kind kind, char c ) { this(kind,String.valueOf(c)); }
  // Unsigned 64-bit index
  public Node( @NotNull Kind kind, long index ) { _kind = kind; _payload = Payload.index(index); }
  public Node( @NotNull Kind kind, @NotNull Payload payload ) {
    if( payload.isChildren() && payload != Payload.NONE )
      throw DM.contract(WrongPayload,"child-count marker "+payload._tag+" is derived, not set, on "+kind);
    _kind = kind;
    _payload = payload;
  }
  // Null children are skipped
  public Node( @NotNull Kind kind, Node... kids ) {
    this(kind);
    _checkAdoptable(Arrays.asList(kids));
    for( Node kid : kids )
      if( kid != null ) _adopt(kid);
    changed();
  }

  // A new Node with a different Kind, structurally identical: same payload
  // and the same child Nodes, which are re-parented to the new Node.  The
  // source Node still lists them with stale back-links; discard it.
  public Node recast( @NotNull Kind kind ) {
    Node n = new Node(kind);
    n._payload = _payload;
    for( Node kid : _kids ) n._adopt(kid);
    return n;
  }

  // Deep copy; the copy is a root
  public Node copy() {
    Node n = new Node(_kind);
    n._payload = _payload;
    for( Node kid : _kids ) n._adopt(kid.copy());
    return n;
  }

  // --------------------------------------------------------------------------
  // Read access

  public Payload payload() { return _payload; }
  public int numChildren() { return _kids.len(); }
  public List<Node> copyOfChildren() { return _kids.asList(); }
  public @Nullable Node parent() { return _par; }

  // Number of ancestors; 0 for a root
  public int depth() {
    int d=0;
    for( Node p = _par; p != null; p = p._par ) d++;
    return d;
  }

  /** @param i child position
   *  @return the child at i.  A missing child is a caller bug: throws when
   *  DM.STRICT, else returns a fresh UnknownIndex sentinel */
  public @NotNull Node child( int i ) {
    Node kid = _kids.atX(i);
    if( kid != null ) return kid;
    DM.degrade(ChildIndex,"no child "+i+" in "+_kind+" with "+_kids.len()+" children");
    return new Node(Kind.UnknownIndex);
  }
  public @NotNull Node firstChild() { return child(0); }
  public @NotNull Node lastChild () { return child(_kids.len()-1); }

  // First child of the given Kind, or null
  public @Nullable Node childIf( Kind kind ) {
    for( Node kid : _kids ) if( kid._kind==kind ) return kid;
    return null;
  }

  // --------------------------------------------------------------------------
  // Payload reads.  The wrong variant reads as null, not an error.

  // Text, or the empty string if there is none
  public @NotNull String text() { String s = _payload.text(); return s==null ? "" : s; }
  public boolean hasText() { return _payload.isText(); }
  public @Nullable Long index() { return _payload.index(); }
  public @Nullable ValueWitnessKind valueWitnessKind() { return _payload.valueWitnessKind(); }
  public @Nullable FunctionSigSpecializationParamKind functionSigSpecializationParamKind() { return _payload.functionSigParamKind(); }
  public @Nullable Directness directness() { return _payload.directness(); }
  // Either a differentiability payload, or a text payload holding its code
  public @Nullable MangledDifferentiabilityKind mangledDifferentiabilityKind() {
    MangledDifferentiabilityKind dk = _payload.differentiabilityKind();
    return dk != null ? dk : MangledDifferentiabilityKind.decode(_payload.text());
  }

  public boolean isStdlibModule() { return _kind==Kind.Module && DM.STDLIB_NAME.equals(_payload.text()); }
  public boolean isIdentifier( String desired ) { return _kind==Kind.Identifier && text().equals(desired); }

  // --------------------------------------------------------------------------
  // Structural mutation.  Everything funnels through _adopt and changed().

  // Append and set the back-link
  private void _adopt( Node kid ) {
    _kids.add(kid);
    kid._par = this;
  }
  private void _orphan( Node kid ) {
    if( kid._par==this ) kid._par = null;
  }
  // Recompute the child-count marker.  Leaf payloads never reach here with
  // children, since every adding mutation checks first.
  private void changed() {
    if( _payload.isChildren() )
      _payload = Payload.forChildren(_kids.len());
    assert _payload.isChildren() || _kids.isEmpty();
  }
  private void _checkNotLeaf() {
    if( !_payload.isChildren() )
      throw DM.contract(LeafMutation,"cannot add children to "+_kind+" holding "+_payload._tag);
  }
  // Only a fresh root can be adopted, and never this Node or its own root
  private void _checkAdoptable( Node kid ) {
    if( kid._par != null )
      throw DM.contract(Owned,kid._kind+" is already a child of "+kid._par._kind);
    for( Node p = this; p != null; p = p._par )
      if( p==kid )
        throw DM.contract(Cycle,"cannot add "+kid._kind+" below itself");
  }
  // Whole batch checked before any change; the same Node twice is also owned
  private void _checkAdoptable( Collection<Node> kids ) {
    Ary<Node> seen = new Ary<>(Node.class);
    for( Node kid : kids ) {
      if( kid==null ) continue;
      _checkAdoptable(kid);
      if( seen.find(kid) >= 0 )
        throw DM.contract(Owned,kid._kind+" appears twice in one append");
      seen.add(kid);
    }
  }

  // Append one child; null is ignored
  public void add( @Nullable Node kid ) {
    if( kid==null ) return;
    _checkNotLeaf();
    _checkAdoptable(kid);
    _adopt(kid);
    changed();
  }
  public void add( @NotNull Kind kind ) { add(new Node(kind)); }
  public void add( @NotNull Kind kind, @NotNull String text ) { add(new Node(kind,text)); }
  public void add( @NotNull Kind kind, @NotNull Payload payload ) { add(new Node(kind,payload)); }

  // Append many; empty input is a no-op even on a leaf.  Nulls are skipped.
  public void addAll( @NotNull Collection<Node> kids ) {
    if( kids.isEmpty() ) return;
    _checkNotLeaf();
    _checkAdoptable(kids);
    for( Node kid : kids )
      if( kid != null ) _adopt(kid);
    changed();
  }
  // Flow-coding append
  public Node adding( Node... kids ) {
    addAll(Arrays.asList(kids));
    return this;
  }

  // One FunctionSignatureSpecializationParamKind child, then one payload text child per text
  public void addFunctionSigSpecializationParamKind( @NotNull FunctionSigSpecializationParamKind.Kind kind, String... texts ) {
    add(new Node(Kind.FunctionSignatureSpecializationParamKind, Payload.of(FunctionSigSpecializationParamKind.of(kind))));
    for( String text : texts )
      add(new Node(Kind.FunctionSignatureSpecializationParamPayload,text));
  }

  // Remove by identity; no-op if not a child
  public void remove( Node kid ) {
    int idx = _kids.find(kid);
    if( idx >= 0 ) remove(idx);
  }
  // Remove by position; no-op if out of range
  public void remove( int idx ) {
    if( idx < 0 || idx >= _kids.len() ) return;
    _orphan(_kids.remove(idx));
    changed();
  }

  public void replaceLast( @NotNull Node kid ) {
    _checkNotLeaf();
    if( _kids.isEmpty() )
      throw DM.contract(ChildIndex,"no last child to replace in "+_kind);
    if( _kids.last()==kid ) return;
    _checkAdoptable(kid);
    _orphan(_kids.last());
    _kids.set(_kids.len()-1,kid);
    kid._par = this;
    changed();
  }

  public void reverseChildren() { reverseChildren(0); }
  // Children [0,from) stay put, [from,n) are reversed.  from >= n is a no-op.
  public void reverseChildren( int from ) {
    if( from < 0 || from >= _kids.len() ) return;
    _kids.reverse(from);
  }

  // --------------------------------------------------------------------------
  // Grammar semantics.  These decide how a renderer punctuates and qualifies
  // types; a wrong answer prints malformed names instead of failing.

  // Renders without surrounding punctuation next to another type
  public boolean isSimpleType() {
    switch( _kind ) {
    case Type:
      return firstChild().isSimpleType();
    case ProtocolList: {
      // ProtocolList -> TypeList -> protocols; simple with at most one
      Node types = _kids.atX(0);
      if( types==null ) return malformed("ProtocolList without a type list");
      return types.numChildren() <= 1;
    }
    case ProtocolListWithAnyObject: {
      // ProtocolListWithAnyObject -> ProtocolList -> TypeList; simple with no protocols
      Node list  = _kids.atX(0);
      Node types = list==null ? null : list._kids.atX(0);
      if( types==null ) return malformed("ProtocolListWithAnyObject without a protocol list");
      return types.numChildren()==0;
    }
    default:
      return _kind.isSimpleKind();
    }
  }
  private boolean malformed( String msg ) {
    DM.degrade(Malformed,msg);
    return false;
  }

  public boolean isNeedSpaceBeforeType() {
    return switch( _kind ) {
    case Type -> firstChild().isNeedSpaceBeforeType();
    case FunctionType, NoEscapeFunctionType, UncurriedFunctionType, DependentGenericType -> false;
    default -> true;
    };
  }

  public boolean isExistentialType() { return _kind.isExistential(); }
  public boolean isClassType() { return _kind==Kind.Class; }

  // Nominal tests look through a single Type wrapper; bound-generic forms count
  public boolean isAlias() {
    return _kind==Kind.Type ? firstChild().isAlias() : _kind==Kind.TypeAlias;
  }
  public boolean isClass() {
    return _kind==Kind.Type ? firstChild().isClass() : _kind.in(Kind.Class,Kind.BoundGenericClass);
  }
  public boolean isEnum() {
    return _kind==Kind.Type ? firstChild().isEnum() : _kind.in(Kind.Enum,Kind.BoundGenericEnum);
  }
  public boolean isProtocol() {
    return _kind==Kind.Type ? firstChild().isProtocol()
      : _kind.in(Kind.Protocol,Kind.ProtocolSymbolicReference,Kind.ObjectiveCProtocolSymbolicReference);
  }
  public boolean isStruct() {
    return _kind==Kind.Type ? firstChild().isStruct() : _kind.in(Kind.Structure,Kind.BoundGenericStructure);
  }

  // False for contexts that never carry their own generic arguments
  public boolean isConsumesGenericArgs() { return _kind.isConsumesGenericArgs(); }

  public boolean isSpecialized() {
    if( _kind.isBoundGeneric() ) return true;
    if( _kind.isSpecializedByParent() ) return firstChild().isSpecialized();
    if( _kind==Kind.Extension ) return child(1).isSpecialized();
    return false;
  }

  // --------------------------------------------------------------------------
  // The same entity with every specialization layer stripped: the canonical
  // declaration shape.  Idempotent.  Only nominal types, functions, accessors,
  // bound generics and extensions have a specialization; any other Kind is a
  // caller bug and throws under either policy.  The input tree is not changed.
  public @NotNull Node unspecialized() {
    if( _kind.isFunctionLike() || _kind.isNominal() ) {
      // Functions keep all their children, nominals just parent and name
      int ncopy = _kind.isFunctionLike() ? _kids.len() : 2;
      Node result = new Node(_kind);
      Node parent = firstChild();
      result.add(own(parent.isSpecialized() ? parent.unspecialized() : parent));
      for( int i=1; i<ncopy; i++ )
        result.add(child(i).copy());
      return result;
    }
    if( _kind.isBoundGeneric() && _kind!=Kind.BoundGenericFunction ) {
      Node unbound = firstChild();
      if( unbound._kind!=Kind.Type )
        throw DM.contract(Malformed,_kind+" wraps "+unbound._kind+", not a Type");
      Node nominal = unbound.firstChild();
      return nominal.isSpecialized() ? nominal.unspecialized() : nominal;
    }
    if( _kind==Kind.BoundGenericFunction ) {
      Node fun = firstChild();
      if( !fun._kind.in(Kind.Function,Kind.Constructor) )
        throw DM.contract(Malformed,"BoundGenericFunction wraps "+fun._kind);
      return fun.isSpecialized() ? fun.unspecialized() : fun;
    }
    if( _kind==Kind.Extension ) {
      Node parent = child(1);
      if( !parent.isSpecialized() ) return this;
      Node result = new Node(Kind.Extension);
      result.add(firstChild().copy());
      result.add(own(parent.unspecialized()));
      if( _kids.len()==3 )      // Extension generic signature
        result.add(child(2).copy());
      return result;
    }
    throw DM.contract(NotSpecializable,"bad nominal type kind "+_kind);
  }
  // Fresh roots are taken as-is; anything still owned elsewhere is copied
  private static Node own( Node n ) { return n._par==null ? n : n.copy(); }

  // Multi-line debug dump
  @Override public String toString() { return NodePrinter.dump(this); }
}
