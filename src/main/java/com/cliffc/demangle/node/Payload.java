package com.cliffc.demangle.node;

import com.cliffc.demangle.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

// The value attached to a Node: either a genuine leaf value (text, index, one
// of the tag enums) or a marker caching the child count.  Immutable; the
// child-count markers and NONE are shared singletons.
public final class Payload {

  public enum Tag {
    None,                       // No value; also the zero-children marker
    Text,
    Index,                      // Unsigned 64-bit
    ValueWitness,
    Differentiability,
    FunctionSigParam,
    Directness,
    OneChild,
    TwoChildren,
    ManyChildren,
  }

  public final Tag _tag;
  private final String _text;
  private final long _index;
  private final Object _obj;    // Tag enum payloads

  private Payload( Tag tag, String text, long index, Object obj ) { _tag=tag; _text=text; _index=index; _obj=obj; }
  private Payload( Tag tag, Object obj ) { this(tag,null,0,obj); }

  public static final Payload NONE          = new Payload(Tag.None        ,null);
  public static final Payload ONE_CHILD     = new Payload(Tag.OneChild    ,null);
  public static final Payload TWO_CHILDREN  = new Payload(Tag.TwoChildren ,null);
  public static final Payload MANY_CHILDREN = new Payload(Tag.ManyChildren,null);

  public static Payload text( @NotNull String s ) { return new Payload(Tag.Text,Objects.requireNonNull(s),0,null); }
  public static Payload index( long idx ) { return new Payload(Tag.Index,null,idx,null); }
  public static Payload of( @NotNull ValueWitnessKind vw ) { return new Payload(Tag.ValueWitness,Objects.requireNonNull(vw)); }
  public static Payload of( @NotNull MangledDifferentiabilityKind dk ) { return new Payload(Tag.Differentiability,Objects.requireNonNull(dk)); }
  public static Payload of( @NotNull FunctionSigSpecializationParamKind fk ) { return new Payload(Tag.FunctionSigParam,Objects.requireNonNull(fk)); }
  public static Payload of( @NotNull Directness d ) { return new Payload(Tag.Directness,Objects.requireNonNull(d)); }

  // Child-count marker for n children
  static Payload forChildren( int n ) {
    return switch( n ) {
    case 0 -> NONE;
    case 1 -> ONE_CHILD;
    case 2 -> TWO_CHILDREN;
    default -> MANY_CHILDREN;
    };
  }

  // Children may be attached: NONE or a child-count marker
  public boolean isChildren() {
    return _tag==Tag.None || _tag==Tag.OneChild || _tag==Tag.TwoChildren || _tag==Tag.ManyChildren;
  }
  public boolean isText() { return _tag==Tag.Text; }
  // A genuine printable value, not a marker
  public boolean hasValue() { return _tag==Tag.Text || _tag==Tag.Index; }

  // Discriminated reads; null when the payload holds another variant
  public @Nullable String text() { return _text; }
  public @Nullable Long index() { return _tag==Tag.Index ? _index : null; }
  public @Nullable ValueWitnessKind valueWitnessKind() { return _tag==Tag.ValueWitness ? (ValueWitnessKind)_obj : null; }
  public @Nullable MangledDifferentiabilityKind differentiabilityKind() { return _tag==Tag.Differentiability ? (MangledDifferentiabilityKind)_obj : null; }
  public @Nullable FunctionSigSpecializationParamKind functionSigParamKind() { return _tag==Tag.FunctionSigParam ? (FunctionSigSpecializationParamKind)_obj : null; }
  public @Nullable Directness directness() { return _tag==Tag.Directness ? (Directness)_obj : null; }

  // Printed form of a valued payload; empty for everything else
  public SB str( SB sb ) {
    return switch( _tag ) {
    case Text  -> sb.p("text:\"").p(_text).p('"');
    case Index -> sb.p("index:").p(Long.toUnsignedString(_index));
    default    -> sb;
    };
  }
  @Override public String toString() { return str(new SB()).toString(); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Payload p) ) return false;
    return _tag==p._tag && _index==p._index && Objects.equals(_text,p._text) && Objects.equals(_obj,p._obj);
  }
  @Override public int hashCode() { return Objects.hash(_tag,_text,_index,_obj); }
}
