package com.cliffc.demangle.node;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.Objects;

// How a function-signature specialization rewrote one parameter.  Either a
// single Kind (raw values 0-9, packed in the low 6 bits) or a set of Option
// flags (bits 6 and up); never both.
public final class FunctionSigSpecializationParamKind {

  public enum Kind {
    ConstantPropFunction,       // 0
    ConstantPropGlobal,         // 1
    ConstantPropInteger,        // 2
    ConstantPropFloat,          // 3
    ConstantPropString,         // 4
    ClosureProp,                // 5
    BoxToValue,                 // 6
    BoxToStack,                 // 7
    InOutToOut,                 // 8
    ConstantPropKeyPath;        // 9
    public int rawValue() { return ordinal(); }
  }

  public enum Option {
    Dead,                       // 1<<6
    OwnedToGuaranteed,          // 1<<7
    SROA,                       // 1<<8
    GuaranteedToOwned,          // 1<<9
    ExistentialToGeneric;       // 1<<10
    public int rawValue() { return 1<<(ordinal()+6); }
  }

  private final Kind _kind;             // Null for an option set
  private final EnumSet<Option> _opts;  // Null for a kind

  private FunctionSigSpecializationParamKind( Kind kind, EnumSet<Option> opts ) { _kind = kind; _opts = opts; }
  public static FunctionSigSpecializationParamKind of( @NotNull Kind kind ) {
    return new FunctionSigSpecializationParamKind(Objects.requireNonNull(kind),null);
  }
  public static FunctionSigSpecializationParamKind of( @NotNull EnumSet<Option> opts ) {
    return new FunctionSigSpecializationParamKind(null,EnumSet.copyOf(opts));
  }
  public static FunctionSigSpecializationParamKind of( Option opt, Option... opts ) {
    return new FunctionSigSpecializationParamKind(null,EnumSet.of(opt,opts));
  }

  /** Decode a raw mangled value.
   *  @return the kind for values below 64, the option set for any
   *  combination of known flag bits, or null otherwise */
  public static @Nullable FunctionSigSpecializationParamKind decode( long raw ) {
    if( raw < 0 ) return null;
    if( raw < (1<<6) )
      return raw < Kind.values().length ? of(Kind.values()[(int)raw]) : null;
    EnumSet<Option> opts = EnumSet.noneOf(Option.class);
    long bits = raw;
    for( Option o : Option.values() )
      if( (bits & o.rawValue()) != 0 ) { opts.add(o); bits &= ~o.rawValue(); }
    return bits==0 ? of(opts) : null;
  }

  public boolean isKind() { return _kind!=null; }
  public @Nullable Kind kind() { return _kind; }
  public @Nullable EnumSet<Option> options() { return _opts==null ? null : EnumSet.copyOf(_opts); }
  public boolean contains( Option o ) { return _opts!=null && _opts.contains(o); }

  public long rawValue() {
    if( _kind!=null ) return _kind.rawValue();
    long raw = 0;
    for( Option o : _opts ) raw |= o.rawValue();
    return raw;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof FunctionSigSpecializationParamKind fk) ) return false;
    return _kind==fk._kind && Objects.equals(_opts,fk._opts);
  }
  @Override public int hashCode() { return Long.hashCode(rawValue()) + (_kind==null ? 0 : 1); }
  @Override public String toString() { return _kind!=null ? _kind.toString() : _opts.toString(); }
}
