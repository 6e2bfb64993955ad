package com.cliffc.demangle.node;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;

// Value witnesses: the runtime operations used to manipulate a value whose
// layout is not statically known.  Each has a fixed two-character code.
public enum ValueWitnessKind {
  AllocateBuffer                    ("al"),
  AssignWithCopy                    ("ca"),
  AssignWithTake                    ("ta"),
  DeallocateBuffer                  ("de"),
  Destroy                           ("xx"),
  DestroyBuffer                     ("XX"),
  DestroyArray                      ("Xx"),
  InitializeBufferWithCopyOfBuffer  ("CP"),
  InitializeBufferWithCopy          ("Cp"),
  InitializeWithCopy                ("cp"),
  InitializeBufferWithTake          ("Tk"),
  InitializeWithTake                ("tk"),
  ProjectBuffer                     ("pr"),
  InitializeBufferWithTakeOfBuffer  ("TK"),
  InitializeArrayWithCopy           ("Cc"),
  InitializeArrayWithTakeFrontToBack("Tt"),
  InitializeArrayWithTakeBackToFront("tT"),
  StoreExtraInhabitant              ("xs"),
  GetExtraInhabitantIndex           ("xg"),
  GetEnumTag                        ("ug"),
  DestructiveProjectEnumData        ("up"),
  DestructiveInjectEnumTag          ("ui"),
  GetEnumTagSinglePayload           ("et"),
  StoreEnumTagSinglePayload         ("st");

  private final String _code;
  private final String _display;
  ValueWitnessKind( String code ) {
    _code = code;
    String s = name();
    _display = Character.toLowerCase(s.charAt(0))+s.substring(1);
  }

  private static final HashMap<String,ValueWitnessKind> CODES = new HashMap<>();
  static { for( ValueWitnessKind vw : values() ) CODES.put(vw._code,vw); }

  // Mangled two-character code
  public @NotNull String code() { return _code; }
  // Tag name with a lower-case first letter, e.g. "getEnumTagSinglePayload"
  public @NotNull String displayName() { return _display; }

  /** @param code two-character mangled code
   *  @return matching witness, or null for an unknown code */
  public static @Nullable ValueWitnessKind decode( String code ) {
    return code==null ? null : CODES.get(code);
  }
}
