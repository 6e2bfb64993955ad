package com.cliffc.demangle;

// A parser or renderer broke the tree's contract: mutated a leaf, indexed a
// missing child, or asked a query of a node with the wrong shape.  These are
// caller bugs, never data problems; expected absence is reported as null.
public class ContractViolation extends RuntimeException {

  public enum Reason {
    LeafMutation,               // Structural change on a text/index/tag payload node
    ChildIndex,                 // No child at the requested position
    NotSpecializable,           // Stripping asked of a Kind with no specialization
    WrongPayload,               // Payload read as a variant it does not hold
    Malformed,                  // Children do not have the shape the Kind requires
    Owned,                      // Appended Node already has a parent
    Cycle,                      // Appended Node is the receiver or its root
  }

  public final Reason _reason;
  public ContractViolation( Reason reason, String msg ) {
    super(reason+": "+msg);
    _reason = reason;
  }
}
