package com.cliffc.demangle;

/** Node tree and semantic queries for a symbol demangler.
 */

public abstract class DM {

  // Contract policy.  Strict: a bad child index or a malformed tree shape
  // throws ContractViolation.  Lenient: the query degrades to an inert answer,
  // an UnknownIndex sentinel node or false, so a renderer can limp through
  // malformed input.  Structural mutation errors and stripping a
  // non-specializable Kind throw under either policy.
  public static boolean STRICT = true;

  // Name of the standard library module
  public static final String STDLIB_NAME = "Swift";

  // throw DM.contract(...);
  public static ContractViolation contract( ContractViolation.Reason reason, String msg ) {
    return new ContractViolation(reason,msg);
  }

  // Throws when STRICT, else returns so the caller can degrade.
  public static void degrade( ContractViolation.Reason reason, String msg ) {
    if( STRICT ) throw contract(reason,msg);
  }
}
