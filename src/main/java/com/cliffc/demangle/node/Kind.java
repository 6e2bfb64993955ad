package com.cliffc.demangle.node;

import com.cliffc.demangle.util.VBitSet;

// One tag per grammar production.  Closed; a Node's Kind never changes.
//
// The semantic groupings (contexts, generic entities, decl-names, ...) are
// bitsets over the ordinal, built once below.  Adding a Kind means deciding
// its memberships here, in the same change.
public enum Kind {
  Allocator, AnonymousContext, AnyProtocolConformanceList, ArgumentTuple, AssociatedType,
  AssociatedTypeRef, AssociatedTypeMetadataAccessor, DefaultAssociatedTypeMetadataAccessor,
  AccessorAttachedMacroExpansion, AssociatedTypeWitnessTableAccessor, BaseWitnessTableAccessor,
  BodyAttachedMacroExpansion, AutoClosureType, BoundGenericClass, BoundGenericEnum,
  BoundGenericStructure, BoundGenericProtocol, BoundGenericOtherNominalType,
  BoundGenericTypeAlias, BoundGenericFunction, BuiltinTypeName, BuiltinTupleType,
  BuiltinFixedArray, CFunctionPointer, ClangType, Class, ClassMetadataBaseOffset,
  ConcreteProtocolConformance, PackProtocolConformance, ConformanceAttachedMacroExpansion,
  Constructor, CoroutineContinuationPrototype, Deallocator, DeclContext,
  DefaultArgumentInitializer, DependentAssociatedConformance, DependentAssociatedTypeRef,
  DependentGenericConformanceRequirement, DependentGenericParamCount, DependentGenericParamType,
  DependentGenericSameTypeRequirement, DependentGenericSameShapeRequirement,
  DependentGenericLayoutRequirement, DependentGenericParamPackMarker, DependentGenericSignature,
  DependentGenericType, DependentMemberType, DependentPseudogenericSignature,
  DependentProtocolConformanceRoot, DependentProtocolConformanceInherited,
  DependentProtocolConformanceAssociated, Destructor, DidSet, Directness, DistributedThunk,
  DistributedAccessor, DynamicAttribute, DirectMethodReferenceAttribute, DynamicSelf,
  DynamicallyReplaceableFunctionImpl, DynamicallyReplaceableFunctionKey,
  DynamicallyReplaceableFunctionVar, Enum, EnumCase, ErrorType, EscapingAutoClosureType,
  NoEscapeFunctionType, ConcurrentFunctionType, GlobalActorFunctionType,
  DifferentiableFunctionType, ExistentialMetatype, ExplicitClosure, Extension,
  ExtensionAttachedMacroExpansion, FieldOffset, FreestandingMacroExpansion, FullTypeMetadata,
  Function, FunctionSignatureSpecialization, FunctionSignatureSpecializationParam,
  FunctionSignatureSpecializationReturn, FunctionSignatureSpecializationParamKind,
  FunctionSignatureSpecializationParamPayload, FunctionType, ConstrainedExistential,
  ConstrainedExistentialRequirementList, ConstrainedExistentialSelf,
  GenericPartialSpecialization, GenericPartialSpecializationNotReAbstracted,
  GenericProtocolWitnessTable, GenericProtocolWitnessTableInstantiationFunction,
  ResilientProtocolWitnessTable, GenericSpecialization, GenericSpecializationNotReAbstracted,
  GenericSpecializationInResilienceDomain, GenericSpecializationParam,
  GenericSpecializationPrespecialized, InlinedGenericFunction, GenericTypeMetadataPattern,
  Getter, Global, GlobalGetter, Identifier, Index, IVarInitializer, IVarDestroyer, ImplEscaping,
  ImplConvention, ImplDifferentiabilityKind, ImplErasedIsolation, ImplSendingResult,
  ImplParameterResultDifferentiability, ImplParameterSending, ImplFunctionAttribute,
  ImplFunctionConvention, ImplFunctionConventionName, ImplFunctionType, ImplCoroutineKind,
  ImplInvocationSubstitutions, ImplicitClosure, ImplParameter, ImplPatternSubstitutions,
  ImplResult, ImplYield, ImplErrorResult, InOut, InfixOperator, Initializer, InitAccessor,
  Isolated, IsolatedDeallocator, Sending, IsolatedAnyFunctionType, SendingResultFunctionType,
  KeyPathGetterThunkHelper, KeyPathSetterThunkHelper, KeyPathEqualsThunkHelper,
  KeyPathHashThunkHelper, LazyProtocolWitnessTableAccessor,
  LazyProtocolWitnessTableCacheVariable, LocalDeclName, Macro, MacroExpansionLoc,
  MacroExpansionUniqueName, MaterializeForSet, MemberAttachedMacroExpansion,
  MemberAttributeAttachedMacroExpansion, MergedFunction, Metatype, MetatypeRepresentation,
  Metaclass, MethodLookupFunction, ObjCMetadataUpdateFunction, ObjCResilientClassStub,
  FullObjCResilientClassStub, ModifyAccessor, Modify2Accessor, Module, NativeOwningAddressor,
  NativeOwningMutableAddressor, NativePinningAddressor, NativePinningMutableAddressor,
  NominalTypeDescriptor, NominalTypeDescriptorRecord, NonObjCAttribute, Number,
  ObjCAsyncCompletionHandlerImpl, PredefinedObjCAsyncCompletionHandlerImpl, ObjCAttribute,
  ObjCBlock, EscapingObjCBlock, OtherNominalType, OwningAddressor, OwningMutableAddressor,
  PartialApplyForwarder, PartialApplyObjCForwarder, PeerAttachedMacroExpansion, PostfixOperator,
  PreambleAttachedMacroExpansion, PrefixOperator, PrivateDeclName, PropertyDescriptor,
  PropertyWrapperBackingInitializer, PropertyWrapperInitFromProjectedValue, Protocol,
  ProtocolSymbolicReference, ProtocolConformance, ProtocolConformanceRefInTypeModule,
  ProtocolConformanceRefInProtocolModule, ProtocolConformanceRefInOtherModule,
  ProtocolDescriptor, ProtocolDescriptorRecord, ProtocolConformanceDescriptor,
  ProtocolConformanceDescriptorRecord, ProtocolList, ProtocolListWithClass,
  ProtocolListWithAnyObject, ProtocolSelfConformanceDescriptor, ProtocolSelfConformanceWitness,
  ProtocolSelfConformanceWitnessTable, ProtocolWitness, ProtocolWitnessTable,
  ProtocolWitnessTableAccessor, ProtocolWitnessTablePattern, ReabstractionThunk,
  ReabstractionThunkHelper, ReabstractionThunkHelperWithSelf,
  ReabstractionThunkHelperWithGlobalActor, ReadAccessor, Read2Accessor, RelatedEntityDeclName,
  RetroactiveConformance, ReturnType, Shared, Owned, SILBoxType, SILBoxTypeWithLayout,
  SILBoxLayout, SILBoxMutableField, SILBoxImmutableField, Setter, SpecializationPassID,
  IsSerialized, Static, Structure, Subscript, Suffix, ThinFunctionType, Tuple, TupleElement,
  TupleElementName, Pack, SILPackDirect, SILPackIndirect, PackExpansion, PackElement,
  PackElementLevel, Type, TypeSymbolicReference, TypeAlias, TypeList, TypeMangling, TypeMetadata,
  TypeMetadataAccessFunction, TypeMetadataCompletionFunction, TypeMetadataInstantiationCache,
  TypeMetadataInstantiationFunction, TypeMetadataSingletonInitializationCache,
  TypeMetadataDemanglingCache, TypeMetadataLazyCache, UncurriedFunctionType, UnknownIndex, Weak,
  Unowned, Unmanaged, UnsafeAddressor, UnsafeMutableAddressor, ValueWitness, ValueWitnessTable,
  Variable, VTableThunk, VTableAttribute, WillSet, ReflectionMetadataBuiltinDescriptor,
  ReflectionMetadataFieldDescriptor, ReflectionMetadataAssocTypeDescriptor,
  ReflectionMetadataSuperclassDescriptor, GenericTypeParamDecl, CurryThunk, SILThunkIdentity,
  SILThunkHopToMainActorIfNeeded, DispatchThunk, MethodDescriptor,
  ProtocolRequirementsBaseDescriptor, AssociatedConformanceDescriptor,
  DefaultAssociatedConformanceAccessor, BaseConformanceDescriptor, AssociatedTypeDescriptor,
  AsyncAnnotation, ThrowsAnnotation, TypedThrowsAnnotation, EmptyList, FirstElementMarker,
  VariadicMarker, OutlinedBridgedMethod, OutlinedCopy, OutlinedConsume, OutlinedRetain,
  OutlinedRelease, OutlinedInitializeWithTake, OutlinedInitializeWithCopy,
  OutlinedAssignWithTake, OutlinedAssignWithCopy, OutlinedDestroy, OutlinedVariable,
  OutlinedReadOnlyObject, AssocTypePath, LabelList, ModuleDescriptor, ExtensionDescriptor,
  AnonymousDescriptor, AssociatedTypeGenericParamRef, SugaredOptional, SugaredArray,
  SugaredDictionary, SugaredParen, AccessorFunctionReference, OpaqueType,
  OpaqueTypeDescriptorSymbolicReference, OpaqueTypeDescriptor, OpaqueTypeDescriptorRecord,
  OpaqueTypeDescriptorAccessor, OpaqueTypeDescriptorAccessorImpl,
  OpaqueTypeDescriptorAccessorKey, OpaqueTypeDescriptorAccessorVar, OpaqueReturnType,
  OpaqueReturnTypeOf, CanonicalSpecializedGenericMetaclass,
  CanonicalSpecializedGenericTypeMetadataAccessFunction, MetadataInstantiationCache,
  NoncanonicalSpecializedGenericTypeMetadata, NoncanonicalSpecializedGenericTypeMetadataCache,
  GlobalVariableOnceFunction, GlobalVariableOnceToken, GlobalVariableOnceDeclList,
  CanonicalPrespecializedGenericTypeCachingOnceToken, AsyncFunctionPointer, AutoDiffFunction,
  AutoDiffFunctionKind, AutoDiffSelfReorderingReabstractionThunk, AutoDiffSubsetParametersThunk,
  AutoDiffDerivativeVTableThunk, DifferentiabilityWitness, NoDerivative, IndexSubset,
  AsyncAwaitResumePartialFunction, AsyncSuspendResumePartialFunction, AccessibleFunctionRecord,
  CompileTimeConst, BackDeploymentThunk, BackDeploymentFallback, ExtendedExistentialTypeShape,
  Uniquable, UniqueExtendedExistentialTypeShapeSymbolicReference,
  NonUniqueExtendedExistentialTypeShapeSymbolicReference, SymbolicExtendedExistentialType,
  DroppedArgument, HasSymbolQuery, OpaqueReturnTypeIndex, OpaqueReturnTypeParent,
  OutlinedEnumTagStore, OutlinedEnumProjectDataForLoad, OutlinedEnumGetTag, AsyncRemoved,
  ObjectiveCProtocolSymbolicReference, OutlinedInitializeWithCopyNoValueWitness,
  OutlinedAssignWithTakeNoValueWitness, OutlinedAssignWithCopyNoValueWitness,
  OutlinedDestroyNoValueWitness, DependentGenericInverseConformanceRequirement, Integer,
  NegativeInteger, DependentGenericParamValueMarker;

  // --------------------------------------------------------------------------
  // Semantic sets

  private static VBitSet bits( Kind... ks ) {
    VBitSet bs = new VBitSet();
    for( Kind k : ks ) bs.set(k.ordinal());
    return bs;
  }

  private static final VBitSet DECL_NAMES = bits(
    Identifier, LocalDeclName, PrivateDeclName, RelatedEntityDeclName, PrefixOperator,
    PostfixOperator, InfixOperator, TypeSymbolicReference, ProtocolSymbolicReference,
    ObjectiveCProtocolSymbolicReference);

  private static final VBitSet ANY_GENERICS = bits(
    Structure, Class, Enum, Protocol, ProtocolSymbolicReference,
    ObjectiveCProtocolSymbolicReference, OtherNominalType, TypeAlias, TypeSymbolicReference,
    BuiltinTupleType);

  private static final VBitSet REQUIREMENTS = bits(
    DependentGenericParamPackMarker, DependentGenericParamValueMarker,
    DependentGenericSameTypeRequirement, DependentGenericSameShapeRequirement,
    DependentGenericLayoutRequirement, DependentGenericConformanceRequirement,
    DependentGenericInverseConformanceRequirement);

  private static final VBitSet CONTEXTS = bits(
    Allocator, AnonymousContext, Class, Constructor, Deallocator, DefaultArgumentInitializer,
    Destructor, DidSet, Enum, ExplicitClosure, Extension, Function, Getter, GlobalGetter,
    IVarInitializer, IVarDestroyer, ImplicitClosure, Initializer, InitAccessor,
    IsolatedDeallocator, MaterializeForSet, ModifyAccessor, Modify2Accessor, Module,
    NativeOwningAddressor, NativeOwningMutableAddressor, NativePinningAddressor,
    NativePinningMutableAddressor, OtherNominalType, OwningAddressor, OwningMutableAddressor,
    PropertyWrapperBackingInitializer, PropertyWrapperInitFromProjectedValue, Protocol,
    ProtocolSymbolicReference, ReadAccessor, Read2Accessor, Setter, Static, Structure,
    Subscript, TypeSymbolicReference, TypeAlias, UnsafeAddressor, UnsafeMutableAddressor,
    Variable, WillSet, OpaqueReturnTypeOf, AutoDiffFunction);

  private static final VBitSet FUNCTION_ATTRS = bits(
    FunctionSignatureSpecialization, GenericSpecialization, GenericSpecializationPrespecialized,
    InlinedGenericFunction, GenericSpecializationNotReAbstracted, GenericPartialSpecialization,
    GenericPartialSpecializationNotReAbstracted, GenericSpecializationInResilienceDomain,
    ObjCAttribute, NonObjCAttribute, DynamicAttribute, DirectMethodReferenceAttribute,
    VTableAttribute, PartialApplyForwarder, PartialApplyObjCForwarder, OutlinedVariable,
    OutlinedReadOnlyObject, OutlinedBridgedMethod, MergedFunction, DistributedThunk,
    DistributedAccessor, DynamicallyReplaceableFunctionImpl, DynamicallyReplaceableFunctionKey,
    DynamicallyReplaceableFunctionVar, AsyncFunctionPointer, AsyncAwaitResumePartialFunction,
    AsyncSuspendResumePartialFunction, AccessibleFunctionRecord, BackDeploymentThunk,
    BackDeploymentFallback, HasSymbolQuery);

  private static final VBitSet MACRO_EXPANSIONS = bits(
    AccessorAttachedMacroExpansion, MemberAttributeAttachedMacroExpansion,
    FreestandingMacroExpansion, MemberAttachedMacroExpansion, PeerAttachedMacroExpansion,
    ConformanceAttachedMacroExpansion, ExtensionAttachedMacroExpansion, MacroExpansionLoc);

  // Kinds that render without surrounding punctuation when placed next to
  // another type.  Type, ProtocolList and ProtocolListWithAnyObject depend on
  // their children and are decided in Node.isSimpleType.
  private static final VBitSet SIMPLE_TYPES = bits(
    AssociatedType, AssociatedTypeRef, BoundGenericClass, BoundGenericEnum,
    BoundGenericStructure, BoundGenericProtocol, BoundGenericOtherNominalType,
    BoundGenericTypeAlias, BoundGenericFunction, BuiltinTypeName, BuiltinTupleType,
    BuiltinFixedArray, Class, DependentGenericType, DependentMemberType,
    DependentGenericParamType, DynamicSelf, Enum, ErrorType, ExistentialMetatype, Metatype,
    MetatypeRepresentation, Module, Tuple, Pack, SILPackDirect, SILPackIndirect,
    ConstrainedExistentialRequirementList, ConstrainedExistentialSelf, Protocol,
    ProtocolSymbolicReference, ReturnType, SILBoxType, SILBoxTypeWithLayout, Structure,
    OtherNominalType, TupleElementName, TypeAlias, TypeList, LabelList,
    TypeSymbolicReference, SugaredOptional, SugaredArray, SugaredDictionary, SugaredParen,
    Integer, NegativeInteger);

  private static final VBitSet EXISTENTIALS = bits(
    ExistentialMetatype, ProtocolList, ProtocolListWithClass, ProtocolListWithAnyObject);

  // Contexts which never take generic arguments of their own
  private static final VBitSet NO_GENERIC_ARGS = bits(
    Variable, Subscript, ImplicitClosure, ExplicitClosure, DefaultArgumentInitializer,
    Initializer, PropertyWrapperBackingInitializer, PropertyWrapperInitFromProjectedValue);

  private static final VBitSet BOUND_GENERICS = bits(
    BoundGenericStructure, BoundGenericEnum, BoundGenericClass, BoundGenericOtherNominalType,
    BoundGenericTypeAlias, BoundGenericProtocol, BoundGenericFunction);

  // Plain nominal types; unspecialized copies parent context and name only
  private static final VBitSet NOMINALS = bits(
    Structure, Enum, Class, TypeAlias, OtherNominalType);

  // Functions, accessors, closures and initializers; specialized through their parent
  private static final VBitSet FUNCTION_LIKE = bits(
    Function, Getter, Setter, WillSet, DidSet, ReadAccessor, ModifyAccessor, UnsafeAddressor,
    UnsafeMutableAddressor, Allocator, Constructor, Destructor, Variable, Subscript,
    ExplicitClosure, ImplicitClosure, Initializer, PropertyWrapperBackingInitializer,
    PropertyWrapperInitFromProjectedValue, DefaultArgumentInitializer);

  public boolean isDeclName()       { return DECL_NAMES      .test(ordinal()); }
  public boolean isAnyGeneric()     { return ANY_GENERICS    .test(ordinal()); }
  public boolean isRequirement()    { return REQUIREMENTS    .test(ordinal()); }
  public boolean isContext()        { return CONTEXTS        .test(ordinal()); }
  public boolean isFunctionAttr()   { return FUNCTION_ATTRS  .test(ordinal()); }
  public boolean isMacroExpansion() { return MACRO_EXPANSIONS.test(ordinal()); }
  // Type, or anything that can be a context
  public boolean isEntity()         { return this==Type || isContext(); }

  boolean isSimpleKind()            { return SIMPLE_TYPES    .test(ordinal()); }
  boolean isExistential()           { return EXISTENTIALS    .test(ordinal()); }
  boolean isConsumesGenericArgs()   { return !NO_GENERIC_ARGS.test(ordinal()); }
  boolean isBoundGeneric()          { return BOUND_GENERICS  .test(ordinal()); }
  boolean isNominal()               { return NOMINALS        .test(ordinal()); }
  boolean isFunctionLike()          { return FUNCTION_LIKE   .test(ordinal()); }
  // Unbound kinds whose specialization is decided by their parent context
  boolean isSpecializedByParent()   { return isNominal() || isFunctionLike() || this==Protocol; }

  public boolean in( Kind... ks ) {
    for( Kind k : ks ) if( k==this ) return true;
    return false;
  }
}
