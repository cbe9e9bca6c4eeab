package org.asma.assembler.engine;

/**
 * The phases of an assembly run, in execution order.
 */
public enum AssemblyPhase {
    /** Read statements, create sections and regions, declare symbols. */
    PARSE,
    /** Evaluate everything that does not depend on locations. */
    EARLY_RESOLVE,
    /** One more attempt for expressions deferred by the first pass. */
    EARLY_RESOLVE_RETRY,
    /** Position content within sections. */
    ALLOCATE,
    /** Place sections in regions and convert addresses to absolute. */
    BIND,
    /** Produce machine code and constants. */
    OBJECT_GENERATE,
    /** Copy content bottom-up into the image. */
    CONSOLIDATE,
    /** Compute entry and load addresses and hand the image to the writers. */
    FINISH
}
