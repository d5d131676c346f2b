package com.raditha.hygiene.model;

/**
 * Advisory flags passed between passes through node metadata.
 * A flag, once set, is authoritative for every later pass.
 */
public enum MetaFlag {
    /** The binder (or the variable read) must keep its exact name. */
    PRESERVE_NAME,
    /** The node was created by the pipeline rather than the upstream builder. */
    SYNTHESIZED,
    /** The binder is a temporary introduced by lowering and may be collapsed away. */
    COMPILER_TEMP
}
