package com.raditha.hygiene.passes;

/**
 * Binding positions handled by {@link BinderHygienePass}.
 */
public enum BinderScope {
    /** parameters of {@code def}, {@code defp} and macros */
    FUNCTION_PARAM,
    /** parameters of anonymous function clauses */
    FN_PARAM,
    CASE_CLAUSE,
    RECEIVE_CLAUSE,
    /** the {@code e} of {@code rescue e in ...} */
    RESCUE,
    /** kind and value of {@code catch kind, value} */
    CATCH,
    /** {@code pattern <- source} of a comprehension */
    GENERATOR,
    /** {@code pattern <- value} of a {@code with} */
    WITH_CLAUSE
}
