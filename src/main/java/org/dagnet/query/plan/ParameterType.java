package org.dagnet.query.plan;

/**
 * Kind of parameter a planned query retrieves data for.
 */
public enum ParameterType {
    EDGE_BASE_P,
    EDGE_CONDITIONAL_P,
    COST_GBP,
    COST_TIME,
    CASE_VARIANT_EDGE
}
