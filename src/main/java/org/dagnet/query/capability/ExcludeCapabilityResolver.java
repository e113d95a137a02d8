package org.dagnet.query.capability;

/**
 * Answers whether a data provider can evaluate {@code exclude(..)} natively.
 *
 * <p>When it cannot, exclusions are compiled into signed positive sub-queries.</p>
 */
@FunctionalInterface
public interface ExcludeCapabilityResolver {

    /**
     * @param connectionName configured connection, may be null.
     * @param providerName provider type used when the connection is unknown, may be null.
     * @return whether native exclude is supported; unknown connections and providers answer {@code false}.
     */
    boolean supportsNativeExclude(String connectionName, String providerName);
}
