package org.dagnet.query.plan;

import lombok.Value;

/**
 * Where a parameter's data comes from; either part may be null.
 */
@Value
public class DataSourceRef {
    String connectionName;
    String providerName;

    public static DataSourceRef of(String connectionName, String providerName) {
        return new DataSourceRef(connectionName, providerName);
    }
}
