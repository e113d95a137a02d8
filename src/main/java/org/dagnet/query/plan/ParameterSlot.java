package org.dagnet.query.plan;

import lombok.Value;

/**
 * One data-bearing parameter on an edge.
 */
@Value
public class ParameterSlot {
    /** Parameter file id; null when the parameter has none yet. */
    String id;
    /** Null when the parameter is not bound to a data source. */
    DataSourceRef dataSource;

    public static ParameterSlot of(String id, DataSourceRef dataSource) {
        return new ParameterSlot(id, dataSource);
    }

    public static ParameterSlot unbound(String id) {
        return new ParameterSlot(id, null);
    }
}
