package org.dagnet.query.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters attached to one funnel edge. Absent slots are null.
 */
@Value
@Builder
public class EdgeParameters {
    String from;
    String to;
    ParameterSlot p;
    @Singular
    List<ConditionalParameter> conditionals;
    ParameterSlot costGbp;
    ParameterSlot costTime;

    public String edgeKey() {
        return from + "->" + to;
    }

    /**
     * Returns the data sources of every slot on the edge, conditionals included.
     */
    public List<DataSourceRef> dataSources() {
        List<DataSourceRef> sources = new ArrayList<>();
        addSource(sources, p);
        for (ConditionalParameter conditional : conditionals) {
            addSource(sources, conditional.getSlot());
        }
        addSource(sources, costGbp);
        addSource(sources, costTime);
        return sources;
    }

    private static void addSource(List<DataSourceRef> sources, ParameterSlot slot) {
        if (slot != null && slot.getDataSource() != null) {
            sources.add(slot.getDataSource());
        }
    }
}
