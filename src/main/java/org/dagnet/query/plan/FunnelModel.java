package org.dagnet.query.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.dagnet.query.graph.FunnelGraph;

import java.util.List;

/**
 * Funnel graph together with the parameters that need data retrieval.
 */
@Value
@Builder
public class FunnelModel {
    FunnelGraph graph;
    @Singular
    List<EdgeParameters> edges;
    @Singular
    List<CaseNode> caseNodes;
}
