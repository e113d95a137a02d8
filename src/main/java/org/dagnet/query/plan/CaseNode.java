package org.dagnet.query.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Node splitting traffic across experiment variants.
 */
@Value
@Builder
public class CaseNode {
    String nodeKey;
    /** Case file id; null when the case has none yet. */
    String caseId;
    @Singular
    List<String> variants;
}
