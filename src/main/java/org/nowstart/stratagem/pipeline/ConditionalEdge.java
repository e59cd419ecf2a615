package org.nowstart.stratagem.pipeline;

import java.util.function.BiPredicate;
import org.nowstart.stratagem.data.type.NodeName;

public record ConditionalEdge(
        NodeName from,
        String label,
        BiPredicate<PipelineState, NodeOutcome> predicate,
        RouteDecision decision
) {

    public boolean matches(NodeName node, PipelineState state, NodeOutcome outcome) {
        return from == node && predicate.test(state, outcome);
    }
}
