package org.nowstart.stratagem.pipeline;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.exception.StateConsistencyException;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.RouteAction;

/**
 * Ordered edge table. The first edge whose source and predicate match decides; declaration order breaks ties.
 */
@Slf4j
public class PipelineRouter {

    private final List<ConditionalEdge> edges;
    private final Set<NodeName> suspensionPoints;

    public PipelineRouter(List<ConditionalEdge> edges) {
        this.edges = List.copyOf(edges);
        this.suspensionPoints = this.edges.stream()
                .filter(edge -> edge.decision().action() == RouteAction.SUSPEND)
                .map(ConditionalEdge::from)
                .collect(Collectors.toUnmodifiableSet());
    }

    public RouteDecision next(NodeName node, PipelineState state, NodeOutcome outcome) {
        for (ConditionalEdge edge : edges) {
            if (edge.matches(node, state, outcome)) {
                log.debug("event=pipeline_route session={} node={} edge={} action={}",
                        state.getSessionId(), node, edge.label(), edge.decision().action());
                return edge.decision();
            }
        }
        throw new StateConsistencyException("No route matches node=" + node + " result=" + outcome.result());
    }

    public boolean isSuspensionPoint(NodeName node) {
        return suspensionPoints.contains(node);
    }

    public List<ConditionalEdge> edges() {
        return edges;
    }
}
