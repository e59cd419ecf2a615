package org.nowstart.stratagem.pipeline;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.SessionStatus;

/**
 * Edge table of the strategy backtest workflow.
 */
public final class PipelineRoutes {

    public static final String AWAITING_CONFIRMATION = "awaiting human confirmation";

    private PipelineRoutes() {
    }

    public static PipelineRouter standard() {
        List<ConditionalEdge> edges = new ArrayList<>();
        RouteDecision failed = RouteDecision.terminate(SessionStatus.FAILED);

        edges.add(new ConditionalEdge(NodeName.TRANSLATE, "translate_failed",
                (state, outcome) -> outcome.isHardFailure(), failed));
        edges.add(new ConditionalEdge(NodeName.TRANSLATE, "translated",
                (state, outcome) -> true, RouteDecision.goTo(NodeName.INTERPRET)));

        edges.add(new ConditionalEdge(NodeName.INTERPRET, "interpret_failed",
                (state, outcome) -> outcome.isHardFailure(), failed));
        edges.add(new ConditionalEdge(NodeName.INTERPRET, "confirmed",
                (state, outcome) -> state.getPendingInput() != null && state.getPendingInput().confirmed(),
                RouteDecision.goTo(NodeName.VALIDATE)));
        edges.add(new ConditionalEdge(NodeName.INTERPRET, "rejected_with_edits",
                (state, outcome) -> state.getPendingInput() != null
                        && !state.getPendingInput().confirmed()
                        && state.getPendingInput().hasEdits(),
                RouteDecision.goTo(NodeName.TRANSLATE)));
        edges.add(new ConditionalEdge(NodeName.INTERPRET, "awaiting_confirmation",
                (state, outcome) -> true, RouteDecision.suspend(AWAITING_CONFIRMATION)));

        edges.add(new ConditionalEdge(NodeName.VALIDATE, "invalid_spec",
                (state, outcome) -> outcome.isHardFailure() || state.hasErrorsFrom(NodeName.VALIDATE), failed));
        edges.add(new ConditionalEdge(NodeName.VALIDATE, "valid_spec",
                (state, outcome) -> true, RouteDecision.goTo(NodeName.FETCH_DATA)));

        edges.add(new ConditionalEdge(NodeName.PRE_QA, "pre_qa_failed",
                (state, outcome) -> outcome.isHardFailure(), failed));
        edges.add(new ConditionalEdge(NodeName.PRE_QA, "pre_qa_passed",
                (state, outcome) -> true, RouteDecision.goTo(NodeName.BACKTEST)));

        edges.add(new ConditionalEdge(NodeName.EXPLAIN, "completed",
                (state, outcome) -> true, RouteDecision.terminate(SessionStatus.COMPLETED)));

        linear(edges, NodeName.FETCH_DATA, NodeName.ADD_FEATURES, failed);
        linear(edges, NodeName.ADD_FEATURES, NodeName.PRE_QA, failed);
        linear(edges, NodeName.BACKTEST, NodeName.METRICS, failed);
        linear(edges, NodeName.METRICS, NodeName.TRADES, failed);
        linear(edges, NodeName.TRADES, NodeName.EXPLAIN, failed);

        return new PipelineRouter(edges);
    }

    private static void linear(List<ConditionalEdge> edges, NodeName from, NodeName to, RouteDecision failed) {
        edges.add(new ConditionalEdge(from, from.id() + "_failed", (state, outcome) -> outcome.isHardFailure(), failed));
        edges.add(new ConditionalEdge(from, from.id() + "_done", (state, outcome) -> true, RouteDecision.goTo(to)));
    }
}
