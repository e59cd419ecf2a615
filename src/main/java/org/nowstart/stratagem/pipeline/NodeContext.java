package org.nowstart.stratagem.pipeline;

import java.util.function.Supplier;
import org.nowstart.stratagem.data.type.NodeName;

/**
 * Per-invocation handle a node uses for retried external calls. Every attempt is counted in the session's retry counts.
 */
public class NodeContext {

    private final NodeName node;
    private final PipelineState state;
    private final RetryExecutor retryExecutor;

    NodeContext(NodeName node, PipelineState state, RetryExecutor retryExecutor) {
        this.node = node;
        this.state = state;
        this.retryExecutor = retryExecutor;
    }

    public NodeName node() {
        return node;
    }

    public <T> T retry(RetryPolicy policy, Supplier<T> call) {
        return retryExecutor.execute(policy, call, attempt -> state.recordAttempt(node));
    }
}
