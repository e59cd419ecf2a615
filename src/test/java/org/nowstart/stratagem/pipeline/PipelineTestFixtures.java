package org.nowstart.stratagem.pipeline;

import java.time.Duration;
import java.time.Instant;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.nowstart.stratagem.data.type.NodeName;

/**
 * Entry points into package-private engine plumbing for node tests in other packages.
 */
public final class PipelineTestFixtures {

    public static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    private PipelineTestFixtures() {
    }

    public static PipelineProperties properties(boolean checkpointEveryNode) {
        return new PipelineProperties(
                "gpt-4o-mini",
                "http://llm.local",
                "",
                "http://market.local",
                3,
                3,
                Duration.ofSeconds(1),
                Duration.ofSeconds(4),
                Duration.ofHours(24),
                Duration.ofMinutes(5),
                checkpointEveryNode
        );
    }

    public static PipelineState newState(String sessionId, String userText) {
        return PipelineState.create(sessionId, userText, "gpt-4o-mini", NOW);
    }

    /**
     * Runs one node the way the engine does: with write access to its own payload slots only.
     */
    public static NodeOutcome runNode(PipelineNode node, PipelineState state, Sleeper sleeper) {
        state.getPayload().enterNode(node.name());
        try {
            return node.run(state, new NodeContext(node.name(), state, new RetryExecutor(sleeper)));
        } finally {
            state.getPayload().exitNode();
        }
    }

    /**
     * Writes a slot as its owning node would, for arranging state ahead of a later node.
     */
    public static void writeAs(PipelineState state, NodeName owner, Runnable write) {
        state.getPayload().enterNode(owner);
        try {
            write.run();
        } finally {
            state.getPayload().exitNode();
        }
    }
}
