package org.nowstart.stratagem.pipeline;

import java.util.Set;
import org.nowstart.stratagem.data.type.NodeName;

/**
 * One workflow step. Implementations write only the payload slots they own and must be safe to re-run.
 */
public interface PipelineNode {

    NodeName name();

    /**
     * Payload slots that must be present before {@link #run} is called.
     */
    default Set<PayloadField> requires() {
        return Set.of();
    }

    NodeOutcome run(PipelineState state, NodeContext context);
}
