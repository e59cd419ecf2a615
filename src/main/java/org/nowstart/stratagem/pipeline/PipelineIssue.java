package org.nowstart.stratagem.pipeline;

import java.time.Instant;
import org.nowstart.stratagem.data.type.NodeName;

public record PipelineIssue(NodeName step, String message, Instant occurredAt) {
}
