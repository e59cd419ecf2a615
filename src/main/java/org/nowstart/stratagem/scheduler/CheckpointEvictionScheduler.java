package org.nowstart.stratagem.scheduler;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.nowstart.stratagem.repository.CheckpointStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckpointEvictionScheduler {

    private final CheckpointStore checkpointStore;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${stratagem.pipeline.checkpoint-eviction-interval:5m}")
    public void run() {
        int evicted = checkpointStore.evictExpired(clock.instant(), pipelineProperties.checkpointTtl());
        if (evicted > 0) {
            log.info("event=checkpoint_evicted count={} ttl={}", evicted, pipelineProperties.checkpointTtl());
        }
    }
}
