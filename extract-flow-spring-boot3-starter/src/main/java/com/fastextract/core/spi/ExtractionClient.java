package com.fastextract.core.spi;

import com.fastextract.core.workflow.PreparedSource;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 下游最终抽取调用, 对编排层不透明
 */
public interface ExtractionClient {

    CompletableFuture<JsonNode> extract(List<PreparedSource> sources, StageProgressListener listener);

    /**
     * 下游分阶段进度
     */
    @FunctionalInterface
    interface StageProgressListener {
        void onStage(int stageNumber, int totalStages, String message);
    }
}
