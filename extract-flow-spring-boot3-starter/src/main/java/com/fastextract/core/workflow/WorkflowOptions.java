package com.fastextract.core.workflow;

import com.fastextract.core.cancel.CancellationSignal;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Consumer;

@Getter
@Builder
public class WorkflowOptions {

    @Builder.Default
    private final CancellationSignal signal = CancellationSignal.none();

    @Builder.Default
    private final Consumer<WorkflowProgress> onProgress = p -> { };

    /** 抓取阶段超时, 为空时用默认值 */
    private final Long fetchTimeoutMs;

    public static WorkflowOptions defaults() {
        return WorkflowOptions.builder().build();
    }
}
