package com.fastextract.core.workflow;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 统一的 0-100 进度, 同一次运行内单调不减
 */
@Getter
@ToString
@AllArgsConstructor
public class WorkflowProgress {

    private final WorkflowStage stage;
    private final int stageNumber;
    private final int totalStages;
    private final int currentItem;
    private final int totalItems;
    private final int percentage;
    private final String message;
}
