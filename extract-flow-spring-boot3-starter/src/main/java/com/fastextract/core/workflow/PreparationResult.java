package com.fastextract.core.workflow;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString(exclude = {"sources", "decisions"})
public class PreparationResult {

    private final List<PreparedSource> sources;
    private final List<SourceDecision> decisions;
    private final int fullTextCount;
    private final int abstractOverflowCount;
    private final int abstractCount;
    private final int noContentCount;
    /** 保留来源的平均内容长度 */
    private final int averageContentLength;
    private final int totalSelected;
    private final int totalWithContent;
    private final int totalSkipped;
}
