package com.fastextract.core.workflow;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 每条记录保留或丢弃的依据
 */
@Getter
@ToString
@AllArgsConstructor
public class SourceDecision {

    private final String id;
    private final String title;
    private final boolean kept;
    private final ContentType contentType;
    private final int contentLength;
    /** 仅丢弃时有值 */
    private final String skipReason;
}
