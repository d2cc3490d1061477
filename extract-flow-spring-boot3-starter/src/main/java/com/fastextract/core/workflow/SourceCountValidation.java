package com.fastextract.core.workflow;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class SourceCountValidation {

    private final boolean valid;
    /** 超过软上限时的提示 */
    private final String warning;
    /** 无效时的原因 */
    private final String error;
    private final long estimatedSeconds;
}
