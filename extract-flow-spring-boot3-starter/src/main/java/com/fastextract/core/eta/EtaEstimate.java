package com.fastextract.core.eta;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public final class EtaEstimate {

    private final long estimatedMs;
    private final String formatted;
    private final long averageTaskMs;
    private final int samplesUsed;
    /** 样本数达到 minSamples 才可信 */
    private final boolean reliable;
}
