package com.fastextract.core.extract;

import com.fastextract.core.cancel.CancellationSignal;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Consumer;

@Getter
@Builder
public class ExtractionOptions {

    @Builder.Default
    private final CancellationSignal signal = CancellationSignal.none();

    /** 整批截止时长, 为空时使用协调器默认值 */
    private final Long timeoutMs;

    @Builder.Default
    private final Consumer<ExtractionProgress> onProgress = p -> { };

    public static ExtractionOptions defaults() {
        return ExtractionOptions.builder().build();
    }
}
