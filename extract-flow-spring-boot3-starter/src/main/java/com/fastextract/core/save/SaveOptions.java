package com.fastextract.core.save;

import com.fastextract.core.cancel.CancellationSignal;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Consumer;

@Getter
@Builder
public class SaveOptions {

    @Builder.Default
    private final CancellationSignal signal = CancellationSignal.none();

    @Builder.Default
    private final Consumer<BatchSaveProgress> onProgress = p -> { };

    public static SaveOptions defaults() {
        return SaveOptions.builder().build();
    }
}
