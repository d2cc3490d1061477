package com.fastextract.core.save;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public final class FailedItem {

    /** 输入中的原始 id, 缺失时为 null */
    private final String originalId;

    private final String reason;
}
