package com.fastextract.core.spi;

import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.SaveResponse;

import java.util.concurrent.CompletableFuture;

/**
 * 持久化调用
 * 硬失败时以异常完成 future（或直接抛出）
 */
public interface PersistenceClient {

    CompletableFuture<SaveResponse> save(LiteratureRecord record);
}
