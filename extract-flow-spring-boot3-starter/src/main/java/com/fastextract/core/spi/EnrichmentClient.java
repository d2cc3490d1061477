package com.fastextract.core.spi;

import com.fastextract.model.LiteratureRecord;

import java.util.concurrent.CompletableFuture;

/**
 * 获取富化内容（全文等）
 */
public interface EnrichmentClient {

    /**
     * @param persistedId 持久化后的记录 id
     */
    CompletableFuture<LiteratureRecord> fetchEnrichedContent(String persistedId);
}
