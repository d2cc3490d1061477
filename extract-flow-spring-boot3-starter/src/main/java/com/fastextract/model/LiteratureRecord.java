package com.fastextract.model;

import com.fastextract.model.enums.FullTextStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 文献记录
 * 保存前必填: id、title
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LiteratureRecord {

    /** 原始 id（检索结果中的 id） */
    private String id;
    private String title;
    private List<String> authors;
    private Integer year;
    private String abstractText;
    private String doi;
    private String url;
    private String venue;
    private Integer citationCount;
    private List<String> keywords;

    /** 富化后填充 */
    private String fullText;
    private boolean hasFullText;
    private Integer fullTextWordCount;
    private FullTextStatus fullTextStatus;
}
