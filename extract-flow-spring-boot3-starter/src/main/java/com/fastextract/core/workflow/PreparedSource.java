package com.fastextract.core.workflow;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 交给下游抽取的来源
 */
@Getter
@Builder
@ToString(exclude = "content")
public class PreparedSource {

    private final String id;
    private final String title;
    private final String content;
    private final ContentType contentType;
    private final List<String> keywords;
    private final String url;
    private final List<String> authors;
    private final Integer year;
}
