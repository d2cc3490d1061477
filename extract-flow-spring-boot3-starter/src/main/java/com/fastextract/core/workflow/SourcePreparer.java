package com.fastextract.core.workflow;

import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.enums.FullTextStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.fastextract.core.util.Ids.shortId;

/**
 * 抽取前的内容准备
 * 有全文用全文, 否则用摘要; 内容长度不超过 minContentLength 的记录被丢弃并记录原因
 */
public class SourcePreparer {

    private static final Logger log = LoggerFactory.getLogger(SourcePreparer.class);

    static final String NO_CONTENT = "No abstract or full-text available";

    private final int minContentLength;

    public SourcePreparer(int minContentLength) {
        this.minContentLength = minContentLength;
    }

    public PreparationResult prepare(List<LiteratureRecord> records) {
        List<PreparedSource> sources = new ArrayList<>();
        List<SourceDecision> decisions = new ArrayList<>();
        int fullText = 0;
        int overflow = 0;
        int abstracts = 0;
        int none = 0;
        long keptLength = 0;

        List<LiteratureRecord> input = records == null ? List.of() : records;
        for (LiteratureRecord r : input) {
            if (r == null) {
                continue;
            }
            String full = usableFullText(r);
            String content = full != null ? full : trimToEmpty(r.getAbstractText());
            ContentType type = ContentType.classify(content, full != null);
            switch (type) {
                case FULL_TEXT -> fullText++;
                case ABSTRACT_OVERFLOW -> overflow++;
                case ABSTRACT -> abstracts++;
                default -> none++;
            }

            if (content.length() <= minContentLength) {
                String reason = content.isEmpty()
                        ? NO_CONTENT
                        : "Content too short (" + content.length() + " chars, need >" + minContentLength + ")";
                decisions.add(new SourceDecision(r.getId(), r.getTitle(), false, type, content.length(), reason));
                log.debug("[Prepare] {} skipped: {}", shortId(r.getId()), reason);
                continue;
            }
            keptLength += content.length();
            decisions.add(new SourceDecision(r.getId(), r.getTitle(), true, type, content.length(), null));
            sources.add(PreparedSource.builder()
                    .id(r.getId())
                    .title(r.getTitle())
                    .content(content)
                    .contentType(type)
                    .keywords(r.getKeywords() == null ? List.of() : List.copyOf(r.getKeywords()))
                    .url(r.getUrl())
                    .authors(r.getAuthors() == null ? List.of() : List.copyOf(r.getAuthors()))
                    .year(r.getYear())
                    .build());
        }

        int kept = sources.size();
        PreparationResult result = PreparationResult.builder()
                .sources(List.copyOf(sources))
                .decisions(List.copyOf(decisions))
                .fullTextCount(fullText)
                .abstractOverflowCount(overflow)
                .abstractCount(abstracts)
                .noContentCount(none)
                .averageContentLength(kept == 0 ? 0 : (int) Math.round((double) keptLength / kept))
                .totalSelected(decisions.size())
                .totalWithContent(kept)
                .totalSkipped(decisions.size() - kept)
                .build();
        log.info("[Prepare] selected={}, kept={}, skipped={}, fullText={}, abstractOverflow={}, abstract={}, none={}",
                result.getTotalSelected(), kept, result.getTotalSkipped(), fullText, overflow, abstracts, none);
        return result;
    }

    /**
     * 全文可用: 去空白后非空且状态不是 FAILED
     */
    private static String usableFullText(LiteratureRecord r) {
        if (r.getFullTextStatus() == FullTextStatus.FAILED) {
            return null;
        }
        String t = trimToEmpty(r.getFullText());
        return t.isEmpty() ? null : t;
    }

    private static String trimToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
