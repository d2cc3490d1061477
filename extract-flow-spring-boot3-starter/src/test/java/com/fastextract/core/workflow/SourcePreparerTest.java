package com.fastextract.core.workflow;

import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.enums.FullTextStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourcePreparerTest {

    private final SourcePreparer preparer = new SourcePreparer(50);

    @Test
    void prepare_prefersFullTextOverAbstract() {
        LiteratureRecord r = LiteratureRecord.builder()
                .id("a").title("A")
                .abstractText(words(60))
                .fullText("  " + words(400) + "  ")
                .hasFullText(true)
                .fullTextStatus(FullTextStatus.SUCCESS)
                .keywords(List.of("nlp"))
                .build();

        PreparationResult result = preparer.prepare(List.of(r));

        assertThat(result.getSources()).hasSize(1);
        PreparedSource s = result.getSources().get(0);
        assertThat(s.getContentType()).isEqualTo(ContentType.FULL_TEXT);
        assertThat(s.getContent()).isEqualTo(words(400));
        assertThat(s.getKeywords()).containsExactly("nlp");
        assertThat(s.getAuthors()).isEmpty();
        assertThat(result.getFullTextCount()).isEqualTo(1);
    }

    @Test
    void prepare_failedFullText_fallsBackToAbstract() {
        LiteratureRecord r = LiteratureRecord.builder()
                .id("a").title("A")
                .abstractText(words(60))
                .fullText(words(400))
                .fullTextStatus(FullTextStatus.FAILED)
                .build();

        PreparationResult result = preparer.prepare(List.of(r));

        assertThat(result.getSources()).singleElement()
                .satisfies(s -> assertThat(s.getContentType()).isEqualTo(ContentType.ABSTRACT));
    }

    @Test
    void prepare_classifiesAbstractsByWordCount() {
        PreparationResult result = preparer.prepare(List.of(
                LiteratureRecord.builder().id("long").title("L").abstractText(words(300)).build(),
                LiteratureRecord.builder().id("mid").title("M").abstractText(words(60)).build(),
                LiteratureRecord.builder().id("few").title("F").abstractText(words(20)).build()));

        assertThat(result.getSources()).extracting(PreparedSource::getContentType)
                .containsExactly(ContentType.ABSTRACT_OVERFLOW, ContentType.ABSTRACT, ContentType.NONE);
        assertThat(result.getAbstractOverflowCount()).isEqualTo(1);
        assertThat(result.getAbstractCount()).isEqualTo(1);
        assertThat(result.getNoContentCount()).isEqualTo(1);
    }

    @Test
    void prepare_shortOrMissingContent_isSkippedWithReason() {
        List<LiteratureRecord> input = new ArrayList<>();
        input.add(LiteratureRecord.builder().id("empty").title("E").build());
        input.add(LiteratureRecord.builder().id("short").title("S").abstractText("too short").build());
        input.add(null);
        input.add(LiteratureRecord.builder().id("ok").title("O").abstractText(words(30)).build());

        PreparationResult result = preparer.prepare(input);

        assertThat(result.getTotalSelected()).isEqualTo(3);
        assertThat(result.getTotalWithContent()).isEqualTo(1);
        assertThat(result.getTotalSkipped()).isEqualTo(2);
        assertThat(result.getDecisions()).extracting(SourceDecision::getSkipReason)
                .containsExactly(SourcePreparer.NO_CONTENT, "Content too short (9 chars, need >50)", null);
        assertThat(result.getSources()).extracting(PreparedSource::getId).containsExactly("ok");
    }

    @Test
    void prepare_contentExactlyAtThreshold_isSkipped() {
        String fifty = "x".repeat(50);

        PreparationResult result = preparer.prepare(List.of(
                LiteratureRecord.builder().id("edge").title("E").abstractText(fifty).build()));

        assertThat(result.getSources()).isEmpty();
        assertThat(result.getAverageContentLength()).isZero();
    }

    @Test
    void prepare_averagesKeptContentLength() {
        PreparationResult result = preparer.prepare(List.of(
                LiteratureRecord.builder().id("a").title("A").abstractText("a".repeat(100)).build(),
                LiteratureRecord.builder().id("b").title("B").abstractText("b".repeat(201)).build()));

        assertThat(result.getAverageContentLength()).isEqualTo(151);
    }

    @Test
    void prepare_nullInput_yieldsEmptyResult() {
        PreparationResult result = preparer.prepare(null);

        assertThat(result.getTotalSelected()).isZero();
        assertThat(result.getSources()).isEmpty();
    }

    static String words(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append("word").append(i);
        }
        return sb.toString();
    }
}
