package com.fastextract.core.workflow;

/**
 * 来源内容类型
 */
public enum ContentType {
    /** 抓取到或已存储的全文 */
    FULL_TEXT,
    /** 摘要 >= 250 词 */
    ABSTRACT_OVERFLOW,
    /** 摘要 >= 50 词 */
    ABSTRACT,
    NONE;

    public static final int ABSTRACT_OVERFLOW_MIN_WORDS = 250;
    public static final int ABSTRACT_MIN_WORDS = 50;

    /**
     * 有全文时直接 FULL_TEXT, 否则按词数分档
     */
    public static ContentType classify(String text, boolean hasFullText) {
        if (hasFullText) {
            return FULL_TEXT;
        }
        int words = wordCount(text);
        if (words >= ABSTRACT_OVERFLOW_MIN_WORDS) {
            return ABSTRACT_OVERFLOW;
        }
        if (words >= ABSTRACT_MIN_WORDS) {
            return ABSTRACT;
        }
        return NONE;
    }

    public static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String t = text.trim();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}
