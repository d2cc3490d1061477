package com.fastextract.core.extract;

import com.fastextract.model.LiteratureRecord;

/**
 * 单条抽取结果: Success 或 Failure, 每条输入恰好产生一个
 */
public abstract class ExtractionOutcome {

    private final String originalId;

    private ExtractionOutcome(String originalId) {
        this.originalId = originalId;
    }

    public String getOriginalId() {
        return originalId;
    }

    public abstract boolean isSuccess();

    public static Success success(String originalId, LiteratureRecord record) {
        return new Success(originalId, record);
    }

    public static Failure failure(String originalId, String persistedId, String reason) {
        return new Failure(originalId, persistedId, reason);
    }

    public static final class Success extends ExtractionOutcome {

        private final LiteratureRecord record;

        private Success(String originalId, LiteratureRecord record) {
            super(originalId);
            this.record = record;
        }

        public LiteratureRecord getRecord() {
            return record;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toString() {
            return "Success{" + getOriginalId() + '}';
        }
    }

    public static final class Failure extends ExtractionOutcome {

        private final String persistedId;

        private final String reason;

        private Failure(String originalId, String persistedId, String reason) {
            super(originalId);
            this.persistedId = persistedId;
            this.reason = reason;
        }

        public String getPersistedId() {
            return persistedId;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return "Failure{" + getOriginalId() + ", reason=" + reason + '}';
        }
    }
}
