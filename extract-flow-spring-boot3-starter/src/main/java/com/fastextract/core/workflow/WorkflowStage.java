package com.fastextract.core.workflow;

/**
 * 四个阶段及其进度区间
 */
public enum WorkflowStage {
    SAVE(1, 0, 15),
    FETCH(2, 15, 40),
    PREPARE(3, 40, 40),
    EXTRACT(4, 40, 100);

    public static final int TOTAL_STAGES = 4;

    private final int number;
    private final int fromPercent;
    private final int toPercent;

    WorkflowStage(int number, int fromPercent, int toPercent) {
        this.number = number;
        this.fromPercent = fromPercent;
        this.toPercent = toPercent;
    }

    public int getNumber() { return number; }
    public int getFromPercent() { return fromPercent; }
    public int getToPercent() { return toPercent; }

    /**
     * 把阶段内进度 done/total 映射到区间内
     */
    public int percentOf(int done, int total) {
        if (total <= 0) {
            return fromPercent;
        }
        double ratio = Math.min(1.0, Math.max(0.0, (double) done / total));
        return fromPercent + (int) Math.round(ratio * (toPercent - fromPercent));
    }
}
