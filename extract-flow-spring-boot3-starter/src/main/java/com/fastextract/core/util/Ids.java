package com.fastextract.core.util;

public final class Ids {

    private Ids() {}

    /** 日志中只打印前 8 位 */
    public static String shortId(String id) {
        if (id == null) {
            return "null";
        }
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** 异常的可读原因, 无消息时退回类名 */
    public static String reasonOf(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
