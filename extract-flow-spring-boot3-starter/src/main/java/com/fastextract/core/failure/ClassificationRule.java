package com.fastextract.core.failure;

import java.util.function.Predicate;

/**
 * 分类规则: 谓词 + 类别, 按顺序求值, 首个命中生效
 * 业务方可声明此类型的 bean, 优先于内置规则
 */
public interface ClassificationRule {

    /** 规则名, 用于日志 */
    String name();

    boolean matches(NormalizedError error);

    ErrorCategory category();

    static ClassificationRule of(String name, ErrorCategory category, Predicate<NormalizedError> predicate) {
        return new ClassificationRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean matches(NormalizedError error) {
                return predicate.test(error);
            }

            @Override
            public ErrorCategory category() {
                return category;
            }

            @Override
            public String toString() {
                return "ClassificationRule[" + name + " -> " + category + "]";
            }
        };
    }
}
