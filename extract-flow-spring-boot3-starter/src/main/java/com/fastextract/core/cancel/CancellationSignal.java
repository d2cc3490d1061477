package com.fastextract.core.cancel;

import java.util.ArrayList;
import java.util.List;

/**
 * 协作式取消令牌
 * 只在约定的检查点读取, 不会强行中断在途调用
 */
public interface CancellationSignal {

    boolean isCancelled();

    /**
     * 注册取消回调; 已取消时立即执行
     * @return 注销句柄, 用完即注销, 避免长生命周期的信号持有回调
     */
    Registration onCancel(Runnable listener);

    /** 永不取消 */
    static CancellationSignal none() {
        return NeverCancelled.INSTANCE;
    }

    /**
     * 组合信号: 任一输入取消即取消, null 项忽略
     * 不再使用时 close(), 从输入信号上摘除挂载的回调
     */
    static LinkedSignal anyOf(CancellationSignal... signals) {
        CancellationController combined = new CancellationController();
        List<Registration> links = new ArrayList<>(signals.length);
        for (CancellationSignal s : signals) {
            if (s != null) {
                links.add(s.onCancel(combined::cancel));
            }
        }
        return new LinkedSignal(combined.signal(), links);
    }

    /**
     * 回调注册句柄
     */
    interface Registration {

        Registration NOOP = () -> false;

        /** 摘除回调, 已触发或已摘除返回 false */
        boolean unregister();
    }

    /**
     * 挂在若干输入信号上的组合信号
     */
    final class LinkedSignal implements CancellationSignal, AutoCloseable {

        private final CancellationSignal delegate;
        private final List<Registration> links;

        private LinkedSignal(CancellationSignal delegate, List<Registration> links) {
            this.delegate = delegate;
            this.links = links;
        }

        @Override
        public boolean isCancelled() {
            return delegate.isCancelled();
        }

        @Override
        public Registration onCancel(Runnable listener) {
            return delegate.onCancel(listener);
        }

        @Override
        public void close() {
            for (Registration r : links) {
                r.unregister();
            }
        }
    }

    final class NeverCancelled implements CancellationSignal {

        private static final NeverCancelled INSTANCE = new NeverCancelled();

        private NeverCancelled() {}

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable listener) {
            return Registration.NOOP;
        }
    }
}
