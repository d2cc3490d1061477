package com.fastextract.autoconfig;

import com.fastextract.config.ExtractNotifierProperties;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.notify.AsyncNotifyingService;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.core.notify.notifier.LoggingNotifier;
import com.fastextract.core.notify.ratelimit.RateLimitFilter;
import com.fastextract.core.spi.notify.Notifier;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = ExtractFlowMetricsAutoConfiguration.class)
@EnableConfigurationProperties(ExtractNotifierProperties.class)
public class ExtractNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "extract.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(ObjectProvider<Notifier> notifiers,
                                                       ExtractMetrics metrics,
                                                       ExtractNotifierProperties props) {
        ExtractNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "extract-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, notifiers.orderedStream().collect(Collectors.toList()), filter, metrics);
    }

    @Bean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
