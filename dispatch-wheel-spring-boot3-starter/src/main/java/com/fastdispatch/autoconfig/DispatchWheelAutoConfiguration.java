package com.fastdispatch.autoconfig;

import com.fastdispatch.annotation.EnableDispatchWheel;
import com.fastdispatch.config.DispatchWheelProperties;
import com.fastdispatch.core.DispatchEngineRunner;
import com.fastdispatch.core.backoff.BackoffRegistry;
import com.fastdispatch.core.clock.SystemDispatchClock;
import com.fastdispatch.core.engine.DispatchEngine;
import com.fastdispatch.core.executor.SimulatedJobExecutor;
import com.fastdispatch.core.failure.DefaultFailureDecider;
import com.fastdispatch.core.failure.FailureDeciderHandlerFactory;
import com.fastdispatch.core.failure.handler.RetryDeciderHandler;
import com.fastdispatch.core.failure.handler.TerminalFailureDeciderHandler;
import com.fastdispatch.core.metric.DispatchMetrics;
import com.fastdispatch.core.random.GaussianRandomSource;
import com.fastdispatch.core.report.LoggingDispatchListener;
import com.fastdispatch.core.retry.RetryPolicy;
import com.fastdispatch.core.scheduler.PriorityJobScheduler;
import com.fastdispatch.core.sink.JsonLinesMetricsSink;
import com.fastdispatch.core.spi.BackoffPolicy;
import com.fastdispatch.core.spi.DispatchClock;
import com.fastdispatch.core.spi.DispatchListener;
import com.fastdispatch.core.spi.JobExecutor;
import com.fastdispatch.core.spi.MetricsSink;
import com.fastdispatch.core.spi.RandomSource;
import com.fastdispatch.core.spi.failure.FailureDecider;
import com.fastdispatch.core.spi.failure.FailureDeciderHandler;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * 调度引擎及其策略组件
 */
@AutoConfiguration(after = {
        DispatchWheelMetricsAutoConfiguration.class,
        DispatchWheelMybatisAutoConfiguration.class
})
@EnableConfigurationProperties(DispatchWheelProperties.class)
public class DispatchWheelAutoConfiguration {

    /**
     * 单调时钟
     */
    @Bean
    @ConditionalOnMissingBean(DispatchClock.class)
    public DispatchClock dispatchClock() {
        return new SystemDispatchClock();
    }

    /**
     * 默认随机源
     */
    @Bean
    @ConditionalOnMissingBean(RandomSource.class)
    public RandomSource randomSource(DispatchWheelProperties props) {
        return new GaussianRandomSource(props);
    }

    /**
     * 默认模拟执行器
     */
    @Bean
    @ConditionalOnMissingBean(JobExecutor.class)
    public JobExecutor jobExecutor(DispatchClock clock, RandomSource random) {
        return new SimulatedJobExecutor(clock, random);
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(DispatchWheelProperties props,
                                           ObjectProvider<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(DispatchWheelProperties props) {
        return new RetryPolicy(props);
    }

    /**
     * 默认失败判定
     */
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider() {
        return new DefaultFailureDecider();
    }

    @Bean
    public RetryDeciderHandler retryDeciderHandler() {
        return new RetryDeciderHandler();
    }

    @Bean
    public TerminalFailureDeciderHandler terminalFailureDeciderHandler() {
        return new TerminalFailureDeciderHandler();
    }

    /**
     * 失败决策处理器工厂，用户注册的同名 Outcome 处理器会覆盖内置
     */
    @Bean
    @ConditionalOnMissingBean
    public FailureDeciderHandlerFactory failureDeciderHandlerFactory(ObjectProvider<FailureDeciderHandler> handlers) {
        return new FailureDeciderHandlerFactory(handlers.orderedStream().collect(Collectors.toList()));
    }

    /**
     * 控制台输出
     */
    @Bean
    @ConditionalOnMissingBean
    public LoggingDispatchListener loggingDispatchListener() {
        return new LoggingDispatchListener();
    }

    /**
     * JSON Lines 输出，配置 dispatch.sink.jsonl.path 时启用
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "dispatch.sink.jsonl", name = "path")
    public JsonLinesMetricsSink jsonLinesMetricsSink(DispatchWheelProperties props) {
        return new JsonLinesMetricsSink(Path.of(props.getSink().getJsonl().getPath()));
    }

    /**
     * 调度引擎
     */
    @Bean
    @ConditionalOnMissingBean
    public DispatchEngine dispatchEngine(DispatchWheelProperties props,
                                         DispatchClock clock,
                                         RandomSource random,
                                         JobExecutor executor,
                                         BackoffRegistry backoffRegistry,
                                         RetryPolicy retryPolicy,
                                         FailureDecider failureDecider,
                                         FailureDeciderHandlerFactory failureHandlerFactory,
                                         DispatchMetrics meter,
                                         ObjectProvider<MetricsSink> sinks,
                                         ObjectProvider<DispatchListener> listeners) {
        return new DispatchEngine(props, clock, random, executor, backoffRegistry, retryPolicy,
                failureDecider, failureHandlerFactory, meter,
                sinks.orderedStream().collect(Collectors.toList()),
                listeners.orderedStream().collect(Collectors.toList()),
                PriorityJobScheduler::new);
    }

    /**
     * 启动后执行一次调度
     */
    @Bean
    @ConditionalOnMissingBean
    public DispatchEngineRunner dispatchEngineRunner(DispatchEngine engine,
                                                     DispatchWheelProperties props,
                                                     ApplicationContext applicationContext) {
        EnableDispatchWheel enableDispatchWheel = findEnableDispatchWheel(applicationContext);
        if (enableDispatchWheel != null) {
            props.getRunner().setEnabled(enableDispatchWheel.value());
        }
        return new DispatchEngineRunner(engine, props);
    }

    private EnableDispatchWheel findEnableDispatchWheel(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            // 配置类会被 CGLIB 增强，需要向父类查找
            EnableDispatchWheel an = AnnotationUtils.findAnnotation(type, EnableDispatchWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}
