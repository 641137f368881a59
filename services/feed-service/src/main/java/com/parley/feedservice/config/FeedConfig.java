package com.parley.feedservice.config;

import com.parley.eventbus.AuthGate;
import com.parley.eventbus.ChannelSettings;
import com.parley.eventbus.TopicBus;
import com.parley.eventbus.routing.SubscriptionDefinition;
import com.parley.eventbus.routing.SubscriptionRouter;
import com.parley.feedmodel.Message;
import com.parley.feedservice.infrastructure.persistence.JdbcGroupRepository;
import com.parley.observability.MetricFactory;
import com.parley.pagination.PageWindowResolver;
import com.parley.pagination.PaginationSettings;
import com.parley.security.GroupAccessChecker;
import com.parley.security.GroupAccessEnforcer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the feed libraries into the Spring context: one {@link TopicBus} for the process, the
 * pagination engine, the authorization gate and the subscription router.
 */
@Configuration
public class FeedConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, FeedServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public PageWindowResolver<Message> messagePageResolver(
            FeedServiceProperties properties, MetricFactory metrics) {
        return new PageWindowResolver<>(
                new PaginationSettings(properties.defaultPageSize(), properties.maxPageSize()), metrics);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(FeedServiceProperties properties) {
        return Executors.newFixedThreadPool(properties.deliveryThreads(), namedThreads("feed-delivery-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService membershipLookupExecutor() {
        return Executors.newCachedThreadPool(namedThreads("membership-lookup-"));
    }

    @Bean
    public TopicBus topicBus(
            FeedServiceProperties properties, ExecutorService deliveryExecutor, MetricFactory metrics) {
        return new TopicBus(new ChannelSettings(properties.channelBufferSize(), deliveryExecutor), metrics);
    }

    @Bean
    public AuthGate authGate(FeedServiceProperties properties) {
        return new AuthGate(properties.authTimeout(), properties.gatePolicy());
    }

    @Bean
    public GroupAccessChecker groupAccessChecker(JdbcGroupRepository groups) {
        return new GroupAccessChecker(groups);
    }

    @Bean
    public GroupAccessEnforcer groupAccessEnforcer(GroupAccessChecker checker) {
        return new GroupAccessEnforcer(checker);
    }

    @Bean
    public SubscriptionRouter subscriptionRouter(
            TopicBus bus,
            AuthGate gate,
            List<SubscriptionDefinition<?>> definitions,
            MetricFactory metrics) {
        return new SubscriptionRouter(bus, gate, definitions, metrics);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
