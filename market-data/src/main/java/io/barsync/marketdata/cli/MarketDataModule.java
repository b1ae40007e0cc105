package io.barsync.marketdata.cli;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.barsync.budget.RateLimiter;
import io.barsync.budget.TimeSource;
import io.barsync.budget.TokenBucketRateLimiter;
import io.barsync.marketdata.config.SyncConfig;
import io.barsync.marketdata.fetch.FetchExecutor;
import io.barsync.marketdata.fetch.HttpUpstreamClient;
import io.barsync.marketdata.fetch.InstrumentResolver;
import io.barsync.marketdata.fetch.TransientFetchException;
import io.barsync.marketdata.fetch.UpstreamClient;
import io.barsync.marketdata.plan.GapPlanner;
import io.barsync.marketdata.plan.TradingCalendar;
import io.barsync.marketdata.store.LocalStoreRegistry;
import io.barsync.marketdata.store.StoreOptions;
import io.barsync.marketdata.sync.MarketDataSync;
import io.barsync.marketdata.validate.BarValidator;
import io.barsync.retry.ExponentialBackoffRetryPolicy;
import io.barsync.retry.RetryPolicy;

import java.io.IOException;

public class MarketDataModule extends AbstractModule {
    private final SyncConfig config;

    public MarketDataModule(SyncConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(SyncConfig.class).toInstance(config);
        bind(TimeSource.class).toInstance(TimeSource.SYSTEM);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    /** One limiter for the whole process: every request of every series draws from it. */
    @Provides @Singleton RateLimiter rateLimiter(TimeSource time) {
        return TokenBucketRateLimiter.perMinute(config.requestsPerMinute(), config.rateSafetyMargin(), time);
    }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.retryMaxAttempts(), config.retryBaseMillis(), config.retryMaxMillis(),
                config.retryMultiplier(), e -> e instanceof TransientFetchException);
    }

    @Provides @Singleton StoreOptions storeOptions() {
        StoreOptions defaults = StoreOptions.defaults(config.dataDir());
        return new StoreOptions(defaults.backupDir(), config.maxBackups(), defaults.verifyOnOpen(), defaults.clock(), defaults.migrations());
    }

    @Provides @Singleton LocalStoreRegistry stores(StoreOptions options) { return new LocalStoreRegistry(config.dataDir(), options); }

    @Provides @Singleton GapPlanner gapPlanner(LocalStoreRegistry stores) { return new GapPlanner(stores); }

    @Provides @Singleton TradingCalendar tradingCalendar() throws IOException { return TradingCalendar.load(config.holidaysFile()); }

    @Provides @Singleton InstrumentResolver instruments() throws IOException { return InstrumentResolver.load(config.instrumentsFile()); }

    @Provides @Singleton UpstreamClient upstream(InstrumentResolver instruments, ObjectMapper mapper) {
        return new HttpUpstreamClient(config.upstreamBaseUrl(), config.apiKey(), config.accessToken(), instruments,
                config.upstreamTimeout(), mapper);
    }

    @Provides BarValidator validator() { return new BarValidator(config.maxWarningRatio(), config.strictValidation()); }

    @Provides @Singleton FetchExecutor fetchExecutor(UpstreamClient client, RateLimiter limiter, RetryPolicy retry, TimeSource time,
                                                     BarValidator validator, TradingCalendar calendar, LocalStoreRegistry stores,
                                                     MetricRegistry registry) {
        return new FetchExecutor(client, limiter, retry, time, validator, calendar, stores, config.fetchWorkers(), registry,
                "upstream:" + config.upstreamBaseUrl().getHost());
    }

    @Provides @Singleton MarketDataSync marketDataSync(LocalStoreRegistry stores, GapPlanner planner, FetchExecutor executor,
                                                       StoreOptions options, MetricRegistry registry) {
        return new MarketDataSync(stores, planner, executor, options, registry);
    }
}
