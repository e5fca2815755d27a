package com.khaounen.authguard.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.authguard.config.RequestContextFilter;
import com.khaounen.authguard.security.bruteforce.BruteForceAuthenticationListener;
import com.khaounen.authguard.security.bruteforce.BruteForceGuard;
import com.khaounen.authguard.security.bruteforce.BruteForceProperties;
import com.khaounen.authguard.security.bruteforce.InMemoryBruteForceGuard;
import com.khaounen.authguard.security.events.GuardEventDispatcher;
import com.khaounen.authguard.security.events.GuardEventListener;
import com.khaounen.authguard.security.filters.RateLimitFilter;
import com.khaounen.authguard.security.ratelimit.AccountIdentifierResolver;
import com.khaounen.authguard.security.ratelimit.InMemoryWindowCounterStore;
import com.khaounen.authguard.security.ratelimit.PolicyPresetRegistry;
import com.khaounen.authguard.security.ratelimit.RateLimitProperties;
import com.khaounen.authguard.security.ratelimit.RateLimitService;
import com.khaounen.authguard.security.ratelimit.SecurityContextAccountIdentifierResolver;
import com.khaounen.authguard.security.ratelimit.WindowCounterStore;
import com.khaounen.authguard.security.sweep.ExpirableStore;
import com.khaounen.authguard.security.sweep.ExpiredEntrySweeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({RateLimitProperties.class, BruteForceProperties.class})
public class RateGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock rateGuardClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardEventListener guardEventListener(ObjectProvider<ApplicationEventPublisher> publisherProvider) {
        return new GuardEventDispatcher(publisherProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyPresetRegistry policyPresetRegistry(RateLimitProperties properties) {
        PolicyPresetRegistry registry = PolicyPresetRegistry.fromProperties(properties);
        log.debug("rate limit presets: {}", registry.all());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public WindowCounterStore windowCounterStore(RateLimitProperties properties, Clock clock) {
        return new InMemoryWindowCounterStore(clock, properties.getMaxEntries());
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitService rateLimitService(WindowCounterStore store, GuardEventListener eventListener, Clock clock) {
        return new RateLimitService(store, eventListener, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rate-limit.brute-force", name = "enabled", matchIfMissing = true)
    public BruteForceGuard bruteForceGuard(
            BruteForceProperties properties,
            Clock clock,
            GuardEventListener eventListener
    ) {
        return new InMemoryBruteForceGuard(properties.toPolicy(), clock, eventListener);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rate-limit.sweep", name = "enabled", matchIfMissing = true)
    public ExpiredEntrySweeper expiredEntrySweeper(
            RateLimitProperties properties,
            WindowCounterStore windowCounterStore,
            ObjectProvider<BruteForceGuard> bruteForceGuardProvider
    ) {
        List<ExpirableStore> stores = new ArrayList<>();
        stores.add(windowCounterStore);
        bruteForceGuardProvider.ifAvailable(stores::add);
        return new ExpiredEntrySweeper(stores, properties.getSweep().getInterval());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletFilterConfiguration {

        @Bean(name = "rateGuardRequestContextFilter")
        @ConditionalOnMissingBean(name = "rateGuardRequestContextFilter")
        public FilterRegistrationBean<RequestContextFilter> requestContextFilter(RateLimitProperties properties) {
            FilterRegistrationBean<RequestContextFilter> registration =
                    new FilterRegistrationBean<>(new RequestContextFilter(properties.getClientIpHeaders()));
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
            return registration;
        }

        @Bean
        @ConditionalOnMissingBean
        public RateLimitFilter rateLimitFilter(
                RateLimitProperties properties,
                PolicyPresetRegistry presets,
                RateLimitService service,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<AccountIdentifierResolver> accountIdentifierResolverProvider,
                ObjectProvider<BruteForceGuard> bruteForceGuardProvider,
                BruteForceProperties bruteForceProperties
        ) {
            ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            AccountIdentifierResolver accountIdentifierResolver =
                    accountIdentifierResolverProvider.getIfAvailable(() -> AccountIdentifierResolver.NONE);
            return new RateLimitFilter(
                    properties,
                    presets,
                    service,
                    objectMapper,
                    accountIdentifierResolver,
                    bruteForceGuardProvider.getIfAvailable(),
                    bruteForceProperties
            );
        }

        @Bean
        @ConditionalOnMissingBean(name = "rateLimitFilterRegistration")
        public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(
                RateLimitFilter filter,
                RateLimitProperties properties
        ) {
            FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setOrder(properties.getFilterOrder());
            return registration;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.security.core.context.SecurityContextHolder")
    static class SpringSecurityConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
        public AccountIdentifierResolver securityContextAccountIdentifierResolver() {
            return new SecurityContextAccountIdentifierResolver();
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(
                prefix = "rate-limit.brute-force",
                name = {"enabled", "listen-to-authentication-events"},
                matchIfMissing = true
        )
        public BruteForceAuthenticationListener bruteForceAuthenticationListener(
                BruteForceGuard guard,
                BruteForceProperties properties
        ) {
            return new BruteForceAuthenticationListener(guard, properties.getIdentity());
        }
    }
}
