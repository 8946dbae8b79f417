package io.mailagenda.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mailagenda.MailAgenda;
import io.mailagenda.MailTransport;
import io.mailagenda.Renderer;
import io.mailagenda.TimeParser;
import io.mailagenda.core.JobStore;
import io.mailagenda.core.RateLimiter;
import io.mailagenda.internal.DefaultMailAgenda;
import io.mailagenda.internal.PlaceholderRenderer;
import io.mailagenda.internal.RetryPolicy;
import io.mailagenda.internal.SlidingWindowRateLimiter;
import io.mailagenda.internal.mail.JavaMailTransport;
import io.mailagenda.internal.mongo.MailJobIndexes;
import io.mailagenda.internal.mongo.MongoJobStore;
import io.mailagenda.utils.DefaultTimeParser;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for MailAgenda components.
 *
 * <p>The engine needs a {@link MongoTemplate} and a {@link MailTransport}. The transport defaults to
 * {@link JavaMailTransport} when a {@link JavaMailSender} is configured ({@code spring.mail.*}).
 */
@AutoConfiguration(after = {MongoDataAutoConfiguration.class, MailSenderAutoConfiguration.class})
@ConditionalOnClass({MailAgenda.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "mail-agenda", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MailAgendaConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "mail-agenda")
    public MailAgendaProperties mailAgendaProperties() {
        return new MailAgendaProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobStore mailJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MailJobIndexes mailJobIndexes(MongoTemplate mongoTemplate) {
        return new MailJobIndexes(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public Renderer mailAgendaRenderer() {
        return new PlaceholderRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeParser mailAgendaTimeParser(MailAgendaProperties props) {
        return new DefaultTimeParser(props.getTimezone());
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimiter mailAgendaRateLimiter(MailAgendaProperties props, ObjectProvider<Clock> clock) {
        return SlidingWindowRateLimiter.from(props, clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy mailAgendaRetryPolicy(MailAgendaProperties props) {
        return RetryPolicy.from(props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JavaMailSender.class)
    public MailTransport javaMailTransport(JavaMailSender mailSender, MailAgendaProperties props) {
        return new JavaMailTransport(mailSender, props.getFrom());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MailTransport.class)
    public MailAgenda mailAgenda(MailAgendaProperties props,
                                 JobStore jobStore,
                                 MailTransport transport,
                                 Renderer renderer,
                                 TimeParser timeParser,
                                 RateLimiter rateLimiter,
                                 RetryPolicy retryPolicy,
                                 ObjectProvider<ObjectMapper> objectMapper,
                                 ObjectProvider<Clock> clock) {
        return new DefaultMailAgenda(
                props,
                jobStore,
                transport,
                renderer,
                timeParser,
                rateLimiter,
                retryPolicy,
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MailAgenda.class)
    public MailAgendaLifecycle mailAgendaLifecycle(MailAgenda mailAgenda) {
        return new MailAgendaLifecycle(mailAgenda);
    }

    @Bean
    @ConditionalOnProperty(prefix = "mail-agenda", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton mailJobIndexesInitializer(MailJobIndexes indexes) {
        return indexes::ensureIndexes;
    }
}
