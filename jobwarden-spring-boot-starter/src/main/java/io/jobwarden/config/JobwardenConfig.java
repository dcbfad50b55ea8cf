package io.jobwarden.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobwarden.Jobwarden;
import io.jobwarden.RecordChangeListener;
import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionOperatorRegistry;
import io.jobwarden.engine.ActionApplier;
import io.jobwarden.engine.ConditionEvaluator;
import io.jobwarden.engine.JobRunner;
import io.jobwarden.engine.TimeWindowMatcher;
import io.jobwarden.engine.operator.BuiltinOperators;
import io.jobwarden.internal.mongo.MongoAutomationJobStore;
import io.jobwarden.internal.mongo.MongoBackgroundJobQueue;
import io.jobwarden.internal.mongo.MongoChannelSource;
import io.jobwarden.internal.mongo.MongoCreatedRecordCounter;
import io.jobwarden.internal.mongo.MongoImportJobSource;
import io.jobwarden.internal.mongo.MongoJobwarden;
import io.jobwarden.internal.mongo.MongoMonitoringTokenStore;
import io.jobwarden.internal.mongo.MongoRecordStore;
import io.jobwarden.internal.mongo.MongoSchedulerTaskSource;
import io.jobwarden.internal.mongo.MongoSystemStatusSource;
import io.jobwarden.monitor.AmountChecker;
import io.jobwarden.monitor.BackgroundJobQueue;
import io.jobwarden.monitor.ChannelSource;
import io.jobwarden.monitor.FileSystemMailSpool;
import io.jobwarden.monitor.HealthAggregator;
import io.jobwarden.monitor.HealthCheckOptions;
import io.jobwarden.monitor.ImportJobSource;
import io.jobwarden.monitor.MailSpool;
import io.jobwarden.monitor.MonitoringTokenStore;
import io.jobwarden.monitor.SchedulerTaskSource;
import io.jobwarden.monitor.SystemStatusSource;
import io.jobwarden.web.MonitoringAuthenticator;
import io.jobwarden.web.MonitoringController;
import io.jobwarden.web.MonitoringExceptionHandler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Jobwarden components.
 */
@AutoConfiguration
@ConditionalOnClass({Jobwarden.class, MongoTemplate.class})
@EnableConfigurationProperties(JobwardenProperties.class)
@ConditionalOnProperty(prefix = "jobwarden", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobwardenConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoAutomationJobStore mongoAutomationJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoAutomationJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoRecordStore mongoRecordStore(MongoTemplate mongoTemplate, JobwardenProperties props) {
        return new MongoRecordStore(mongoTemplate, props.getRunner().getEntityCollections());
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobwardenMongoIndexConfig jobwardenMongoIndexConfig(MongoTemplate mongoTemplate, JobwardenProperties props) {
        return new JobwardenMongoIndexConfig(mongoTemplate, props.getRunner().getEntityCollections().values());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionOperatorRegistry conditionOperatorRegistry(ObjectProvider<List<ConditionOperator>> operatorsProvider) {
        List<ConditionOperator> extra = operatorsProvider.getIfAvailable(List::of);
        return BuiltinOperators.registry(extra);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeWindowMatcher timeWindowMatcher(JobwardenProperties props) {
        return new TimeWindowMatcher(props.getRunner().resolveZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator(ConditionOperatorRegistry registry) {
        return new ConditionEvaluator(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionApplier actionApplier(MongoRecordStore recordStore,
                                       ObjectProvider<List<RecordChangeListener>> listenersProvider) {
        return new ActionApplier(recordStore, listenersProvider.getIfAvailable(List::of));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunner jobRunner(MongoAutomationJobStore jobStore,
                               MongoRecordStore recordStore,
                               TimeWindowMatcher windowMatcher,
                               ConditionEvaluator conditionEvaluator,
                               ActionApplier actionApplier,
                               JobwardenProperties props) {
        return new JobRunner(jobStore, recordStore, windowMatcher, conditionEvaluator, actionApplier,
                props.toRunnerOptions());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelSource channelSource(MongoTemplate mongoTemplate) {
        return new MongoChannelSource(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerTaskSource schedulerTaskSource(MongoTemplate mongoTemplate) {
        return new MongoSchedulerTaskSource(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackgroundJobQueue backgroundJobQueue(MongoTemplate mongoTemplate) {
        return new MongoBackgroundJobQueue(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ImportJobSource importJobSource(MongoTemplate mongoTemplate) {
        return new MongoImportJobSource(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MailSpool mailSpool(JobwardenProperties props) {
        return new FileSystemMailSpool(props.getMonitoring().getUnprocessableMailDir());
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemStatusSource systemStatusSource(MongoTemplate mongoTemplate, JobwardenProperties props) {
        return new MongoSystemStatusSource(mongoTemplate, props.getMonitoring().getStatusCollections());
    }

    @Bean
    @ConditionalOnMissingBean
    public MonitoringTokenStore monitoringTokenStore(MongoTemplate mongoTemplate) {
        return new MongoMonitoringTokenStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthCheckOptions healthCheckOptions(JobwardenProperties props) {
        return props.toHealthCheckOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthAggregator healthAggregator(ChannelSource channels,
                                             SchedulerTaskSource schedulerTasks,
                                             BackgroundJobQueue jobQueue,
                                             MailSpool mailSpool,
                                             ImportJobSource importJobs,
                                             HealthCheckOptions options) {
        return new HealthAggregator(channels, schedulerTasks, jobQueue, mailSpool, importJobs, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public AmountChecker amountChecker(MongoTemplate mongoTemplate, JobwardenProperties props) {
        return new AmountChecker(new MongoCreatedRecordCounter(mongoTemplate,
                props.getMonitoring().getAmountCheckCollection()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Jobwarden jobwarden(JobwardenProperties props, JobRunner runner, HealthAggregator healthAggregator) {
        return new MongoJobwarden(props, runner, healthAggregator);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobwardenLifecycle jobwardenLifecycle(Jobwarden jobwarden) {
        return new JobwardenLifecycle(jobwarden);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobwarden", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobwardenIndexesInitializer(JobwardenMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    /**
     * Monitoring endpoints, only in servlet web applications.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class MonitoringWebConfig {

        @Bean
        @ConditionalOnMissingBean
        public MonitoringAuthenticator monitoringAuthenticator() {
            return MonitoringAuthenticator.none();
        }

        @Bean
        @ConditionalOnMissingBean
        public MonitoringController monitoringController(Jobwarden jobwarden,
                                                         SystemStatusSource statusSource,
                                                         MonitoringTokenStore tokenStore,
                                                         BackgroundJobQueue jobQueue,
                                                         AmountChecker amountChecker,
                                                         MonitoringAuthenticator authenticator,
                                                         HealthCheckOptions healthCheckOptions) {
            return new MonitoringController(jobwarden, statusSource, tokenStore, jobQueue, amountChecker,
                    authenticator, healthCheckOptions.retryCeiling(), Clock.systemUTC());
        }

        @Bean
        @ConditionalOnMissingBean
        public MonitoringExceptionHandler monitoringExceptionHandler() {
            return new MonitoringExceptionHandler();
        }
    }
}
