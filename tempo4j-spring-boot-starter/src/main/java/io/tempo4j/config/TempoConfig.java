package io.tempo4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tempo4j.JobHandler;
import io.tempo4j.Scheduler;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.ScheduleRegistry;
import io.tempo4j.handlers.AgentTaskJobHandler;
import io.tempo4j.handlers.AgentTaskRunner;
import io.tempo4j.handlers.ReminderJobHandler;
import io.tempo4j.interaction.ChatTransport;
import io.tempo4j.interaction.InteractionBridge;
import io.tempo4j.interaction.TaskSupervisor;
import io.tempo4j.internal.DefaultScheduler;
import io.tempo4j.internal.mongo.MongoJobStore;
import io.tempo4j.internal.mongo.MongoScheduleRegistry;
import io.tempo4j.service.ScheduleService;
import io.tempo4j.utils.TriggerEvaluator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for tempo4j components.
 */
@AutoConfiguration
@ConditionalOnClass({Scheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "tempo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TempoConfig {

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleRegistry.class)
    protected MongoScheduleRegistry mongoScheduleRegistry(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoScheduleRegistry(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected TempoMongoIndexConfig tempoMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new TempoMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerEvaluator triggerEvaluator(SchedulerProperties props) {
        return new TriggerEvaluator(props.getSearchHorizon());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock tempoClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props, JobStore jobStore, JobHandlerRegistry registry,
                               TriggerEvaluator evaluator, ObjectMapper om, Clock clock) {
        return new DefaultScheduler(props, jobStore, registry, evaluator, om, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(Scheduler scheduler, ObjectProvider<TaskSupervisor> supervisor) {
        return new SchedulerLifecycle(scheduler, supervisor.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleService scheduleService(Scheduler scheduler, ScheduleRegistry registry, Clock clock) {
        return new ScheduleService(scheduler, registry, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tempo", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton tempoIndexesInitializer(TempoMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    /**
     * Chat-facing beans, registered once the application provides a {@link ChatTransport}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(ChatTransport.class)
    static class InteractionConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public InteractionBridge interactionBridge(ChatTransport transport, SchedulerProperties props) {
            return new InteractionBridge(transport, props.getAskTimeout());
        }

        @Bean
        @ConditionalOnMissingBean
        public TaskSupervisor taskSupervisor(InteractionBridge bridge, Clock clock, SchedulerProperties props) {
            return new TaskSupervisor(bridge, clock, props.getShutdownTimeout());
        }

        @Bean
        @ConditionalOnMissingBean
        public ReminderJobHandler reminderJobHandler(ChatTransport transport) {
            return new ReminderJobHandler(transport);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(AgentTaskRunner.class)
        public AgentTaskJobHandler agentTaskJobHandler(AgentTaskRunner runner, TaskSupervisor supervisor,
                                                       InteractionBridge bridge, ChatTransport transport) {
            return new AgentTaskJobHandler(runner, supervisor, bridge, transport);
        }
    }
}
