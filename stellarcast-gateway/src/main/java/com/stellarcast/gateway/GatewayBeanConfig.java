package com.stellarcast.gateway;

import com.stellarcast.channel.delivery.MessageDeliveryService;
import com.stellarcast.channel.registry.BotRegistry;
import com.stellarcast.channel.reply.ReplyMetadataStore;
import com.stellarcast.common.config.ConfigPaths;
import com.stellarcast.common.config.ConfigService;
import com.stellarcast.common.config.StellarcastConfig;
import com.stellarcast.gateway.command.ApodCommandHandler;
import com.stellarcast.gateway.cron.CacheJanitor;
import com.stellarcast.gateway.cron.JobScheduler;
import com.stellarcast.gateway.cron.ScheduleRecovery;
import com.stellarcast.gateway.cron.ScheduleStore;
import com.stellarcast.gateway.cron.SchedulerService;
import com.stellarcast.gateway.delivery.DeliveryPipeline;
import com.stellarcast.gateway.delivery.DeliverySettings;
import com.stellarcast.gateway.delivery.PictureCache;
import com.stellarcast.media.apod.ApodClient;
import com.stellarcast.media.apod.NasaApodClient;
import com.stellarcast.media.compose.ApodImageComposer;
import com.stellarcast.media.compose.HtmlSnapshotter;
import com.stellarcast.media.compose.ImageComposer;
import com.stellarcast.media.compose.PlaywrightSnapshotter;
import com.stellarcast.media.translate.Translator;
import com.stellarcast.media.translate.Translators;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Spring configuration for the scheduling and delivery beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${stellarcast.config.path:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String home = System.getProperty("user.home");
        if (configPath == null || configPath.isBlank()) {
            return new ConfigService(ConfigPaths.resolveConfigPath(ConfigPaths.resolveStateDir()));
        }
        return new ConfigService(ConfigPaths.resolveUserPath(configPath.trim(), home));
    }

    @Bean
    public StellarcastConfig stellarcastConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public HttpClient apodHttpClient(StellarcastConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(requestTimeout(config))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    // --- Outbound messaging ---

    @Bean
    public BotRegistry botRegistry() {
        return new BotRegistry();
    }

    @Bean
    public ReplyMetadataStore replyMetadataStore() {
        return new ReplyMetadataStore();
    }

    @Bean
    public MessageDeliveryService messageDeliveryService(BotRegistry botRegistry, ReplyMetadataStore replyMetadata,
            StellarcastConfig config) {
        return new MessageDeliveryService(botRegistry, replyMetadata, config.getDelivery().getMaxTextLength());
    }

    // --- Collaborators ---

    @Bean
    public ApodClient apodClient(HttpClient apodHttpClient, StellarcastConfig config) {
        return new NasaApodClient(apodHttpClient, config.getApod().getApiUrl(), config.getApod().getApiKey(),
                requestTimeout(config));
    }

    @Bean
    public Translator translator(HttpClient apodHttpClient, StellarcastConfig config) {
        return Translators.fromConfig(config.getTranslate(), apodHttpClient, requestTimeout(config));
    }

    @Bean(destroyMethod = "close")
    public PlaywrightSnapshotter htmlSnapshotter() {
        return new PlaywrightSnapshotter();
    }

    @Bean
    public ImageComposer imageComposer(Translator translator, HtmlSnapshotter htmlSnapshotter,
            StellarcastConfig config) {
        return new ApodImageComposer(translator, htmlSnapshotter,
                Boolean.TRUE.equals(config.getApod().getInfopuzzleDarkMode()));
    }

    // --- Scheduling and delivery ---

    @Bean
    public PictureCache pictureCache(StellarcastConfig config) {
        return new PictureCache(ConfigPaths.cacheDir(stateDir(config)));
    }

    @Bean
    public ScheduleStore scheduleStore(StellarcastConfig config) {
        return new ScheduleStore(ConfigPaths.dataDir(stateDir(config)).resolve(ConfigPaths.TASK_CONFIG_FILENAME));
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(StellarcastConfig config) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(config.getCron().getPoolSize());
        scheduler.setThreadNamePrefix("stellarcast-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public JobScheduler jobScheduler(ThreadPoolTaskScheduler taskScheduler) {
        return new JobScheduler(taskScheduler, ZoneId.systemDefault());
    }

    @Bean
    public DeliveryPipeline deliveryPipeline(MessageDeliveryService messageDeliveryService, ApodClient apodClient,
            Translator translator, ImageComposer imageComposer, PictureCache pictureCache,
            StellarcastConfig config) {
        return new DeliveryPipeline(messageDeliveryService, apodClient, translator, imageComposer, pictureCache,
                DeliverySettings.from(config));
    }

    @Bean
    public SchedulerService schedulerService(ScheduleStore scheduleStore, JobScheduler jobScheduler,
            DeliveryPipeline deliveryPipeline, StellarcastConfig config) {
        return new SchedulerService(scheduleStore, jobScheduler, deliveryPipeline::deliverScheduled,
                config.getApod().getDefaultSendTime());
    }

    @Bean
    public ScheduleRecovery scheduleRecovery(ScheduleStore scheduleStore, SchedulerService schedulerService) {
        return new ScheduleRecovery(scheduleStore, schedulerService);
    }

    @Bean
    public CacheJanitor cacheJanitor(JobScheduler jobScheduler, PictureCache pictureCache, StellarcastConfig config) {
        return new CacheJanitor(jobScheduler, pictureCache,
                CacheJanitor.resolveTime(config.getCron().getJanitorTime()));
    }

    @Bean
    public ApodCommandHandler apodCommandHandler(SchedulerService schedulerService, DeliveryPipeline deliveryPipeline,
            MessageDeliveryService messageDeliveryService, ReplyMetadataStore replyMetadataStore,
            StellarcastConfig config) {
        return new ApodCommandHandler(schedulerService, deliveryPipeline, messageDeliveryService, replyMetadataStore,
                config.isApodEnabled());
    }

    private static Duration requestTimeout(StellarcastConfig config) {
        return Duration.ofSeconds(config.getApod().getRequestTimeoutSeconds());
    }

    private static Path stateDir(StellarcastConfig config) {
        if (config.getStateDir() != null && !config.getStateDir().isBlank()) {
            return ConfigPaths.resolveUserPath(config.getStateDir().trim(), System.getProperty("user.home"));
        }
        return ConfigPaths.resolveStateDir();
    }
}
