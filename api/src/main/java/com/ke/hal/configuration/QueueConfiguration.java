package com.ke.hal.configuration;

import com.ke.hal.queue.InMemoryRunQueue;
import com.ke.hal.queue.RedisRunQueue;
import com.ke.hal.queue.RunQueue;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Run 队列配置，按 hal.assistant.queue.type 选择实现
 */
@Configuration
@Slf4j
public class QueueConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "hal.assistant.queue.type", havingValue = "redis", matchIfMissing = true)
    public RedissonClient redissonClient(AssistantProperties assistantProperties) {
        QueueProperties.RedisProperties redis = assistantProperties.getQueue().getRedis();
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(redis.getAddress())
                .setDatabase(redis.getDatabase())
                .setConnectionPoolSize(redis.getConnectionPoolSize());
        if(StringUtils.isNotBlank(redis.getPassword())) {
            server.setPassword(redis.getPassword());
        }
        log.info("Connecting run queue to redis {}", redis.getAddress());
        return Redisson.create(config);
    }

    @Bean
    @ConditionalOnProperty(name = "hal.assistant.queue.type", havingValue = "redis", matchIfMissing = true)
    public RunQueue redisRunQueue(RedissonClient redissonClient, AssistantProperties assistantProperties) {
        return new RedisRunQueue(redissonClient, assistantProperties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "hal.assistant.queue.type", havingValue = "memory")
    public RunQueue inMemoryRunQueue() {
        return new InMemoryRunQueue(Clock.systemUTC());
    }
}
