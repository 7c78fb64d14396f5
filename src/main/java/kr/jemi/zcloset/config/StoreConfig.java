package kr.jemi.zcloset.config;

import kr.jemi.zcloset.common.store.DocumentStore;
import kr.jemi.zcloset.common.store.InMemoryDocumentStore;
import kr.jemi.zcloset.common.store.redis.RedisDocumentStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.Set;

@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "zcloset.store.type", havingValue = "redis", matchIfMissing = true)
    static class RedisStoreConfig {

        @Bean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            return container;
        }

        @Bean
        public DocumentStore documentStore(StringRedisTemplate redisTemplate,
                                           RedisMessageListenerContainer redisMessageListenerContainer,
                                           @Value("${zcloset.store.indexed-fields}") Set<String> indexedFields) {
            return new RedisDocumentStore(redisTemplate, redisMessageListenerContainer, indexedFields);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "zcloset.store.type", havingValue = "memory")
    static class MemoryStoreConfig {

        @Bean
        public DocumentStore documentStore() {
            return new InMemoryDocumentStore();
        }
    }
}
