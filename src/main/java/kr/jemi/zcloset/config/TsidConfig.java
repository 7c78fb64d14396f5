package kr.jemi.zcloset.config;

import io.hypersistence.tsid.TSID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class TsidConfig {

    @Bean
    @ConditionalOnProperty(name = "zcloset.store.type", havingValue = "redis", matchIfMissing = true)
    public TSID.Factory tsidFactory(StringRedisTemplate redisTemplate,
                                    @Value("${zcloset.tsid.node-bits}") int nodeBits) {
        int maxNodeCount = 1 << nodeBits;
        Long counter = redisTemplate.opsForValue().increment("zcloset:tsid:node:counter");
        int nodeId = (int) (counter % maxNodeCount);

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId)
                .build();
    }

    // 단일 노드로 동작하는 메모리 저장소에서는 노드 번호를 고정한다
    @Bean
    @ConditionalOnProperty(name = "zcloset.store.type", havingValue = "memory")
    public TSID.Factory localTsidFactory(@Value("${zcloset.tsid.node-bits}") int nodeBits) {
        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(0)
                .build();
    }
}
