package kr.jemi.zcassa.config;

import io.hypersistence.tsid.TSID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 인스턴스마다 Redis 카운터로 노드 번호를 받아 TSID 충돌을 피한다.
 */
@Configuration
public class TsidConfig {

    private static final Logger log = LoggerFactory.getLogger(TsidConfig.class);

    @Bean
    public TSID.Factory tsidFactory(StringRedisTemplate redisTemplate,
                                    @Value("${zcassa.tsid.node-bits}") int nodeBits,
                                    @Value("${zcassa.tsid.node-counter-key:zcassa:tsid:node:counter}") String counterKey) {
        Long counter = redisTemplate.opsForValue().increment(counterKey);
        if (counter == null) {
            throw new IllegalStateException("TSID 노드 번호를 받지 못했습니다: key=" + counterKey);
        }
        int nodeId = (int) (counter % (1L << nodeBits));
        log.info("TSID 노드 할당: nodeId={}, nodeBits={}", nodeId, nodeBits);

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId)
                .build();
    }
}
