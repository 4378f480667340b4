package kr.jemi.zcassa.seal.infrastructure.out.redis;

import kr.jemi.zcassa.seal.application.port.out.DeviceLockPort;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Component
public class DeviceLockRedisAdapter implements DeviceLockPort {

    private static final String KEY = "seal:device:lock";
    private static final long RETRY_INTERVAL_MILLIS = 50;
    private static final DefaultRedisScript<Boolean> RELEASE_IF_OWNER_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            else
                return 0
            end
            """, Boolean.class);

    private final StringRedisTemplate redisTemplate;

    public DeviceLockRedisAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> acquire(long waitMillis, long leaseMillis) {
        String owner = UUID.randomUUID().toString();
        long deadline = System.currentTimeMillis() + waitMillis;
        while (true) {
            Boolean acquired = redisTemplate.opsForValue()
                    .setIfAbsent(KEY, owner, leaseMillis, TimeUnit.MILLISECONDS);
            if (Boolean.TRUE.equals(acquired)) {
                return Optional.of(owner);
            }
            if (System.currentTimeMillis() >= deadline) {
                return Optional.empty();
            }
            try {
                Thread.sleep(RETRY_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public void release(String owner) {
        redisTemplate.execute(RELEASE_IF_OWNER_SCRIPT, List.of(KEY), owner);
    }
}
