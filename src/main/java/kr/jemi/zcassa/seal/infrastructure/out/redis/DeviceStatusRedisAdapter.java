package kr.jemi.zcassa.seal.infrastructure.out.redis;

import kr.jemi.zcassa.seal.application.port.out.DeviceStatusPort;
import kr.jemi.zcassa.seal.domain.DeviceStatus;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Component
public class DeviceStatusRedisAdapter implements DeviceStatusPort {

    private static final String KEY = "seal:device:status";

    private final StringRedisTemplate redisTemplate;

    public DeviceStatusRedisAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void save(DeviceStatus status, long ttlSeconds) {
        Map<String, String> fields = new HashMap<>();
        fields.put("connected", String.valueOf(status.connected()));
        fields.put("cardInserted", String.valueOf(status.cardInserted()));
        fields.put("cardReady", String.valueOf(status.cardReady()));
        fields.put("cardError", status.cardError() != null ? status.cardError() : "");
        fields.put("serialNumber", status.serialNumber() != null ? status.serialNumber() : "");
        fields.put("reportedAt", status.reportedAt() != null
                ? status.reportedAt().toString() : LocalDateTime.now().toString());
        // 조회 쪽에서 TTL 없는 키나 비어 있는 해시를 보지 않도록 MULTI 로 묶는다
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public List<Object> execute(RedisOperations operations) throws DataAccessException {
                operations.multi();
                operations.delete(KEY);
                operations.opsForHash().putAll(KEY, fields);
                operations.expire(KEY, ttlSeconds, TimeUnit.SECONDS);
                return operations.exec();
            }
        });
    }

    @Override
    public Optional<DeviceStatus> find() {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(KEY);
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DeviceStatus(
                Boolean.parseBoolean((String) fields.get("connected")),
                Boolean.parseBoolean((String) fields.get("cardInserted")),
                Boolean.parseBoolean((String) fields.get("cardReady")),
                emptyToNull((String) fields.get("cardError")),
                emptyToNull((String) fields.get("serialNumber")),
                LocalDateTime.parse((String) fields.get("reportedAt"))));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
