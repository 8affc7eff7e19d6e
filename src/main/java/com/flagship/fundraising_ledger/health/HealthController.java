package com.flagship.fundraising_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe outside Actuator. The database decides the
 * status; the Redis idempotency cache is optional and only reported.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;

    public HealthController(DataSource dataSource, ObjectProvider<StringRedisTemplate> redisTemplate) {
        this.dataSource = dataSource;
        this.redisTemplate = redisTemplate;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("idempotencyCache", checkRedis());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private String checkRedis() {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null || template.getConnectionFactory() == null) {
            return "NOT_CONFIGURED";
        }
        try (RedisConnection connection = template.getConnectionFactory().getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping()) ? "UP" : "DEGRADED";
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return "DEGRADED";
        }
    }
}
