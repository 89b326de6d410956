package com.umitunal.qrun.storage.list;

import com.umitunal.qrun.config.RedisConfig;
import com.umitunal.qrun.core.QueueConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link ListStoreClient} backed by a pooled Jedis connection to Redis.
 */
public class JedisListStoreClient implements ListStoreClient {
    private static final Logger log = LoggerFactory.getLogger(JedisListStoreClient.class);

    private final JedisPooled jedis;
    private final RedisConfig config;

    public JedisListStoreClient(RedisConfig config) {
        this.config = config;

        DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
                .database(config.getDatabase())
                .connectionTimeoutMillis(config.getConnectTimeoutMillis())
                .socketTimeoutMillis(config.getReadTimeoutMillis())
                .ssl(config.isSsl());
        if (config.getUser() != null) {
            clientConfig.user(config.getUser());
        }
        if (config.getPassword() != null) {
            clientConfig.password(config.getPassword());
        }
        JedisClientConfig built = clientConfig.build();

        this.jedis = new JedisPooled(new HostAndPort(config.getHost(), config.getPort()), built);
        log.info("Created Redis list store client for {}", config);
    }

    @Override
    public boolean ping() {
        try {
            jedis.exists(config.getKeyPrefix() + "ping");
            return true;
        } catch (JedisException e) {
            log.debug("Redis at {}:{} not reachable: {}", config.getHost(), config.getPort(), e.getMessage());
            return false;
        }
    }

    @Override
    public long rPush(String key, String value) {
        return execute("RPUSH", () -> jedis.rpush(key, value));
    }

    @Override
    public String lPop(String key) {
        return execute("LPOP", () -> jedis.lpop(key));
    }

    @Override
    public long lLen(String key) {
        return execute("LLEN", () -> jedis.llen(key));
    }

    @Override
    public List<String> lRange(String key, long start, long stop) {
        return execute("LRANGE", () -> jedis.lrange(key, start, stop));
    }

    @Override
    public long lRem(String key, long count, String value) {
        return execute("LREM", () -> jedis.lrem(key, count, value));
    }

    @Override
    public long zAdd(String key, double score, String member) {
        return execute("ZADD", () -> jedis.zadd(key, score, member));
    }

    @Override
    public long zRem(String key, String member) {
        return execute("ZREM", () -> jedis.zrem(key, member));
    }

    @Override
    public List<String> zRangeByScore(String key, double min, double max) {
        return execute("ZRANGEBYSCORE", () -> jedis.zrangeByScore(key, min, max));
    }

    @Override
    public List<String> zRange(String key, long start, long stop) {
        return execute("ZRANGE", () -> jedis.zrange(key, start, stop));
    }

    @Override
    public long zCard(String key) {
        return execute("ZCARD", () -> jedis.zcard(key));
    }

    @Override
    public long hSet(String key, String field, String value) {
        return execute("HSET", () -> jedis.hset(key, field, value));
    }

    @Override
    public String hGet(String key, String field) {
        return execute("HGET", () -> jedis.hget(key, field));
    }

    @Override
    public long hDel(String key, String field) {
        return execute("HDEL", () -> jedis.hdel(key, field));
    }

    @Override
    public long hLen(String key) {
        return execute("HLEN", () -> jedis.hlen(key));
    }

    @Override
    public Map<String, String> hGetAll(String key) {
        return execute("HGETALL", () -> jedis.hgetAll(key));
    }

    @Override
    public long del(String... keys) {
        return execute("DEL", () -> jedis.del(keys));
    }

    @Override
    public Set<String> keys(String pattern) {
        return execute("KEYS", () -> jedis.keys(pattern));
    }

    @Override
    public String getClientType() {
        return "jedis";
    }

    @Override
    public void close() {
        jedis.close();
    }

    private <T> T execute(String command, Supplier<T> call) {
        try {
            return call.get();
        } catch (JedisException e) {
            throw new QueueConnectionException("Redis " + command + " failed against "
                    + config.getHost() + ":" + config.getPort(), e);
        }
    }
}
