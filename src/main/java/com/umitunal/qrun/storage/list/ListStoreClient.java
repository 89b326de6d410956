package com.umitunal.qrun.storage.list;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The list, sorted-set and hash primitives the list store is built on, named after their
 * Redis commands.
 *
 * <p>Implementations throw {@link com.umitunal.qrun.core.QueueConnectionException} when the
 * server cannot be reached. Keys are used as given; prefixing is up to the caller.</p>
 */
public interface ListStoreClient extends AutoCloseable {

    /**
     * Whether the server answers.
     */
    boolean ping();

    // List operations

    long rPush(String key, String value);

    /**
     * Remove and return the head of a list, atomically.
     *
     * @return the head element, or null if the list is empty or absent
     */
    String lPop(String key);

    long lLen(String key);

    List<String> lRange(String key, long start, long stop);

    long lRem(String key, long count, String value);

    // Sorted set operations

    long zAdd(String key, double score, String member);

    long zRem(String key, String member);

    /**
     * Members with {@code min <= score <= max}, lowest score first.
     */
    List<String> zRangeByScore(String key, double min, double max);

    List<String> zRange(String key, long start, long stop);

    long zCard(String key);

    // Hash operations

    long hSet(String key, String field, String value);

    String hGet(String key, String field);

    long hDel(String key, String field);

    long hLen(String key);

    Map<String, String> hGetAll(String key);

    // Key operations

    long del(String... keys);

    /**
     * Keys matching a glob pattern. Only {@code *} needs to be supported.
     */
    Set<String> keys(String pattern);

    /**
     * Short identifier of the client implementation, for diagnostics.
     */
    String getClientType();

    @Override
    void close();
}
