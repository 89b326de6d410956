package com.umitunal.qrun.storage.list;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * In-process {@link ListStoreClient}, for tests and single-JVM deployments.
 *
 * Mirrors Redis semantics where the list store relies on them: empty structures disappear,
 * negative range indexes count from the end, sorted sets order by score then member.
 */
public class InMemoryListStoreClient implements ListStoreClient {
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public synchronized long rPush(String key, String value) {
        Deque<String> list = lists.computeIfAbsent(key, k -> new ArrayDeque<>());
        list.addLast(value);
        return list.size();
    }

    @Override
    public synchronized String lPop(String key) {
        Deque<String> list = lists.get(key);
        if (list == null) {
            return null;
        }
        String head = list.pollFirst();
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return head;
    }

    @Override
    public synchronized long lLen(String key) {
        Deque<String> list = lists.get(key);
        return list == null ? 0 : list.size();
    }

    @Override
    public synchronized List<String> lRange(String key, long start, long stop) {
        Deque<String> list = lists.get(key);
        return list == null ? new ArrayList<>() : slice(new ArrayList<>(list), start, stop);
    }

    @Override
    public synchronized long lRem(String key, long count, String value) {
        Deque<String> list = lists.get(key);
        if (list == null) {
            return 0;
        }
        long limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
        long removed = 0;
        var it = count < 0 ? list.descendingIterator() : list.iterator();
        while (it.hasNext() && removed < limit) {
            if (it.next().equals(value)) {
                it.remove();
                removed++;
            }
        }
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return removed;
    }

    @Override
    public synchronized long zAdd(String key, double score, String member) {
        Double previous = sortedSets.computeIfAbsent(key, k -> new HashMap<>()).put(member, score);
        return previous == null ? 1 : 0;
    }

    @Override
    public synchronized long zRem(String key, String member) {
        Map<String, Double> set = sortedSets.get(key);
        if (set == null || set.remove(member) == null) {
            return 0;
        }
        if (set.isEmpty()) {
            sortedSets.remove(key);
        }
        return 1;
    }

    @Override
    public synchronized List<String> zRangeByScore(String key, double min, double max) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ordered(key)) {
            if (entry.getValue() >= min && entry.getValue() <= max) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    @Override
    public synchronized List<String> zRange(String key, long start, long stop) {
        List<String> members = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ordered(key)) {
            members.add(entry.getKey());
        }
        return slice(members, start, stop);
    }

    @Override
    public synchronized long zCard(String key) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public synchronized long hSet(String key, String field, String value) {
        String previous = hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value);
        return previous == null ? 1 : 0;
    }

    @Override
    public synchronized String hGet(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? null : hash.get(field);
    }

    @Override
    public synchronized long hDel(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        if (hash == null || hash.remove(field) == null) {
            return 0;
        }
        if (hash.isEmpty()) {
            hashes.remove(key);
        }
        return 1;
    }

    @Override
    public synchronized long hLen(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? 0 : hash.size();
    }

    @Override
    public synchronized Map<String, String> hGetAll(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? new LinkedHashMap<>() : new LinkedHashMap<>(hash);
    }

    @Override
    public synchronized long del(String... keys) {
        long removed = 0;
        for (String key : keys) {
            if (lists.remove(key) != null) removed++;
            if (sortedSets.remove(key) != null) removed++;
            if (hashes.remove(key) != null) removed++;
        }
        return removed;
    }

    @Override
    public synchronized Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        Set<String> result = new LinkedHashSet<>();
        for (Set<String> keySet : List.of(lists.keySet(), sortedSets.keySet(), hashes.keySet())) {
            for (String key : keySet) {
                if (regex.matcher(key).matches()) {
                    result.add(key);
                }
            }
        }
        return result;
    }

    @Override
    public String getClientType() {
        return "memory";
    }

    @Override
    public synchronized void close() {
        lists.clear();
        sortedSets.clear();
        hashes.clear();
    }

    private List<Map.Entry<String, Double>> ordered(String key) {
        Map<String, Double> set = sortedSets.get(key);
        if (set == null) {
            return new ArrayList<>();
        }
        List<Map.Entry<String, Double>> entries = new ArrayList<>(set.entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue()
                .thenComparing(Map.Entry.comparingByKey(Comparator.naturalOrder())));
        return entries;
    }

    private static List<String> slice(List<String> values, long start, long stop) {
        int size = values.size();
        long from = start < 0 ? Math.max(size + start, 0) : start;
        long to = stop < 0 ? size + stop : Math.min(stop, size - 1);
        if (from > to || from >= size) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values.subList((int) from, (int) to + 1));
    }

    private static Pattern globToRegex(String glob) {
        String[] parts = glob.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
