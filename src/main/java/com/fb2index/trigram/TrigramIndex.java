package com.fb2index.trigram;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class TrigramIndex {
    static final double RELEVANCE_THRESHOLD = 0.75;

    private static final long[] NO_IDS = new long[0];
    private static final Comparator<Map.Entry<Long, Integer>> BY_RELEVANCE = (left, right) -> {
        int byCount = Integer.compare(right.getValue(), left.getValue());
        return byCount != 0 ? byCount : Long.compare(left.getKey(), right.getKey());
    };

    private final Map<Integer, PostingList> postings = new HashMap<>();
    private final PostingList allIds = new PostingList();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void add(long id, String text) {
        addTrigrams(id, Trigrams.extract(text));
    }

    /**
     * Appends {@code id} to the posting list of every trigram and to the universal list.
     *
     * @throws IndexInvariantViolationException if {@code id} is lower than an ID already indexed
     */
    public void addTrigrams(long id, int[] trigrams) {
        if (trigrams == null || trigrams.length == 0) {
            return;
        }

        lock.writeLock().lock();
        try {
            if (!allIds.isEmpty() && allIds.last() > id) {
                throw new IndexInvariantViolationException(id, allIds.last());
            }
            allIds.appendIfNew(id);
            for (int trigram : trigrams) {
                postings.computeIfAbsent(trigram, unused -> new PostingList()).appendIfNew(id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long[] query(String text) {
        return queryTrigrams(Trigrams.extract(text));
    }

    public long[] queryTrigrams(int[] trigrams) {
        if (trigrams == null || trigrams.length == 0) {
            return NO_IDS;
        }
        int[] distinct = distinct(trigrams);

        Map<Long, Integer> relevance;
        lock.readLock().lock();
        try {
            int expected = 0;
            for (int trigram : distinct) {
                PostingList list = postings.get(trigram);
                if (list != null) {
                    expected += list.size();
                }
            }
            expected = Math.min(expected, allIds.size());

            relevance = new HashMap<>(Math.max(16, expected * 4 / 3 + 1));
            for (int trigram : distinct) {
                PostingList list = postings.get(trigram);
                if (list == null) {
                    continue;
                }
                for (int i = 0; i < list.size(); i++) {
                    relevance.merge(list.get(i), 1, Integer::sum);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        int threshold = (int) (distinct.length * RELEVANCE_THRESHOLD);
        List<Map.Entry<Long, Integer>> matches = new ArrayList<>(relevance.size());
        for (Map.Entry<Long, Integer> entry : relevance.entrySet()) {
            if (entry.getValue() >= threshold) {
                matches.add(entry);
            }
        }
        matches.sort(BY_RELEVANCE);

        long[] ids = new long[matches.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = matches.get(i).getKey();
        }
        return ids;
    }

    long[] postingsFor(int trigram) {
        lock.readLock().lock();
        try {
            PostingList list = postings.get(trigram);
            return list == null ? NO_IDS : list.toArray();
        } finally {
            lock.readLock().unlock();
        }
    }

    long[] allIds() {
        lock.readLock().lock();
        try {
            return allIds.toArray();
        } finally {
            lock.readLock().unlock();
        }
    }

    int trigramCount() {
        lock.readLock().lock();
        try {
            return postings.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static int[] distinct(int[] trigrams) {
        int[] unique = new int[trigrams.length];
        int count = 0;
        outer:
        for (int trigram : trigrams) {
            for (int i = 0; i < count; i++) {
                if (unique[i] == trigram) {
                    continue outer;
                }
            }
            unique[count++] = trigram;
        }
        return count == trigrams.length ? trigrams : Arrays.copyOf(unique, count);
    }
}
