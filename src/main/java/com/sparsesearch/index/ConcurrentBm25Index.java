package com.sparsesearch.index;

import com.sparsesearch.query.SearchHit;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 读写锁包装的 {@link Bm25Index}：search/stats 等只读操作共享读锁，addDocument/build 独占写锁。
 */
public class ConcurrentBm25Index {
    private final Bm25Index delegate;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ConcurrentBm25Index(Bm25Index delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate不能为null");
        }
        this.delegate = delegate;
    }

    public void addDocument(int docId, String text) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            delegate.addDocument(docId, text);
        } finally {
            writeLock.unlock();
        }
    }

    public void build() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            delegate.build();
        } finally {
            writeLock.unlock();
        }
    }

    public List<SearchHit> search(String query, int k) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.search(query, k);
        } finally {
            readLock.unlock();
        }
    }

    public IndexStats stats() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.stats();
        } finally {
            readLock.unlock();
        }
    }

    public Optional<int[]> postings(String term) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.postings(term);
        } finally {
            readLock.unlock();
        }
    }

    public boolean isPostingsFresh() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.isPostingsFresh();
        } finally {
            readLock.unlock();
        }
    }

    public int documentFrequency(String term) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.documentFrequency(term);
        } finally {
            readLock.unlock();
        }
    }

    public List<DocumentMeta> documents() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return delegate.documents();
        } finally {
            readLock.unlock();
        }
    }
}
