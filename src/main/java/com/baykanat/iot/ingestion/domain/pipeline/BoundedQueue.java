package com.baykanat.iot.ingestion.domain.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;

/**
 * Sabit kapasiteli FIFO kuyruk; pipeline'daki tek backpressure noktası.
 *
 * <p>Yer, eklemeden önce {@link #tryReserve()} ile ayrılır ve {@link #putReserved} ile doldurulur.
 * Böylece çağıran taraf kaydın kuyruğa gireceğini eklemeden önce bilir. Serbest izin sayısı hiçbir
 * zaman boş slot sayısını aşmaz; izinler sadece {@link #drainUpTo} ile geri verilir.
 *
 * <p>Hiçbir işlem beklemez. Çok sayıda producer aynı anda ekleyebilir, drain eden tek bir collector
 * vardır.
 */
public class BoundedQueue<T> {

    private final BlockingQueue<T> queue;
    private final Semaphore permits;
    private final int capacity;

    public BoundedQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("queue capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.permits = new Semaphore(capacity);
    }

    /** Bir slot ayırır; kuyruk doluysa false (backpressure). */
    public boolean tryReserve() {
        return permits.tryAcquire();
    }

    /** Önceden {@link #tryReserve()} ile ayrılmış slota ekler. */
    public void putReserved(T item) {
        if (!queue.offer(Objects.requireNonNull(item, "item"))) {
            throw new IllegalStateException("no reserved slot for item");
        }
    }

    /** Yer varsa ekler; kuyruk doluysa false. */
    public boolean offer(T item) {
        Objects.requireNonNull(item, "item");
        if (!tryReserve()) {
            return false;
        }
        putReserved(item);
        return true;
    }

    /** En eski en fazla {@code max} elemanı sırasıyla çıkarır; kuyruk boşsa boş liste. */
    public List<T> drainUpTo(int max) {
        if (max <= 0) {
            return List.of();
        }
        List<T> drained = new ArrayList<>(Math.min(max, queue.size()));
        queue.drainTo(drained, max);
        if (!drained.isEmpty()) {
            permits.release(drained.size());
        }
        return drained;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
