package com.bookcraft.generation.ratelimit;

import com.bookcraft.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按模型类别的滚动窗口限流器（请求数 + token 数双预算）
 *
 * 每个模型类别一条等待队列，按优先级出队、同优先级先到先得。
 * 只放行队首请求：队首预算不足时后面的小请求也必须等待，大请求不会被饿死。
 * 单个请求超过整个窗口预算时，在窗口清空后单独放行。
 */
@Component
public class TokenBudgetRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(TokenBudgetRateLimiter.class);

    /** 估算时额外预留给消息格式的 token */
    static final int REQUEST_OVERHEAD_TOKENS = 100;

    private final RateLimitProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, ModelBucket> buckets = new ConcurrentHashMap<>();
    private final AtomicLong permitSequence = new AtomicLong();
    private final AtomicLong waiterSequence = new AtomicLong();

    @Autowired
    public TokenBudgetRateLimiter(RateLimitProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public TokenBudgetRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 申请许可，阻塞直到本请求位于队首且窗口内预算足够
     *
     * @throws InterruptedException 等待期间线程被中断
     * @throws CancellationException 等待期间队列被 clearQueue 清空
     */
    public RateLimitPermit requestPermission(String modelClass, long estimatedTokens, RequestPriority priority)
            throws InterruptedException {
        RequestPriority effectivePriority = priority != null ? priority : RequestPriority.NORMAL;
        long tokens = Math.max(0, estimatedTokens);
        lock.lock();
        try {
            ModelBucket bucket = bucketFor(modelClass);
            Waiter waiter = new Waiter(effectivePriority, waiterSequence.incrementAndGet());
            bucket.waiting.add(waiter);
            boolean logged = false;
            try {
                while (true) {
                    if (waiter.cancelled) {
                        throw new CancellationException("限流队列已清空: " + modelClass);
                    }
                    Instant now = clock.instant();
                    bucket.prune(now, window());
                    if (bucket.waiting.peek() == waiter && bucket.canAdmit(tokens)) {
                        bucket.waiting.poll();
                        RateLimitPermit permit = new RateLimitPermit(permitSequence.incrementAndGet(), modelClass,
                                tokens, effectivePriority, now);
                        bucket.reservations.addLast(new Reservation(permit.getId(), now, tokens));
                        bucket.totalRequests++;
                        changed.signalAll();
                        return permit;
                    }
                    if (!logged) {
                        logger.debug("⏳ 限流排队: model={}, tokens={}, priority={}, 队列长度={}",
                                modelClass, tokens, effectivePriority, bucket.waiting.size());
                        logged = true;
                    }
                    long waitNanos = bucket.waiting.peek() == waiter
                            ? bucket.nanosUntilOldestExpires(now, window())
                            : TimeUnit.MILLISECONDS.toNanos(window().toMillis());
                    changed.awaitNanos(Math.max(TimeUnit.MILLISECONDS.toNanos(1), waitNanos));
                }
            } catch (InterruptedException | RuntimeException e) {
                bucket.waiting.remove(waiter);
                changed.signalAll();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 用实际用量替换许可对应的预估值
     */
    public void recordUsage(RateLimitPermit permit, long actualTokens) {
        if (permit == null) {
            return;
        }
        lock.lock();
        try {
            ModelBucket bucket = bucketFor(permit.getModelClass());
            bucket.totalTokens += Math.max(0, actualTokens);
            for (Reservation reservation : bucket.reservations) {
                if (reservation.permitId == permit.getId()) {
                    reservation.tokens = Math.max(0, actualTokens);
                    reservation.reconciled = true;
                    break;
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 没有许可句柄时按模型类别记账：对最早一条未对账的预留生效，找不到则追加一条用量记录
     */
    public void recordUsage(String modelClass, long actualTokens) {
        lock.lock();
        try {
            ModelBucket bucket = bucketFor(modelClass);
            bucket.totalTokens += Math.max(0, actualTokens);
            for (Reservation reservation : bucket.reservations) {
                if (!reservation.reconciled) {
                    reservation.tokens = Math.max(0, actualTokens);
                    reservation.reconciled = true;
                    changed.signalAll();
                    return;
                }
            }
            Reservation usage = new Reservation(-1, clock.instant(), Math.max(0, actualTokens));
            usage.reconciled = true;
            usage.countsAsRequest = false;
            bucket.reservations.addLast(usage);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public RateLimitStatus getStatus(String modelClass) {
        lock.lock();
        try {
            ModelBucket bucket = bucketFor(modelClass);
            bucket.prune(clock.instant(), window());
            return RateLimitStatus.builder()
                    .modelClass(modelClass)
                    .requestsInWindow(bucket.requestsInWindow())
                    .tokensInWindow(bucket.tokensInWindow())
                    .requestLimit(bucket.limit.getRequestsPerWindow())
                    .tokenLimit(bucket.limit.getTokensPerWindow())
                    .queuedRequests(bucket.waiting.size())
                    .totalRequests(bucket.totalRequests)
                    .totalTokens(bucket.totalTokens)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 拒绝所有排队中的请求，等待方收到 CancellationException
     */
    public int clearQueue() {
        lock.lock();
        try {
            int cleared = 0;
            for (ModelBucket bucket : buckets.values()) {
                for (Waiter waiter : bucket.waiting) {
                    waiter.cancelled = true;
                    cleared++;
                }
                bucket.waiting.clear();
            }
            changed.signalAll();
            if (cleared > 0) {
                logger.warn("🧹 已清空限流队列，拒绝 {} 个等待中的请求", cleared);
            }
            return cleared;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 粗略估算：每4个字符约1个token
     */
    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }

    /**
     * 一次调用的预留量 = 输入估算 + 最大输出 + 固定开销
     */
    public static long estimateRequestTokens(String prompt, int maxOutputTokens) {
        return estimateTokens(prompt) + Math.max(0, maxOutputTokens) + REQUEST_OVERHEAD_TOKENS;
    }

    private Duration window() {
        return properties.getWindow();
    }

    private ModelBucket bucketFor(String modelClass) {
        return buckets.computeIfAbsent(modelClass, key -> new ModelBucket(properties.limitFor(key)));
    }

    private static final class Reservation {
        private final long permitId;
        private final Instant timestamp;
        private long tokens;
        private boolean reconciled;
        private boolean countsAsRequest = true;

        private Reservation(long permitId, Instant timestamp, long tokens) {
            this.permitId = permitId;
            this.timestamp = timestamp;
            this.tokens = tokens;
        }
    }

    private static final class Waiter {
        private final RequestPriority priority;
        private final long sequence;
        private boolean cancelled;

        private Waiter(RequestPriority priority, long sequence) {
            this.priority = priority;
            this.sequence = sequence;
        }
    }

    private static final class ModelBucket {
        private final RateLimitProperties.ModelLimit limit;
        private final Deque<Reservation> reservations = new ArrayDeque<>();
        private final PriorityQueue<Waiter> waiting = new PriorityQueue<>(
                Comparator.<Waiter, Integer>comparing(w -> w.priority.ordinal()).thenComparingLong(w -> w.sequence));
        private long totalRequests;
        private long totalTokens;

        private ModelBucket(RateLimitProperties.ModelLimit limit) {
            this.limit = limit;
        }

        private void prune(Instant now, Duration window) {
            Instant cutoff = now.minus(window);
            Iterator<Reservation> it = reservations.iterator();
            while (it.hasNext()) {
                if (!it.next().timestamp.isAfter(cutoff)) {
                    it.remove();
                } else {
                    break;
                }
            }
        }

        private int requestsInWindow() {
            int count = 0;
            for (Reservation reservation : reservations) {
                if (reservation.countsAsRequest) {
                    count++;
                }
            }
            return count;
        }

        private long tokensInWindow() {
            long sum = 0;
            for (Reservation reservation : reservations) {
                sum += reservation.tokens;
            }
            return sum;
        }

        private boolean canAdmit(long tokens) {
            if (reservations.isEmpty()) {
                return true;
            }
            return requestsInWindow() + 1 <= limit.getRequestsPerWindow()
                    && tokensInWindow() + tokens <= limit.getTokensPerWindow();
        }

        private long nanosUntilOldestExpires(Instant now, Duration window) {
            Reservation oldest = reservations.peekFirst();
            if (oldest == null) {
                return 0;
            }
            Duration remaining = Duration.between(now, oldest.timestamp.plus(window));
            return Math.max(0, remaining.toNanos()) + TimeUnit.MILLISECONDS.toNanos(1);
        }
    }
}
