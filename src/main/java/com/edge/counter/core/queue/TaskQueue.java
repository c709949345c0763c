package com.edge.counter.core.queue;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 无锁多生产者/多消费者队列 (Michael-Scott 算法)
 * <p>
 * 队列始终保留一个哨兵节点：head 指向已被消费的节点（初始哨兵或上一次弹出的节点），
 * tail 指向最后一个链接的节点，或落后于它，但绝不会在 head 之前。
 * <p>
 * 节点回收：节点在 head 的 CAS 成功后即脱离队列，但只有在没有任何线程再引用它时
 * 才会被 GC 回收，因此并发读取同一个旧 head 的线程不会访问到已释放的内存。
 * <p>
 * {@link #size()} 和 {@link #isEmpty()} 在并发下只是近似值。
 *
 * @param <T> 元素类型，不允许为 null
 */
public class TaskQueue<T> {

    private static final class Node<T> {
        volatile T item;
        final AtomicReference<Node<T>> next = new AtomicReference<>();

        Node(T item) {
            this.item = item;
        }
    }

    private final AtomicReference<Node<T>> head;
    private final AtomicReference<Node<T>> tail;
    private final AtomicInteger size = new AtomicInteger();

    public TaskQueue() {
        Node<T> sentinel = new Node<>(null);
        this.head = new AtomicReference<>(sentinel);
        this.tail = new AtomicReference<>(sentinel);
    }

    /**
     * 入队，总是成功（无背压）
     *
     * @throws NullPointerException 如果 value 为 null
     */
    public void push(T value) {
        Objects.requireNonNull(value, "value");
        Node<T> node = new Node<>(value);

        while (true) {
            Node<T> last = tail.get();
            Node<T> next = last.next.get();

            if (last != tail.get()) {
                continue;
            }

            if (next == null) {
                if (last.next.compareAndSet(null, node)) {
                    // 推进 tail 失败没关系，其他线程会帮忙推进
                    tail.compareAndSet(last, node);
                    size.incrementAndGet();
                    return;
                }
            } else {
                // tail 落后，帮助推进
                tail.compareAndSet(last, next);
            }
        }
    }

    /**
     * 出队，立即返回，不阻塞
     *
     * @return 队首元素；如果此刻观察到队列为空则返回 null
     */
    public T pop() {
        while (true) {
            Node<T> first = head.get();
            Node<T> last = tail.get();
            Node<T> next = first.next.get();

            if (first != head.get()) {
                continue;
            }

            if (first == last) {
                if (next == null) {
                    return null;
                }
                tail.compareAndSet(last, next);
                continue;
            }

            // 必须在 CAS 之前读取数据
            T value = next.item;
            if (value != null && head.compareAndSet(first, next)) {
                // next 成为新的哨兵，清掉引用以便元素被回收
                next.item = null;
                size.decrementAndGet();
                return value;
            }
        }
    }

    /**
     * 近似长度
     */
    public int size() {
        return Math.max(0, size.get());
    }

    public boolean isEmpty() {
        Node<T> first = head.get();
        return first == tail.get() && first.next.get() == null;
    }
}
