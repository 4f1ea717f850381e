package com.sentinel.core.broadcast;

import com.sentinel.core.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;

/**
 * Набор живых наблюдателей одного скана.
 *
 * <p>Атомарность подключения относительно публикации обеспечивает вызывающая сторона:
 * {@link #register} и {@link #publish} вызываются под одной и той же блокировкой состояния скана,
 * поэтому подписчик получает каждое событие ровно один раз - либо в повторе, либо вживую.
 */
public final class SubscriberRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final String scanId;
    private final Executor deliveryExecutor;
    private final int backlogLimit;
    private final long backlogBytesLimit;
    private final Set<Subscriber> subscribers = new CopyOnWriteArraySet<>();
    private volatile boolean closed;

    public SubscriberRegistry(String scanId, Executor deliveryExecutor, int backlogLimit) {
        this(scanId, deliveryExecutor, backlogLimit, Long.MAX_VALUE);
    }

    /**
     * @param backlogLimit сколько живых событий может ждать доставки одному подписчику
     * @param backlogBytesLimit сколько байт исходных строк может ждать доставки одному подписчику
     */
    public SubscriberRegistry(String scanId, Executor deliveryExecutor, int backlogLimit, long backlogBytesLimit) {
        if (backlogLimit <= 0) {
            throw new IllegalArgumentException("backlogLimit must be positive: " + backlogLimit);
        }
        if (backlogBytesLimit <= 0) {
            throw new IllegalArgumentException("backlogBytesLimit must be positive: " + backlogBytesLimit);
        }
        this.scanId = scanId;
        this.deliveryExecutor = deliveryExecutor;
        this.backlogLimit = backlogLimit;
        this.backlogBytesLimit = backlogBytesLimit;
    }

    /**
     * Регистрирует наблюдателя: сначала повтор истории, затем живая доставка.
     * Если скан уже завершен, канал закрывается сразу после повтора.
     *
     * @param sink транспорт наблюдателя
     * @param replay снимок уже сохраненных событий
     * @return дескриптор подписчика
     */
    public Subscriber register(EventSink sink, List<EventRecord> replay) {
        Subscriber subscriber = new Subscriber(scanId, sink, deliveryExecutor, backlogLimit, backlogBytesLimit,
            subscribers::remove);
        subscriber.enqueueReplay(replay);
        if (closed) {
            subscriber.closeAfterDrain();
        } else {
            subscribers.add(subscriber);
        }
        logger.debug("Subscriber {} joined scan {} with {} replayed event(s)", subscriber.getId(), scanId, replay.size());
        return subscriber;
    }

    /**
     * Рассылает событие всем подписчикам. Никогда не блокируется на медленном подписчике.
     */
    public void publish(EventRecord event) {
        for (Subscriber subscriber : subscribers) {
            subscriber.offer(event);
        }
    }

    /**
     * Отключает подписчика без дочитывания очереди.
     */
    public void leave(Subscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            logger.debug("Subscriber {} left scan {}", subscriber.getId(), scanId);
        }
        subscriber.cancel();
    }

    /**
     * Закрывает все каналы после доставки уже поставленных в очередь событий.
     */
    public void closeAll() {
        closed = true;
        for (Subscriber subscriber : subscribers) {
            subscriber.closeAfterDrain();
        }
        subscribers.clear();
    }

    public int size() {
        return subscribers.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
