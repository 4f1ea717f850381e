package com.sentinel.core.broadcast;

import com.sentinel.core.model.EventRecord;

import java.io.IOException;

/**
 * Транспортный канал одного наблюдателя (WebSocket, консоль, тестовый приемник).
 *
 * <p>Методы вызываются последовательно из одного потока доставки за раз.
 */
public interface EventSink {

    /**
     * Отправляет событие наблюдателю.
     *
     * @param event событие
     * @throws IOException если канал закрыт или отправка не удалась; подписчик будет удален
     */
    void send(EventRecord event) throws IOException;

    /**
     * Закрывает канал. Вызывается после терминального события или при удалении подписчика.
     */
    void close();
}
