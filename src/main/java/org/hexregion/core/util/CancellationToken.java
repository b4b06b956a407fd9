package org.hexregion.core.util;

/**
 * Кооперативная отмена: генераторы, сериализатор и поиск пути проверяют флаг
 * на границах проходов и раз в N клеток.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled(String where) {
        if (cancelled) {
            throw new OperationCancelledException("Operation cancelled: " + where);
        }
    }
}
