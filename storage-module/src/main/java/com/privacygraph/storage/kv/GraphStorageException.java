package com.privacygraph.storage.kv;

/**
 * Ошибка хранилища графа: транзакция не прошла или данные не читаются
 */
public class GraphStorageException extends Exception {

    public GraphStorageException(String message) {
        super(message);
    }

    public GraphStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
