package com.imapbox.mailbox;

import com.imapbox.domain.MessageView;

/**
 * Generic keyed collection a message can be copied into when no
 * server-side copy is possible (another server, a local store).
 * <p>
 * Copy runs {@code lock(); add(message); flush(); unlock()} on the sink.
 *
 * @param <K> key the sink assigns to an added message
 */
public interface MessageSink<K> {

    K add(MessageView message);

    void flush();

    default void lock() {
    }

    default void unlock() {
    }
}
