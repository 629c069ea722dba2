package com.phoenixchannels.config;

import com.phoenixchannels.mailbox.LinkedMailbox;
import com.phoenixchannels.mailbox.Mailbox;
import com.phoenixchannels.mailbox.MpscMailbox;

/**
 * Which queue backs an actor's mailbox. Socket actors use the default, an unbounded MPSC queue;
 * a bounded {@link LinkedMailbox} is there for actors that should shed load instead.
 */
public class MailboxConfig {

    public enum MailboxType {
        LINKED,
        MPSC
    }

    private MailboxType mailboxType = MailboxType.MPSC;
    private int capacity = Integer.MAX_VALUE;
    private int chunkSize = MpscMailbox.DEFAULT_CHUNK_SIZE;

    public <T> Mailbox<T> createMailbox() {
        if (mailboxType == MailboxType.LINKED) {
            return capacity == Integer.MAX_VALUE ? new LinkedMailbox<>() : new LinkedMailbox<>(capacity);
        }
        return new MpscMailbox<>(chunkSize);
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }

    /**
     * Only honoured by {@link MailboxType#LINKED}.
     */
    public int getCapacity() {
        return capacity;
    }

    public MailboxConfig setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public MailboxConfig setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }
}
