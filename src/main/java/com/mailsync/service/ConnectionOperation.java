package com.mailsync.service;

import com.mailsync.transport.MailConnection;
import com.mailsync.transport.TransportException;

/**
 * Remote step run against the lease's current connection
 */
@FunctionalInterface
public interface ConnectionOperation<T> {

    T apply(MailConnection connection) throws TransportException;
}
