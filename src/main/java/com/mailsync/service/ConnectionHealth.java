package com.mailsync.service;

public enum ConnectionHealth {
    ABSENT,
    CONNECTING,
    HEALTHY,
    UNHEALTHY
}
