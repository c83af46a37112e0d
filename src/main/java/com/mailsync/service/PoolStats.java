package com.mailsync.service;

public record PoolStats(int pooled, long healthy, long unhealthy, long connecting) {
}
