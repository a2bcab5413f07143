package com.example.datalake.thinking.session;

/**
 * A session resolved by the store. {@code resumed} is true when the caller's hint named a live
 * session, false when a new one was minted.
 */
public record SessionHandle(long id, ThinkingSession session, boolean resumed) {
}
