package com.makerhedge.exchange;

/** Builds authenticated clients. Called at startup and again whenever a session goes stale. */
@FunctionalInterface
public interface ExchangeClientFactory {

    ExchangeClient create(AccountCredentials credentials);
}
