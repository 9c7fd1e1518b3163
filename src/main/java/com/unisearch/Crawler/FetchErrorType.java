package com.unisearch.Crawler;

public enum FetchErrorType {
    TIMEOUT,
    CONNECTION_FAILED,
    HTTP_ERROR,
    REDIRECT_LOOP
}
