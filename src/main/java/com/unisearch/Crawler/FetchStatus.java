package com.unisearch.Crawler;

public enum FetchStatus {
    SUCCESS,
    FAILURE,
    REDIRECT
}
